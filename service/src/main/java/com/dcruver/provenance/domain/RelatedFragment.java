package com.dcruver.provenance.domain;

import lombok.Value;

/**
 * A fragment reached over one link, with the edge that connects it.
 */
@Value
public class RelatedFragment {

    public enum Direction {
        /** The queried fragment is the link source */
        OUTGOING,
        /** The queried fragment is the link target */
        INCOMING
    }

    Fragment fragment;
    double strength;
    LinkKind kind;
    Direction direction;
}
