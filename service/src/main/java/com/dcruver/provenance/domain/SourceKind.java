package com.dcruver.provenance.domain;

import com.dcruver.provenance.error.ValidationException;

/**
 * Where a fragment was captured from.
 */
public enum SourceKind {
    /**
     * Typed in directly by the user
     */
    QUICK_CAPTURE("quick_capture"),

    /**
     * Meeting recording transcript (Zoom and similar)
     */
    MEETING_VIDEO("meeting_video"),

    /**
     * Chat platform message or thread (Teams and similar)
     */
    CHAT("chat"),

    /**
     * Imported notes or markdown
     */
    NOTES("notes");

    private final String value;

    SourceKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SourceKind fromValue(String value) {
        if (value == null) {
            throw new ValidationException("Source kind must not be null");
        }
        for (SourceKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value.trim()) || kind.name().equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        throw new ValidationException("Unknown source kind: " + value);
    }
}
