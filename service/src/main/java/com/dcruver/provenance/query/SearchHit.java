package com.dcruver.provenance.query;

import com.dcruver.provenance.domain.Fragment;
import lombok.Value;

@Value
public class SearchHit {
    Fragment fragment;
    double similarity;
}
