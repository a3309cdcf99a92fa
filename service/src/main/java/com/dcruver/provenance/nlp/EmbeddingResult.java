package com.dcruver.provenance.nlp;

import lombok.Value;

import java.util.List;

@Value
public class EmbeddingResult {
    List<Double> vector;
    String model;
    int dimension;
    boolean cached;
}
