package com.dcruver.provenance.nlp;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Parsed structured output and the model that produced it.
 */
@Value
public class GenerationResult {
    JsonNode content;
    String model;
}
