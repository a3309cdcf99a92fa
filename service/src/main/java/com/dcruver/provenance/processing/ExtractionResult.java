package com.dcruver.provenance.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Value;

import java.util.List;

/**
 * Records that survived filtering, with the raw provider reply and the model tag.
 * An unparseable reply yields no records and the model "unknown".
 */
@Value
public class ExtractionResult<T> {

    public static final String UNKNOWN_MODEL = "unknown";

    List<T> records;
    JsonNode rawResponse;
    String model;

    public static <T> ExtractionResult<T> unparsed() {
        return new ExtractionResult<>(List.of(), JsonNodeFactory.instance.objectNode(), UNKNOWN_MODEL);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
