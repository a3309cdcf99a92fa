package com.dcruver.provenance.processing;

import com.dcruver.provenance.domain.Assumption;
import com.dcruver.provenance.domain.AssumptionValidity;
import com.dcruver.provenance.domain.Decision;
import com.dcruver.provenance.error.StructuredOutputParseException;
import com.dcruver.provenance.nlp.GenerationResult;
import com.dcruver.provenance.nlp.TextGenerationProvider;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the text-generation provider for decisions and assumptions in a fragment's text
 * and keeps only the candidates that pass validation.
 *
 * <ul>
 *   <li>Decisions below the minimum confidence are dropped; an empty "what" is kept.</li>
 *   <li>Decisions whose confidence is NaN, infinite or outside [0, 1] are dropped.</li>
 *   <li>Assumptions with an empty statement are dropped; there is no confidence gate.</li>
 *   <li>A reply that is not the expected JSON shape gives an empty result tagged "unknown".</li>
 *   <li>An unreachable provider raises {@link com.dcruver.provenance.error.ProviderConnectionException}.</li>
 * </ul>
 *
 * Returned records are drafts: ids and timestamps are assigned when they are stored.
 */
@Component
@Slf4j
public class ExtractionFilter {

    private static final double TEMPERATURE = 0.0;

    private final TextGenerationProvider textGenerationProvider;

    public ExtractionFilter(TextGenerationProvider textGenerationProvider) {
        this.textGenerationProvider = textGenerationProvider;
    }

    public ExtractionResult<Decision> extractDecisions(String content, String fragmentId, double minConfidence) {
        GenerationResult generation;
        List<Decision> decisions = new ArrayList<>();
        try {
            generation = textGenerationProvider.generateStructured(
                ExtractionPrompts.decisionPrompt(content),
                ExtractionPrompts.DECISION_SYSTEM_PROMPT,
                TEMPERATURE
            );

            for (JsonNode candidate : candidates(generation.getContent(), "decisions")) {
                double confidence = confidenceOf(candidate);
                if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
                    log.debug("Skipping decision with out-of-range confidence {}", confidence);
                    continue;
                }
                if (confidence < minConfidence) {
                    log.debug("Skipping decision with confidence {} < {}", confidence, minConfidence);
                    continue;
                }

                decisions.add(Decision.builder()
                    .fragmentId(fragmentId)
                    .what(candidate.path("what").asText(""))
                    .why(candidate.path("why").asText(""))
                    .confidence(confidence)
                    .build());
            }
        } catch (StructuredOutputParseException e) {
            log.error("Failed to parse decision extraction response for fragment {}: {}", fragmentId, e.getMessage());
            return ExtractionResult.unparsed();
        }

        log.info("Extracted {} decisions from fragment {}", decisions.size(), fragmentId);
        return new ExtractionResult<>(List.copyOf(decisions), generation.getContent(), generation.getModel());
    }

    public ExtractionResult<Assumption> extractAssumptions(String content, String fragmentId) {
        GenerationResult generation;
        List<Assumption> assumptions = new ArrayList<>();
        try {
            generation = textGenerationProvider.generateStructured(
                ExtractionPrompts.assumptionPrompt(content),
                ExtractionPrompts.ASSUMPTION_SYSTEM_PROMPT,
                TEMPERATURE
            );

            for (JsonNode candidate : candidates(generation.getContent(), "assumptions")) {
                String statement = candidate.path("statement").asText("").trim();
                if (statement.isEmpty()) {
                    continue;
                }

                assumptions.add(Assumption.builder()
                    .fragmentId(fragmentId)
                    .statement(statement)
                    .explicit(candidate.path("explicit").asBoolean(true))
                    .validity(AssumptionValidity.UNKNOWN)
                    .build());
            }
        } catch (StructuredOutputParseException e) {
            log.error("Failed to parse assumption extraction response for fragment {}: {}", fragmentId, e.getMessage());
            return ExtractionResult.unparsed();
        }

        log.info("Extracted {} assumptions from fragment {}", assumptions.size(), fragmentId);
        return new ExtractionResult<>(List.copyOf(assumptions), generation.getContent(), generation.getModel());
    }

    /**
     * The candidate array under {@code field}. A missing field means no candidates;
     * anything other than an array of objects is a shape error.
     */
    private static List<JsonNode> candidates(JsonNode content, String field) {
        JsonNode array = content.path(field);
        if (array.isMissingNode() || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new StructuredOutputParseException("\"" + field + "\" is not an array");
        }

        List<JsonNode> result = new ArrayList<>();
        for (JsonNode candidate : array) {
            if (!candidate.isObject()) {
                throw new StructuredOutputParseException("\"" + field + "\" contains a non-object entry");
            }
            result.add(candidate);
        }
        return result;
    }

    private static double confidenceOf(JsonNode candidate) {
        JsonNode node = candidate.path("confidence");
        if (node.isMissingNode() || node.isNull()) {
            return 0.0;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new StructuredOutputParseException("Confidence is not a number: " + node.asText(), e);
            }
        }
        throw new StructuredOutputParseException("Confidence is not a number: " + node);
    }
}
