package com.dcruver.provenance.nlp;

/**
 * Asks a language model for structured (JSON object) output.
 */
public interface TextGenerationProvider {

    /**
     * @throws com.dcruver.provenance.error.ProviderConnectionException if the model cannot be reached
     * @throws com.dcruver.provenance.error.StructuredOutputParseException if the reply is not a JSON object
     */
    GenerationResult generateStructured(String prompt, String systemPrompt, double temperature);

    String getModelName();
}
