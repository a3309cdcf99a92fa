package com.dcruver.provenance.nlp;

import com.dcruver.provenance.error.ProviderConnectionException;
import com.dcruver.provenance.error.StructuredOutputParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured text generation with Ollama via Spring AI. Requests JSON mode and
 * parses the reply with Jackson.
 */
@Service
@Slf4j
public class OllamaTextGenerationProvider implements TextGenerationProvider {

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final String modelName;

    public OllamaTextGenerationProvider(
        ChatModel chatModel,
        ObjectMapper objectMapper,
        @Value("${spring.ai.ollama.chat.options.model:llama3.2}") String modelName
    ) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.modelName = modelName;
        log.info("OllamaTextGenerationProvider initialized with model {}", modelName);
    }

    @Override
    public GenerationResult generateStructured(String prompt, String systemPrompt, double temperature) {
        List<Message> messages = new ArrayList<>();

        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(new SystemMessage(systemPrompt));
        }
        messages.add(new UserMessage(prompt));

        OllamaOptions options = OllamaOptions.builder()
            .temperature(temperature)
            .format("json")
            .build();

        ChatResponse response;
        try {
            response = chatModel.call(new Prompt(messages, options));
        } catch (RuntimeException e) {
            throw new ProviderConnectionException("text generation provider", e.getMessage(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new StructuredOutputParseException("No response generated");
        }

        String text = response.getResult().getOutput().getText();
        String model = response.getMetadata() != null && response.getMetadata().getModel() != null
            && !response.getMetadata().getModel().isBlank()
            ? response.getMetadata().getModel()
            : modelName;

        return new GenerationResult(parseObject(text), model);
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    /**
     * Parse a reply as a JSON object, tolerating a surrounding markdown code fence.
     */
    JsonNode parseObject(String text) {
        if (text == null || text.isBlank()) {
            throw new StructuredOutputParseException("Empty response from model");
        }

        String json = stripCodeFence(text.trim());
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StructuredOutputParseException("Failed to parse JSON response: " + e.getOriginalMessage(), e);
        }

        if (node == null || !node.isObject()) {
            throw new StructuredOutputParseException("Expected a JSON object but got: " + truncate(json, 80));
        }
        return node;
    }

    private static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).trim();
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}
