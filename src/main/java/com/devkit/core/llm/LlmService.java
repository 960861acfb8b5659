package com.devkit.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;

/**
 * Wraps Spring AI's {@link ChatClient} to produce structured (typed) output.
 * <p>
 * Uses {@link BeanOutputConverter} to append JSON format instructions to the user prompt and
 * map the response onto the requested type, with a lenient Jackson pass as fallback.
 */
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .registerModule(new ParameterNamesModule());

    public LlmService(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    /**
     * Sends a system + user prompt and maps the response onto {@code outputType}.
     *
     * @throws LlmResponseException when the response is empty or cannot be mapped
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.info("LLM call started -> {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete -> {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));

        if (response == null || response.isBlank()) {
            throw new LlmResponseException("LLM returned empty content for " + outputType.getSimpleName(), response);
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    private <T> T parseWithJackson(String json, Class<T> outputType) {
        String cleaned = json.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        try {
            return lenientMapper.readValue(cleaned.trim(), outputType);
        } catch (Exception e) {
            throw new LlmResponseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), json, e);
        }
    }
}
