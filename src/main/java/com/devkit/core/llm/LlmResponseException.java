package com.devkit.core.llm;

/**
 * Thrown when the LLM returns no content or content that cannot be mapped to the requested type.
 */
public class LlmResponseException extends RuntimeException {

    private final String rawResponse;

    public LlmResponseException(String message, String rawResponse) {
        super(message);
        this.rawResponse = rawResponse;
    }

    public LlmResponseException(String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse;
    }

    /** The unparsed model output, null when the model returned nothing. */
    public String getRawResponse() {
        return rawResponse;
    }
}
