package com.opsdiag.llm;

/**
 * Raised when the narrative provider is not configured or the call fails.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
