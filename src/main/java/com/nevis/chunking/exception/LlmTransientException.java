package com.nevis.chunking.exception;

/**
 * Timeouts, server errors and provider-side throttling. Worth another attempt.
 */
public class LlmTransientException extends LlmException {

    public LlmTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
