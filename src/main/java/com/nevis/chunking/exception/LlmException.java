package com.nevis.chunking.exception;

/**
 * Failure reported by the completion provider.
 */
public abstract class LlmException extends RuntimeException {

    protected LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
