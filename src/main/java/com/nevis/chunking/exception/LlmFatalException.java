package com.nevis.chunking.exception;

/**
 * Authentication failures, rejected requests and unparseable responses. Never retried.
 */
public class LlmFatalException extends LlmException {

    public LlmFatalException(String message, Throwable cause) {
        super(message, cause);
    }

    public LlmFatalException(String message) {
        super(message, null);
    }
}
