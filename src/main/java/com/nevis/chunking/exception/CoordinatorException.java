package com.nevis.chunking.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class CoordinatorException extends RuntimeException {
    private final UUID jobId;

    public CoordinatorException(UUID jobId, String message, Throwable cause) {
        super("Job " + jobId + " cannot proceed: " + message, cause);
        this.jobId = jobId;
    }
}
