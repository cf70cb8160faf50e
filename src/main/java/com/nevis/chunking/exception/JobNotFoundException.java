package com.nevis.chunking.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class JobNotFoundException extends RuntimeException {
    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }
}
