package com.nevis.chunking.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class ChunkingException extends RuntimeException {
    private final UUID articleId;

    public ChunkingException(UUID articleId, String reason) {
        super("Cannot chunk article " + articleId + ": " + reason);
        this.articleId = articleId;
    }
}
