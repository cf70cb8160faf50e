package com.nevis.chunking.model;

public enum ErrorKind {
    ARTICLE_NOT_FOUND,
    CHUNKING_FAILED,
    PERSISTENCE_FAILED,
    LLM_FATAL,
    UNEXPECTED
}
