package com.nevis.chunking.model;

public enum ChunkingStrategy {
    PARAGRAPH,
    SLIDING_WINDOW
}
