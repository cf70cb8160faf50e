package com.nevis.chunking.model;

public record JobCounts(int queued, int running, int finished) {
}
