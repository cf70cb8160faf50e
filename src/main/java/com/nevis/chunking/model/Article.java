package com.nevis.chunking.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record Article(
    UUID id,
    String title,
    String text,
    String domain,
    String language,
    OffsetDateTime publishedAt,
    Map<String, String> metadata
) {
    public Article {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
