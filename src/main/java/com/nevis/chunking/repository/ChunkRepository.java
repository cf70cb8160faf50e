package com.nevis.chunking.repository;

import com.nevis.chunking.model.Chunk;

import java.util.List;
import java.util.UUID;

public interface ChunkRepository {

    /**
     * Replaces every stored chunk of the article with {@code chunks}.
     */
    void persistChunks(UUID articleId, List<Chunk> chunks);

    List<Chunk> findByArticleId(UUID articleId);

    boolean hasChunks(UUID articleId);
}
