package com.nevis.chunking.repository;

import com.nevis.chunking.model.Chunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@Slf4j
public class InMemoryChunkRepository implements ChunkRepository {

    private final Map<UUID, List<Chunk>> chunksByArticle = new ConcurrentHashMap<>();

    @Override
    public void persistChunks(UUID articleId, List<Chunk> chunks) {
        chunksByArticle.put(articleId, List.copyOf(chunks));
        log.debug("Stored {} chunks for article {}", chunks.size(), articleId);
    }

    @Override
    public List<Chunk> findByArticleId(UUID articleId) {
        return chunksByArticle.getOrDefault(articleId, List.of());
    }

    @Override
    public boolean hasChunks(UUID articleId) {
        return chunksByArticle.containsKey(articleId);
    }
}
