package com.nevis.chunking.service;

import com.nevis.chunking.config.ChunkingProperties;
import com.nevis.chunking.model.Article;
import com.nevis.chunking.model.Chunk;
import com.nevis.chunking.model.RefinementOutcome;

import java.util.List;

public interface RefinementService {

    /**
     * Asks the completion provider to review {@code chunks.get(index)}. Never throws: whatever goes
     * wrong, the outcome carries the original chunk and says why it was not refined.
     */
    RefinementOutcome refine(Article article, List<Chunk> chunks, int index, String batchId, ChunkingProperties chunking);
}
