package com.nevis.chunking.service;

import com.nevis.chunking.config.PipelineSettings;
import com.nevis.chunking.model.Article;
import com.nevis.chunking.model.Chunk;

import java.util.List;

/**
 * An article after chunking and routing, waiting for its batch's refinement phase.
 *
 * @param flagged indexes of chunks routed to the completion provider, ascending
 */
record PreparedArticle(Article article, PipelineSettings settings, List<Chunk> chunks, List<Integer> flagged) {
}
