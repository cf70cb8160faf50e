package com.nevis.chunking.model;

import java.util.UUID;

/**
 * A contiguous slice {@code [charStart, charEnd)} of an article's text.
 * Instances are never mutated; every refinement step yields a new chunk.
 */
public record Chunk(
    UUID articleId,
    int index,
    String text,
    int charStart,
    int charEnd,
    int wordCount,
    ChunkingStrategy strategy,
    SemanticType semanticType,
    QualityScores scores,
    RefinementStatus status,
    RefinementAdvice advice
) {

    public static Chunk candidate(UUID articleId, int index, String text, int charStart, int charEnd,
                                  int wordCount, ChunkingStrategy strategy, SemanticType semanticType) {
        return new Chunk(articleId, index, text, charStart, charEnd, wordCount, strategy, semanticType,
            null, RefinementStatus.UNREFINED, null);
    }

    public Chunk withScores(QualityScores newScores) {
        return new Chunk(articleId, index, text, charStart, charEnd, wordCount, strategy, semanticType,
            newScores, status, advice);
    }

    public Chunk withIndex(int newIndex) {
        return new Chunk(articleId, newIndex, text, charStart, charEnd, wordCount, strategy, semanticType,
            scores, status, advice);
    }

    public Chunk withSpan(String newText, int newStart, int newEnd, int newWordCount) {
        return new Chunk(articleId, index, newText, newStart, newEnd, newWordCount, strategy, semanticType,
            scores, status, advice);
    }

    public Chunk refined(RefinementAdvice newAdvice, SemanticType newType) {
        return new Chunk(articleId, index, text, charStart, charEnd, wordCount, strategy, newType,
            scores, RefinementStatus.REFINED, newAdvice);
    }

    public Chunk refinementFailed() {
        return new Chunk(articleId, index, text, charStart, charEnd, wordCount, strategy, semanticType,
            scores, RefinementStatus.REFINEMENT_FAILED, advice);
    }
}
