package com.nevis.chunking.llm;

import com.nevis.chunking.model.Article;
import com.nevis.chunking.model.Chunk;

import java.util.List;

public final class RefinementPrompts {

    static final int CONTEXT_CHARS = 120;
    static final int MAX_CHUNK_CHARS = 4000;

    private static final String REFINEMENT_PROMPT_TEMPLATE =
        """
            Role: Chunk boundary reviewer in a news ingestion pipeline.
            Task: Judge whether the current chunk starts and ends at sensible places. Suggest small boundary moves or a structural action. Never rewrite the text.
            Rules:
            - Target size is about %d words. Overlap with neighbours is allowed.
            - Do not split headings, lists, quotes, tables or code blocks.
            - A chunk that is too short or continues a sentence or list should be merged.
            - Move the end boundary only through "offset_adjust", between -%d and %d characters.
            - Boilerplate (cookie notices, footers, navigation) gets action "drop".

            Article title: "%s"
            Source: %s | Language: %s | Published: %s
            Chunk %d of %d | start=%d end=%d | words=%d
            Previous tail: "%s"
            Current chunk: "%s"
            Next head: "%s"

            Reply with JSON only:
            {"action": "keep|merge_prev|merge_next|drop", "offset_adjust": 0, "semantic_type": "intro|body|list|quote|code|conclusion", "confidence": 0.0, "reason": "short explanation"}
            """;

    private RefinementPrompts() {
    }

    public static String build(Article article, List<Chunk> chunks, int index, int targetWords, int maxOffset) {
        Chunk chunk = chunks.get(index);
        String previousTail = index > 0 ? tail(chunks.get(index - 1).text()) : "";
        String nextHead = index + 1 < chunks.size() ? head(chunks.get(index + 1).text()) : "";

        return String.format(REFINEMENT_PROMPT_TEMPLATE,
            targetWords,
            maxOffset,
            maxOffset,
            orUnknown(article.title()),
            orUnknown(article.domain()),
            orUnknown(article.language()),
            article.publishedAt() == null ? "unknown" : article.publishedAt().toString(),
            index + 1,
            chunks.size(),
            chunk.charStart(),
            chunk.charEnd(),
            chunk.wordCount(),
            previousTail,
            chunk.text().length() > MAX_CHUNK_CHARS ? chunk.text().substring(0, MAX_CHUNK_CHARS) : chunk.text(),
            nextHead
        );
    }

    static String tail(String text) {
        return text.length() <= CONTEXT_CHARS ? text : text.substring(text.length() - CONTEXT_CHARS);
    }

    static String head(String text) {
        return text.length() <= CONTEXT_CHARS ? text : text.substring(0, CONTEXT_CHARS);
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
