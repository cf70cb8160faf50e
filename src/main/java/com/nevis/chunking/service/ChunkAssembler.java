package com.nevis.chunking.service;

import com.nevis.chunking.chunking.TextSpans;
import com.nevis.chunking.config.ChunkingProperties;
import com.nevis.chunking.model.Article;
import com.nevis.chunking.model.Chunk;
import com.nevis.chunking.model.ChunkingStrategy;
import com.nevis.chunking.model.RefinementAction;
import com.nevis.chunking.model.RefinementAdvice;
import com.nevis.chunking.model.RefinementStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Final pass over an article's chunks after refinement: keeps neighbouring paragraph chunks
 * flush against a moved boundary, optionally applies drop/merge verdicts and renumbers. A boundary
 * move that would leave text outside every chunk is reverted.
 */
@Component
@Slf4j
public class ChunkAssembler {

    public List<Chunk> assemble(Article article, List<Chunk> refined, ChunkingProperties chunking, boolean applyStructuralActions) {
        List<Chunk> chunks = new ArrayList<>(refined);
        String source = article.text();

        for (int i = 0; i < chunks.size(); i++) {
            Chunk current = chunks.get(i);
            if (!movedEnd(current)) {
                continue;
            }
            if (i + 1 == chunks.size()) {
                if (uncovers(source, current.charEnd(), source.length())) {
                    log.debug("Reverting boundary move of final chunk {} in article {}: tail would be lost",
                        current.index(), article.id());
                    chunks.set(i, revertEnd(source, current));
                }
                continue;
            }

            Chunk next = chunks.get(i + 1);
            // only paragraph neighbours are resliced; any other neighbour must already cover the text
            if (current.strategy() != ChunkingStrategy.PARAGRAPH || next.strategy() != ChunkingStrategy.PARAGRAPH) {
                if (uncovers(source, current.charEnd(), next.charStart())) {
                    log.debug("Reverting boundary move of chunk {} in article {}: {} neighbour cannot follow it",
                        current.index(), article.id(), next.strategy());
                    chunks.set(i, revertEnd(source, current));
                }
                continue;
            }

            int nextStart = firstWordStartAtOrAfter(source, current.charEnd());
            boolean lastNeighbour = i + 1 == chunks.size() - 1;
            Chunk shifted = nextStart >= next.charEnd() ? null : reslice(source, next, nextStart, next.charEnd());
            if (shifted == null || !legalSize(shifted, chunking, lastNeighbour)) {
                log.debug("Reverting boundary move of chunk {} in article {}: neighbour would become illegal",
                    current.index(), article.id());
                chunks.set(i, revertEnd(source, current));
                continue;
            }
            chunks.set(i + 1, shifted);
        }

        if (applyStructuralActions) {
            chunks = applyActions(source, chunks, chunking);
        }

        List<Chunk> indexed = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            indexed.add(chunks.get(i).withIndex(i));
        }
        return indexed;
    }

    private List<Chunk> applyActions(String source, List<Chunk> chunks, ChunkingProperties chunking) {
        List<Chunk> result = new ArrayList<>(chunks.size());
        boolean previousDropped = false;
        for (Chunk chunk : chunks) {
            RefinementAction action = chunk.status() == RefinementStatus.REFINED ? chunk.advice().action() : RefinementAction.KEEP;

            if (action == RefinementAction.DROP) {
                log.debug("Dropping boilerplate chunk {} of article {}", chunk.index(), chunk.articleId());
                previousDropped = true;
                continue;
            }

            // merging across a dropped chunk would pull its text back in
            if (action == RefinementAction.MERGE_PREV && !result.isEmpty() && !previousDropped) {
                Chunk previous = result.get(result.size() - 1);
                Chunk merged = reslice(source, previous, previous.charStart(), Math.max(previous.charEnd(), chunk.charEnd()));
                if (merged.wordCount() <= chunking.maxWords()) {
                    result.set(result.size() - 1, merged);
                    continue;
                }
            }
            previousDropped = false;
            result.add(chunk);
        }
        return result;
    }

    private static boolean movedEnd(Chunk chunk) {
        return chunk.status() == RefinementStatus.REFINED && chunk.advice() != null && chunk.advice().appliedOffset() != 0;
    }

    private static Chunk revertEnd(String source, Chunk chunk) {
        RefinementAdvice advice = chunk.advice();
        int originalEnd = chunk.charEnd() - advice.appliedOffset();
        Chunk reverted = reslice(source, chunk, chunk.charStart(), originalEnd);
        return reverted.refined(advice.withAppliedOffset(0), reverted.semanticType());
    }

    private static Chunk reslice(String source, Chunk chunk, int start, int end) {
        String text = source.substring(start, end);
        return chunk.withSpan(text, start, end, TextSpans.countWords(text));
    }

    private static boolean legalSize(Chunk chunk, ChunkingProperties chunking, boolean last) {
        return chunk.wordCount() <= chunking.maxWords() && (last ? chunk.wordCount() > 0 : chunk.wordCount() >= chunking.minWords());
    }

    private static boolean uncovers(String source, int from, int to) {
        for (int i = from; i < to; i++) {
            if (!Character.isWhitespace(source.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static int firstWordStartAtOrAfter(String source, int from) {
        int i = from;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
            i++;
        }
        return i;
    }
}
