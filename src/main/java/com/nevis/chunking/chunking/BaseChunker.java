package com.nevis.chunking.chunking;

import com.nevis.chunking.chunking.TextSpans.Word;
import com.nevis.chunking.chunking.TextSpans.WordRange;
import com.nevis.chunking.config.ChunkingProperties;
import com.nevis.chunking.exception.ChunkingException;
import com.nevis.chunking.model.Article;
import com.nevis.chunking.model.Chunk;
import com.nevis.chunking.model.ChunkingStrategy;
import com.nevis.chunking.model.SemanticType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Deterministic paragraph-first segmentation with a sliding-window fallback.
 * <p>
 * Paragraphs are packed until a chunk reaches the target size without exceeding the maximum.
 * Paragraphs (or a pending undersized group plus the paragraph that does not fit) longer than the
 * maximum are cut into overlapping windows whose ends snap back to a sentence or paragraph end.
 * Every chunk is an exact slice of the source text, so offsets can be trusted downstream.
 */
public class BaseChunker {

    private static final Pattern LIST_LINE = Pattern.compile("^\\s*(?:[-•*]|\\d+\\.)\\s+");
    private static final Pattern QUOTE_LINE = Pattern.compile("^>\\s+.+$");
    private static final Pattern CODE = Pattern.compile("```[\\s\\S]*?```|`[^`\\n]+`");
    private static final List<String> CONCLUSION_MARKERS = List.of(
        "in conclusion", "to conclude", "to summarize", "in summary", "in closing", "to sum up", "conclusion", "finally"
    );

    private final int targetWords;
    private final int overlapWords;
    private final int minWords;
    private final int maxWords;
    private final int minChars;

    public BaseChunker(ChunkingProperties properties) {
        this.targetWords = properties.targetWords();
        this.overlapWords = properties.overlapWords();
        this.minWords = properties.minWords();
        this.maxWords = properties.maxWords();
        this.minChars = properties.minChars();
    }

    public List<Chunk> chunk(Article article) {
        return chunk(article.id(), article.text());
    }

    public List<Chunk> chunk(UUID articleId, String text) {
        if (text == null) {
            throw new ChunkingException(articleId, "text is missing");
        }

        List<Word> words = TextSpans.words(text);
        if (words.isEmpty()) {
            return List.of();
        }

        List<WordRange> paragraphs = TextSpans.paragraphs(text, words);
        boolean[] boundaries = TextSpans.boundaries(text, words, paragraphs);

        List<Span> spans = new ArrayList<>();
        int groupFrom = -1;
        int groupTo = -1;

        for (WordRange paragraph : paragraphs) {
            if (groupFrom < 0) {
                if (paragraph.size() > maxWords) {
                    window(paragraph.from(), paragraph.to(), boundaries, spans);
                    continue;
                }
                groupFrom = paragraph.from();
                groupTo = paragraph.to();
            } else {
                int grouped = groupTo - groupFrom;
                if (grouped + paragraph.size() <= maxWords) {
                    groupTo = paragraph.to();
                } else if (grouped >= minWords) {
                    spans.add(new Span(groupFrom, groupTo, ChunkingStrategy.PARAGRAPH));
                    if (paragraph.size() > maxWords) {
                        window(paragraph.from(), paragraph.to(), boundaries, spans);
                        groupFrom = -1;
                        continue;
                    }
                    groupFrom = paragraph.from();
                    groupTo = paragraph.to();
                } else {
                    // undersized group cannot stand alone, window it together with the paragraph
                    window(groupFrom, paragraph.to(), boundaries, spans);
                    groupFrom = -1;
                    continue;
                }
            }

            if (groupTo - groupFrom >= targetWords) {
                spans.add(new Span(groupFrom, groupTo, ChunkingStrategy.PARAGRAPH));
                groupFrom = -1;
            }
        }
        if (groupFrom >= 0) {
            spans.add(new Span(groupFrom, groupTo, ChunkingStrategy.PARAGRAPH));
        }

        List<Span> merged = mergeShortSpans(spans, words);

        List<Chunk> chunks = new ArrayList<>(merged.size());
        for (int i = 0; i < merged.size(); i++) {
            Span span = merged.get(i);
            int charStart = words.get(span.from()).start();
            int charEnd = words.get(span.to() - 1).end();
            String slice = text.substring(charStart, charEnd);
            chunks.add(Chunk.candidate(articleId, i, slice, charStart, charEnd, span.size(), span.strategy(),
                detectSemanticType(slice, i)));
        }
        return chunks;
    }

    /**
     * Classifies a chunk by position and content markers.
     */
    public static SemanticType detectSemanticType(String text, int index) {
        if (index == 0) {
            return SemanticType.INTRO;
        }

        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : CONCLUSION_MARKERS) {
            if (lower.contains(marker)) {
                return SemanticType.CONCLUSION;
            }
        }

        String[] lines = text.split("\n");
        int listLines = 0;
        int quoteLines = 0;
        for (String line : lines) {
            if (LIST_LINE.matcher(line).find()) {
                listLines++;
            }
            if (QUOTE_LINE.matcher(line).matches()) {
                quoteLines++;
            }
        }
        if (listLines > 0 && (double) listLines / lines.length > 0.3) {
            return SemanticType.LIST;
        }
        if (quoteLines > 0 && (double) quoteLines / lines.length > 0.5) {
            return SemanticType.QUOTE;
        }
        if (CODE.matcher(text).find()) {
            return SemanticType.CODE;
        }
        return SemanticType.BODY;
    }

    private void window(int from, int to, boolean[] boundaries, List<Span> spans) {
        int start = from;
        while (to - start > maxWords) {
            int end = snapEnd(start, boundaries);
            spans.add(new Span(start, end, ChunkingStrategy.SLIDING_WINDOW));
            start = end - overlapWords;
        }
        spans.add(new Span(start, to, ChunkingStrategy.SLIDING_WINDOW));
    }

    private int snapEnd(int start, boolean[] boundaries) {
        for (int end = start + targetWords; end >= start + minWords; end--) {
            if (boundaries[end - 1]) {
                return end;
            }
        }
        return start + targetWords;
    }

    private List<Span> mergeShortSpans(List<Span> spans, List<Word> words) {
        List<Span> result = new ArrayList<>(spans);
        int i = 0;
        while (i < result.size() && result.size() > 1) {
            Span span = result.get(i);
            if (charLength(span, words) >= minChars) {
                i++;
                continue;
            }
            if (i + 1 < result.size()) {
                Span union = span.union(result.get(i + 1));
                if (union.size() <= maxWords) {
                    result.set(i, union);
                    result.remove(i + 1);
                    continue;
                }
            }
            if (i > 0) {
                Span union = result.get(i - 1).union(span);
                if (union.size() <= maxWords) {
                    result.set(i - 1, union);
                    result.remove(i);
                    i--;
                    continue;
                }
            }
            i++;
        }
        return result;
    }

    private static int charLength(Span span, List<Word> words) {
        return words.get(span.to() - 1).end() - words.get(span.from()).start();
    }

    private record Span(int from, int to, ChunkingStrategy strategy) {

        int size() {
            return to - from;
        }

        Span union(Span next) {
            ChunkingStrategy merged = strategy == ChunkingStrategy.PARAGRAPH && next.strategy == ChunkingStrategy.PARAGRAPH
                ? ChunkingStrategy.PARAGRAPH
                : ChunkingStrategy.SLIDING_WINDOW;
            return new Span(Math.min(from, next.from), Math.max(to, next.to), merged);
        }
    }
}
