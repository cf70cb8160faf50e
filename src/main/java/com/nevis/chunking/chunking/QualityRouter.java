package com.nevis.chunking.chunking;

import com.nevis.chunking.config.ChunkingProperties;
import com.nevis.chunking.config.RouterProperties;
import com.nevis.chunking.model.Chunk;
import com.nevis.chunking.model.QualityScores;
import com.nevis.chunking.model.RoutingDecision;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Scores a candidate chunk and decides whether it is worth a completion call.
 * Each factor lies in [0, 1] and only falls as its penalties grow, so more trouble
 * never produces a higher combined score.
 */
public class QualityRouter {

    public static final String BOUNDARY_PROBLEMS = "boundary_problems";
    public static final String SIZE_DEVIATION = "size_deviation";
    public static final String STRUCTURAL_COMPLEXITY = "structural_complexity";

    private static final Pattern CLEAN_START = Pattern.compile("^[\\p{Lu}\\p{N}\"'“‘(\\[#>*•`|-]");
    private static final Pattern CONTINUATION_START =
        Pattern.compile("^(?:and|or|also|furthermore|moreover|but|however)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLEAN_END = Pattern.compile("(?:[.!?]+[\"'”’)\\]]*|```|\\|)$");
    private static final Pattern DANGLING_END = Pattern.compile("[,;:]$");

    private static final Pattern LIST_LINE = Pattern.compile("^\\s*(?:[-•*]|\\d+\\.)\\s+");
    private static final Pattern HEADING_LINE = Pattern.compile("^#{1,6}\\s+");
    private static final Pattern QUOTE_LINE = Pattern.compile("^>\\s*");
    private static final Pattern TABLE_LINE = Pattern.compile("^\\s*\\|.*\\|\\s*$");

    private final double boundaryWeight;
    private final double sizeWeight;
    private final double complexityWeight;
    private final double confidenceMin;
    private final int targetWords;
    private final int minWords;
    private final int maxWords;

    public QualityRouter(RouterProperties router, ChunkingProperties chunking) {
        this.boundaryWeight = router.boundaryWeight();
        this.sizeWeight = router.sizeWeight();
        this.complexityWeight = router.complexityWeight();
        this.confidenceMin = router.confidenceMin();
        this.targetWords = chunking.targetWords();
        this.minWords = chunking.minWords();
        this.maxWords = chunking.maxWords();
    }

    public RoutingDecision route(Chunk chunk) {
        String text = chunk.text().strip();

        double boundary = boundaryScore(text);
        double size = sizeScore(chunk.wordCount());
        double complexity = complexityScore(text);
        double combined = boundaryWeight * boundary + sizeWeight * size + complexityWeight * complexity;

        QualityScores scores = new QualityScores(boundary, size, complexity, combined);
        boolean needsLlm = combined < confidenceMin;

        List<String> reasons = new ArrayList<>();
        if (needsLlm) {
            if (boundary < 1.0) {
                reasons.add(BOUNDARY_PROBLEMS);
            }
            if (size < 0.5) {
                reasons.add(SIZE_DEVIATION);
            }
            if (complexity < 1.0) {
                reasons.add(STRUCTURAL_COMPLEXITY);
            }
        }
        return new RoutingDecision(chunk.withScores(scores), needsLlm, scores, reasons);
    }

    double boundaryScore(String text) {
        if (text.isEmpty()) {
            return 0.0;
        }
        double score = 1.0;
        if (!CLEAN_START.matcher(text).find()) {
            score -= 0.3;
        }
        if (CONTINUATION_START.matcher(text).find()) {
            score -= 0.2;
        }
        if (!CLEAN_END.matcher(text).find()) {
            score -= 0.3;
        }
        if (DANGLING_END.matcher(text).find()) {
            score -= 0.2;
        }
        return clamp(score);
    }

    double sizeScore(int words) {
        if (words == targetWords) {
            return 1.0;
        }
        double deviation = words < targetWords
            ? (double) (targetWords - words) / (targetWords - minWords)
            : (double) (words - targetWords) / (maxWords - targetWords);
        return clamp(1.0 - deviation);
    }

    double complexityScore(String text) {
        if (text.isEmpty()) {
            return 1.0;
        }
        String[] lines = text.split("\n");
        int structural = 0;
        for (String line : lines) {
            if (LIST_LINE.matcher(line).find() || HEADING_LINE.matcher(line).find()
                || QUOTE_LINE.matcher(line).find() || TABLE_LINE.matcher(line).matches()) {
                structural++;
            }
        }

        double irregularity = 0.5 * structural / lines.length;

        int fences = countOccurrences(text, "```");
        if (fences > 0) {
            irregularity += 0.2;
        }
        if (fences % 2 != 0) {
            irregularity += 0.3;
        }
        if (count(text, '(') != count(text, ')') || count(text, '[') != count(text, ']')) {
            irregularity += 0.15;
        }
        if (count(text, '"') % 2 != 0 || count(text, '“') != count(text, '”')) {
            irregularity += 0.15;
        }
        return clamp(1.0 - irregularity);
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    private static int countOccurrences(String text, String token) {
        int n = 0;
        int from = text.indexOf(token);
        while (from >= 0) {
            n++;
            from = text.indexOf(token, from + token.length());
        }
        return n;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
