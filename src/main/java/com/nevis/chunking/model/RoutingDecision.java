package com.nevis.chunking.model;

import java.util.List;

public record RoutingDecision(
    Chunk chunk,
    boolean needsLlm,
    QualityScores scores,
    List<String> reasons
) {
    public RoutingDecision {
        reasons = List.copyOf(reasons);
    }

    public double score() {
        return scores.combined();
    }
}
