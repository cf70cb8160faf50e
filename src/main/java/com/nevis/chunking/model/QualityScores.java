package com.nevis.chunking.model;

public record QualityScores(
    double boundary,
    double size,
    double complexity,
    double combined
) {
}
