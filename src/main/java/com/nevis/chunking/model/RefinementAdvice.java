package com.nevis.chunking.model;

/**
 * Parsed reply of the completion provider for one chunk.
 *
 * @param appliedOffset how far the end boundary actually moved; zero when the suggested move was rejected
 */
public record RefinementAdvice(
    RefinementAction action,
    int offsetAdjust,
    SemanticType semanticType,
    double confidence,
    String reason,
    int appliedOffset
) {
    public RefinementAdvice withAppliedOffset(int applied) {
        return new RefinementAdvice(action, offsetAdjust, semanticType, confidence, reason, applied);
    }
}
