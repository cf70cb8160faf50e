package com.nevis.chunking.model;

public record RefinementOutcome(Chunk chunk, OutcomeKind kind, String detail) {

    public static RefinementOutcome of(Chunk chunk, OutcomeKind kind) {
        return new RefinementOutcome(chunk, kind, null);
    }

    public boolean calledProvider() {
        return kind == OutcomeKind.REFINED || kind == OutcomeKind.TRANSIENT_FAILURE || kind == OutcomeKind.FATAL_FAILURE;
    }
}
