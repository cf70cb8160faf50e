package com.nevis.chunking.model;

public enum OutcomeKind {
    REFINED,
    RATE_LIMITED,
    CIRCUIT_OPEN,
    TRANSIENT_FAILURE,
    FATAL_FAILURE
}
