package com.nevis.chunking.model;

public enum RefinementStatus {
    UNREFINED,
    REFINED,
    REFINEMENT_FAILED
}
