package com.nevis.chunking.model;

import java.util.Locale;
import java.util.Optional;

public enum RefinementAction {
    KEEP,
    MERGE_PREV,
    MERGE_NEXT,
    DROP;

    public static Optional<RefinementAction> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (RefinementAction action : values()) {
            if (action.name().equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
