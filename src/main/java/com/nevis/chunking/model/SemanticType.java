package com.nevis.chunking.model;

import java.util.Locale;

public enum SemanticType {
    INTRO,
    BODY,
    LIST,
    QUOTE,
    CODE,
    CONCLUSION;

    public static SemanticType fromLabel(String label, SemanticType fallback) {
        if (label == null || label.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
