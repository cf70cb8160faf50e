package com.nevis.chunking.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class ConfigurationException extends RuntimeException {
    private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super("Invalid pipeline configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
