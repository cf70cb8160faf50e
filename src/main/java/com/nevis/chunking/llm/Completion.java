package com.nevis.chunking.llm;

/**
 * Raw provider reply. Token counts are {@code null} when the provider did not report them;
 * some providers only report {@code totalTokens}.
 */
public record Completion(String text, Integer inputTokens, Integer outputTokens, Integer totalTokens) {

    public Completion(String text, Integer inputTokens, Integer outputTokens) {
        this(text, inputTokens, outputTokens,
            inputTokens != null && outputTokens != null ? inputTokens + outputTokens : null);
    }

    public boolean hasUsage() {
        return inputTokens != null && outputTokens != null;
    }
}
