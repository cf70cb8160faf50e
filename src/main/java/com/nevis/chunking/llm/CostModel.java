package com.nevis.chunking.llm;

import com.nevis.chunking.config.LlmProperties;
import com.nevis.chunking.config.RateLimitProperties;
import org.springframework.stereotype.Component;

/**
 * Turns prompts and token usage into spend. A bare token total is split 80/20 between input and
 * output. Without any usage data roughly four characters count as one token, and estimates
 * assume the reply uses the full output allowance.
 */
@Component
public class CostModel {

    private static final double CHARS_PER_TOKEN = 4.0;
    static final double INPUT_SHARE_OF_TOTAL = 0.8;

    private final double costPerInputToken;
    private final double costPerOutputToken;
    private final int maxOutputTokens;

    public CostModel(RateLimitProperties rateLimit, LlmProperties llm) {
        this.costPerInputToken = rateLimit.costPerInputToken();
        this.costPerOutputToken = rateLimit.costPerOutputToken();
        this.maxOutputTokens = llm.maxOutputTokens();
    }

    public static int estimateTokens(String text) {
        return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
    }

    public double estimateCost(String prompt) {
        return estimateTokens(prompt) * costPerInputToken + maxOutputTokens * costPerOutputToken;
    }

    public double actualCost(String prompt, Completion completion) {
        if (completion.hasUsage()) {
            return completion.inputTokens() * costPerInputToken + completion.outputTokens() * costPerOutputToken;
        }
        if (completion.totalTokens() != null) {
            int total = completion.totalTokens();
            return total * INPUT_SHARE_OF_TOTAL * costPerInputToken + total * (1.0 - INPUT_SHARE_OF_TOTAL) * costPerOutputToken;
        }
        return estimateTokens(prompt) * costPerInputToken + estimateTokens(completion.text()) * costPerOutputToken;
    }
}
