package com.nevis.chunking.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LangChainConfig {

    // retries belong to llmRetryTemplate so that the breaker and the cost ledger see every failure
    @Bean
    public ChatModel chatLanguageModel(LlmProperties properties) {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(properties.apiKey())
            .modelName(properties.modelName())
            .temperature(properties.temperature())
            .maxOutputTokens(properties.maxOutputTokens())
            .timeout(properties.timeout())
            .maxRetries(0)
            .logRequests(properties.logRequests())
            .logResponses(properties.logRequests())
            .build();
    }
}
