package com.nevis.chunking.config;

import com.nevis.chunking.exception.LlmTransientException;
import com.nevis.chunking.infra.InMemoryQuotaRateLimiter;
import com.nevis.chunking.infra.LlmCircuitBreaker;
import com.nevis.chunking.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.util.Map;

@Configuration
public class LimiterConfig {

    public static final String LLM_BREAKER = "llm";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean("llmRateLimiter")
    public RateLimiter llmRateLimiter(RateLimitProperties properties, Clock clock) {
        return new InMemoryQuotaRateLimiter(properties, clock);
    }

    @Bean
    public LlmCircuitBreaker llmCircuitBreaker(LlmProperties properties, Clock clock) {
        return new LlmCircuitBreaker(LLM_BREAKER, properties.breakerThreshold(), properties.breakerTimeout(), clock);
    }

    @Bean
    public Sleeper retrySleeper() {
        return new ThreadWaitSleeper();
    }

    /**
     * Retries only {@link LlmTransientException}: {@code maxRetries} extra attempts with delays of
     * {@code min(baseDelay * 2^attempt, maxDelay)}.
     */
    @Bean("llmRetryTemplate")
    public RetryTemplate llmRetryTemplate(LlmProperties properties, Sleeper retrySleeper) {
        Map<Class<? extends Throwable>, Boolean> retryable = Map.of(LlmTransientException.class, true);
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(properties.maxRetries() + 1, retryable, true);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(properties.baseDelay().toMillis());
        backOffPolicy.setMultiplier(2.0);
        backOffPolicy.setMaxInterval(properties.maxDelay().toMillis());
        backOffPolicy.setSleeper(retrySleeper);

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(retryPolicy);
        retryTemplate.setBackOffPolicy(backOffPolicy);
        return retryTemplate;
    }
}
