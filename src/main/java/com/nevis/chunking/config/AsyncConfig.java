package com.nevis.chunking.config;

import com.nevis.chunking.infra.BackpressureGate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    // the coordinator caps running jobs itself; a throttle here would block a finishing job starting its successor
    @Bean(name = "jobTaskExecutor")
    public Executor jobTaskExecutor() {
        return new SimpleAsyncTaskExecutor("chunk-job-");
    }

    @Bean(name = "batchTaskExecutor")
    public Executor batchTaskExecutor() {
        return new SimpleAsyncTaskExecutor("chunk-batch-");
    }

    @Bean(name = "articleTaskExecutor")
    public Executor articleTaskExecutor(BatchProperties batch) {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("chunk-article-");
        executor.setConcurrencyLimit(batch.maxInFlightArticles());
        return executor;
    }

    @Bean
    public BackpressureGate backpressureGate(BatchProperties batch) {
        return new BackpressureGate(batch.maxInFlightArticles(), batch.backpressureThreshold());
    }
}
