package com.parsely.backend.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    // Strategies are CPU-bound regex work; four per document at most.
    @Bean(name = "strategyEvaluationExecutor")
    public Executor strategyEvaluationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("strategy-eval-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "learnedExtractionExecutor")
    public Executor learnedExtractionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("learned-extract-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "extractionBatchExecutor")
    public Executor extractionBatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("extraction-batch-");
        executor.initialize();
        return executor;
    }
}
