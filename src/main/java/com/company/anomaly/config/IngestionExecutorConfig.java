package com.company.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Separate pools for the evaluation and rollup paths. When a queue is full the
 * task runs on the submitting thread.
 */
@Configuration
public class IngestionExecutorConfig {

    @Bean(name = "evaluationExecutor")
    public ThreadPoolTaskExecutor evaluationExecutor(AnomalyProperties properties) {
        return buildExecutor("evaluation-", properties.getExecutor().getEvaluationThreads(),
                properties.getExecutor().getQueueCapacity());
    }

    @Bean(name = "rollupExecutor")
    public ThreadPoolTaskExecutor rollupExecutor(AnomalyProperties properties) {
        return buildExecutor("rollup-", properties.getExecutor().getRollupThreads(),
                properties.getExecutor().getQueueCapacity());
    }

    private ThreadPoolTaskExecutor buildExecutor(String prefix, int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
