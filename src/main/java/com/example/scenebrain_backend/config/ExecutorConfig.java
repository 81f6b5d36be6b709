package com.example.scenebrain_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Provides the thread pools used by {@link com.example.scenebrain_backend.context.ContextBuilder}
 * to run sub-fetches concurrently, by streamed orchestration runs, and by the preference learner and
 * image analyser to run detached from the request.
 */
@Configuration
@EnableConfigurationProperties(ExecutorProperties.class)
public class ExecutorConfig {

    @Bean(name = "contextFetchExecutor")
    public ThreadPoolTaskExecutor contextFetchExecutor(ExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getContextFetch().getThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getContextFetch().getQueueCapacity());
        executor.setThreadNamePrefix("context-");
        // a saturated pool runs the fetch on the request thread rather than failing the build
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean(name = "learnerTaskExecutor")
    public ThreadPoolTaskExecutor learnerTaskExecutor(ExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getLearner().getThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getLearner().getQueueCapacity());
        executor.setThreadNamePrefix("learner-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean(name = "orchestrationExecutor")
    public ThreadPoolTaskExecutor orchestrationExecutor(ExecutorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getOrchestration().getThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getOrchestration().getQueueCapacity());
        executor.setThreadNamePrefix("orchestrate-");
        executor.initialize();
        return executor;
    }
}
