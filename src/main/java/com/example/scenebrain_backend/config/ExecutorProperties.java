package com.example.scenebrain_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizes the thread pools used for context sub-fetches, streamed orchestration runs and detached
 * background learning.
 */
@ConfigurationProperties(prefix = "brain.executors")
public class ExecutorProperties {

    private Pool contextFetch = new Pool(8, 200);
    private Pool learner = new Pool(2, 100);
    private Pool orchestration = new Pool(4, 100);

    public Pool getContextFetch() {
        return contextFetch;
    }

    public void setContextFetch(Pool contextFetch) {
        this.contextFetch = contextFetch;
    }

    public Pool getLearner() {
        return learner;
    }

    public void setLearner(Pool learner) {
        this.learner = learner;
    }

    public Pool getOrchestration() {
        return orchestration;
    }

    public void setOrchestration(Pool orchestration) {
        this.orchestration = orchestration;
    }

    public static class Pool {
        private int threads = 2;
        private int queueCapacity = 50;

        public Pool() {
        }

        public Pool(int threads, int queueCapacity) {
            this.threads = threads;
            this.queueCapacity = queueCapacity;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
