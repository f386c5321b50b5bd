package com.phillippitts.mockinterview.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the session scheduler (timers, monitors, pollers, retries)
 * and the worker executor (preflight probes, answer checkpoints).
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private SchedulerPoolProperties scheduler = new SchedulerPoolProperties();
    private WorkerPoolProperties worker = new WorkerPoolProperties();

    public SchedulerPoolProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerPoolProperties scheduler) {
        this.scheduler = scheduler;
    }

    public WorkerPoolProperties getWorker() {
        return worker;
    }

    public void setWorker(WorkerPoolProperties worker) {
        this.worker = worker;
    }

    /**
     * Scheduled pool configuration.
     */
    public static class SchedulerPoolProperties {
        private int poolSize = 4;
        private String threadNamePrefix = "session-sched-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Worker executor pool configuration.
     */
    public static class WorkerPoolProperties {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 50;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "session-worker-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
