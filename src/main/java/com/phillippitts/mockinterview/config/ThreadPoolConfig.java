package com.phillippitts.mockinterview.config;

import com.phillippitts.mockinterview.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind session background work.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on expected concurrent sessions.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Shared scheduler for question timers, integrity monitors, feedback pollers and completion
     * retries.
     *
     * <p>Cancelled tasks are removed from the work queue immediately, so the queue size reflects
     * exactly the background work still owned by live sessions.
     *
     * @return scheduler shut down with the application context
     */
    @Bean(name = "sessionScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService sessionScheduler() {
        ThreadPoolProperties.SchedulerPoolProperties props = threadPoolProperties.getScheduler();
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(props.getThreadNamePrefix());
        threadFactory.setDaemon(true);
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(props.getPoolSize(), threadFactory);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return scheduler;
    }

    /**
     * Bounded pool for concurrent preflight probes and best-effort answer checkpoints.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the caller thread executes the task,
     * providing backpressure instead of failing fast.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread to preserve request and session correlation IDs in async logs.
     *
     * @return configured executor
     */
    @Bean(name = "workerExecutor")
    public Executor workerExecutor() {
        ThreadPoolProperties.WorkerPoolProperties workerProps = threadPoolProperties.getWorker();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workerProps.getCorePoolSize());
        executor.setMaxPoolSize(workerProps.getMaxPoolSize());
        executor.setQueueCapacity(workerProps.getQueueCapacity());
        executor.setThreadNamePrefix(workerProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(workerProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
