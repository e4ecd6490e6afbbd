package com.phillippitts.streamwatch.config;

import com.phillippitts.streamwatch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used by the monitor.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on roster size.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the pool that runs one liveness probe per streamer each cycle.
     *
     * <p>Configured with {@code queue-capacity=0}, so each submitted probe gets its own worker up to
     * {@code max-pool-size}; a queued probe would otherwise wait behind slow ones and miss the
     * poll deadline.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. Past {@code max-pool-size}
     * the control loop runs the probe itself, which slows the cycle instead of dropping a
     * streamer from the snapshot.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext (e.g. {@code streamer}) from the
     * submitting thread to the worker thread.
     *
     * @return configured executor for liveness probes
     */
    @Bean(name = "probeExecutor")
    public Executor probeExecutor() {
        return buildExecutor(threadPoolProperties.getProbe());
    }

    /**
     * Creates the pool that runs recording start and stop work off the control loop.
     *
     * @return configured executor for recording session lifecycle tasks
     */
    @Bean(name = "sessionExecutor")
    public Executor sessionExecutor() {
        return buildExecutor(threadPoolProperties.getSession());
    }

    /**
     * Creates the scheduler for deferred disconnect confirmations.
     *
     * <p>Cancelled tasks are removed from the queue immediately so pending confirmations made
     * moot by a reconnect or an official end do not accumulate. Scheduled tasks set their own
     * {@code streamer} ThreadContext entry.
     *
     * @return scheduler for grace-period timers
     */
    @Bean(name = "disconnectScheduler")
    public ThreadPoolTaskScheduler disconnectScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
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
