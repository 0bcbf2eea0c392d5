package com.phillippitts.radflow.config;

import com.phillippitts.radflow.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the scheduler and thread pools used outside the action worker.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Scheduler for the periodic tasks: dictation sync ({@code @Scheduled}), the re-armable
     * study poller and one-shot delayed checks.
     *
     * <p>Named {@code taskScheduler} so {@code @Scheduled} methods use it as well.
     * Cancelled tasks are removed from the queue because the study poller re-arms often.
     * Scheduled tasks start with an empty ThreadContext; only the cue executor copies the
     * submitter's context.
     *
     * @param clock clock that trigger instants are measured against
     * @return configured scheduler
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler(Clock clock) {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setClock(clock);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Bounded pool for audio cue playback so a 200 ms tone never blocks the action worker
     * or a poller.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.DiscardOldestPolicy}. A cue that cannot
     * be played promptly is worthless, so the oldest pending cue is dropped.
     *
     * @return configured cue executor
     */
    @Bean(name = "cueExecutor")
    public Executor cueExecutor() {
        ThreadPoolProperties.CuePoolProperties cueProps = threadPoolProperties.getCue();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cueProps.getCorePoolSize());
        executor.setMaxPoolSize(cueProps.getMaxPoolSize());
        executor.setQueueCapacity(cueProps.getQueueCapacity());
        executor.setThreadNamePrefix(cueProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(cueProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies Log4j2 ThreadContext (MDC) from the submitting thread to the worker thread
     * and restores the worker's previous context afterwards.
     */
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
