package com.phillippitts.lifecycle.config;

import com.phillippitts.lifecycle.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for concurrent fan-out.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.*}).
 *
 * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
 * are full, the submitting thread runs the task itself, providing backpressure instead of
 * dropping handlers.
 *
 * <p>MDC propagation: the Log4j2 ThreadContext of the submitting thread (entity kind and id
 * of the running transition) is copied to the worker thread.
 *
 * <p>The dispatch and subscriber pools are wrapped in {@link NestedFanOutExecutor}: fan-out
 * started from one of their worker threads runs on that thread.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Pool running event handlers.
     */
    @Bean(name = "dispatchExecutor")
    public Executor dispatchExecutor() {
        return new NestedFanOutExecutor(buildExecutor(threadPoolProperties.getDispatch()));
    }

    /**
     * Pool running status subscribers. Kept apart from the dispatch pool so subscribers that
     * start new transitions never compete with the handlers of those transitions.
     */
    @Bean(name = "subscriberExecutor")
    public Executor subscriberExecutor() {
        return new NestedFanOutExecutor(buildExecutor(threadPoolProperties.getSubscriber()));
    }

    /**
     * Pool running status validators. Kept apart from the dispatch pool so a validator is never
     * queued behind the handler waiting for it.
     */
    @Bean(name = "validationExecutor")
    public Executor validationExecutor() {
        return buildExecutor(threadPoolProperties.getValidation());
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties pool) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(pool.getMaxPoolSize());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix(pool.getThreadNamePrefix());
        executor.setKeepAliveSeconds(pool.getKeepAliveSeconds());
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
