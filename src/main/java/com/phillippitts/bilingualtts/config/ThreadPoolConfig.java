package com.phillippitts.bilingualtts.config;

import com.phillippitts.bilingualtts.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used by the synthesis pipeline.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.dispatch.*} and
 * {@code threadpool.synthesis.*}). The pipeline's own concurrency limit is enforced separately per
 * request, so these pools only need to be large enough for the expected number of concurrent requests.
 *
 * <p>Rejection policies differ per pool:
 * <ul>
 *   <li>dispatch: {@link ThreadPoolExecutor.CallerRunsPolicy}. The request thread runs the segment
 *       task itself, and the backend call inside it is still bounded by the synthesis timeout.</li>
 *   <li>synthesis: {@link ThreadPoolExecutor.AbortPolicy}. A backend call must never run on the
 *       thread that waits on it with a timeout, so a saturated pool rejects instead.</li>
 * </ul>
 *
 * <p>The dispatch pool defaults to a zero-capacity queue. Each run already bounds its in-flight
 * tasks with a semaphore, so a task goes straight to a thread (growing up to the max pool size)
 * rather than waiting behind other requests' tasks.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor running one task per segment. Each task waits on the synthesis pool with a timeout.
     *
     * @return executor for per-segment dispatch
     */
    @Bean(name = "dispatchExecutor")
    public Executor dispatchExecutor() {
        return build(threadPoolProperties.getDispatch(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Executor running backend calls. Exposed as {@link AsyncTaskExecutor} so callers get a
     * {@link java.util.concurrent.Future} they can bound with a timeout and cancel.
     *
     * @return executor for synthesis client calls
     */
    @Bean(name = "synthesisExecutor")
    public AsyncTaskExecutor synthesisExecutor() {
        return build(threadPoolProperties.getSynthesis(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies Log4j2 ThreadContext (MDC) from the submitting thread to the worker thread so that
     * request and session ids survive the hop into the pool.
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
