package com.phillippitts.talkback.config;

import com.phillippitts.talkback.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the listening loop and the interrupt monitor.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.*}).
 * Both pools copy the Log4j2 ThreadContext of the submitting thread so {@code listenId} and
 * {@code mode} survive the hand-off.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor that runs the continuous listening loop.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. The loop logs and stays stopped
     * rather than running capture on the caller's thread.
     *
     * @return executor for listen calls
     */
    @Bean(name = "captureExecutor")
    public Executor captureExecutor() {
        return build(threadPoolProperties.getCapture());
    }

    /**
     * Executor that runs the interrupt monitor while the assistant is speaking.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. The speaking-state event is
     * published from the playback thread, which must never be blocked by capture.
     *
     * @return executor for interrupt checks
     */
    @Bean(name = "interruptExecutor")
    public Executor interruptExecutor() {
        return build(threadPoolProperties.getInterrupt());
    }

    private static Executor build(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    // Package-private for tests
    static TaskDecorator threadContextDecorator() {
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
