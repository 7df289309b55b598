package com.phillippitts.talkback.config;

import com.phillippitts.talkback.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorsFromDefaults() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

        ThreadPoolTaskExecutor capture = (ThreadPoolTaskExecutor) config.captureExecutor();
        ThreadPoolTaskExecutor interrupt = (ThreadPoolTaskExecutor) config.interruptExecutor();
        try {
            assertThat(capture.getCorePoolSize()).isEqualTo(1);
            assertThat(capture.getMaxPoolSize()).isEqualTo(1);
            assertThat(capture.getThreadNamePrefix()).isEqualTo("capture-");
            assertThat(interrupt.getThreadNamePrefix()).isEqualTo("interrupt-");
        } finally {
            capture.shutdown();
            interrupt.shutdown();
        }
    }

    @Test
    void shouldRejectInsteadOfBlockingWhenSaturated() throws InterruptedException {
        // Arrange
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties())
                .interruptExecutor();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        Runnable blocker = () -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        try {
            executor.execute(blocker);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            executor.execute(blocker);

            // Act & Assert
            assertThatThrownBy(() -> executor.execute(blocker))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorker() throws InterruptedException {
        // Arrange
        Executor executor = new ThreadPoolConfig(new ThreadPoolProperties()).captureExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        ThreadContext.put("listenId", "abc123");

        // Act
        executor.execute(() -> {
            seen.set(ThreadContext.get("listenId"));
            done.countDown();
        });

        // Assert
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("abc123");
        ((ThreadPoolTaskExecutor) executor).shutdown();
    }

    @Test
    void shouldRestoreWorkerContextAfterTask() {
        ThreadContext.put("mode", "NORMAL");
        Runnable decorated = ThreadPoolConfig.threadContextDecorator().decorate(() -> ThreadContext.put("leak", "x"));
        ThreadContext.clearAll();
        ThreadContext.put("worker", "1");

        decorated.run();

        assertThat(ThreadContext.get("leak")).isNull();
        assertThat(ThreadContext.get("mode")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("1");
    }
}
