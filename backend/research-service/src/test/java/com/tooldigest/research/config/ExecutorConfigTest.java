package com.tooldigest.research.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutorConfigTest {

    private final ThreadPoolTaskExecutor executor = new ExecutorConfig().researchExecutor();
    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdown();
    }

    @Test
    @DisplayName("Runs on one research thread, queues one task and rejects the next")
    void singleThreadWithOneSlot() throws Exception {
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch started = new CountDownLatch(1);

        executor.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            started.countDown();
            awaitRelease();
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        executor.execute(this::awaitRelease);

        assertThat(threadName.get()).startsWith("research-");
        assertThatThrownBy(() -> executor.execute(this::awaitRelease))
                .isInstanceOf(RejectedExecutionException.class);
    }

    private void awaitRelease() {
        try {
            release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
