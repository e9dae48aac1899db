package com.phillippitts.hierarchicalforecast.config;

import com.phillippitts.hierarchicalforecast.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @Test
    void shouldCreateExecutorWithDefaultConfiguration() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties())
                .reconciliationExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(4);
            assertThat(executor.getMaxPoolSize()).isEqualTo(8);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("reconcile-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldApplyConfiguredSizes() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getReconciliation().setCorePoolSize(2);
        properties.getReconciliation().setMaxPoolSize(3);
        properties.getReconciliation().setThreadNamePrefix("custom-");

        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties)
                .reconciliationExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
            assertThat(executor.getMaxPoolSize()).isEqualTo(3);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("custom-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        Executor executor = new ThreadPoolConfig(new ThreadPoolProperties()).reconciliationExecutor();
        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                completedTasks.incrementAndGet();
                latch.countDown();
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
        ((ThreadPoolTaskExecutor) executor).shutdown();
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        Executor executor = new ThreadPoolConfig(new ThreadPoolProperties()).reconciliationExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        ThreadContext.put("reconciliationId", "abc-123");
        try {
            executor.execute(() -> {
                seen.set(ThreadContext.get("reconciliationId"));
                latch.countDown();
            });
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            ThreadContext.remove("reconciliationId");
            ((ThreadPoolTaskExecutor) executor).shutdown();
        }

        assertThat(seen.get()).isEqualTo("abc-123");
    }
}
