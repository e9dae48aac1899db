package com.phillippitts.hierarchicalforecast.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconciliationMetricsTest {

    private MeterRegistry registry;
    private ReconciliationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ReconciliationMetrics(registry);
    }

    @Test
    void shouldRecordLatencyPerReconciler() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(12);

        metrics.recordLatency("BottomUp", durationNanos);

        Timer timer = registry.find("hierarchy.reconciliation.latency")
                .tag("reconciler", "BottomUp")
                .timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }

    @Test
    void shouldKeepReconcilersApart() {
        metrics.incrementSuccess("BottomUp");
        metrics.incrementSuccess("BottomUp");
        metrics.incrementSuccess("TopDown_method-average_proportions");

        Counter bottomUp = registry.find("hierarchy.reconciliation.success").tag("reconciler", "BottomUp").counter();
        Counter topDown = registry.find("hierarchy.reconciliation.success")
                .tag("reconciler", "TopDown_method-average_proportions").counter();

        assertThat(bottomUp.count()).isEqualTo(2.0);
        assertThat(topDown.count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagFailuresWithReason() {
        metrics.incrementFailure("BottomUp", "IllegalArgumentException");

        Counter counter = registry.find("hierarchy.reconciliation.failure")
                .tag("reconciler", "BottomUp")
                .tag("reason", "IllegalArgumentException")
                .counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldRejectNullRegistry() {
        assertThatThrownBy(() -> new ReconciliationMetrics(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("registry");
    }
}
