package com.phillippitts.hierarchicalforecast.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for reconciliation runs.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Reconciler invocation latency per reconciler label</li>
 *   <li>Success/failure counts per reconciler label</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ReconciliationMetrics {

    private static final String METRIC_PREFIX = "hierarchy.reconciliation";

    private final MeterRegistry registry;

    public ReconciliationMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Records the latency of one reconciler invocation.
     *
     * @param reconciler reconciler label
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String reconciler, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by one reconciler invocation")
                .tag("reconciler", reconciler)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the success counter for a reconciler.
     *
     * @param reconciler reconciler label
     */
    public void incrementSuccess(String reconciler) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful reconciler invocations")
                .tag("reconciler", reconciler)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for a reconciler.
     *
     * @param reconciler reconciler label
     * @param reason exception simple name
     */
    public void incrementFailure(String reconciler, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed reconciler invocations")
                .tag("reconciler", reconciler)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
