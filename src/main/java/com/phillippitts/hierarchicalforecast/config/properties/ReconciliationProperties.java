package com.phillippitts.hierarchicalforecast.config.properties;

import com.phillippitts.hierarchicalforecast.domain.ConfidenceLevels;
import com.phillippitts.hierarchicalforecast.service.reconcile.impl.TopDownReconciler;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "hierarchy.reconciliation")
public class ReconciliationProperties {

    public enum Method { BOTTOM_UP, TOP_DOWN }

    /** Confidence levels for prediction intervals; empty for means only. */
    @NotNull
    private final List<Double> levels;

    /** Build intervals from bootstrapped residual paths instead of the Gaussian scale. */
    private final boolean bootstrap;

    /** Number of bootstrap paths per model. */
    @Min(1)
    private final int bootstrapSamples;

    /** Seed of the residual block sampler. */
    private final long bootstrapSeed;

    /** Run (method, model) tasks on the reconciliation executor. */
    private final boolean parallel;

    /** Reconciliation methods, in invocation order. */
    @NotEmpty
    private final List<Method> methods;

    /** Proportion scheme used by {@link Method#TOP_DOWN}. */
    @NotNull
    private final TopDownReconciler.Method topDownMethod;

    @ConstructorBinding
    public ReconciliationProperties(List<Double> levels, Boolean bootstrap, Integer bootstrapSamples,
                                    Long bootstrapSeed, Boolean parallel, List<Method> methods,
                                    TopDownReconciler.Method topDownMethod) {
        this.levels = levels == null ? List.of() : List.copyOf(levels);
        this.levels.forEach(ConfidenceLevels::requireValid);
        this.bootstrap = bootstrap != null && bootstrap;
        int samples = bootstrapSamples == null ? 1_000 : bootstrapSamples;
        if (samples < 1) {
            throw new IllegalArgumentException("hierarchy.reconciliation.bootstrap-samples must be >= 1");
        }
        this.bootstrapSamples = samples;
        this.bootstrapSeed = bootstrapSeed == null ? 0L : bootstrapSeed;
        this.parallel = parallel != null && parallel;
        this.methods = methods == null || methods.isEmpty() ? List.of(Method.BOTTOM_UP) : List.copyOf(methods);
        this.topDownMethod = topDownMethod == null ? TopDownReconciler.Method.AVERAGE_PROPORTIONS : topDownMethod;
    }

    public List<Double> getLevels() {
        return levels;
    }

    public boolean isBootstrap() {
        return bootstrap;
    }

    public int getBootstrapSamples() {
        return bootstrapSamples;
    }

    public long getBootstrapSeed() {
        return bootstrapSeed;
    }

    public boolean isParallel() {
        return parallel;
    }

    public List<Method> getMethods() {
        return methods;
    }

    public TopDownReconciler.Method getTopDownMethod() {
        return topDownMethod;
    }
}
