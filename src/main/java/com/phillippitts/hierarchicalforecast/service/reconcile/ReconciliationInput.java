package com.phillippitts.hierarchicalforecast.service.reconcile;

import com.phillippitts.hierarchicalforecast.service.bootstrap.BootstrapSamples;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable input bundle for one (reconciler, model) invocation.
 *
 * <p>Holds the mandatory point forecast plus the optional inputs that were both staged and
 * declared by the reconciler. Reading an input that was not supplied raises
 * {@link IllegalStateException}; use {@link #isProvided(ReconcilerInput)} to branch.
 *
 * <p>Fitted values distinguish "not offered" from "offered but unavailable": when
 * {@link ReconcilerInput#FITTED_VALUES} is provided, {@link #fittedValues()} may still be empty.
 * Matrices are copied on read so one reconciler cannot alter what another one sees.
 */
public final class ReconciliationInput {

    private final RealMatrix forecast;
    private final Set<ReconcilerInput> provided;
    private final Optional<RealMatrix> fitted;
    private final List<Double> levels;
    private final RealMatrix sigma;
    private final BootstrapSamples samples;
    private final boolean bootstrap;
    private final Map<String, int[]> tags;
    private final int[] bottomIndex;
    private final RealMatrix summingMatrix;
    private final RealMatrix insample;

    private ReconciliationInput(Builder builder, Set<ReconcilerInput> provided) {
        this.forecast = builder.forecast.copy();
        this.provided = provided;
        this.fitted = provided.contains(ReconcilerInput.FITTED_VALUES) ? builder.fitted : null;
        this.levels = provided.contains(ReconcilerInput.LEVELS) ? builder.levels : null;
        this.sigma = provided.contains(ReconcilerInput.SIGMA) ? builder.sigma : null;
        this.samples = provided.contains(ReconcilerInput.BOOTSTRAP_SAMPLES) ? builder.samples : null;
        this.bootstrap = provided.contains(ReconcilerInput.BOOTSTRAP) && builder.bootstrap;
        this.tags = provided.contains(ReconcilerInput.TAGS) ? builder.tags : null;
        this.bottomIndex = provided.contains(ReconcilerInput.BOTTOM_INDEX) ? builder.bottomIndex : null;
        this.summingMatrix = provided.contains(ReconcilerInput.SUMMING_MATRIX) ? builder.summingMatrix : null;
        this.insample = provided.contains(ReconcilerInput.INSAMPLE) ? builder.insample : null;
    }

    /**
     * Starts a bundle for the given point forecast.
     *
     * @param forecast series x horizon point forecasts
     * @return new builder
     */
    public static Builder builder(RealMatrix forecast) {
        return new Builder(forecast);
    }

    /** Series x horizon point forecasts. */
    public RealMatrix forecast() {
        return forecast.copy();
    }

    public boolean isProvided(ReconcilerInput kind) {
        return provided.contains(kind);
    }

    /** Inputs present in this bundle. */
    public Set<ReconcilerInput> provided() {
        return provided;
    }

    /** Fitted values, empty when the model has no in-sample column. */
    public Optional<RealMatrix> fittedValues() {
        require(ReconcilerInput.FITTED_VALUES);
        return fitted.map(RealMatrix::copy);
    }

    public List<Double> levels() {
        require(ReconcilerInput.LEVELS);
        return levels;
    }

    public RealMatrix sigma() {
        require(ReconcilerInput.SIGMA);
        return sigma.copy();
    }

    public BootstrapSamples bootstrapSamples() {
        require(ReconcilerInput.BOOTSTRAP_SAMPLES);
        return samples;
    }

    public boolean bootstrap() {
        require(ReconcilerInput.BOOTSTRAP);
        return bootstrap;
    }

    /** Tag label to row positions. Arrays are copies. */
    public Map<String, int[]> tags() {
        require(ReconcilerInput.TAGS);
        Map<String, int[]> copy = new LinkedHashMap<>();
        tags.forEach((k, v) -> copy.put(k, v.clone()));
        return copy;
    }

    public int[] bottomIndex() {
        require(ReconcilerInput.BOTTOM_INDEX);
        return bottomIndex.clone();
    }

    public RealMatrix summingMatrix() {
        require(ReconcilerInput.SUMMING_MATRIX);
        return summingMatrix.copy();
    }

    public RealMatrix insample() {
        require(ReconcilerInput.INSAMPLE);
        return insample.copy();
    }

    private void require(ReconcilerInput kind) {
        if (!provided.contains(kind)) {
            throw new IllegalStateException("Input " + kind + " was not supplied to this reconciler");
        }
    }

    /**
     * Collects staged inputs, then keeps only those a reconciler declared.
     */
    public static final class Builder {
        private final RealMatrix forecast;
        private final EnumSet<ReconcilerInput> staged = EnumSet.noneOf(ReconcilerInput.class);
        private Optional<RealMatrix> fitted;
        private List<Double> levels;
        private RealMatrix sigma;
        private BootstrapSamples samples;
        private boolean bootstrap;
        private Map<String, int[]> tags;
        private int[] bottomIndex;
        private RealMatrix summingMatrix;
        private RealMatrix insample;

        private Builder(RealMatrix forecast) {
            this.forecast = Objects.requireNonNull(forecast, "forecast must not be null");
        }

        public Builder fittedValues(RealMatrix fitted) {
            this.fitted = Optional.of(fitted);
            staged.add(ReconcilerInput.FITTED_VALUES);
            return this;
        }

        /** Stages the explicit "fitted values unavailable" marker. */
        public Builder fittedValuesUnavailable() {
            this.fitted = Optional.empty();
            staged.add(ReconcilerInput.FITTED_VALUES);
            return this;
        }

        public Builder levels(List<Double> levels) {
            this.levels = List.copyOf(levels);
            staged.add(ReconcilerInput.LEVELS);
            return this;
        }

        public Builder sigma(RealMatrix sigma) {
            this.sigma = Objects.requireNonNull(sigma, "sigma must not be null");
            staged.add(ReconcilerInput.SIGMA);
            return this;
        }

        public Builder bootstrapSamples(BootstrapSamples samples) {
            this.samples = Objects.requireNonNull(samples, "samples must not be null");
            this.bootstrap = true;
            staged.add(ReconcilerInput.BOOTSTRAP_SAMPLES);
            staged.add(ReconcilerInput.BOOTSTRAP);
            return this;
        }

        public Builder tags(Map<String, int[]> tags) {
            this.tags = Objects.requireNonNull(tags, "tags must not be null");
            staged.add(ReconcilerInput.TAGS);
            return this;
        }

        public Builder bottomIndex(int[] bottomIndex) {
            this.bottomIndex = Objects.requireNonNull(bottomIndex, "bottomIndex must not be null");
            staged.add(ReconcilerInput.BOTTOM_INDEX);
            return this;
        }

        public Builder summingMatrix(RealMatrix summingMatrix) {
            this.summingMatrix = Objects.requireNonNull(summingMatrix, "summingMatrix must not be null");
            staged.add(ReconcilerInput.SUMMING_MATRIX);
            return this;
        }

        public Builder insample(RealMatrix insample) {
            this.insample = Objects.requireNonNull(insample, "insample must not be null");
            staged.add(ReconcilerInput.INSAMPLE);
            return this;
        }

        /** Keys staged so far. */
        Set<ReconcilerInput> staged() {
            return EnumSet.copyOf(staged);
        }

        /**
         * Builds the bundle from the intersection of staged inputs and declared capabilities.
         *
         * @param capabilities inputs the reconciler declared
         * @return immutable input bundle
         */
        public ReconciliationInput buildFor(Set<ReconcilerInput> capabilities) {
            Set<ReconcilerInput> selected = EnumSet.noneOf(ReconcilerInput.class);
            for (ReconcilerInput kind : staged) {
                if (capabilities.contains(kind)) {
                    selected.add(kind);
                }
            }
            return new ReconciliationInput(this, Collections.unmodifiableSet(selected));
        }
    }
}
