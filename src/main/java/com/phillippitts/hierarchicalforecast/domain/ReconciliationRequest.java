package com.phillippitts.hierarchicalforecast.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Inputs of one reconciliation call.
 *
 * @param forecasts base forecasts: one column per model plus optional interval columns
 * @param history historical observations ({@link SeriesTable#TARGET_COLUMN}) plus optional
 *                in-sample fitted values named after the models
 * @param summingMatrix aggregation matrix covering at least every forecast series
 * @param tags hierarchy level label to member series identifiers
 * @param levels requested confidence levels in percent; empty when no intervals are requested
 * @param bootstrap whether intervals come from bootstrap samples instead of a Gaussian scale
 */
public record ReconciliationRequest(
        SeriesTable forecasts,
        SeriesTable history,
        SummingMatrix summingMatrix,
        Map<String, List<String>> tags,
        List<Double> levels,
        boolean bootstrap
) {

    public ReconciliationRequest {
        Objects.requireNonNull(forecasts, "forecasts must not be null");
        Objects.requireNonNull(history, "history must not be null");
        Objects.requireNonNull(summingMatrix, "summingMatrix must not be null");
        if (forecasts.rowCount() == 0) {
            throw new IllegalArgumentException("forecasts must contain at least one row");
        }
        if (!history.hasColumn(SeriesTable.TARGET_COLUMN)) {
            throw new IllegalArgumentException("history must contain a '" + SeriesTable.TARGET_COLUMN + "' column");
        }
        Map<String, List<String>> tagCopy = new LinkedHashMap<>();
        if (tags != null) {
            tags.forEach((key, members) -> tagCopy.put(key, List.copyOf(members)));
        }
        tags = Collections.unmodifiableMap(tagCopy);
        levels = levels == null ? List.of() : List.copyOf(levels);
        levels.forEach(ConfidenceLevels::requireValid);
    }

    /**
     * Whether prediction intervals were requested.
     *
     * @return true if at least one level was given
     */
    boolean hasLevels() {
        return !levels.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder; tags and levels are optional.
     */
    public static final class Builder {
        private SeriesTable forecasts;
        private SeriesTable history;
        private SummingMatrix summingMatrix;
        private Map<String, List<String>> tags = Map.of();
        private List<Double> levels = List.of();
        private boolean bootstrap;

        private Builder() {
        }

        public Builder forecasts(SeriesTable forecasts) {
            this.forecasts = forecasts;
            return this;
        }

        public Builder history(SeriesTable history) {
            this.history = history;
            return this;
        }

        public Builder summingMatrix(SummingMatrix summingMatrix) {
            this.summingMatrix = summingMatrix;
            return this;
        }

        public Builder tags(Map<String, List<String>> tags) {
            this.tags = tags;
            return this;
        }

        public Builder levels(List<Double> levels) {
            this.levels = levels;
            return this;
        }

        public Builder levels(double... levels) {
            this.levels = Arrays.stream(levels).boxed().toList();
            return this;
        }

        public Builder bootstrap(boolean bootstrap) {
            this.bootstrap = bootstrap;
            return this;
        }

        public ReconciliationRequest build() {
            return new ReconciliationRequest(forecasts, history, summingMatrix, tags, levels, bootstrap);
        }
    }
}
