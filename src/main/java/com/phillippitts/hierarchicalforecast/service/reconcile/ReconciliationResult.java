package com.phillippitts.hierarchicalforecast.service.reconcile;

import org.apache.commons.math3.linear.RealMatrix;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of one reconciler invocation.
 *
 * @param mean series x horizon reconciled mean forecasts
 * @param intervals confidence level to reconciled bounds; empty when no levels were supplied
 */
public record ReconciliationResult(RealMatrix mean, Map<Double, Interval> intervals) {

    /**
     * Lower and upper bound matrices for one level.
     *
     * @param lower series x horizon lower bounds
     * @param upper series x horizon upper bounds
     */
    public record Interval(RealMatrix lower, RealMatrix upper) {
        public Interval {
            Objects.requireNonNull(lower, "lower must not be null");
            Objects.requireNonNull(upper, "upper must not be null");
        }
    }

    public ReconciliationResult {
        Objects.requireNonNull(mean, "mean must not be null");
        intervals = intervals == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(intervals));
    }

    /**
     * Creates a result without intervals.
     *
     * @param mean reconciled mean forecasts
     * @return new result
     */
    public static ReconciliationResult meanOnly(RealMatrix mean) {
        return new ReconciliationResult(mean, Map.of());
    }

    /**
     * Returns a copy of this result with one more interval.
     *
     * @param level confidence level in percent
     * @param lower lower bounds
     * @param upper upper bounds
     * @return new result
     */
    public ReconciliationResult withInterval(double level, RealMatrix lower, RealMatrix upper) {
        Map<Double, Interval> merged = new LinkedHashMap<>(intervals);
        merged.put(level, new Interval(lower, upper));
        return new ReconciliationResult(mean, merged);
    }

    public Optional<Interval> interval(double level) {
        return Optional.ofNullable(intervals.get(level));
    }
}
