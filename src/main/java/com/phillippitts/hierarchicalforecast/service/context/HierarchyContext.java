package com.phillippitts.hierarchicalforecast.service.context;

import org.apache.commons.math3.linear.RealMatrix;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared numeric context of one reconciliation call, built once and read by every
 * (reconciler, model) task. Accessors return copies, so instances are effectively immutable.
 *
 * @param uniqueIds series order of the call (first occurrence in the base forecasts)
 * @param summingMatrix aggregation matrix restricted and reordered to {@code uniqueIds}
 * @param insample series x time historical observations, NaN where unobserved
 * @param bottomIndex positions of the bottom series within {@code uniqueIds}, in S column order
 * @param tagIndex tag label to positions within {@code uniqueIds}
 * @param forecastLayout wide view of the base forecasts (time axis = horizon)
 * @param historyLayout wide view of the history (time axis = observed timestamps)
 */
public record HierarchyContext(
        List<String> uniqueIds,
        RealMatrix summingMatrix,
        RealMatrix insample,
        int[] bottomIndex,
        Map<String, int[]> tagIndex,
        RowLayout forecastLayout,
        RowLayout historyLayout
) {

    public HierarchyContext {
        uniqueIds = List.copyOf(uniqueIds);
        summingMatrix = Objects.requireNonNull(summingMatrix, "summingMatrix must not be null").copy();
        insample = Objects.requireNonNull(insample, "insample must not be null").copy();
        bottomIndex = Objects.requireNonNull(bottomIndex, "bottomIndex must not be null").clone();
        tagIndex = Collections.unmodifiableMap(copyOf(tagIndex));
        Objects.requireNonNull(forecastLayout, "forecastLayout must not be null");
        Objects.requireNonNull(historyLayout, "historyLayout must not be null");
    }

    @Override
    public RealMatrix summingMatrix() {
        return summingMatrix.copy();
    }

    @Override
    public RealMatrix insample() {
        return insample.copy();
    }

    @Override
    public int[] bottomIndex() {
        return bottomIndex.clone();
    }

    @Override
    public Map<String, int[]> tagIndex() {
        return copyOf(tagIndex);
    }

    List<Instant> horizon() {
        return forecastLayout.timestamps();
    }

    private static Map<String, int[]> copyOf(Map<String, int[]> tags) {
        Map<String, int[]> copy = new LinkedHashMap<>();
        tags.forEach((k, v) -> copy.put(k, v.clone()));
        return copy;
    }
}
