package com.phillippitts.hierarchicalforecast.service.orchestration;

import com.phillippitts.hierarchicalforecast.domain.SeriesTable;
import com.phillippitts.hierarchicalforecast.service.context.HierarchyContext;
import com.phillippitts.hierarchicalforecast.service.interval.IntervalColumns;
import com.phillippitts.hierarchicalforecast.service.interval.IntervalColumns.IntervalColumn;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wide (series x horizon) views of one model's columns, pivoted once per call and shared
 * read-only by every reconciler task of that model.
 *
 * @param model model column name
 * @param forecast point forecasts
 * @param intervals interval columns of this model, in table column order
 * @param bounds interval column name to bound matrix
 * @param fitted in-sample fitted values (series x historical time), empty when the history has
 *               no column for this model
 */
record ModelSlice(
        String model,
        RealMatrix forecast,
        List<IntervalColumn> intervals,
        Map<String, RealMatrix> bounds,
        Optional<RealMatrix> fitted
) {

    static ModelSlice of(String model, SeriesTable forecasts, SeriesTable history, HierarchyContext context) {
        RealMatrix forecast = context.forecastLayout().pivot(forecasts, model);
        List<IntervalColumn> intervals = IntervalColumns.forPrefix(model, forecasts.columnNames());
        Map<String, RealMatrix> bounds = new LinkedHashMap<>();
        for (IntervalColumn column : intervals) {
            bounds.put(column.columnName(), context.forecastLayout().pivot(forecasts, column.columnName()));
        }
        Optional<RealMatrix> fitted = history.hasColumn(model)
                ? Optional.of(context.historyLayout().pivot(history, model))
                : Optional.empty();
        return new ModelSlice(model, forecast, List.copyOf(intervals), Map.copyOf(bounds), fitted);
    }

    boolean hasIntervals() {
        return !intervals.isEmpty();
    }

    RealMatrix bound(IntervalColumn column) {
        return bounds.get(column.columnName());
    }

    /**
     * The opposite-side column of the same level, if the table carries one.
     */
    Optional<IntervalColumn> partnerOf(IntervalColumn column) {
        return intervals.stream()
                .filter(c -> c.side() == column.side().opposite() && c.level() == column.level())
                .findFirst();
    }
}
