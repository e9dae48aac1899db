package com.phillippitts.hierarchicalforecast.service.orchestration;

import com.phillippitts.hierarchicalforecast.domain.SeriesTable;
import com.phillippitts.hierarchicalforecast.service.context.RowLayout;
import com.phillippitts.hierarchicalforecast.service.interval.BoundSide;
import com.phillippitts.hierarchicalforecast.service.interval.IntervalColumns;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes reconciled matrices into the base forecast table.
 *
 * <p>Column names:
 * <ul>
 *   <li>mean: {@code "{model}/{label}"}</li>
 *   <li>bounds: {@code "{model}/{label}-lo-{level}"} and {@code "{model}/{label}-hi-{level}"}</li>
 * </ul>
 * Matrices are flattened back into the base table's own row order. Columns are appended in task
 * order, so the output does not depend on which worker finished first.
 */
public final class ForecastColumnAssembler {

    public static String meanColumn(String model, String label) {
        return model + "/" + label;
    }

    public static String boundColumn(String model, String label, BoundSide side, double level) {
        return IntervalColumns.name(meanColumn(model, label), side, level);
    }

    SeriesTable assemble(SeriesTable forecasts, RowLayout layout, List<ModelReconciliation> outputs) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (ModelReconciliation out : outputs) {
            columns.put(meanColumn(out.model(), out.label()), layout.flatten(out.result().mean()));
            for (double level : out.levels()) {
                ReconciliationResult.Interval interval = out.result().intervals().get(level);
                columns.put(boundColumn(out.model(), out.label(), BoundSide.LOWER, level),
                        layout.flatten(interval.lower()));
                columns.put(boundColumn(out.model(), out.label(), BoundSide.UPPER, level),
                        layout.flatten(interval.upper()));
            }
        }
        return forecasts.withColumns(columns);
    }
}
