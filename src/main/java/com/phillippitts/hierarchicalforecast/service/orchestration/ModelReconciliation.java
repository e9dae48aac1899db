package com.phillippitts.hierarchicalforecast.service.orchestration;

import com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationResult;

import java.util.List;

/**
 * Result of one (reconciler, model) task, ready for column assembly.
 *
 * @param model model column name
 * @param label reconciler label
 * @param result reconciled mean and intervals
 * @param levels levels whose intervals must be written; empty for mean-only output
 */
record ModelReconciliation(String model, String label, ReconciliationResult result, List<Double> levels) {

    ModelReconciliation {
        levels = List.copyOf(levels);
    }
}
