package com.phillippitts.hierarchicalforecast.exception;

/**
 * Thrown when a reconciler returns a result that does not honour its output contract,
 * e.g. a missing interval for a requested level or a mean of the wrong shape.
 */
public class ReconcilerContractException extends HierarchicalForecastException {

    private final String reconciler;

    public ReconcilerContractException(String reconciler, String reason) {
        super(reason + " (reconciler: " + reconciler + ")");
        this.reconciler = reconciler;
    }

    public String getReconciler() {
        return reconciler;
    }
}
