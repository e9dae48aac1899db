package com.phillippitts.hierarchicalforecast.exception;

import java.util.List;

/**
 * Thrown when series identifiers cannot be located in the aggregation matrix.
 * This is fatal for the whole reconciliation call.
 */
public class HierarchyMismatchException extends HierarchicalForecastException {

    private final List<String> missingIds;

    public HierarchyMismatchException(List<String> missingIds, String where) {
        super("Series not found in " + where + ": " + missingIds);
        this.missingIds = List.copyOf(missingIds);
    }

    public List<String> getMissingIds() {
        return missingIds;
    }
}
