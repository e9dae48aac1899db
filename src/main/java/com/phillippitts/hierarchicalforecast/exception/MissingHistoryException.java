package com.phillippitts.hierarchicalforecast.exception;

import java.util.List;

/**
 * Thrown when forecast series have no rows in the historical table.
 */
public class MissingHistoryException extends HierarchicalForecastException {

    private final List<String> missingIds;

    public MissingHistoryException(List<String> missingIds) {
        super("No historical observations for series: " + missingIds);
        this.missingIds = List.copyOf(missingIds);
    }

    public List<String> getMissingIds() {
        return missingIds;
    }
}
