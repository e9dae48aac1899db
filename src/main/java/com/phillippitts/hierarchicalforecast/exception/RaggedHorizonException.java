package com.phillippitts.hierarchicalforecast.exception;

/**
 * Thrown when series of a long-format table do not share one forecast horizon,
 * or when a (series, timestamp) pair repeats.
 */
public class RaggedHorizonException extends HierarchicalForecastException {

    private final String uniqueId;

    public RaggedHorizonException(String uniqueId, String reason) {
        super("Inconsistent horizon for series '" + uniqueId + "': " + reason);
        this.uniqueId = uniqueId;
    }

    public String getUniqueId() {
        return uniqueId;
    }
}
