package com.phillippitts.hierarchicalforecast.exception;

/**
 * Thrown when a confidence level lies outside the open interval (0, 100).
 */
public class InvalidConfidenceLevelException extends HierarchicalForecastException {

    private final double level;

    public InvalidConfidenceLevelException(double level) {
        super("Confidence level must be in (0, 100), got: " + level);
        this.level = level;
    }

    public double getLevel() {
        return level;
    }
}
