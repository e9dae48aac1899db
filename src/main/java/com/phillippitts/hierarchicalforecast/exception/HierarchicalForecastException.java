package com.phillippitts.hierarchicalforecast.exception;

/**
 * Base exception for all hierarchical-forecast application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class HierarchicalForecastException extends RuntimeException {

    public HierarchicalForecastException(String message) {
        super(message);
    }

    public HierarchicalForecastException(String message, Throwable cause) {
        super(message, cause);
    }

    public HierarchicalForecastException(Throwable cause) {
        super(cause);
    }
}
