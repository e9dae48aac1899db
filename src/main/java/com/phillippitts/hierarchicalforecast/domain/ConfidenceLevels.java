package com.phillippitts.hierarchicalforecast.domain;

import com.phillippitts.hierarchicalforecast.exception.InvalidConfidenceLevelException;

import java.math.BigDecimal;

/**
 * Validation and formatting of confidence levels expressed as percentages.
 */
public final class ConfidenceLevels {

    private ConfidenceLevels() {
        // Utility class - prevent instantiation
    }

    /**
     * Rejects levels outside the open interval (0, 100).
     *
     * @param level confidence level in percent
     * @return the level, unchanged
     * @throws InvalidConfidenceLevelException if level is NaN, {@code <= 0} or {@code >= 100}
     */
    public static double requireValid(double level) {
        if (Double.isNaN(level) || level <= 0.0 || level >= 100.0) {
            throw new InvalidConfidenceLevelException(level);
        }
        return level;
    }

    /**
     * Formats a level for column names: {@code 80.0 -> "80"}, {@code 97.5 -> "97.5"}.
     *
     * @param level confidence level in percent
     * @return shortest plain representation
     */
    public static String format(double level) {
        if (level == Math.rint(level)) {
            return Long.toString((long) level);
        }
        return BigDecimal.valueOf(level).stripTrailingZeros().toPlainString();
    }
}
