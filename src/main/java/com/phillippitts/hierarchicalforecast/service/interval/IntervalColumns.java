package com.phillippitts.hierarchicalforecast.service.interval;

import com.phillippitts.hierarchicalforecast.domain.ConfidenceLevels;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming convention for interval columns: {@code "{prefix}-lo-{level}"} and
 * {@code "{prefix}-hi-{level}"}.
 *
 * <p>The prefix is a model name in base forecasts and {@code "{model}/{label}"} in reconciled
 * output.
 */
public final class IntervalColumns {

    private static final Pattern INTERVAL = Pattern.compile("^(.+)-(lo|hi)-(\\d+(?:\\.\\d+)?)$");

    private IntervalColumns() {
        // Utility class - prevent instantiation
    }

    /**
     * A parsed interval column.
     *
     * @param columnName full column name
     * @param prefix model (or model/label) part
     * @param side bound side
     * @param level confidence level in percent
     */
    public record IntervalColumn(String columnName, String prefix, BoundSide side, double level) {
    }

    /**
     * Whether a column name carries an interval marker.
     *
     * @param columnName column name
     * @return true for {@code -lo-} and {@code -hi-} columns
     */
    public static boolean isIntervalColumn(String columnName) {
        return columnName.contains("-" + BoundSide.LOWER.marker() + "-")
                || columnName.contains("-" + BoundSide.UPPER.marker() + "-");
    }

    /**
     * Parses an interval column name.
     *
     * @param columnName column name
     * @return parsed column, or empty when the name does not follow the convention
     */
    public static Optional<IntervalColumn> parse(String columnName) {
        Matcher m = INTERVAL.matcher(columnName);
        if (!m.matches()) {
            return Optional.empty();
        }
        BoundSide side = BoundSide.LOWER.marker().equals(m.group(2)) ? BoundSide.LOWER : BoundSide.UPPER;
        return Optional.of(new IntervalColumn(columnName, m.group(1), side, Double.parseDouble(m.group(3))));
    }

    /**
     * Interval columns that belong to exactly the given prefix, in the order given.
     *
     * @param prefix model name
     * @param columnNames candidate columns
     * @return matching interval columns
     */
    public static List<IntervalColumn> forPrefix(String prefix, List<String> columnNames) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        return columnNames.stream()
                .map(IntervalColumns::parse)
                .flatMap(Optional::stream)
                .filter(c -> c.prefix().equals(prefix))
                .toList();
    }

    /**
     * Builds an interval column name.
     *
     * @param prefix model or model/label part
     * @param side bound side
     * @param level confidence level in percent
     * @return column name
     */
    public static String name(String prefix, BoundSide side, double level) {
        return prefix + "-" + side.marker() + "-" + ConfidenceLevels.format(level);
    }
}
