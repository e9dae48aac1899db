package com.phillippitts.hierarchicalforecast.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable long-format table keyed by series identifier and timestamp.
 *
 * <p>Each row carries a {@code (uniqueId, ds)} key and one value per named column. Rows and
 * columns keep their insertion order. The same type is used for base forecasts (one column per
 * model plus optional {@code "{model}-lo-{L}"}/{@code "{model}-hi-{L}"} interval columns) and for
 * historical observations (a {@value #TARGET_COLUMN} column plus optional in-sample fitted
 * values named after each model).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SeriesTable forecasts = SeriesTable.builder("naive", "naive-lo-80")
 *         .row("total", t0, 10.0, 7.44)
 *         .row("total", t1, 10.0, 7.44)
 *         .build();
 * }</pre>
 */
public final class SeriesTable {

    /** Observed-value column of historical tables. */
    public static final String TARGET_COLUMN = "y";

    private final List<String> uniqueIds;
    private final List<Instant> timestamps;
    private final LinkedHashMap<String, double[]> columns;

    private SeriesTable(List<String> uniqueIds, List<Instant> timestamps,
                        LinkedHashMap<String, double[]> columns) {
        this.uniqueIds = uniqueIds;
        this.timestamps = timestamps;
        this.columns = columns;
    }

    /**
     * Creates a table from parallel row keys and column vectors.
     *
     * @param uniqueIds series identifier of each row
     * @param timestamps timestamp of each row
     * @param columns named column vectors, each of the same length as the row keys
     * @return new table
     * @throws IllegalArgumentException if lengths disagree
     * @throws NullPointerException if any argument or key is null
     */
    public static SeriesTable of(List<String> uniqueIds, List<Instant> timestamps,
                                 Map<String, double[]> columns) {
        Objects.requireNonNull(uniqueIds, "uniqueIds must not be null");
        Objects.requireNonNull(timestamps, "timestamps must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        if (uniqueIds.size() != timestamps.size()) {
            throw new IllegalArgumentException("uniqueIds and timestamps differ in length: "
                    + uniqueIds.size() + " vs " + timestamps.size());
        }
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            copy.put(Objects.requireNonNull(entry.getKey(), "column name must not be null"),
                    checkLength(entry.getKey(), entry.getValue(), uniqueIds.size()).clone());
        }
        return new SeriesTable(List.copyOf(uniqueIds), List.copyOf(timestamps), copy);
    }

    /**
     * Starts a row-at-a-time builder for a table with the given value columns.
     *
     * @param columnNames value column names, in order
     * @return new builder
     */
    public static Builder builder(String... columnNames) {
        return new Builder(List.of(columnNames));
    }

    public int rowCount() {
        return uniqueIds.size();
    }

    public String uniqueId(int row) {
        return uniqueIds.get(row);
    }

    public Instant timestamp(int row) {
        return timestamps.get(row);
    }

    /**
     * Returns the distinct series identifiers in order of first occurrence (never sorted).
     *
     * @return deduplicated identifiers
     */
    public List<String> uniqueIds() {
        return List.copyOf(new LinkedHashSet<>(uniqueIds));
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Returns a copy of the named column.
     *
     * @param name column name
     * @return column values in row order
     * @throws IllegalArgumentException if the column does not exist
     */
    public double[] column(String name) {
        return requireColumn(name).clone();
    }

    /**
     * Reads one cell without copying the column.
     *
     * @param name column name
     * @param row row position
     * @return cell value
     */
    public double value(String name, int row) {
        return requireColumn(name)[row];
    }

    /**
     * Returns a new table with the column added (or replaced when the name already exists).
     *
     * @param name column name
     * @param values values in row order
     * @return new table; this table is left untouched
     */
    SeriesTable withColumn(String name, double[] values) {
        return withColumns(Collections.singletonMap(name, values));
    }

    /**
     * Returns a new table with all given columns appended in iteration order.
     *
     * @param added columns to add or replace
     * @return new table; this table is left untouched
     */
    public SeriesTable withColumns(Map<String, double[]> added) {
        LinkedHashMap<String, double[]> merged = new LinkedHashMap<>(columns);
        for (Map.Entry<String, double[]> entry : added.entrySet()) {
            merged.put(Objects.requireNonNull(entry.getKey(), "column name must not be null"),
                    checkLength(entry.getKey(), entry.getValue(), rowCount()).clone());
        }
        return new SeriesTable(uniqueIds, timestamps, merged);
    }

    private double[] requireColumn(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return values;
    }

    private static double[] checkLength(String name, double[] values, int expected) {
        Objects.requireNonNull(values, () -> "values of column " + name + " must not be null");
        if (values.length != expected) {
            throw new IllegalArgumentException("Column " + name + " has " + values.length
                    + " values, expected " + expected);
        }
        return values;
    }

    @Override
    public String toString() {
        return "SeriesTable[rows=" + rowCount() + ", columns=" + columns.keySet() + "]";
    }

    /**
     * Row-at-a-time builder.
     */
    public static final class Builder {
        private final List<String> columnNames;
        private final List<String> ids = new ArrayList<>();
        private final List<Instant> ds = new ArrayList<>();
        private final List<double[]> rows = new ArrayList<>();

        private Builder(List<String> columnNames) {
            if (new LinkedHashSet<>(columnNames).size() != columnNames.size()) {
                throw new IllegalArgumentException("Duplicate column names: " + columnNames);
            }
            this.columnNames = columnNames;
        }

        /**
         * Appends one row.
         *
         * @param uniqueId series identifier
         * @param timestamp row timestamp
         * @param values one value per column, in column order
         * @return this builder for chaining
         */
        public Builder row(String uniqueId, Instant timestamp, double... values) {
            if (values.length != columnNames.size()) {
                throw new IllegalArgumentException("Expected " + columnNames.size()
                        + " values, got " + values.length + ": " + Arrays.toString(values));
            }
            ids.add(Objects.requireNonNull(uniqueId, "uniqueId must not be null"));
            ds.add(Objects.requireNonNull(timestamp, "timestamp must not be null"));
            rows.add(values.clone());
            return this;
        }

        public SeriesTable build() {
            LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();
            for (int c = 0; c < columnNames.size(); c++) {
                double[] values = new double[rows.size()];
                for (int r = 0; r < rows.size(); r++) {
                    values[r] = rows.get(r)[c];
                }
                columns.put(columnNames.get(c), values);
            }
            return new SeriesTable(List.copyOf(ids), List.copyOf(ds), columns);
        }
    }
}
