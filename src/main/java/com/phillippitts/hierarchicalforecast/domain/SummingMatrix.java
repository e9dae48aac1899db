package com.phillippitts.hierarchicalforecast.domain;

import com.phillippitts.hierarchicalforecast.exception.HierarchyMismatchException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Labelled aggregation matrix S.
 *
 * <p>Rows are every series of the hierarchy (aggregate and bottom), columns are the bottom-level
 * series only. Entry {@code S[i][j]} is 1 when bottom series {@code j} sums into series
 * {@code i}, and 0 otherwise. Instances are immutable.
 */
public final class SummingMatrix {

    private final List<String> rowIds;
    private final List<String> bottomIds;
    private final double[][] values;
    private final Map<String, Integer> rowIndex;

    /**
     * Creates an aggregation matrix.
     *
     * @param rowIds labels of all series, one per row
     * @param bottomIds labels of the bottom series, one per column
     * @param values 0/1 entries, {@code rowIds.size() x bottomIds.size()}
     * @throws IllegalArgumentException if shapes disagree, labels repeat or an entry is not 0/1
     */
    public SummingMatrix(List<String> rowIds, List<String> bottomIds, double[][] values) {
        this.rowIds = List.copyOf(Objects.requireNonNull(rowIds, "rowIds must not be null"));
        this.bottomIds = List.copyOf(Objects.requireNonNull(bottomIds, "bottomIds must not be null"));
        Objects.requireNonNull(values, "values must not be null");
        if (values.length != this.rowIds.size()) {
            throw new IllegalArgumentException("Expected " + this.rowIds.size() + " rows, got " + values.length);
        }
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != this.bottomIds.size()) {
                throw new IllegalArgumentException("Row " + this.rowIds.get(i) + " has " + values[i].length
                        + " entries, expected " + this.bottomIds.size());
            }
            for (double v : values[i]) {
                if (v != 0.0 && v != 1.0) {
                    throw new IllegalArgumentException("Aggregation entries must be 0 or 1, got " + v
                            + " in row " + this.rowIds.get(i));
                }
            }
            this.values[i] = values[i].clone();
        }
        this.rowIndex = new HashMap<>();
        for (int i = 0; i < this.rowIds.size(); i++) {
            if (rowIndex.put(this.rowIds.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate row label: " + this.rowIds.get(i));
            }
        }
        if (this.bottomIds.stream().distinct().count() != this.bottomIds.size()) {
            throw new IllegalArgumentException("Duplicate bottom label in " + this.bottomIds);
        }
    }

    List<String> rowIds() {
        return rowIds;
    }

    public List<String> bottomIds() {
        return bottomIds;
    }

    /**
     * Position of a series among the rows.
     *
     * @param id series identifier
     * @return row position, or -1 when absent
     */
    public int indexOfRow(String id) {
        Integer idx = rowIndex.get(id);
        return idx == null ? -1 : idx;
    }

    /**
     * Selects and reorders rows to exactly the given identifiers.
     *
     * @param ids identifiers in the required order
     * @return matrix restricted to {@code ids}; columns are unchanged
     * @throws HierarchyMismatchException listing every identifier absent from the rows
     */
    public SummingMatrix restrictTo(List<String> ids) {
        List<String> missing = new ArrayList<>();
        double[][] selected = new double[ids.size()][];
        for (int i = 0; i < ids.size(); i++) {
            int idx = indexOfRow(ids.get(i));
            if (idx < 0) {
                missing.add(ids.get(i));
            } else {
                selected[i] = values[idx];
            }
        }
        if (!missing.isEmpty()) {
            throw new HierarchyMismatchException(missing, "aggregation matrix");
        }
        return new SummingMatrix(ids, bottomIds, selected);
    }

    /**
     * Returns the numeric entries as a fresh matrix.
     *
     * @return copy of the entries
     */
    public RealMatrix toRealMatrix() {
        return MatrixUtils.createRealMatrix(values);
    }

    @Override
    public String toString() {
        return "SummingMatrix[" + rowIds.size() + "x" + bottomIds.size() + "]";
    }
}
