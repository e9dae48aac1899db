package com.phillippitts.hierarchicalforecast.service.context;

import com.phillippitts.hierarchicalforecast.domain.SeriesTable;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Position of every long-format row in the wide (series x time) view of a table.
 *
 * <p>{@code seriesIndex[row]} is -1 for rows of series outside the selection.
 *
 * @param seriesIndex row to series position
 * @param timeIndex row to time position
 * @param seriesCount number of selected series
 * @param timestamps sorted time axis of the wide view
 */
public record RowLayout(int[] seriesIndex, int[] timeIndex, int seriesCount, List<Instant> timestamps) {

    public RowLayout {
        Objects.requireNonNull(seriesIndex, "seriesIndex must not be null");
        Objects.requireNonNull(timeIndex, "timeIndex must not be null");
        if (seriesIndex.length != timeIndex.length) {
            throw new IllegalArgumentException("seriesIndex and timeIndex differ in length");
        }
        seriesIndex = seriesIndex.clone();
        timeIndex = timeIndex.clone();
        timestamps = List.copyOf(timestamps);
    }

    public int rowCount() {
        return seriesIndex.length;
    }

    public int timeCount() {
        return timestamps.size();
    }

    /**
     * Pivots one column to series x time; cells without a row are NaN.
     *
     * @param table table this layout was computed from
     * @param column column to pivot
     * @return wide matrix
     */
    public RealMatrix pivot(SeriesTable table, String column) {
        if (table.rowCount() != rowCount()) {
            throw new IllegalArgumentException("Layout covers " + rowCount() + " rows, table has " + table.rowCount());
        }
        double[][] wide = new double[seriesCount][timeCount()];
        for (double[] row : wide) {
            Arrays.fill(row, Double.NaN);
        }
        double[] values = table.column(column);
        for (int r = 0; r < values.length; r++) {
            if (seriesIndex[r] >= 0) {
                wide[seriesIndex[r]][timeIndex[r]] = values[r];
            }
        }
        return MatrixUtils.createRealMatrix(wide);
    }

    /**
     * Reads a series x time matrix back into long row order.
     *
     * @param wide matrix shaped {@code seriesCount x timeCount}
     * @return one value per row; NaN for rows outside the selection
     */
    public double[] flatten(RealMatrix wide) {
        if (wide.getRowDimension() != seriesCount || wide.getColumnDimension() != timeCount()) {
            throw new IllegalArgumentException("Expected " + seriesCount + "x" + timeCount() + " matrix, got "
                    + wide.getRowDimension() + "x" + wide.getColumnDimension());
        }
        double[] out = new double[rowCount()];
        for (int r = 0; r < out.length; r++) {
            out[r] = seriesIndex[r] >= 0 ? wide.getEntry(seriesIndex[r], timeIndex[r]) : Double.NaN;
        }
        return out;
    }
}
