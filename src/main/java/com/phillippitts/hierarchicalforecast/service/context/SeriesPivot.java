package com.phillippitts.hierarchicalforecast.service.context;

import com.phillippitts.hierarchicalforecast.domain.SeriesTable;
import com.phillippitts.hierarchicalforecast.exception.MissingHistoryException;
import com.phillippitts.hierarchicalforecast.exception.RaggedHorizonException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes {@link RowLayout}s for long-format tables.
 */
final class SeriesPivot {

    private SeriesPivot() {
        // Utility class - prevent instantiation
    }

    /**
     * Layout of base forecasts: every series must carry the same timestamps, each exactly once.
     *
     * @param forecasts base forecasts
     * @param uids series order (all series of the table)
     * @return layout whose time axis is the shared, sorted horizon
     * @throws RaggedHorizonException if horizons differ or a (series, timestamp) pair repeats
     */
    static RowLayout forecastLayout(SeriesTable forecasts, List<String> uids) {
        Map<String, Set<Instant>> perSeries = new LinkedHashMap<>();
        for (int r = 0; r < forecasts.rowCount(); r++) {
            String id = forecasts.uniqueId(r);
            if (!perSeries.computeIfAbsent(id, k -> new HashSet<>()).add(forecasts.timestamp(r))) {
                throw new RaggedHorizonException(id, "duplicate timestamp " + forecasts.timestamp(r));
            }
        }
        TreeSet<Instant> horizon = new TreeSet<>(perSeries.get(uids.get(0)));
        for (String id : uids) {
            Set<Instant> own = perSeries.get(id);
            if (!own.equals(horizon)) {
                throw new RaggedHorizonException(id, "expected " + horizon.size() + " timestamps " + horizon
                        + " but found " + new TreeSet<>(own));
            }
        }
        return layout(forecasts, uids, new ArrayList<>(horizon));
    }

    /**
     * Layout of historical observations over the sorted union of all observed timestamps.
     *
     * @param history historical table
     * @param uids series to select, in order
     * @return layout; rows of other series map to -1
     * @throws MissingHistoryException if a selected series has no rows
     * @throws RaggedHorizonException if a (series, timestamp) pair repeats
     */
    static RowLayout historyLayout(SeriesTable history, List<String> uids) {
        TreeSet<Instant> axis = new TreeSet<>();
        Map<String, Set<Instant>> seen = new HashMap<>();
        for (int r = 0; r < history.rowCount(); r++) {
            axis.add(history.timestamp(r));
            if (!seen.computeIfAbsent(history.uniqueId(r), k -> new HashSet<>()).add(history.timestamp(r))) {
                throw new RaggedHorizonException(history.uniqueId(r),
                        "duplicate historical timestamp " + history.timestamp(r));
            }
        }
        List<String> missing = uids.stream().filter(id -> !seen.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            throw new MissingHistoryException(missing);
        }
        return layout(history, uids, new ArrayList<>(axis));
    }

    private static RowLayout layout(SeriesTable table, List<String> uids, List<Instant> axis) {
        Map<String, Integer> seriesPos = new HashMap<>();
        for (int i = 0; i < uids.size(); i++) {
            seriesPos.put(uids.get(i), i);
        }
        Map<Instant, Integer> timePos = new HashMap<>();
        for (int t = 0; t < axis.size(); t++) {
            timePos.put(axis.get(t), t);
        }
        int[] seriesIndex = new int[table.rowCount()];
        int[] timeIndex = new int[table.rowCount()];
        for (int r = 0; r < table.rowCount(); r++) {
            seriesIndex[r] = seriesPos.getOrDefault(table.uniqueId(r), -1);
            timeIndex[r] = timePos.get(table.timestamp(r));
        }
        return new RowLayout(seriesIndex, timeIndex, uids.size(), axis);
    }
}
