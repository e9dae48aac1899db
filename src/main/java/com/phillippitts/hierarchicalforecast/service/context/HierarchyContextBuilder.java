package com.phillippitts.hierarchicalforecast.service.context;

import com.phillippitts.hierarchicalforecast.domain.ReconciliationRequest;
import com.phillippitts.hierarchicalforecast.domain.SeriesTable;
import com.phillippitts.hierarchicalforecast.domain.SummingMatrix;
import com.phillippitts.hierarchicalforecast.exception.HierarchyMismatchException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link HierarchyContext} of a reconciliation call.
 *
 * <p>Steps:
 * <ol>
 *   <li>series order = distinct ids of the base forecasts in first-occurrence order</li>
 *   <li>S restricted and reordered to that order</li>
 *   <li>bottom positions = S column labels located among the selected rows</li>
 *   <li>tag members resolved to positions among the selected rows</li>
 *   <li>history pivoted to series x time; base forecast horizon validated</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
public final class HierarchyContextBuilder {
    private static final Logger LOG = LogManager.getLogger(HierarchyContextBuilder.class);

    /**
     * Builds the shared context.
     *
     * @param request reconciliation inputs
     * @return immutable context
     * @throws HierarchyMismatchException if a forecast series is not a row of S, or a bottom
     *         series of S is not among the forecast series
     * @throws com.phillippitts.hierarchicalforecast.exception.RaggedHorizonException if forecast
     *         series do not share one horizon
     * @throws com.phillippitts.hierarchicalforecast.exception.MissingHistoryException if a
     *         forecast series has no history
     */
    public HierarchyContext build(ReconciliationRequest request) {
        SeriesTable forecasts = request.forecasts();
        List<String> uids = forecasts.uniqueIds();

        SummingMatrix selected = request.summingMatrix().restrictTo(uids);
        int[] bottomIndex = bottomIndex(selected);
        Map<String, int[]> tagIndex = tagIndex(request.tags(), selected);

        RowLayout forecastLayout = SeriesPivot.forecastLayout(forecasts, uids);
        RowLayout historyLayout = SeriesPivot.historyLayout(request.history(), uids);
        RealMatrix insample = historyLayout.pivot(request.history(), SeriesTable.TARGET_COLUMN);

        LOG.debug("Context: {} series, {} bottom, horizon {}, {} historical periods, tags {}",
                uids.size(), bottomIndex.length, forecastLayout.timeCount(), historyLayout.timeCount(),
                tagIndex.keySet());
        return new HierarchyContext(uids, selected.toRealMatrix(), insample, bottomIndex, tagIndex,
                forecastLayout, historyLayout);
    }

    private static int[] bottomIndex(SummingMatrix selected) {
        List<String> bottoms = selected.bottomIds();
        List<String> missing = new ArrayList<>();
        int[] idx = new int[bottoms.size()];
        for (int j = 0; j < bottoms.size(); j++) {
            idx[j] = selected.indexOfRow(bottoms.get(j));
            if (idx[j] < 0) {
                missing.add(bottoms.get(j));
            }
        }
        if (!missing.isEmpty()) {
            throw new HierarchyMismatchException(missing, "forecast series (bottom level)");
        }
        return idx;
    }

    private static Map<String, int[]> tagIndex(Map<String, List<String>> tags, SummingMatrix selected) {
        Map<String, int[]> resolved = new LinkedHashMap<>();
        tags.forEach((level, members) -> {
            List<Integer> positions = new ArrayList<>(members.size());
            for (String member : members) {
                int pos = selected.indexOfRow(member);
                if (pos >= 0) {
                    positions.add(pos);
                } else {
                    LOG.debug("Tag {}: series {} is not part of this call, skipped", level, member);
                }
            }
            resolved.put(level, positions.stream().mapToInt(Integer::intValue).toArray());
        });
        return resolved;
    }
}
