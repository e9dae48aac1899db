package com.phillippitts.hierarchicalforecast;

import com.phillippitts.hierarchicalforecast.domain.SeriesTable;
import com.phillippitts.hierarchicalforecast.domain.SummingMatrix;
import com.phillippitts.hierarchicalforecast.service.interval.GaussianScaleEstimator;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared fixtures: a two-level hierarchy {@code total = A + B}.
 */
public final class TestHierarchies {

    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    /** Per-series Gaussian scales used to build interval columns. */
    public static final Map<String, Double> SIGMA = Map.of("total", 3.0, "A", 1.0, "B", 2.0);

    private TestHierarchies() {
        // Utility class - prevent instantiation
    }

    public static Instant day(int offset) {
        return START.plus(offset, ChronoUnit.DAYS);
    }

    public static SummingMatrix twoLevelMatrix() {
        return new SummingMatrix(List.of("total", "A", "B"), List.of("A", "B"),
                new double[][]{{1, 1}, {1, 0}, {0, 1}});
    }

    public static Map<String, List<String>> twoLevelTags() {
        Map<String, List<String>> tags = new LinkedHashMap<>();
        tags.put("Country", List.of("total"));
        tags.put("Country/Region", List.of("A", "B"));
        return tags;
    }

    /** Point forecast of a series at horizon step t (0-based); total is deliberately incoherent. */
    public static double forecast(String id, int t) {
        return switch (id) {
            case "A" -> 11.0 + t;
            case "B" -> 21.0 + t;
            default -> 30.0;
        };
    }

    public static double observed(String id, int t) {
        double a = 10.0 + (t % 4);
        double b = 20.0 + (t % 3);
        return switch (id) {
            case "A" -> a;
            case "B" -> b;
            default -> a + b;
        };
    }

    /**
     * Base forecasts grouped by series (total, A, B) with a single {@code naive} column.
     */
    public static SeriesTable pointForecasts(int horizon) {
        SeriesTable.Builder builder = SeriesTable.builder("naive");
        for (String id : List.of("total", "A", "B")) {
            for (int t = 0; t < horizon; t++) {
                builder.row(id, day(t), forecast(id, t));
            }
        }
        return builder.build();
    }

    /**
     * Base forecasts with {@code naive}, {@code naive-lo-80} and {@code naive-hi-80} columns built
     * from {@link #SIGMA}.
     */
    public static SeriesTable forecastsWithIntervals(int horizon) {
        double z = GaussianScaleEstimator.zScore(80);
        SeriesTable.Builder builder = SeriesTable.builder("naive", "naive-lo-80", "naive-hi-80");
        for (String id : List.of("total", "A", "B")) {
            for (int t = 0; t < horizon; t++) {
                double p = forecast(id, t);
                double spread = z * SIGMA.get(id);
                builder.row(id, day(t), p, p - spread, p + spread);
            }
        }
        return builder.build();
    }

    /**
     * History over the {@code periods} days before {@link #START}. With {@code withFitted} a
     * {@code naive} column holds the previous observation (NaN for the first period).
     */
    public static SeriesTable history(int periods, boolean withFitted) {
        SeriesTable.Builder builder = withFitted ? SeriesTable.builder("y", "naive") : SeriesTable.builder("y");
        for (String id : List.of("total", "A", "B")) {
            for (int t = 0; t < periods; t++) {
                Instant ds = day(t - periods);
                double y = observed(id, t);
                if (withFitted) {
                    builder.row(id, ds, y, t == 0 ? Double.NaN : observed(id, t - 1));
                } else {
                    builder.row(id, ds, y);
                }
            }
        }
        return builder.build();
    }
}
