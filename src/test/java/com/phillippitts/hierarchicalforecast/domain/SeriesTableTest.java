package com.phillippitts.hierarchicalforecast.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.phillippitts.hierarchicalforecast.TestHierarchies.day;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeriesTableTest {

    @Test
    void uniqueIdsFollowFirstOccurrenceNotSortOrder() {
        SeriesTable table = SeriesTable.builder("m")
                .row("zeta", day(0), 1.0)
                .row("alpha", day(0), 2.0)
                .row("zeta", day(1), 3.0)
                .build();

        assertThat(table.uniqueIds()).containsExactly("zeta", "alpha");
        assertThat(table.rowCount()).isEqualTo(3);
    }

    @Test
    void withColumnReturnsNewTableAndLeavesOriginalUntouched() {
        SeriesTable table = SeriesTable.builder("m").row("a", day(0), 1.0).build();

        SeriesTable extended = table.withColumn("m/BottomUp", new double[]{5.0});

        assertThat(table.columnNames()).containsExactly("m");
        assertThat(extended.columnNames()).containsExactly("m", "m/BottomUp");
        assertThat(extended.value("m/BottomUp", 0)).isEqualTo(5.0);
        assertThat(extended.uniqueId(0)).isEqualTo("a");
    }

    @Test
    void withColumnReplacesExistingColumnInPlace() {
        SeriesTable table = SeriesTable.builder("m", "n").row("a", day(0), 1.0, 2.0).build();

        SeriesTable replaced = table.withColumn("m", new double[]{9.0});

        assertThat(replaced.columnNames()).containsExactly("m", "n");
        assertThat(replaced.value("m", 0)).isEqualTo(9.0);
    }

    @Test
    void columnReturnsDefensiveCopy() {
        SeriesTable table = SeriesTable.builder("m").row("a", day(0), 1.0).build();

        table.column("m")[0] = 42.0;

        assertThat(table.value("m", 0)).isEqualTo(1.0);
    }

    @Test
    void unknownColumnIsRejected() {
        SeriesTable table = SeriesTable.builder("m").row("a", day(0), 1.0).build();

        assertThatThrownBy(() -> table.column("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown column: missing");
    }

    @Test
    void builderRejectsWrongValueCount() {
        SeriesTable.Builder builder = SeriesTable.builder("m", "n");

        assertThatThrownBy(() -> builder.row("a", day(0), 1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 2 values");
    }

    @Test
    void ofRejectsColumnsOfWrongLength() {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("m", new double[]{1.0});

        assertThatThrownBy(() -> SeriesTable.of(List.of("a", "b"), List.of(day(0), day(0)), columns))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Column m has 1 values, expected 2");
    }

    @Test
    void ofCopiesInputArrays() {
        double[] values = {1.0, 2.0};
        Map<String, double[]> columns = Map.of("m", values);
        SeriesTable table = SeriesTable.of(List.of("a", "a"), List.of(Instant.EPOCH, day(1)), columns);

        values[0] = 99.0;

        assertThat(table.value("m", 0)).isEqualTo(1.0);
        assertThat(table.timestamp(0)).isEqualTo(Instant.EPOCH);
    }
}
