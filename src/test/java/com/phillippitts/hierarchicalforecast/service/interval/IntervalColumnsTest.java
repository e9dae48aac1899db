package com.phillippitts.hierarchicalforecast.service.interval;

import com.phillippitts.hierarchicalforecast.service.interval.IntervalColumns.IntervalColumn;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IntervalColumnsTest {

    @Test
    void parsesLowerAndUpperColumns() {
        IntervalColumn lo = IntervalColumns.parse("naive-lo-80").orElseThrow();
        IntervalColumn hi = IntervalColumns.parse("auto-arima-hi-97.5").orElseThrow();

        assertThat(lo.prefix()).isEqualTo("naive");
        assertThat(lo.side()).isEqualTo(BoundSide.LOWER);
        assertThat(lo.level()).isEqualTo(80.0);
        assertThat(hi.prefix()).isEqualTo("auto-arima");
        assertThat(hi.side()).isEqualTo(BoundSide.UPPER);
        assertThat(hi.level()).isEqualTo(97.5);
    }

    @Test
    void plainModelColumnIsNotAnInterval() {
        assertThat(IntervalColumns.parse("naive")).isEmpty();
        assertThat(IntervalColumns.isIntervalColumn("naive")).isFalse();
        assertThat(IntervalColumns.isIntervalColumn("naive-lo-80")).isTrue();
        assertThat(IntervalColumns.isIntervalColumn("naive-hi-95")).isTrue();
    }

    @Test
    void forPrefixMatchesModelNameExactly() {
        List<String> columns = List.of("naive", "naive-lo-80", "snaive-lo-80", "naive2-hi-80", "naive-hi-80");

        List<IntervalColumn> matched = IntervalColumns.forPrefix("naive", columns);

        assertThat(matched).extracting(IntervalColumn::columnName)
                .containsExactly("naive-lo-80", "naive-hi-80");
    }

    @Test
    void buildsNamesWithoutTrailingZero() {
        assertThat(IntervalColumns.name("naive/BottomUp", BoundSide.LOWER, 80.0))
                .isEqualTo("naive/BottomUp-lo-80");
        assertThat(IntervalColumns.name("naive/BottomUp", BoundSide.UPPER, 97.5))
                .isEqualTo("naive/BottomUp-hi-97.5");
    }

    @Test
    void boundSideOppositeAndSign() {
        assertThat(BoundSide.LOWER.opposite()).isEqualTo(BoundSide.UPPER);
        assertThat(BoundSide.UPPER.opposite()).isEqualTo(BoundSide.LOWER);
        assertThat(BoundSide.LOWER.sign()).isEqualTo(-1);
        assertThat(BoundSide.UPPER.sign()).isEqualTo(1);
    }
}
