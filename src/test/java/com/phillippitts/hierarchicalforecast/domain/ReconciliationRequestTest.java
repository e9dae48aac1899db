package com.phillippitts.hierarchicalforecast.domain;

import com.phillippitts.hierarchicalforecast.TestHierarchies;
import com.phillippitts.hierarchicalforecast.exception.InvalidConfidenceLevelException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconciliationRequestTest {

    @Test
    void defaultsToNoLevelsNoTagsAndNoBootstrap() {
        ReconciliationRequest request = ReconciliationRequest.builder()
                .forecasts(TestHierarchies.pointForecasts(2))
                .history(TestHierarchies.history(5, false))
                .summingMatrix(TestHierarchies.twoLevelMatrix())
                .build();

        assertThat(request.levels()).isEmpty();
        assertThat(request.hasLevels()).isFalse();
        assertThat(request.tags()).isEmpty();
        assertThat(request.bootstrap()).isFalse();
    }

    @Test
    void rejectsInvalidLevel() {
        ReconciliationRequest.Builder builder = ReconciliationRequest.builder()
                .forecasts(TestHierarchies.pointForecasts(2))
                .history(TestHierarchies.history(5, false))
                .summingMatrix(TestHierarchies.twoLevelMatrix())
                .levels(80, 100);

        assertThatThrownBy(builder::build)
                .isInstanceOf(InvalidConfidenceLevelException.class)
                .hasMessageContaining("100");
    }

    @Test
    void rejectsHistoryWithoutTargetColumn() {
        SeriesTable history = SeriesTable.builder("value").row("A", TestHierarchies.day(-1), 1.0).build();
        ReconciliationRequest.Builder builder = ReconciliationRequest.builder()
                .forecasts(TestHierarchies.pointForecasts(2))
                .history(history)
                .summingMatrix(TestHierarchies.twoLevelMatrix());

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'y'");
    }

    @Test
    void rejectsEmptyForecasts() {
        ReconciliationRequest.Builder builder = ReconciliationRequest.builder()
                .forecasts(SeriesTable.builder("naive").build())
                .history(TestHierarchies.history(5, false))
                .summingMatrix(TestHierarchies.twoLevelMatrix());

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one row");
    }

    @Test
    void rejectsMissingSummingMatrix() {
        ReconciliationRequest.Builder builder = ReconciliationRequest.builder()
                .forecasts(TestHierarchies.pointForecasts(2))
                .history(TestHierarchies.history(5, false));

        assertThatThrownBy(builder::build)
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("summingMatrix");
    }
}
