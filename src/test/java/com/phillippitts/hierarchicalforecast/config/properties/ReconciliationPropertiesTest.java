package com.phillippitts.hierarchicalforecast.config.properties;

import com.phillippitts.hierarchicalforecast.exception.InvalidConfidenceLevelException;
import com.phillippitts.hierarchicalforecast.service.reconcile.impl.TopDownReconciler;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconciliationPropertiesTest {

    @Test
    void appliesDefaults() {
        ReconciliationProperties props = new ReconciliationProperties(null, null, null, null, null, null, null);

        assertThat(props.getLevels()).isEmpty();
        assertThat(props.isBootstrap()).isFalse();
        assertThat(props.getBootstrapSamples()).isEqualTo(1000);
        assertThat(props.getBootstrapSeed()).isZero();
        assertThat(props.isParallel()).isFalse();
        assertThat(props.getMethods()).containsExactly(ReconciliationProperties.Method.BOTTOM_UP);
        assertThat(props.getTopDownMethod()).isEqualTo(TopDownReconciler.Method.AVERAGE_PROPORTIONS);
    }

    @Test
    void keepsExplicitValues() {
        ReconciliationProperties props = new ReconciliationProperties(List.of(80.0, 95.0), true, 250, 7L, true,
                List.of(ReconciliationProperties.Method.TOP_DOWN, ReconciliationProperties.Method.BOTTOM_UP),
                TopDownReconciler.Method.PROPORTION_AVERAGES);

        assertThat(props.getLevels()).containsExactly(80.0, 95.0);
        assertThat(props.isBootstrap()).isTrue();
        assertThat(props.getBootstrapSamples()).isEqualTo(250);
        assertThat(props.getBootstrapSeed()).isEqualTo(7L);
        assertThat(props.isParallel()).isTrue();
        assertThat(props.getMethods()).containsExactly(ReconciliationProperties.Method.TOP_DOWN,
                ReconciliationProperties.Method.BOTTOM_UP);
    }

    @Test
    void rejectsInvalidLevel() {
        assertThatThrownBy(() -> new ReconciliationProperties(List.of(100.0), null, null, null, null, null, null))
                .isInstanceOf(InvalidConfidenceLevelException.class);
    }

    @Test
    void rejectsNonPositiveSampleCount() {
        assertThatThrownBy(() -> new ReconciliationProperties(null, null, 0, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bootstrap-samples");
    }
}
