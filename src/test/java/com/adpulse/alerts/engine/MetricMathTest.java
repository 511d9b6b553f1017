package com.adpulse.alerts.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricMathTest {

    @Test
    void pctChange_regularBaseline() {
        assertThat(MetricMath.pctChange(1.8, 3.0)).isCloseTo(-40.0, within(1e-9));
        assertThat(MetricMath.pctChange(60.0, 50.0)).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void pctChange_zeroBaseline_reportsFullIncreaseOrNothing() {
        assertThat(MetricMath.pctChange(5.0, 0.0)).isEqualTo(100.0);
        assertThat(MetricMath.pctChange(0.0, 0.0)).isEqualTo(0.0);
    }

    @Test
    void toPercent_acceptsFractionOrPercent() {
        assertThat(MetricMath.toPercent(0.42)).isCloseTo(42.0, within(1e-9));
        assertThat(MetricMath.toPercent(42.0)).isEqualTo(42.0);
    }
}
