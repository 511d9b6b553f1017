package com.adpulse.alerts.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertPriorityTest {

    @Test
    void classify_normalBuckets() {
        assertThat(AlertPriority.classify(AlertType.ROAS_DROP, 55)).isEqualTo(AlertPriority.CRITICAL);
        assertThat(AlertPriority.classify(AlertType.ROAS_DROP, 40)).isEqualTo(AlertPriority.HIGH);
        assertThat(AlertPriority.classify(AlertType.CPA_HIGH, 20)).isEqualTo(AlertPriority.MEDIUM);
        assertThat(AlertPriority.classify(AlertType.CTR_DECLINE, 12)).isEqualTo(AlertPriority.LOW);
    }

    @Test
    void classify_highStakesBucketsNeverGoBelowMedium() {
        assertThat(AlertPriority.classify(AlertType.BUDGET_LOSS, 60)).isEqualTo(AlertPriority.CRITICAL);
        assertThat(AlertPriority.classify(AlertType.RANKING_LOSS, 45)).isEqualTo(AlertPriority.HIGH);
        assertThat(AlertPriority.classify(AlertType.BUDGET_LOSS, 10)).isEqualTo(AlertPriority.MEDIUM);
    }

    @Test
    void classify_burnRateUsesRawRatio() {
        assertThat(AlertPriority.classify(AlertType.BURN_RATE, 1.6)).isEqualTo(AlertPriority.CRITICAL);
        assertThat(AlertPriority.classify(AlertType.BURN_RATE, 1.35)).isEqualTo(AlertPriority.HIGH);
        assertThat(AlertPriority.classify(AlertType.BURN_RATE, 1.1)).isEqualTo(AlertPriority.MEDIUM);
    }

    @Test
    void classify_usesAbsoluteMagnitude() {
        assertThat(AlertPriority.classify(AlertType.ROAS_DROP, -40)).isEqualTo(AlertPriority.HIGH);
    }
}
