package com.adpulse.alerts.model;

/**
 * The closed set of anomaly kinds the engine can raise. Each value is handled by
 * exactly one detector.
 */
public enum AlertType {
    ROAS_DROP,
    CPA_HIGH,
    BUDGET_LOSS,
    RANKING_LOSS,
    CTR_DECLINE,
    BURN_RATE;

    /**
     * Budget, rank and pacing anomalies are scored on the stricter bucket table.
     */
    public boolean isHighStakes() {
        return this == BUDGET_LOSS || this == RANKING_LOSS || this == BURN_RATE;
    }
}
