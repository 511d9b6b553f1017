package com.adpulse.alerts.model;

public enum AlertPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Map a detector's deviation magnitude to a severity.
     *
     * Burn rate is classified on the raw spend ratio (1.5 = 50% ahead of pace).
     * The other high-stakes detectors use 60/40 cut-offs on a percent; everything else
     * uses 50/30/20.
     *
     * @param type      the detector that produced the magnitude
     * @param magnitude absolute deviation percent, or the burn ratio for BURN_RATE
     */
    public static AlertPriority classify(AlertType type, double magnitude) {
        double value = Math.abs(magnitude);

        if (type == AlertType.BURN_RATE) {
            if (value >= 1.5) return CRITICAL;
            if (value >= 1.3) return HIGH;
            return MEDIUM;
        }

        if (type.isHighStakes()) {
            if (value >= 60) return CRITICAL;
            if (value >= 40) return HIGH;
            return MEDIUM;
        }

        if (value >= 50) return CRITICAL;
        if (value >= 30) return HIGH;
        if (value >= 20) return MEDIUM;
        return LOW;
    }
}
