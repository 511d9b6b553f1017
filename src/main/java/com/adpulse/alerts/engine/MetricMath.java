package com.adpulse.alerts.engine;

/**
 * Shared arithmetic for detectors.
 */
public final class MetricMath {

    private MetricMath() {}

    /**
     * Percent change from {@code previous} to {@code current}. A zero baseline reports
     * 100 when anything appeared and 0 otherwise.
     */
    public static double pctChange(double current, double previous) {
        if (previous == 0) {
            return current > 0 ? 100.0 : 0.0;
        }
        return (current - previous) / previous * 100.0;
    }

    /**
     * Impression-share losses arrive either as a fraction (0.45) or as a percent (45).
     */
    public static double toPercent(double share) {
        return share <= 1.0 ? share * 100.0 : share;
    }
}
