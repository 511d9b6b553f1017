package com.adpulse.alerts.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated campaign performance over one period (a day, a lookback window or a week).
 * Derived ratios are null when their denominator is zero.
 */
@Value
@Builder
public class MetricsSnapshot {

    long impressions;
    long clicks;
    double cost;
    double conversions;
    double conversionValue;

    // Fraction (0.42) or percent (42.0) of impressions lost, as reported upstream
    Double lostImpressionShareBudget;
    Double lostImpressionShareRank;

    // Human label of the period, e.g. "2026-W41" or "2026-10-12"
    String period;

    public static MetricsSnapshot empty() {
        return MetricsSnapshot.builder().build();
    }

    public boolean isEmpty() {
        return impressions == 0 && clicks == 0 && cost == 0 && conversions == 0 && conversionValue == 0
                && lostImpressionShareBudget == null && lostImpressionShareRank == null;
    }

    public Double getCtr() {
        return impressions > 0 ? (double) clicks / impressions : null;
    }

    public Double getCpa() {
        return conversions > 0 ? cost / conversions : null;
    }

    public Double getRoas() {
        return cost > 0 ? conversionValue / cost : null;
    }

    public Double getAverageCpc() {
        return clicks > 0 ? cost / clicks : null;
    }
}
