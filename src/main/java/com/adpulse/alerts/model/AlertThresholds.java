package com.adpulse.alerts.model;

import lombok.Builder;
import lombok.Value;

/**
 * Effective thresholds for one detection run.
 */
@Value
@Builder(toBuilder = true)
public class AlertThresholds {
    double roasDropPercent;
    double cpaAboveTargetPercent;
    double impressionLossBudgetPercent;
    double impressionLossRankPercent;
    int ctrDropWeeks;
    double ctrDropMinPercent;
    double burnRateThreshold;
    /** CPA target used when the campaign has none of its own; null means no fallback. */
    Double targetCpa;

    /**
     * Overlay tenant overrides on the defaults. Missing or non-positive overrides keep the default.
     */
    public AlertThresholds withOverrides(ThresholdOverrides overrides) {
        if (overrides == null) {
            return this;
        }
        return toBuilder()
                .roasDropPercent(pick(overrides.getRoasDropPercent(), roasDropPercent))
                .cpaAboveTargetPercent(pick(overrides.getCpaAboveTargetPercent(), cpaAboveTargetPercent))
                .impressionLossBudgetPercent(pick(overrides.getImpressionLossBudgetPercent(), impressionLossBudgetPercent))
                .impressionLossRankPercent(pick(overrides.getImpressionLossRankPercent(), impressionLossRankPercent))
                .ctrDropWeeks(overrides.getCtrDropWeeks() != null && overrides.getCtrDropWeeks() > 0
                        ? overrides.getCtrDropWeeks() : ctrDropWeeks)
                .ctrDropMinPercent(pick(overrides.getCtrDropMinPercent(), ctrDropMinPercent))
                .burnRateThreshold(pick(overrides.getBurnRateThreshold(), burnRateThreshold))
                .targetCpa(overrides.getTargetCpa() != null && overrides.getTargetCpa() > 0
                        ? overrides.getTargetCpa() : targetCpa)
                .build();
    }

    private static double pick(Double override, double fallback) {
        return override != null && override > 0 ? override : fallback;
    }
}
