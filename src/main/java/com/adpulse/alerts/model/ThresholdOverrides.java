package com.adpulse.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-tenant threshold overrides. A null (or non-positive) value means "use the system default".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdOverrides {
    private String tenantId;
    private Double roasDropPercent;
    private Double cpaAboveTargetPercent;
    private Double impressionLossBudgetPercent;
    private Double impressionLossRankPercent;
    private Integer ctrDropWeeks;
    private Double ctrDropMinPercent;
    private Double burnRateThreshold;
    private Double targetCpa;
}
