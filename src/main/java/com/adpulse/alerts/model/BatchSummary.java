package com.adpulse.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSummary {
    private String runType;                 // "FULL" or "CRITICAL_ONLY"
    private int campaignsAnalyzed;          // campaigns whose evaluation was started
    private int alertsGenerated;
    private int errors;                     // campaigns that failed
    @Builder.Default
    private List<String> failedCampaignIds = new ArrayList<>();
    private int droppedAlerts;              // candidates lost to persistence failures
    private int skippedCampaigns;           // not started because the run deadline passed
    private boolean partial;
    private long durationMs;
}
