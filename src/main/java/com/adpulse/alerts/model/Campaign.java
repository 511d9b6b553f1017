package com.adpulse.alerts.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Campaign {
    private String id;
    private String name;
    private String tenantId;            // the advertiser (client) owning the campaign
    private CampaignStatus status;
    private Double dailyBudget;
    private Double monthlyBudget;
    private Double targetRoas;
    private Double targetCpa;
    private String recipientId;         // operator (manager) who receives the alerts

    /**
     * Explicit monthly budget, else the daily budget spread over an average month.
     */
    public double resolveMonthlyBudget() {
        if (monthlyBudget != null && monthlyBudget > 0) {
            return monthlyBudget;
        }
        if (dailyBudget != null && dailyBudget > 0) {
            return dailyBudget * 30.4;
        }
        return 0.0;
    }
}
