package com.adpulse.alerts.model.detail;

import com.adpulse.alerts.model.AlertType;

public record BudgetLossDetail(double lostPercent, long impressions, double cost, Double dailyBudget)
        implements AlertDetail {

    @Override
    public AlertType type() {
        return AlertType.BUDGET_LOSS;
    }
}
