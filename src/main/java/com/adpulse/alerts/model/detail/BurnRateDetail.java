package com.adpulse.alerts.model.detail;

import com.adpulse.alerts.model.AlertType;

public record BurnRateDetail(double actualSpend,
                             double expectedSpend,
                             double monthlyBudget,
                             double projectedMonthlySpend,
                             double projectedOverspend,
                             int dayOfMonth,
                             int daysInMonth) implements AlertDetail {

    @Override
    public AlertType type() {
        return AlertType.BURN_RATE;
    }
}
