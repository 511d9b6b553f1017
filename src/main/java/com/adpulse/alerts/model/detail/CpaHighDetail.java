package com.adpulse.alerts.model.detail;

import com.adpulse.alerts.model.AlertType;

public record CpaHighDetail(double percentAbove, double conversions, double cost) implements AlertDetail {

    @Override
    public AlertType type() {
        return AlertType.CPA_HIGH;
    }
}
