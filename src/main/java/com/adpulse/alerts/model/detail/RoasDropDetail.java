package com.adpulse.alerts.model.detail;

import com.adpulse.alerts.model.AlertType;

public record RoasDropDetail(double dropPercent, double conversionValue, double cost) implements AlertDetail {

    @Override
    public AlertType type() {
        return AlertType.ROAS_DROP;
    }
}
