package com.adpulse.alerts.model.detail;

import com.adpulse.alerts.model.AlertType;

public record RankingLossDetail(double lostPercent, long impressions, long clicks, Double averageCpc)
        implements AlertDetail {

    @Override
    public AlertType type() {
        return AlertType.RANKING_LOSS;
    }
}
