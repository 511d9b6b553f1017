package com.adpulse.alerts.model.detail;

import com.adpulse.alerts.model.AlertType;

import java.util.List;

/**
 * @param consecutiveWeeks weeks in the declining window, including the most recent one
 * @param weeklyCtr        the window's CTR values, most recent first
 */
public record CtrDeclineDetail(int consecutiveWeeks, double overallDropPercent, List<WeeklyCtr> weeklyCtr)
        implements AlertDetail {

    public record WeeklyCtr(String period, double ctr) {}

    @Override
    public AlertType type() {
        return AlertType.CTR_DECLINE;
    }
}
