package com.adpulse.alerts.engine.detectors;

import com.adpulse.alerts.engine.AlertDetector;
import com.adpulse.alerts.engine.DetectionContext;
import com.adpulse.alerts.engine.MetricMath;
import com.adpulse.alerts.model.AlertCandidate;
import com.adpulse.alerts.model.AlertPriority;
import com.adpulse.alerts.model.AlertThresholds;
import com.adpulse.alerts.model.AlertType;
import com.adpulse.alerts.model.Campaign;
import com.adpulse.alerts.model.MetricsSnapshot;
import com.adpulse.alerts.model.detail.BudgetLossDetail;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects impressions lost because the daily budget ran out.
 *
 * Logic: lost impression share (budget), as a percent, >= impressionLossBudgetPercent triggers.
 */
@Component
public class BudgetLossDetector implements AlertDetector {

    @Override
    public AlertType getSupportedType() {
        return AlertType.BUDGET_LOSS;
    }

    @Override
    public Optional<AlertCandidate> detect(Campaign campaign, DetectionContext context, AlertThresholds thresholds) {
        MetricsSnapshot current = context.getCurrent();
        if (current == null || current.getLostImpressionShareBudget() == null) {
            return Optional.empty();
        }

        double threshold = thresholds.getImpressionLossBudgetPercent();
        double lostPercent = MetricMath.toPercent(current.getLostImpressionShareBudget());
        if (lostPercent < threshold) {
            return Optional.empty();
        }

        String message = String.format(
                "%.1f%% of eligible impressions are being lost to a limited budget. " +
                        "Consider raising the daily budget to capture more demand.",
                lostPercent);

        return Optional.of(AlertCandidate.builder()
                .type(AlertType.BUDGET_LOSS)
                .priority(AlertPriority.classify(AlertType.BUDGET_LOSS, lostPercent))
                .title("Impressions lost to budget: " + campaign.getName())
                .message(message)
                .threshold(threshold)
                .currentValue(lostPercent)
                .previousValue(null)
                .magnitude(lostPercent)
                .detail(new BudgetLossDetail(lostPercent, current.getImpressions(), current.getCost(),
                        campaign.getDailyBudget()))
                .build());
    }
}
