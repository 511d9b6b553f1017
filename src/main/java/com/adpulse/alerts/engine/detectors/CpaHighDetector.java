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
import com.adpulse.alerts.model.detail.CpaHighDetail;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects a cost per acquisition running above the campaign's target.
 * Campaigns without a target of their own fall back to the tenant's CPA target override.
 *
 * Logic: pctChange(current CPA, target CPA) > cpaAbovePercent triggers. The stored
 * threshold is the CPA value at which the alert starts, i.e. target * (1 + pct/100).
 */
@Component
public class CpaHighDetector implements AlertDetector {

    @Override
    public AlertType getSupportedType() {
        return AlertType.CPA_HIGH;
    }

    @Override
    public Optional<AlertCandidate> detect(Campaign campaign, DetectionContext context, AlertThresholds thresholds) {
        Double targetCpa = campaign.getTargetCpa() != null && campaign.getTargetCpa() > 0
                ? campaign.getTargetCpa() : thresholds.getTargetCpa();
        MetricsSnapshot current = context.getCurrent();
        if (targetCpa == null || targetCpa <= 0 || current == null || current.getCpa() == null) {
            return Optional.empty();
        }

        double cpa = current.getCpa();
        double thresholdPct = thresholds.getCpaAboveTargetPercent();
        double percentAbove = MetricMath.pctChange(cpa, targetCpa);
        if (percentAbove <= thresholdPct) {
            return Optional.empty();
        }

        String message = String.format(
                "CPA is %.1f%% above target. Current CPA: %.2f, target: %.2f.",
                percentAbove, cpa, targetCpa);

        return Optional.of(AlertCandidate.builder()
                .type(AlertType.CPA_HIGH)
                .priority(AlertPriority.classify(AlertType.CPA_HIGH, percentAbove))
                .title("High CPA: " + campaign.getName())
                .message(message)
                .threshold(targetCpa * (1 + thresholdPct / 100.0))
                .currentValue(cpa)
                .previousValue(targetCpa)
                .magnitude(percentAbove)
                .detail(new CpaHighDetail(percentAbove, current.getConversions(), current.getCost()))
                .build());
    }
}
