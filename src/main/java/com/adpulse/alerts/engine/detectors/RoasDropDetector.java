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
import com.adpulse.alerts.model.detail.RoasDropDetail;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects a fall in return on ad spend against the previous comparison window.
 *
 * Logic: pctChange(current ROAS, previous ROAS) <= -roasDropPercent triggers.
 *
 * Example: previous ROAS 3.0, current 1.8 -> change of -40%. With the default
 * threshold of 20 this triggers with magnitude 40, which classifies as HIGH.
 */
@Component
public class RoasDropDetector implements AlertDetector {

    @Override
    public AlertType getSupportedType() {
        return AlertType.ROAS_DROP;
    }

    @Override
    public Optional<AlertCandidate> detect(Campaign campaign, DetectionContext context, AlertThresholds thresholds) {
        MetricsSnapshot current = context.getCurrent();
        MetricsSnapshot previous = context.getPrevious();
        if (current == null || previous == null) {
            return Optional.empty();
        }

        Double currentRoas = current.getRoas();
        Double previousRoas = previous.getRoas();
        if (currentRoas == null || previousRoas == null) {
            return Optional.empty();
        }

        double threshold = thresholds.getRoasDropPercent();
        double change = MetricMath.pctChange(currentRoas, previousRoas);
        if (change > -threshold) {
            return Optional.empty();
        }

        double dropPercent = Math.abs(change);
        String message = String.format(
                "ROAS fell %.1f%% against the previous period. Current ROAS: %.2fx, previous: %.2fx.",
                dropPercent, currentRoas, previousRoas);

        return Optional.of(AlertCandidate.builder()
                .type(AlertType.ROAS_DROP)
                .priority(AlertPriority.classify(AlertType.ROAS_DROP, dropPercent))
                .title("ROAS drop: " + campaign.getName())
                .message(message)
                .threshold(threshold)
                .currentValue(currentRoas)
                .previousValue(previousRoas)
                .magnitude(dropPercent)
                .detail(new RoasDropDetail(dropPercent, current.getConversionValue(), current.getCost()))
                .build());
    }
}
