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
import com.adpulse.alerts.model.detail.RankingLossDetail;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects impressions lost to low ad rank (quality and bids).
 */
@Component
public class RankingLossDetector implements AlertDetector {

    @Override
    public AlertType getSupportedType() {
        return AlertType.RANKING_LOSS;
    }

    @Override
    public Optional<AlertCandidate> detect(Campaign campaign, DetectionContext context, AlertThresholds thresholds) {
        MetricsSnapshot current = context.getCurrent();
        if (current == null || current.getLostImpressionShareRank() == null) {
            return Optional.empty();
        }

        double threshold = thresholds.getImpressionLossRankPercent();
        double lostPercent = MetricMath.toPercent(current.getLostImpressionShareRank());
        if (lostPercent < threshold) {
            return Optional.empty();
        }

        String message = String.format(
                "%.1f%% of eligible impressions are being lost to low ad rank. " +
                        "Review ad quality and consider adjusting bids.",
                lostPercent);

        return Optional.of(AlertCandidate.builder()
                .type(AlertType.RANKING_LOSS)
                .priority(AlertPriority.classify(AlertType.RANKING_LOSS, lostPercent))
                .title("Impressions lost to rank: " + campaign.getName())
                .message(message)
                .threshold(threshold)
                .currentValue(lostPercent)
                .previousValue(null)
                .magnitude(lostPercent)
                .detail(new RankingLossDetail(lostPercent, current.getImpressions(), current.getClicks(),
                        current.getAverageCpc()))
                .build());
    }
}
