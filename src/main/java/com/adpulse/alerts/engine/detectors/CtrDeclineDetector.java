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
import com.adpulse.alerts.model.detail.CtrDeclineDetail;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Detects click-through rate falling week over week for several weeks in a row.
 *
 * Logic: walk the weekly series from the most recent week backwards. A week qualifies when
 * its CTR is more than ctrDropMinPercent below the week before it. Counting stops at the first
 * week that does not qualify (or has no CTR). The alert triggers when ctrDropWeeks - 1 weeks
 * qualify in a row, i.e. when the CTR fell across ctrDropWeeks consecutive data points.
 *
 * Example (ctrDropWeeks=3, min 10%): weekly CTR 2.0%, 2.35%, 2.67%, 2.9% (newest first)
 * gives drops of 15% and 12%, two qualifying weeks, so the alert triggers. The overall drop
 * is measured from the oldest week of that window (2.67%) to the newest (2.0%).
 */
@Component
public class CtrDeclineDetector implements AlertDetector {

    @Override
    public AlertType getSupportedType() {
        return AlertType.CTR_DECLINE;
    }

    @Override
    public Optional<AlertCandidate> detect(Campaign campaign, DetectionContext context, AlertThresholds thresholds) {
        // A trend needs at least two points
        int minWeeks = Math.max(2, thresholds.getCtrDropWeeks());
        double minDropPercent = thresholds.getCtrDropMinPercent();
        List<MetricsSnapshot> weeks = context.getWeekly();

        if (weeks == null || weeks.size() < minWeeks) {
            return Optional.empty();
        }

        int required = minWeeks - 1;
        int consecutiveDrops = 0;
        for (int i = 0; i < weeks.size() - 1 && consecutiveDrops < required; i++) {
            Double currentCtr = weeks.get(i).getCtr();
            Double previousCtr = weeks.get(i + 1).getCtr();
            if (currentCtr == null || previousCtr == null) {
                break;
            }

            double change = MetricMath.pctChange(currentCtr, previousCtr);
            if (change < -minDropPercent) {
                consecutiveDrops++;
            } else {
                break;
            }
        }

        if (consecutiveDrops < required) {
            return Optional.empty();
        }

        double latestCtr = weeks.get(0).getCtr();
        double oldestCtr = weeks.get(required).getCtr();
        double overallDrop = Math.abs(MetricMath.pctChange(latestCtr, oldestCtr));

        List<CtrDeclineDetail.WeeklyCtr> window = new ArrayList<>();
        for (int i = 0; i <= required; i++) {
            MetricsSnapshot week = weeks.get(i);
            String period = week.getPeriod() != null ? week.getPeriod() : "week-" + i;
            window.add(new CtrDeclineDetail.WeeklyCtr(period, week.getCtr()));
        }

        String message = String.format(
                "CTR has fallen for %d consecutive weeks, %.1f%% in total. " +
                        "Current CTR: %.2f%%, CTR %d weeks ago: %.2f%%.",
                minWeeks, overallDrop, latestCtr * 100, required, oldestCtr * 100);

        return Optional.of(AlertCandidate.builder()
                .type(AlertType.CTR_DECLINE)
                .priority(AlertPriority.classify(AlertType.CTR_DECLINE, overallDrop))
                .title("Declining CTR: " + campaign.getName())
                .message(message)
                .threshold(minWeeks)
                .currentValue(latestCtr * 100)
                .previousValue(oldestCtr * 100)
                .magnitude(overallDrop)
                .detail(new CtrDeclineDetail(consecutiveDrops + 1, overallDrop, window))
                .build());
    }
}
