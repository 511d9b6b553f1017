package com.adpulse.alerts.engine.detectors;

import com.adpulse.alerts.engine.AlertDetector;
import com.adpulse.alerts.engine.DetectionContext;
import com.adpulse.alerts.model.AlertCandidate;
import com.adpulse.alerts.model.AlertPriority;
import com.adpulse.alerts.model.AlertThresholds;
import com.adpulse.alerts.model.AlertType;
import com.adpulse.alerts.model.Campaign;
import com.adpulse.alerts.model.MetricsSnapshot;
import com.adpulse.alerts.model.detail.BurnRateDetail;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Detects month-to-date spend running ahead of a linear pace through the monthly budget.
 *
 * Logic: expected = monthlyBudget * dayOfMonth / daysInMonth; burnRate = actual / expected.
 * burnRate >= burnRateThreshold triggers. The monthly budget falls back to dailyBudget * 30.4.
 *
 * Example: budget 3000, day 10 of 30, spend 1600 -> expected 1000, burn rate 1.6 (CRITICAL).
 * At that pace the month closes at 4800, i.e. 1800 over budget.
 */
@Component
public class BurnRateDetector implements AlertDetector {

    @Override
    public AlertType getSupportedType() {
        return AlertType.BURN_RATE;
    }

    @Override
    public Optional<AlertCandidate> detect(Campaign campaign, DetectionContext context, AlertThresholds thresholds) {
        double monthlyBudget = campaign.resolveMonthlyBudget();
        MetricsSnapshot monthToDate = context.getMonthToDate();
        LocalDate asOf = context.getAsOf();
        if (monthlyBudget <= 0 || monthToDate == null || monthToDate.getCost() <= 0 || asOf == null) {
            return Optional.empty();
        }

        int dayOfMonth = asOf.getDayOfMonth();
        int daysInMonth = asOf.lengthOfMonth();
        double expectedFraction = (double) dayOfMonth / daysInMonth;
        double expectedSpend = monthlyBudget * expectedFraction;
        double actualSpend = monthToDate.getCost();
        double burnRate = actualSpend / expectedSpend;

        double threshold = thresholds.getBurnRateThreshold();
        if (burnRate < threshold) {
            return Optional.empty();
        }

        double projectedMonthlySpend = actualSpend / expectedFraction;
        double projectedOverspend = projectedMonthlySpend - monthlyBudget;
        double excessPercent = (burnRate - 1) * 100;

        String message = String.format(
                "Spend is %.0f%% ahead of the ideal pace. Spent so far: %.2f (expected: %.2f). " +
                        "At this rate the month will close at %.2f against a budget of %.2f (%.2f over).",
                excessPercent, actualSpend, expectedSpend, projectedMonthlySpend, monthlyBudget,
                projectedOverspend);

        return Optional.of(AlertCandidate.builder()
                .type(AlertType.BURN_RATE)
                .priority(AlertPriority.classify(AlertType.BURN_RATE, burnRate))
                .title("High burn rate: " + campaign.getName())
                .message(message)
                .threshold(threshold)
                .currentValue(burnRate)
                .previousValue(1.0)
                .magnitude(burnRate)
                .detail(new BurnRateDetail(actualSpend, expectedSpend, monthlyBudget,
                        projectedMonthlySpend, projectedOverspend, dayOfMonth, daysInMonth))
                .build());
    }
}
