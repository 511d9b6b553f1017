package com.adpulse.alerts.engine;

import com.adpulse.alerts.model.AlertCandidate;
import com.adpulse.alerts.model.AlertThresholds;
import com.adpulse.alerts.model.AlertType;
import com.adpulse.alerts.model.Campaign;

import java.util.Optional;

/**
 * Interface for all campaign anomaly detectors.
 * Each implementation handles exactly one AlertType and must be free of side effects.
 */
public interface AlertDetector {

    /**
     * The alert type this detector raises.
     */
    AlertType getSupportedType();

    /**
     * Inspect a campaign's metrics and report at most one candidate alert.
     *
     * @param campaign   the campaign under analysis (budgets, targets)
     * @param context    current, previous, weekly and month-to-date metrics
     * @param thresholds effective thresholds for the campaign's tenant
     * @return a candidate when the anomaly condition holds, empty otherwise
     */
    Optional<AlertCandidate> detect(Campaign campaign, DetectionContext context, AlertThresholds thresholds);
}
