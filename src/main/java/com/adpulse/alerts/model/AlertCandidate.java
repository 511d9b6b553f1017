package com.adpulse.alerts.model;

import com.adpulse.alerts.model.detail.AlertDetail;
import lombok.Builder;
import lombok.Value;

/**
 * What a detector reports before deduplication decides whether it becomes a new alert.
 */
@Value
@Builder
public class AlertCandidate {
    AlertType type;
    AlertPriority priority;
    String title;
    String message;
    double threshold;
    double currentValue;
    Double previousValue;
    // Absolute deviation (percent), or the burn ratio for BURN_RATE
    double magnitude;
    AlertDetail detail;
}
