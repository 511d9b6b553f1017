package com.adpulse.alerts.engine;

import com.adpulse.alerts.model.MetricsSnapshot;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Metrics handed to the detectors for one campaign. Fetched once per analysis so every
 * detector sees the same picture.
 */
@Value
@Builder
public class DetectionContext {
    // Latest day's metrics
    MetricsSnapshot current;

    // Aggregate of the comparison window before the current one
    MetricsSnapshot previous;

    // Weekly aggregates, most recent first; may be shorter than requested
    @Singular("week")
    List<MetricsSnapshot> weekly;

    // Spend accumulated since the first of the month
    MetricsSnapshot monthToDate;

    // Day the analysis is evaluated for (drives burn-rate pacing)
    LocalDate asOf;
}
