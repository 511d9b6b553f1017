package com.adpulse.alerts.repository;

import com.adpulse.alerts.model.MetricsSnapshot;

import java.time.LocalDate;
import java.util.List;

/**
 * Source of campaign performance snapshots. Implementations throw
 * {@link com.adpulse.alerts.exception.ProviderException} when the backing store fails;
 * absent data is reported as an empty snapshot, not an error.
 */
public interface MetricsProvider {

    MetricsSnapshot getCurrent(String campaignId);

    /**
     * Aggregate of the window {@code [today - 2*lookbackDays, today - lookbackDays]}.
     */
    MetricsSnapshot getPrevious(String campaignId, int lookbackDays);

    /**
     * Weekly aggregates, most recent first. Weeks without data are left out, so the list may be
     * shorter than requested.
     */
    List<MetricsSnapshot> getWeekly(String campaignId, int weeks);

    /**
     * Aggregate from the first day of {@code asOf}'s month through {@code asOf}.
     */
    MetricsSnapshot getMonthToDate(String campaignId, LocalDate asOf);
}
