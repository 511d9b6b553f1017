package com.adpulse.alerts.service;

import com.adpulse.alerts.config.AlertEngineConfig;
import com.adpulse.alerts.config.MetricsConfig;
import com.adpulse.alerts.exception.ValidationException;
import com.adpulse.alerts.model.Alert;
import com.adpulse.alerts.model.AlertCandidate;
import com.adpulse.alerts.model.AlertStatus;
import com.adpulse.alerts.model.AlertUpdate;
import com.adpulse.alerts.model.UpsertResult;
import com.adpulse.alerts.repository.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Turns detector candidates into stored alerts, keeping at most one ACTIVE alert per
 * (campaign, type) inside the dedup window.
 *
 * Flow, under the store's (campaign, type) lock:
 * 1. Look for an ACTIVE alert of the same type created within the window
 * 2. Found and the value moved by more than the refresh tolerance: update it in place
 * 3. Found otherwise: return it untouched
 * 4. Not found: create a new ACTIVE, unread, undelivered alert
 */
@Service
public class AlertDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(AlertDeduplicator.class);

    private final AlertStore alertStore;
    private final AlertEngineConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AlertDeduplicator(AlertStore alertStore, AlertEngineConfig config,
                             MetricsConfig metricsConfig, Clock clock) {
        this.alertStore = alertStore;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public Alert upsert(AlertCandidate candidate, String campaignId, String recipientId) {
        return apply(candidate, campaignId, recipientId).alert();
    }

    /**
     * Same as {@link #upsert} but reports whether the alert was created, refreshed or left alone.
     */
    public UpsertResult apply(AlertCandidate candidate, String campaignId, String recipientId) {
        if (isBlank(campaignId) || isBlank(recipientId)) {
            throw new ValidationException("campaignId and recipientId are required to store an alert");
        }

        long now = clock.millis();
        long windowStart = now - config.getDedupWindow().toMillis();

        UpsertResult result;
        try (AlertStore.DedupLock lock = alertStore.lockDedupKey(campaignId, candidate.getType())) {
            Optional<Alert> existing = alertStore.findActiveSince(campaignId, candidate.getType(), windowStart);
            if (existing.isPresent()) {
                result = refreshIfMoved(existing.get(), candidate, now);
            } else {
                result = new UpsertResult(alertStore.create(newAlert(candidate, campaignId, recipientId, now)),
                        UpsertResult.Outcome.CREATED);
            }
        }

        metricsConfig.recordUpsert(candidate.getType().name(), result.outcome().name());
        log.debug("Upsert {} for campaign {}: {} (alert {})",
                candidate.getType(), campaignId, result.outcome(), result.alert().getId());
        return result;
    }

    private UpsertResult refreshIfMoved(Alert existing, AlertCandidate candidate, long now) {
        double delta = Math.abs(existing.getCurrentValue() - candidate.getCurrentValue());
        if (delta <= config.getRefreshTolerance()) {
            return new UpsertResult(existing, UpsertResult.Outcome.UNCHANGED);
        }

        AlertUpdate update = AlertUpdate.builder()
                .currentValue(candidate.getCurrentValue())
                .previousValue(candidate.getPreviousValue())
                .clearPreviousValue(candidate.getPreviousValue() == null)
                .message(candidate.getMessage())
                .detail(candidate.getDetail())
                .updatedAt(now)
                .build();
        return new UpsertResult(alertStore.update(existing.getId(), update), UpsertResult.Outcome.REFRESHED);
    }

    private Alert newAlert(AlertCandidate candidate, String campaignId, String recipientId, long now) {
        return Alert.builder()
                .campaignId(campaignId)
                .recipientId(recipientId)
                .type(candidate.getType())
                .priority(candidate.getPriority())
                .status(AlertStatus.ACTIVE)
                .title(candidate.getTitle())
                .message(candidate.getMessage())
                .threshold(candidate.getThreshold())
                .currentValue(candidate.getCurrentValue())
                .previousValue(candidate.getPreviousValue())
                .detail(candidate.getDetail())
                .read(false)
                .emailSent(false)
                .chatSent(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
