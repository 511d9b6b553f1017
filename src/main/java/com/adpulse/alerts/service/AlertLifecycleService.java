package com.adpulse.alerts.service;

import com.adpulse.alerts.config.MetricsConfig;
import com.adpulse.alerts.exception.NotFoundException;
import com.adpulse.alerts.exception.PermissionDeniedException;
import com.adpulse.alerts.exception.PreconditionException;
import com.adpulse.alerts.exception.ValidationException;
import com.adpulse.alerts.model.Alert;
import com.adpulse.alerts.model.AlertFilter;
import com.adpulse.alerts.model.AlertPage;
import com.adpulse.alerts.model.AlertPriority;
import com.adpulse.alerts.model.AlertStats;
import com.adpulse.alerts.model.AlertStatus;
import com.adpulse.alerts.model.AlertType;
import com.adpulse.alerts.model.AlertUpdate;
import com.adpulse.alerts.model.PageQuery;
import com.adpulse.alerts.repository.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Operator-facing alert operations. Every call names the acting recipient and only touches
 * alerts that recipient owns.
 *
 * Status machine: ACTIVE -> ACKNOWLEDGED -> RESOLVED | DISMISSED, with ACTIVE -> RESOLVED | DISMISSED
 * allowed directly. RESOLVED and DISMISSED are terminal, and only terminal alerts can be deleted.
 */
@Service
public class AlertLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(AlertLifecycleService.class);

    static final Duration STATS_WINDOW = Duration.ofDays(7);

    private final AlertStore alertStore;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AlertLifecycleService(AlertStore alertStore, MetricsConfig metricsConfig, Clock clock) {
        this.alertStore = alertStore;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public Alert getAlert(String recipientId, String alertId) {
        return loadOwned(recipientId, alertId);
    }

    public Alert markAsRead(String recipientId, String alertId) {
        Alert alert = loadOwned(recipientId, alertId);
        if (alert.isRead()) {
            return alert;
        }
        long now = clock.millis();
        return alertStore.update(alertId, AlertUpdate.read(now));
    }

    public int markAllAsRead(String recipientId) {
        requireId(recipientId, "recipientId");
        int changed = alertStore.markAllRead(recipientId, clock.millis());
        log.debug("Marked {} alerts read for {}", changed, recipientId);
        return changed;
    }

    /**
     * Ownership of every id is checked before anything is written.
     *
     * @return number of alerts that were unread
     */
    public int markMultipleAsRead(String recipientId, List<String> alertIds) {
        requireId(recipientId, "recipientId");
        if (alertIds == null || alertIds.isEmpty()) {
            return 0;
        }

        List<Alert> unread = new ArrayList<>();
        for (String alertId : alertIds) {
            Alert alert = loadOwned(recipientId, alertId);
            if (!alert.isRead()) {
                unread.add(alert);
            }
        }

        long now = clock.millis();
        for (Alert alert : unread) {
            alertStore.update(alert.getId(), AlertUpdate.read(now));
        }
        return unread.size();
    }

    public Alert acknowledge(String recipientId, String alertId) {
        Alert alert = loadOwned(recipientId, alertId);
        if (alert.getStatus() != AlertStatus.ACTIVE) {
            throw new PreconditionException("Only ACTIVE alerts can be acknowledged; alert "
                    + alertId + " is " + alert.getStatus());
        }

        long now = clock.millis();
        AlertUpdate.AlertUpdateBuilder update = AlertUpdate.builder()
                .status(AlertStatus.ACKNOWLEDGED)
                .read(true)
                .updatedAt(now);
        if (!alert.isRead()) {
            update.readAt(now);
        }
        return transition(alertId, update.build());
    }

    public Alert resolve(String recipientId, String alertId) {
        return close(recipientId, alertId, AlertStatus.RESOLVED);
    }

    public Alert dismiss(String recipientId, String alertId) {
        return close(recipientId, alertId, AlertStatus.DISMISSED);
    }

    public void delete(String recipientId, String alertId) {
        Alert alert = loadOwned(recipientId, alertId);
        if (!alert.getStatus().isTerminal()) {
            throw new PreconditionException("Alert " + alertId + " is " + alert.getStatus()
                    + "; resolve or dismiss it before deleting");
        }
        alertStore.delete(alertId);
        log.info("Alert {} deleted by {}", alertId, recipientId);
    }

    /**
     * The recipient's alerts in inbox order. The filter's own recipient, if any, is replaced.
     */
    public AlertPage list(String recipientId, AlertFilter filter, PageQuery page) {
        requireId(recipientId, "recipientId");
        AlertFilter scoped = (filter == null ? AlertFilter.builder().build() : filter).toBuilder()
                .recipientId(recipientId)
                .build();
        return alertStore.list(scoped, page == null ? PageQuery.firstPage() : page);
    }

    public AlertStats stats(String recipientId) {
        requireId(recipientId, "recipientId");
        List<Alert> alerts = alertStore.findAll(AlertFilter.builder().recipientId(recipientId).build());
        long windowStart = clock.millis() - STATS_WINDOW.toMillis();

        Map<AlertPriority, Long> byPriority = new EnumMap<>(AlertPriority.class);
        Map<AlertType, Long> byType = new EnumMap<>(AlertType.class);
        Map<AlertStatus, Long> byStatus = new EnumMap<>(AlertStatus.class);
        long totalActive = 0;
        long unread = 0;
        long lastWeek = 0;

        for (Alert alert : alerts) {
            boolean recent = alert.getCreatedAt() >= windowStart;
            byStatus.merge(alert.getStatus(), 1L, Long::sum);
            if (!alert.isRead()) unread++;
            if (recent) lastWeek++;

            if (alert.getStatus() == AlertStatus.ACTIVE) {
                totalActive++;
                byPriority.merge(alert.getPriority(), 1L, Long::sum);
                if (recent) {
                    byType.merge(alert.getType(), 1L, Long::sum);
                }
            }
        }

        return AlertStats.builder()
                .totalActive(totalActive)
                .unread(unread)
                .lastWeek(lastWeek)
                .byPriority(byPriority)
                .byType(byType)
                .byStatus(byStatus)
                .build();
    }

    /**
     * Remove RESOLVED and DISMISSED alerts created more than {@code olderThan} ago.
     */
    public int purgeResolved(Duration olderThan) {
        long cutoff = clock.millis() - olderThan.toMillis();
        int deleted = alertStore.deleteTerminalCreatedBefore(cutoff);
        log.info("Purged {} terminal alerts older than {} days", deleted, olderThan.toDays());
        return deleted;
    }

    private Alert close(String recipientId, String alertId, AlertStatus target) {
        Alert alert = loadOwned(recipientId, alertId);
        if (alert.getStatus().isTerminal()) {
            throw new PreconditionException("Alert " + alertId + " is already " + alert.getStatus());
        }
        long now = clock.millis();
        return transition(alertId, AlertUpdate.builder()
                .status(target)
                .resolvedAt(now)
                .updatedAt(now)
                .build());
    }

    private Alert transition(String alertId, AlertUpdate update) {
        Alert updated = alertStore.update(alertId, update);
        metricsConfig.recordLifecycleTransition(update.getStatus().name());
        log.info("Alert {} moved to {}", alertId, update.getStatus());
        return updated;
    }

    private Alert loadOwned(String recipientId, String alertId) {
        requireId(recipientId, "recipientId");
        requireId(alertId, "alertId");

        Alert alert = alertStore.findById(alertId)
                .orElseThrow(() -> new NotFoundException("Alert not found: " + alertId));
        if (!recipientId.equals(alert.getRecipientId())) {
            throw new PermissionDeniedException("Alert " + alertId + " does not belong to " + recipientId);
        }
        return alert;
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new ValidationException(name + " is required");
        }
    }
}
