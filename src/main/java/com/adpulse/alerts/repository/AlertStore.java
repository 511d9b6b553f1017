package com.adpulse.alerts.repository;

import com.adpulse.alerts.model.Alert;
import com.adpulse.alerts.model.AlertFilter;
import com.adpulse.alerts.model.AlertPage;
import com.adpulse.alerts.model.AlertStatus;
import com.adpulse.alerts.model.AlertType;
import com.adpulse.alerts.model.AlertUpdate;
import com.adpulse.alerts.model.PageQuery;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for alerts. Every method reports storage failures as
 * {@link com.adpulse.alerts.exception.PersistenceException}.
 */
public interface AlertStore {

    /**
     * The ACTIVE alert for (campaign, type) created at or after {@code since}, if any.
     */
    Optional<Alert> findActiveSince(String campaignId, AlertType type, long since);

    Optional<Alert> findById(String alertId);

    /**
     * Persist a new alert. Assigns the id when the alert has none.
     */
    Alert create(Alert alert);

    /**
     * Write the non-null fields of {@code update} and return the stored alert.
     *
     * @throws com.adpulse.alerts.exception.NotFoundException if the alert does not exist
     */
    Alert update(String alertId, AlertUpdate update);

    default Alert updateStatus(String alertId, AlertStatus status) {
        return update(alertId, AlertUpdate.builder().status(status).build());
    }

    /**
     * Filtered page in inbox order (unread, priority desc, newest).
     */
    AlertPage list(AlertFilter filter, PageQuery page);

    /**
     * Every alert matching the filter, unpaged and unordered.
     */
    List<Alert> findAll(AlertFilter filter);

    default List<Alert> findByRecipientSince(String recipientId, long since) {
        return findAll(AlertFilter.builder().recipientId(recipientId).createdFrom(since).build());
    }

    /**
     * Mark every unread alert of the recipient as read.
     *
     * @return number of alerts changed
     */
    int markAllRead(String recipientId, long readAt);

    /**
     * Unconditional delete; callers enforce the status precondition.
     */
    void delete(String alertId);

    /**
     * Delete RESOLVED and DISMISSED alerts created before the cutoff.
     *
     * @return number of alerts deleted
     */
    int deleteTerminalCreatedBefore(long cutoff);

    /**
     * Serialize find-then-write decisions for one (campaign, type) pair across threads and
     * processes. Blocks until the lock is held or the store's wait limit passes.
     */
    DedupLock lockDedupKey(String campaignId, AlertType type);

    /**
     * Whether the store can currently serve requests at all.
     */
    boolean isAvailable();

    interface DedupLock extends AutoCloseable {
        @Override
        void close();
    }
}
