package com.adpulse.alerts.testutil;

import com.adpulse.alerts.exception.NotFoundException;
import com.adpulse.alerts.exception.PersistenceException;
import com.adpulse.alerts.model.*;
import com.adpulse.alerts.repository.AlertStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * AlertStore backed by a map, with per-key locks, for tests that need real dedup semantics.
 */
public class InMemoryAlertStore implements AlertStore {

    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicInteger ids = new AtomicInteger();
    private final AtomicInteger writes = new AtomicInteger();

    private volatile boolean available = true;
    private volatile boolean failWrites = false;

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    /**
     * Number of successful create and update calls.
     */
    public int writeCount() {
        return writes.get();
    }

    public List<Alert> all() {
        return new ArrayList<>(alerts.values());
    }

    public Alert put(Alert alert) {
        alerts.put(alert.getId(), alert);
        return alert;
    }

    @Override
    public Optional<Alert> findActiveSince(String campaignId, AlertType type, long since) {
        return alerts.values().stream()
                .filter(a -> campaignId.equals(a.getCampaignId()))
                .filter(a -> a.getType() == type)
                .filter(a -> a.getStatus() == AlertStatus.ACTIVE)
                .filter(a -> a.getCreatedAt() >= since)
                .max(Comparator.comparingLong(Alert::getCreatedAt));
    }

    @Override
    public Optional<Alert> findById(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    @Override
    public Alert create(Alert alert) {
        checkWritable();
        Alert saved = alert.getId() != null ? alert : alert.toBuilder().id("alert-" + ids.incrementAndGet()).build();
        alerts.put(saved.getId(), saved);
        writes.incrementAndGet();
        return saved;
    }

    @Override
    public Alert update(String alertId, AlertUpdate update) {
        checkWritable();
        Alert existing = alerts.get(alertId);
        if (existing == null) {
            throw new NotFoundException("Alert not found: " + alertId);
        }
        Alert updated = update.applyTo(existing);
        alerts.put(alertId, updated);
        writes.incrementAndGet();
        return updated;
    }

    @Override
    public AlertPage list(AlertFilter filter, PageQuery page) {
        List<Alert> matches = findAll(filter);
        matches.sort(Alert.INBOX_ORDER);
        int from = Math.min(page.offset(), matches.size());
        int to = Math.min(from + page.limit(), matches.size());
        return AlertPage.of(new ArrayList<>(matches.subList(from, to)), matches.size(), page);
    }

    @Override
    public List<Alert> findAll(AlertFilter filter) {
        return alerts.values().stream().filter(filter::matches).collect(Collectors.toList());
    }

    @Override
    public int markAllRead(String recipientId, long readAt) {
        checkWritable();
        int changed = 0;
        for (Alert alert : findAll(AlertFilter.builder().recipientId(recipientId).read(false).build())) {
            alerts.put(alert.getId(), alert.toBuilder().read(true).readAt(readAt).updatedAt(readAt).build());
            changed++;
        }
        return changed;
    }

    @Override
    public void delete(String alertId) {
        checkWritable();
        alerts.remove(alertId);
    }

    @Override
    public int deleteTerminalCreatedBefore(long cutoff) {
        checkWritable();
        List<String> expired = alerts.values().stream()
                .filter(a -> a.getStatus().isTerminal() && a.getCreatedAt() < cutoff)
                .map(Alert::getId)
                .collect(Collectors.toList());
        expired.forEach(alerts::remove);
        return expired.size();
    }

    @Override
    public DedupLock lockDedupKey(String campaignId, AlertType type) {
        ReentrantLock lock = locks.computeIfAbsent(campaignId + ":" + type, k -> new ReentrantLock());
        lock.lock();
        return lock::unlock;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    private void checkWritable() {
        if (failWrites) {
            throw new PersistenceException("Simulated store failure");
        }
    }
}
