package com.adpulse.alerts.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.exp.Exp;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.adpulse.alerts.config.AerospikeConfig;
import com.adpulse.alerts.config.AlertEngineConfig;
import com.adpulse.alerts.exception.NotFoundException;
import com.adpulse.alerts.exception.PersistenceException;
import com.adpulse.alerts.model.Alert;
import com.adpulse.alerts.model.AlertFilter;
import com.adpulse.alerts.model.AlertPage;
import com.adpulse.alerts.model.AlertPriority;
import com.adpulse.alerts.model.AlertStatus;
import com.adpulse.alerts.model.AlertType;
import com.adpulse.alerts.model.AlertUpdate;
import com.adpulse.alerts.model.PageQuery;
import com.adpulse.alerts.model.detail.AlertDetail;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.Supplier;

@Repository
public class AerospikeAlertRepository implements AlertStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeAlertRepository.class);

    private static final long LOCK_RETRY_MILLIS = 50;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final WritePolicy updateOnlyPolicy;
    private final WritePolicy lockPolicy;
    private final Policy readPolicy;
    private final Duration lockMaxWait;
    private final ObjectMapper objectMapper;

    public AerospikeAlertRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    AlertEngineConfig config) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = client.getWritePolicyDefault();
        this.readPolicy = client.getReadPolicyDefault();
        this.objectMapper = new ObjectMapper();

        this.updateOnlyPolicy = new WritePolicy(this.writePolicy);
        this.updateOnlyPolicy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;

        this.lockPolicy = new WritePolicy(this.writePolicy);
        this.lockPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        this.lockPolicy.expiration = (int) Math.max(1, config.getLock().getLease().toSeconds());
        this.lockMaxWait = config.getLock().getMaxWait();
    }

    @Override
    public Optional<Alert> findActiveSince(String campaignId, AlertType type, long since) {
        ScanPolicy scanPolicy = scanPolicy();
        scanPolicy.filterExp = Exp.build(Exp.and(
                Exp.eq(Exp.stringBin("campaignId"), Exp.val(campaignId)),
                Exp.eq(Exp.stringBin("type"), Exp.val(type.name())),
                Exp.eq(Exp.stringBin("status"), Exp.val(AlertStatus.ACTIVE.name())),
                Exp.ge(Exp.intBin("createdAt"), Exp.val(since))));

        // At most one is expected; the newest wins if an older duplicate slipped in.
        return scan("findActiveSince", scanPolicy, alert -> true).stream()
                .max(Comparator.comparingLong(Alert::getCreatedAt));
    }

    @Override
    public Optional<Alert> findById(String alertId) {
        return execute("findById", () -> {
            Record record = client.get(readPolicy, key(alertId));
            return record == null ? Optional.<Alert>empty() : Optional.of(mapRecord(alertId, record));
        });
    }

    @Override
    public Alert create(Alert alert) {
        Alert toSave = alert.getId() == null ? alert.toBuilder().id(UUID.randomUUID().toString()).build() : alert;

        return execute("create", () -> {
            client.put(writePolicy, key(toSave.getId()),
                    new Bin("id", toSave.getId()),
                    new Bin("campaignId", toSave.getCampaignId()),
                    new Bin("recipientId", toSave.getRecipientId()),
                    new Bin("type", toSave.getType().name()),
                    new Bin("priority", toSave.getPriority().name()),
                    new Bin("status", toSave.getStatus().name()),
                    new Bin("title", toSave.getTitle()),
                    new Bin("message", toSave.getMessage()),
                    new Bin("threshold", toSave.getThreshold()),
                    new Bin("currentValue", toSave.getCurrentValue()),
                    previousValueBin(toSave.getPreviousValue()),
                    new Bin("detail", serializeDetail(toSave.getDetail())),
                    new Bin("isRead", toSave.isRead()),
                    new Bin("readAt", toSave.getReadAt()),
                    new Bin("emailSent", toSave.isEmailSent()),
                    new Bin("chatSent", toSave.isChatSent()),
                    new Bin("createdAt", toSave.getCreatedAt()),
                    new Bin("updatedAt", toSave.getUpdatedAt()),
                    new Bin("resolvedAt", toSave.getResolvedAt()));
            return toSave;
        });
    }

    @Override
    public Alert update(String alertId, AlertUpdate update) {
        List<Bin> bins = new ArrayList<>();
        if (update.getStatus() != null) bins.add(new Bin("status", update.getStatus().name()));
        if (update.getCurrentValue() != null) bins.add(new Bin("currentValue", update.getCurrentValue()));
        if (update.getPreviousValue() != null) bins.add(new Bin("previousValue", update.getPreviousValue()));
        if (update.isClearPreviousValue()) bins.add(Bin.asNull("previousValue"));
        if (update.getMessage() != null) bins.add(new Bin("message", update.getMessage()));
        if (update.getDetail() != null) bins.add(new Bin("detail", serializeDetail(update.getDetail())));
        if (update.getRead() != null) bins.add(new Bin("isRead", update.getRead()));
        if (update.getReadAt() != null) bins.add(new Bin("readAt", update.getReadAt()));
        if (update.getEmailSent() != null) bins.add(new Bin("emailSent", update.getEmailSent()));
        if (update.getChatSent() != null) bins.add(new Bin("chatSent", update.getChatSent()));
        if (update.getUpdatedAt() != null) bins.add(new Bin("updatedAt", update.getUpdatedAt()));
        if (update.getResolvedAt() != null) bins.add(new Bin("resolvedAt", update.getResolvedAt()));

        if (!bins.isEmpty()) {
            try {
                client.put(updateOnlyPolicy, key(alertId), bins.toArray(new Bin[0]));
            } catch (AerospikeException e) {
                if (e.getResultCode() == ResultCode.KEY_NOT_FOUND_ERROR) {
                    throw new NotFoundException("Alert not found: " + alertId);
                }
                throw new PersistenceException("Alert store update failed for " + alertId, e);
            }
        }

        return findById(alertId).orElseThrow(() -> new NotFoundException("Alert not found: " + alertId));
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
        ScanPolicy scanPolicy = scanPolicy();
        if (filter.getRecipientId() != null) {
            scanPolicy.filterExp = Exp.build(Exp.eq(Exp.stringBin("recipientId"), Exp.val(filter.getRecipientId())));
        }
        return scan("findAll", scanPolicy, filter::matches);
    }

    @Override
    public int markAllRead(String recipientId, long readAt) {
        List<Alert> unread = findAll(AlertFilter.builder().recipientId(recipientId).read(false).build());
        return execute("markAllRead", () -> {
            int changed = 0;
            for (Alert alert : unread) {
                try {
                    client.put(updateOnlyPolicy, key(alert.getId()),
                            new Bin("isRead", true), new Bin("readAt", readAt), new Bin("updatedAt", readAt));
                    changed++;
                } catch (AerospikeException e) {
                    // Deleted between the scan and the write.
                    if (e.getResultCode() != ResultCode.KEY_NOT_FOUND_ERROR) {
                        throw e;
                    }
                }
            }
            return changed;
        });
    }

    @Override
    public void delete(String alertId) {
        execute("delete", () -> client.delete(writePolicy, key(alertId)));
    }

    @Override
    public int deleteTerminalCreatedBefore(long cutoff) {
        ScanPolicy scanPolicy = scanPolicy();
        scanPolicy.filterExp = Exp.build(Exp.lt(Exp.intBin("createdAt"), Exp.val(cutoff)));

        List<Alert> expired = scan("deleteTerminalCreatedBefore", scanPolicy, a -> a.getStatus().isTerminal());
        return execute("deleteTerminalCreatedBefore", () -> {
            int deleted = 0;
            for (Alert alert : expired) {
                if (client.delete(writePolicy, key(alert.getId()))) {
                    deleted++;
                }
            }
            return deleted;
        });
    }

    /**
     * Lease-based lock: a CREATE_ONLY record in the locks set with a TTL, so a crashed holder
     * cannot block the key for longer than the lease.
     */
    @Override
    public DedupLock lockDedupKey(String campaignId, AlertType type) {
        String lockId = campaignId + ":" + type.name();
        Key lockKey = new Key(namespace, AerospikeConfig.SET_ALERT_LOCKS, lockId);
        String owner = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + lockMaxWait.toNanos();

        while (true) {
            try {
                client.put(lockPolicy, lockKey, new Bin("owner", owner));
                return () -> release(lockKey, lockId, owner);
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.KEY_EXISTS_ERROR) {
                    throw new PersistenceException("Failed to acquire dedup lock " + lockId, e);
                }
            }

            if (System.nanoTime() >= deadline) {
                throw new PersistenceException("Timed out waiting for dedup lock " + lockId);
            }
            try {
                Thread.sleep(LOCK_RETRY_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PersistenceException("Interrupted waiting for dedup lock " + lockId, e);
            }
        }
    }

    @Override
    public boolean isAvailable() {
        return client.isConnected();
    }

    private void release(Key lockKey, String lockId, String owner) {
        try {
            Record record = client.get(readPolicy, lockKey);
            // The lease may have expired and been taken by someone else.
            if (record != null && owner.equals(record.getString("owner"))) {
                client.delete(writePolicy, lockKey);
            }
        } catch (AerospikeException e) {
            // Not rethrown: the lease TTL frees the key regardless.
            log.warn("Failed to release dedup lock {}: {}", lockId, e.getMessage(), e);
        }
    }

    private List<Alert> scan(String operation, ScanPolicy scanPolicy, Predicate<Alert> accept) {
        List<Alert> results = new ArrayList<>();
        execute(operation, () -> {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERTS,
                    (key, record) -> {
                        Alert alert = mapRecord(record.getString("id"), record);
                        if (accept.test(alert)) {
                            synchronized (results) {
                                results.add(alert);
                            }
                        }
                    });
            return null;
        });
        return results;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (AerospikeException e) {
            throw new PersistenceException("Alert store " + operation + " failed", e);
        }
    }

    private ScanPolicy scanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        return scanPolicy;
    }

    private Key key(String alertId) {
        return new Key(namespace, AerospikeConfig.SET_ALERTS, alertId);
    }

    private Bin previousValueBin(Double previousValue) {
        return previousValue == null ? Bin.asNull("previousValue") : new Bin("previousValue", previousValue);
    }

    private Alert mapRecord(String alertId, Record record) {
        Object previous = record.getValue("previousValue");
        return Alert.builder()
                .id(alertId)
                .campaignId(record.getString("campaignId"))
                .recipientId(record.getString("recipientId"))
                .type(AlertType.valueOf(record.getString("type")))
                .priority(AlertPriority.valueOf(record.getString("priority")))
                .status(AlertStatus.valueOf(record.getString("status")))
                .title(record.getString("title"))
                .message(record.getString("message"))
                .threshold(record.getDouble("threshold"))
                .currentValue(record.getDouble("currentValue"))
                .previousValue(previous instanceof Number ? ((Number) previous).doubleValue() : null)
                .detail(deserializeDetail(record.getString("detail")))
                .read(record.getBoolean("isRead"))
                .readAt(record.getLong("readAt"))
                .emailSent(record.getBoolean("emailSent"))
                .chatSent(record.getBoolean("chatSent"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .resolvedAt(record.getLong("resolvedAt"))
                .build();
    }

    private String serializeDetail(AlertDetail detail) {
        if (detail == null) return null;
        try {
            return objectMapper.writerFor(AlertDetail.class).writeValueAsString(detail);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize alert detail " + detail.type(), e);
        }
    }

    private AlertDetail deserializeDetail(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, AlertDetail.class);
        } catch (Exception e) {
            log.error("Failed to deserialize alert detail", e);
            return null;
        }
    }
}
