package com.adpulse.alerts.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.adpulse.alerts.config.AerospikeConfig;
import com.adpulse.alerts.exception.ProviderException;
import com.adpulse.alerts.model.ThresholdOverrides;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class ThresholdOverrideRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;

    public ThresholdOverrideRepository(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = client.getReadPolicyDefault();
    }

    public Optional<ThresholdOverrides> findByTenant(String tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        try {
            Record record = client.get(readPolicy, new Key(namespace, AerospikeConfig.SET_THRESHOLD_OVERRIDES, tenantId));
            if (record == null) {
                return Optional.empty();
            }
            return Optional.of(ThresholdOverrides.builder()
                    .tenantId(tenantId)
                    .roasDropPercent(optionalDouble(record, "roasDropPct"))
                    .cpaAboveTargetPercent(optionalDouble(record, "cpaAbovePct"))
                    .impressionLossBudgetPercent(optionalDouble(record, "isLossBudget"))
                    .impressionLossRankPercent(optionalDouble(record, "isLossRank"))
                    .ctrDropWeeks(optionalInt(record, "ctrDropWeeks"))
                    .ctrDropMinPercent(optionalDouble(record, "ctrDropMinPct"))
                    .burnRateThreshold(optionalDouble(record, "burnRate"))
                    .targetCpa(optionalDouble(record, "targetCpa"))
                    .build());
        } catch (AerospikeException e) {
            throw new ProviderException("Failed to load threshold overrides for tenant " + tenantId, e);
        }
    }

    private static Double optionalDouble(Record record, String bin) {
        Object value = record.getValue(bin);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    private static Integer optionalInt(Record record, String bin) {
        Object value = record.getValue(bin);
        return value instanceof Number ? ((Number) value).intValue() : null;
    }
}
