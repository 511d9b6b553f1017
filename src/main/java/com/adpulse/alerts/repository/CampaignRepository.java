package com.adpulse.alerts.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.adpulse.alerts.config.AerospikeConfig;
import com.adpulse.alerts.exception.ProviderException;
import com.adpulse.alerts.model.Campaign;
import com.adpulse.alerts.model.CampaignStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
public class CampaignRepository {

    private static final Logger log = LoggerFactory.getLogger(CampaignRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final BatchPolicy batchPolicy;

    public CampaignRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = client.getReadPolicyDefault();
        this.batchPolicy = client.getBatchPolicyDefault();
    }

    public Optional<Campaign> findById(String campaignId) {
        try {
            Record record = client.get(readPolicy, new Key(namespace, AerospikeConfig.SET_CAMPAIGNS, campaignId));
            return record == null ? Optional.empty() : Optional.of(mapRecord(campaignId, record));
        } catch (AerospikeException e) {
            throw new ProviderException("Failed to load campaign " + campaignId, e);
        }
    }

    /**
     * ENABLED campaigns whose tenant is active, sorted by id.
     */
    public List<Campaign> findEligible() {
        List<Campaign> enabled = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CAMPAIGNS,
                    (key, record) -> {
                        String id = record.getString("id");
                        if (id == null) {
                            log.warn("Skipping campaign record without id");
                            return;
                        }
                        Campaign campaign = mapRecord(id, record);
                        if (campaign.getStatus() == CampaignStatus.ENABLED) {
                            synchronized (enabled) {
                                enabled.add(campaign);
                            }
                        }
                    });

            Map<String, Boolean> tenantActive = loadTenantActivity(enabled);
            List<Campaign> eligible = new ArrayList<>();
            for (Campaign campaign : enabled) {
                if (tenantActive.getOrDefault(campaign.getTenantId(), false)) {
                    eligible.add(campaign);
                }
            }
            eligible.sort((a, b) -> a.getId().compareTo(b.getId()));
            return eligible;
        } catch (AerospikeException e) {
            throw new ProviderException("Failed to load eligible campaigns", e);
        }
    }

    private Map<String, Boolean> loadTenantActivity(List<Campaign> campaigns) {
        Set<String> tenantIds = new LinkedHashSet<>();
        for (Campaign campaign : campaigns) {
            if (campaign.getTenantId() != null) {
                tenantIds.add(campaign.getTenantId());
            }
        }
        Map<String, Boolean> active = new HashMap<>();
        if (tenantIds.isEmpty()) {
            return active;
        }

        List<String> ids = new ArrayList<>(tenantIds);
        Key[] keys = new Key[ids.size()];
        for (int i = 0; i < ids.size(); i++) {
            keys[i] = new Key(namespace, AerospikeConfig.SET_TENANTS, ids.get(i));
        }
        Record[] records = client.get(batchPolicy, keys);
        for (int i = 0; i < records.length; i++) {
            active.put(ids.get(i), records[i] != null && records[i].getBoolean("active"));
        }
        return active;
    }

    private Campaign mapRecord(String campaignId, Record record) {
        String status = record.getString("status");
        return Campaign.builder()
                .id(campaignId)
                .name(record.getString("name"))
                .tenantId(record.getString("tenantId"))
                .status(status != null ? CampaignStatus.valueOf(status) : CampaignStatus.PAUSED)
                .dailyBudget(optionalDouble(record, "dailyBudget"))
                .monthlyBudget(optionalDouble(record, "monthlyBudget"))
                .targetRoas(optionalDouble(record, "targetRoas"))
                .targetCpa(optionalDouble(record, "targetCpa"))
                .recipientId(record.getString("recipientId"))
                .build();
    }

    private static Double optionalDouble(Record record, String bin) {
        Object value = record.getValue(bin);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }
}
