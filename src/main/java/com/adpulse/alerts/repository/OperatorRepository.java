package com.adpulse.alerts.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.adpulse.alerts.config.AerospikeConfig;
import com.adpulse.alerts.exception.ProviderException;
import com.adpulse.alerts.model.Operator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Operators (account managers) who receive alerts.
 */
@Repository
public class OperatorRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;

    public OperatorRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = client.getReadPolicyDefault();
    }

    public Optional<Operator> findById(String operatorId) {
        try {
            Record record = client.get(readPolicy, new Key(namespace, AerospikeConfig.SET_OPERATORS, operatorId));
            return record == null ? Optional.empty() : Optional.of(mapRecord(operatorId, record));
        } catch (AerospikeException e) {
            throw new ProviderException("Failed to load operator " + operatorId, e);
        }
    }

    public List<Operator> findActive() {
        List<Operator> operators = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_OPERATORS,
                    (key, record) -> {
                        String id = record.getString("id");
                        if (id != null && record.getBoolean("active")) {
                            synchronized (operators) {
                                operators.add(mapRecord(id, record));
                            }
                        }
                    });
        } catch (AerospikeException e) {
            throw new ProviderException("Failed to scan operators", e);
        }
        return operators;
    }

    private Operator mapRecord(String operatorId, Record record) {
        return Operator.builder()
                .id(operatorId)
                .name(record.getString("name"))
                .email(record.getString("email"))
                .active(record.getBoolean("active"))
                .build();
    }
}
