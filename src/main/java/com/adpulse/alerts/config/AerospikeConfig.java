package com.adpulse.alerts.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Aerospike client and set names. Repositories take their read and write policies from the
 * client's defaults ({@code getReadPolicyDefault()}, {@code getWritePolicyDefault()}) and copy them
 * when they need a variant.
 */
@Configuration
public class AerospikeConfig {

    public static final String SET_ALERTS = "alerts";
    public static final String SET_ALERT_LOCKS = "alert_locks";
    public static final String SET_CAMPAIGNS = "campaigns";
    public static final String SET_TENANTS = "tenants";
    public static final String SET_DAILY_METRICS = "campaign_daily_metrics";
    public static final String SET_THRESHOLD_OVERRIDES = "threshold_overrides";
    public static final String SET_OPERATORS = "operators";
    public static final String SET_CONVERSATIONS = "conversations";
    public static final String SET_CHAT_MESSAGES = "chat_messages";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:adpulse}")
    private String namespace;

    @Value("${aerospike.max-conns-per-node:100}")
    private int maxConnsPerNode;

    @Value("${aerospike.total-timeout-ms:3000}")
    private int totalTimeoutMs;

    @Value("${aerospike.socket-timeout-ms:1000}")
    private int socketTimeoutMs;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = maxConnsPerNode;
        clientPolicy.timeout = 5000;

        clientPolicy.readPolicyDefault.totalTimeout = totalTimeoutMs;
        clientPolicy.readPolicyDefault.socketTimeout = socketTimeoutMs;
        clientPolicy.writePolicyDefault.totalTimeout = totalTimeoutMs;
        clientPolicy.writePolicyDefault.socketTimeout = socketTimeoutMs;
        clientPolicy.batchPolicyDefault.totalTimeout = totalTimeoutMs;
        clientPolicy.batchPolicyDefault.socketTimeout = socketTimeoutMs;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
