package com.adpulse.alerts.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.exp.Exp;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.adpulse.alerts.config.AerospikeConfig;
import com.adpulse.alerts.exception.PersistenceException;
import com.adpulse.alerts.model.ChatMessage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manager/client conversations. Conversations are keyed {@code <managerId>:<tenantId>} and carry
 * the bins {@code id}, {@code managerId}, {@code tenantId} and {@code clientUserId}.
 */
@Repository
public class ConversationRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public ConversationRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = client.getWritePolicyDefault();
        this.readPolicy = client.getReadPolicyDefault();
    }

    public Optional<String> findConversationId(String managerId, String tenantId) {
        Key key = new Key(namespace, AerospikeConfig.SET_CONVERSATIONS, managerId + ":" + tenantId);
        try {
            Record record = client.get(readPolicy, key);
            return record == null ? Optional.empty() : Optional.ofNullable(record.getString("id"));
        } catch (AerospikeException e) {
            throw new PersistenceException("Failed to look up conversation for manager " + managerId, e);
        }
    }

    /**
     * Whether {@code userId} is the manager or the client user of the conversation.
     */
    public boolean isParticipant(String conversationId, String userId) {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.filterExp = Exp.build(Exp.and(
                Exp.eq(Exp.stringBin("id"), Exp.val(conversationId)),
                Exp.or(
                        Exp.eq(Exp.stringBin("managerId"), Exp.val(userId)),
                        Exp.eq(Exp.stringBin("clientUserId"), Exp.val(userId)))));

        AtomicBoolean found = new AtomicBoolean();
        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CONVERSATIONS,
                    (key, record) -> found.set(true));
        } catch (AerospikeException e) {
            throw new PersistenceException("Failed to check participants of conversation " + conversationId, e);
        }
        return found.get();
    }

    public ChatMessage saveMessage(ChatMessage message) {
        ChatMessage toSave = message.getId() != null ? message : ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .conversationId(message.getConversationId())
                .senderId(message.getSenderId())
                .content(message.getContent())
                .messageType(message.getMessageType())
                .alertId(message.getAlertId())
                .createdAt(message.getCreatedAt())
                .build();

        Key key = new Key(namespace, AerospikeConfig.SET_CHAT_MESSAGES, toSave.getId());
        try {
            client.put(writePolicy, key,
                    new Bin("id", toSave.getId()),
                    new Bin("conversationId", toSave.getConversationId()),
                    new Bin("senderId", toSave.getSenderId()),
                    new Bin("content", toSave.getContent()),
                    new Bin("messageType", toSave.getMessageType()),
                    new Bin("alertId", toSave.getAlertId()),
                    new Bin("createdAt", toSave.getCreatedAt()));

        } catch (AerospikeException e) {
            throw new PersistenceException("Failed to save chat message in " + toSave.getConversationId(), e);
        }
        return toSave;
    }
}
