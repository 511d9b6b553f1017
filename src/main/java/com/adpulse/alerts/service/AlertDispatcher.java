package com.adpulse.alerts.service;

import com.adpulse.alerts.channel.ChatPoster;
import com.adpulse.alerts.channel.EmailSender;
import com.adpulse.alerts.channel.RealtimePublisher;
import com.adpulse.alerts.config.AlertEngineConfig;
import com.adpulse.alerts.config.MetricsConfig;
import com.adpulse.alerts.exception.AlertEngineException;
import com.adpulse.alerts.model.Alert;
import com.adpulse.alerts.model.AlertUpdate;
import com.adpulse.alerts.model.DispatchReport;
import com.adpulse.alerts.repository.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Best-effort fan-out of an alert to the realtime, email and chat channels.
 *
 * The three attempts run concurrently and independently, each bounded by the channel timeout.
 * A failed or timed-out attempt is logged and counted, leaves its delivery flag false and is not retried.
 * Nothing here throws to the caller.
 */
@Service
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    public static final String NEW_ALERT_EVENT = "new_alert";
    public static final String NEW_MESSAGE_EVENT = "new_message";

    private final RealtimePublisher realtimePublisher;
    private final EmailSender emailSender;
    private final ChatPoster chatPoster;
    private final AlertStore alertStore;
    private final Executor executor;
    private final AlertEngineConfig config;
    private final MetricsConfig metricsConfig;

    public AlertDispatcher(RealtimePublisher realtimePublisher,
                           EmailSender emailSender,
                           ChatPoster chatPoster,
                           AlertStore alertStore,
                           @Qualifier("alertDispatchExecutor") Executor executor,
                           AlertEngineConfig config,
                           MetricsConfig metricsConfig) {
        this.realtimePublisher = realtimePublisher;
        this.emailSender = emailSender;
        this.chatPoster = chatPoster;
        this.alertStore = alertStore;
        this.executor = executor;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    public DispatchReport dispatch(Alert alert) {
        return dispatchAsync(alert).join();
    }

    /**
     * Start all three attempts and return without waiting. The future always completes normally.
     */
    public CompletableFuture<DispatchReport> dispatchAsync(Alert alert) {
        CompletableFuture<Boolean> realtime = attempt("realtime", alert,
                () -> {
                    realtimePublisher.publish(userScope(alert.getRecipientId()), NEW_ALERT_EVENT, alert);
                    return null;
                },
                ignored -> { });

        CompletableFuture<Boolean> email = attempt("email", alert,
                () -> {
                    emailSender.sendAlertEmail(alert);
                    return null;
                },
                ignored -> alertStore.update(alert.getId(), AlertUpdate.emailSent()));

        CompletableFuture<Boolean> chat = attempt("chat", alert,
                () -> chatPoster.postSystemMessage(alert.getCampaignId(), alert),
                conversationId -> {
                    alertStore.update(alert.getId(), AlertUpdate.chatSent());
                    publishConversationEvent(conversationId, alert);
                });

        return CompletableFuture.allOf(realtime, email, chat)
                .thenApply(v -> {
                    DispatchReport report = new DispatchReport(alert.getId(), realtime.join(), email.join(), chat.join());
                    log.info("Dispatched alert {}: realtime={}, email={}, chat={}",
                            alert.getId(), report.realtimeDelivered(), report.emailSent(), report.chatSent());
                    return report;
                });
    }

    /**
     * Run one channel attempt on the dispatch executor.
     *
     * The attempt and its timeout race for {@code settled}; only the winner reports. A delivery that
     * finishes after its timeout was reported never runs {@code markSent}, and an attempt still queued
     * when it times out never starts, so the stored flag always agrees with the report.
     */
    private <T> CompletableFuture<Boolean> attempt(String channel, Alert alert,
                                                   Supplier<T> delivery, Consumer<T> markSent) {
        long timeoutMs = config.getDispatch().getChannelTimeout().toMillis();
        AtomicBoolean settled = new AtomicBoolean();
        CompletableFuture<Boolean> result = new CompletableFuture<>();

        CompletableFuture.delayedExecutor(timeoutMs, TimeUnit.MILLISECONDS).execute(() -> {
            if (settled.compareAndSet(false, true)) {
                metricsConfig.recordDelivery(channel, "timeout");
                log.warn("{} delivery for alert {} timed out after {} ms", channel, alert.getId(), timeoutMs);
                result.complete(false);
            }
        });

        try {
            executor.execute(() -> run(channel, alert, delivery, markSent, settled, result));
        } catch (RejectedExecutionException e) {
            if (settled.compareAndSet(false, true)) {
                recordFailure(channel, alert, e);
                result.complete(false);
            }
        }
        return result;
    }

    private <T> void run(String channel, Alert alert, Supplier<T> delivery, Consumer<T> markSent,
                         AtomicBoolean settled, CompletableFuture<Boolean> result) {
        if (settled.get()) {
            log.debug("{} delivery for alert {} dropped: timed out before it started", channel, alert.getId());
            return;
        }
        boolean claimed = false;
        try {
            T delivered = delivery.get();
            claimed = settled.compareAndSet(false, true);
            if (!claimed) {
                log.warn("{} delivery for alert {} finished after its timeout; not recorded", channel, alert.getId());
                return;
            }
            markSent.accept(delivered);
            metricsConfig.recordDelivery(channel, "success");
            result.complete(true);
        } catch (RuntimeException e) {
            if (claimed || settled.compareAndSet(false, true)) {
                recordFailure(channel, alert, e);
                result.complete(false);
            } else {
                log.debug("{} delivery for alert {} failed after its timeout: {}", channel, alert.getId(), e.getMessage());
            }
        }
    }

    private void recordFailure(String channel, Alert alert, RuntimeException failure) {
        metricsConfig.recordDelivery(channel, "error");
        if (failure instanceof AlertEngineException) {
            log.warn("{} delivery for alert {} failed: {}", channel, alert.getId(), failure.getMessage());
        } else {
            log.error("{} delivery for alert {} failed unexpectedly", channel, alert.getId(), failure);
        }
    }

    // chatSent is already persisted; a lost room notification does not undo it.
    private void publishConversationEvent(String conversationId, Alert alert) {
        try {
            realtimePublisher.publish(conversationScope(conversationId), NEW_MESSAGE_EVENT, alert);
        } catch (AlertEngineException e) {
            metricsConfig.recordDelivery("conversation", "error");
            log.warn("Conversation event for alert {} in {} failed: {}", alert.getId(), conversationId, e.getMessage());
        }
    }

    static String userScope(String recipientId) {
        return "user_" + recipientId;
    }

    static String conversationScope(String conversationId) {
        return "conversation_" + conversationId;
    }
}
