package com.adpulse.alerts.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger lastRunFailedCampaigns;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastRunFailedCampaigns = registry.gauge("alerts.batch.last_run.failed_campaigns", new AtomicInteger(0));
    }

    public void recordDetection(String alertType, String priority) {
        Counter.builder("alerts.detected.count")
                .tag("alert_type", alertType)
                .tag("priority", priority)
                .register(registry)
                .increment();
    }

    public void recordUpsert(String alertType, String outcome) {
        Counter.builder("alerts.upsert.count")
                .tag("alert_type", alertType)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordDelivery(String channel, String status) {
        Counter.builder("alerts.delivery.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordCampaignFailure(String reason) {
        Counter.builder("alerts.campaign.failure.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordBatchRun(String runType, Duration duration, int failedCampaigns, boolean partial) {
        Timer.builder("alerts.batch.duration")
                .tag("run_type", runType)
                .tag("partial", String.valueOf(partial))
                .register(registry)
                .record(duration);
        lastRunFailedCampaigns.set(failedCampaigns);
    }

    public void recordLifecycleTransition(String status) {
        Counter.builder("alerts.lifecycle.transition.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
