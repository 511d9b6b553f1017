package com.adpulse.alerts.config;

import com.adpulse.alerts.model.AlertThresholds;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alerts")
public class AlertEngineConfig {

    // System-wide detector defaults; tenants may override them individually.
    private Thresholds thresholds = new Thresholds();

    // Tightened thresholds for the frequent emergency pass.
    private CriticalPass criticalPass = new CriticalPass();

    private Batch batch = new Batch();

    private Dispatch dispatch = new Dispatch();

    private Schedule schedule = new Schedule();

    private Cleanup cleanup = new Cleanup();

    private Mail mail = new Mail();

    private Lock lock = new Lock();

    // Window in which a re-detection refreshes the existing ACTIVE alert instead of creating one.
    private Duration dedupWindow = Duration.ofHours(24);

    // Re-detections closer than this to the stored value are not written.
    private double refreshTolerance = 0.1;

    // How far back "previous period" metrics are taken from.
    private int previousLookbackDays = 7;

    // Weekly snapshots fetched for the CTR trend.
    private int weeklyHistoryWeeks = 4;

    public AlertThresholds defaultThresholds() {
        return AlertThresholds.builder()
                .roasDropPercent(thresholds.getRoasDropPercent())
                .cpaAboveTargetPercent(thresholds.getCpaAboveTargetPercent())
                .impressionLossBudgetPercent(thresholds.getImpressionLossBudgetPercent())
                .impressionLossRankPercent(thresholds.getImpressionLossRankPercent())
                .ctrDropWeeks(thresholds.getCtrDropWeeks())
                .ctrDropMinPercent(thresholds.getCtrDropMinPercent())
                .burnRateThreshold(thresholds.getBurnRateThreshold())
                .build();
    }

    @Data
    public static class Thresholds {
        private double roasDropPercent = 20.0;
        private double cpaAboveTargetPercent = 20.0;
        private double impressionLossBudgetPercent = 40.0;
        private double impressionLossRankPercent = 50.0;
        private int ctrDropWeeks = 3;
        private double ctrDropMinPercent = 10.0;
        private double burnRateThreshold = 1.3;
    }

    @Data
    public static class CriticalPass {
        private double burnRateThreshold = 1.5;
        private double budgetLossPercent = 60.0;
    }

    @Data
    public static class Batch {
        private int maxConcurrency = 4;
        private Duration maxDuration = Duration.ofMinutes(10);
    }

    @Data
    public static class Dispatch {
        private int poolSize = 8;
        private Duration channelTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Schedule {
        private boolean enabled = true;
        private String zone = "America/Sao_Paulo";
        private String dailyAnalysis = "0 0 8 * * *";
        private String criticalPass = "0 0 */4 * * *";
        private String dailySummary = "0 0 9 * * *";
        private String cleanup = "0 0 2 * * SUN";
    }

    @Data
    public static class Cleanup {
        private Duration retention = Duration.ofDays(30);
    }

    @Data
    public static class Lock {
        // Lease after which an abandoned dedup lock expires on its own.
        private Duration lease = Duration.ofSeconds(30);
        private Duration maxWait = Duration.ofSeconds(5);
    }

    @Data
    public static class Mail {
        private boolean enabled = false;
        private String from = "alerts@adpulse.local";
        private String dashboardUrl = "http://localhost:5173";
    }
}
