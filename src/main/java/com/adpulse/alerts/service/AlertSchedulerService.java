package com.adpulse.alerts.service;

import com.adpulse.alerts.channel.EmailSender;
import com.adpulse.alerts.config.AlertEngineConfig;
import com.adpulse.alerts.exception.AlertEngineException;
import com.adpulse.alerts.model.Alert;
import com.adpulse.alerts.model.BatchSummary;
import com.adpulse.alerts.model.Operator;
import com.adpulse.alerts.repository.AlertStore;
import com.adpulse.alerts.repository.OperatorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Periodic jobs. Every job catches its own failure so one bad run never kills the scheduler
 * thread; the next trigger simply tries again.
 */
@Service
public class AlertSchedulerService {

    private static final Logger log = LoggerFactory.getLogger(AlertSchedulerService.class);

    static final Duration SUMMARY_WINDOW = Duration.ofHours(24);

    // Most severe first, newest first within a priority.
    static final Comparator<Alert> SUMMARY_ORDER = Comparator
            .comparing(Alert::getPriority, Comparator.reverseOrder())
            .thenComparing(Comparator.comparingLong(Alert::getCreatedAt).reversed());

    private final AlertAnalysisService analysisService;
    private final AlertLifecycleService lifecycleService;
    private final AlertStore alertStore;
    private final OperatorRepository operatorRepository;
    private final EmailSender emailSender;
    private final AlertEngineConfig config;
    private final Clock clock;

    public AlertSchedulerService(AlertAnalysisService analysisService,
                                 AlertLifecycleService lifecycleService,
                                 AlertStore alertStore,
                                 OperatorRepository operatorRepository,
                                 EmailSender emailSender,
                                 AlertEngineConfig config,
                                 Clock clock) {
        this.analysisService = analysisService;
        this.lifecycleService = lifecycleService;
        this.alertStore = alertStore;
        this.operatorRepository = operatorRepository;
        this.emailSender = emailSender;
        this.config = config;
        this.clock = clock;
    }

    @Scheduled(cron = "${alerts.schedule.daily-analysis:0 0 8 * * *}",
               zone = "${alerts.schedule.zone:America/Sao_Paulo}")
    public void runDailyAnalysis() {
        if (!config.getSchedule().isEnabled()) {
            return;
        }
        try {
            BatchSummary summary = analysisService.runBatchAnalysis();
            log.info("Daily analysis finished: {}", summary);
        } catch (RuntimeException e) {
            log.error("Daily analysis aborted: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${alerts.schedule.critical-pass:0 0 */4 * * *}",
               zone = "${alerts.schedule.zone:America/Sao_Paulo}")
    public void runCriticalPass() {
        if (!config.getSchedule().isEnabled()) {
            return;
        }
        try {
            BatchSummary summary = analysisService.runCriticalOnlyPass();
            log.info("Critical pass finished: {}", summary);
        } catch (RuntimeException e) {
            log.error("Critical pass aborted: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${alerts.schedule.daily-summary:0 0 9 * * *}",
               zone = "${alerts.schedule.zone:America/Sao_Paulo}")
    public void sendDailySummaries() {
        if (!config.getSchedule().isEnabled()) {
            return;
        }
        try {
            int sent = sendSummaries();
            log.info("Daily summaries sent: {}", sent);
        } catch (RuntimeException e) {
            log.error("Daily summary job failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${alerts.schedule.cleanup:0 0 2 * * SUN}",
               zone = "${alerts.schedule.zone:America/Sao_Paulo}")
    public void cleanupResolved() {
        if (!config.getSchedule().isEnabled()) {
            return;
        }
        try {
            lifecycleService.purgeResolved(config.getCleanup().getRetention());
        } catch (RuntimeException e) {
            log.error("Alert cleanup failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One summary per active operator with alerts in the last 24 hours.
     *
     * @return number of summaries handed to the mail relay
     */
    int sendSummaries() {
        long since = clock.millis() - SUMMARY_WINDOW.toMillis();
        int sent = 0;

        for (Operator operator : operatorRepository.findActive()) {
            List<Alert> alerts = new ArrayList<>(alertStore.findByRecipientSince(operator.getId(), since));
            if (alerts.isEmpty()) {
                continue;
            }
            alerts.sort(SUMMARY_ORDER);
            try {
                emailSender.sendDailySummary(operator, alerts);
                sent++;
            } catch (AlertEngineException e) {
                log.warn("Daily summary for operator {} not sent: {}", operator.getId(), e.getMessage());
            }
        }
        return sent;
    }
}
