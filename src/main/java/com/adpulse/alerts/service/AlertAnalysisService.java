package com.adpulse.alerts.service;

import com.adpulse.alerts.config.AlertEngineConfig;
import com.adpulse.alerts.config.MetricsConfig;
import com.adpulse.alerts.engine.DetectionContext;
import com.adpulse.alerts.engine.DetectorSet;
import com.adpulse.alerts.exception.AlertEngineException;
import com.adpulse.alerts.exception.NotFoundException;
import com.adpulse.alerts.exception.PermissionDeniedException;
import com.adpulse.alerts.exception.PersistenceException;
import com.adpulse.alerts.exception.ValidationException;
import com.adpulse.alerts.model.Alert;
import com.adpulse.alerts.model.AlertCandidate;
import com.adpulse.alerts.model.AlertPriority;
import com.adpulse.alerts.model.AlertThresholds;
import com.adpulse.alerts.model.AlertType;
import com.adpulse.alerts.model.BatchSummary;
import com.adpulse.alerts.model.Campaign;
import com.adpulse.alerts.model.StageOutcome;
import com.adpulse.alerts.model.UpsertResult;
import com.adpulse.alerts.repository.AlertStore;
import com.adpulse.alerts.repository.CampaignRepository;
import com.adpulse.alerts.repository.MetricsProvider;
import com.adpulse.alerts.repository.ThresholdOverrideRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Main orchestrator for campaign analysis.
 *
 * Flow per campaign:
 * 1. Resolve effective thresholds (system defaults + tenant overrides)
 * 2. Fetch current, previous, weekly and month-to-date metrics once
 * 3. Run the detector set
 * 4. Upsert every candidate through the deduplicator
 *
 * Batch runs add campaign isolation (one failure never aborts the run), a bounded worker pool,
 * a run deadline, and dispatch of every created or refreshed alert.
 */
@Service
public class AlertAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AlertAnalysisService.class);

    static final String RUN_FULL = "FULL";
    static final String RUN_CRITICAL_ONLY = "CRITICAL_ONLY";
    static final String RUN_RECIPIENT = "RECIPIENT";

    private static final Set<AlertType> CRITICAL_PASS_TYPES = EnumSet.of(AlertType.BURN_RATE, AlertType.BUDGET_LOSS);

    private final CampaignRepository campaignRepository;
    private final ThresholdOverrideRepository overrideRepository;
    private final MetricsProvider metricsProvider;
    private final DetectorSet detectorSet;
    private final AlertDeduplicator deduplicator;
    private final AlertDispatcher dispatcher;
    private final AlertStore alertStore;
    private final AlertEngineConfig config;
    private final MetricsConfig metricsConfig;
    private final Executor campaignExecutor;
    private final Clock clock;

    public AlertAnalysisService(CampaignRepository campaignRepository,
                                ThresholdOverrideRepository overrideRepository,
                                MetricsProvider metricsProvider,
                                DetectorSet detectorSet,
                                AlertDeduplicator deduplicator,
                                AlertDispatcher dispatcher,
                                AlertStore alertStore,
                                AlertEngineConfig config,
                                MetricsConfig metricsConfig,
                                @Qualifier("campaignAnalysisExecutor") Executor campaignExecutor,
                                Clock clock) {
        this.campaignRepository = campaignRepository;
        this.overrideRepository = overrideRepository;
        this.metricsProvider = metricsProvider;
        this.detectorSet = detectorSet;
        this.deduplicator = deduplicator;
        this.dispatcher = dispatcher;
        this.alertStore = alertStore;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.campaignExecutor = campaignExecutor;
        this.clock = clock;
    }

    /**
     * Analyze one campaign by id. Alerts are stored but not dispatched.
     */
    @Observed(name = "alerts.analyze", contextualName = "analyze-campaign")
    public List<Alert> analyzeCampaign(String campaignId) {
        return analyzeCampaign(loadCampaign(campaignId));
    }

    /**
     * Manual analysis requested by a manager. The campaign must belong to {@code recipientId}.
     */
    @Observed(name = "alerts.analyze", contextualName = "analyze-own-campaign")
    public List<Alert> analyzeCampaign(String recipientId, String campaignId) {
        if (recipientId == null || recipientId.isBlank()) {
            throw new ValidationException("recipientId is required");
        }
        Campaign campaign = loadCampaign(campaignId);
        if (!recipientId.equals(campaign.getRecipientId())) {
            throw new PermissionDeniedException("Campaign " + campaignId + " is not managed by " + recipientId);
        }
        return analyzeCampaign(campaign);
    }

    public List<Alert> analyzeCampaign(Campaign campaign) {
        CampaignRun run = analyze(campaign, EnumSet.allOf(AlertType.class), resolveThresholds(campaign), c -> true);
        return run.results.stream().map(UpsertResult::alert).collect(Collectors.toList());
    }

    /**
     * Analyze every eligible campaign of one manager. Like {@link #analyzeCampaign(String, String)},
     * alerts are stored but not dispatched.
     */
    @Observed(name = "alerts.batch.recipient", contextualName = "analyze-recipient-campaigns")
    public BatchSummary analyzeForRecipient(String recipientId) {
        if (recipientId == null || recipientId.isBlank()) {
            throw new ValidationException("recipientId is required");
        }
        Supplier<List<Campaign>> own = () -> campaignRepository.findEligible().stream()
                .filter(c -> recipientId.equals(c.getRecipientId()))
                .collect(Collectors.toList());
        return runBatch(RUN_RECIPIENT, own, EnumSet.allOf(AlertType.class), this::resolveThresholds,
                c -> true, false);
    }

    /**
     * Thresholds a detection run would use for this campaign: system defaults with its tenant's overrides.
     */
    public AlertThresholds effectiveThresholds(String campaignId) {
        return resolveThresholds(loadCampaign(campaignId));
    }

    @Observed(name = "alerts.batch", contextualName = "run-batch-analysis")
    public BatchSummary runBatchAnalysis() {
        return runBatch(RUN_FULL, campaignRepository::findEligible, EnumSet.allOf(AlertType.class),
                this::resolveThresholds, c -> true, true);
    }

    /**
     * Burn rate and budget loss only, with tightened thresholds, keeping CRITICAL candidates only.
     */
    @Observed(name = "alerts.batch.critical", contextualName = "run-critical-pass")
    public BatchSummary runCriticalOnlyPass() {
        AlertEngineConfig.CriticalPass criticalPass = config.getCriticalPass();
        Function<Campaign, AlertThresholds> thresholds = campaign -> resolveThresholds(campaign).toBuilder()
                .burnRateThreshold(criticalPass.getBurnRateThreshold())
                .impressionLossBudgetPercent(criticalPass.getBudgetLossPercent())
                .build();

        return runBatch(RUN_CRITICAL_ONLY, campaignRepository::findEligible, CRITICAL_PASS_TYPES, thresholds,
                c -> c.getPriority() == AlertPriority.CRITICAL, true);
    }

    AlertThresholds resolveThresholds(Campaign campaign) {
        AlertThresholds defaults = config.defaultThresholds();
        return overrideRepository.findByTenant(campaign.getTenantId())
                .map(defaults::withOverrides)
                .orElse(defaults);
    }

    private Campaign loadCampaign(String campaignId) {
        if (campaignId == null || campaignId.isBlank()) {
            throw new ValidationException("campaignId is required");
        }
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new NotFoundException("Campaign not found: " + campaignId));
    }

    private BatchSummary runBatch(String runType, Supplier<List<Campaign>> source, Set<AlertType> types,
                                  Function<Campaign, AlertThresholds> thresholds,
                                  Predicate<AlertCandidate> keep, boolean dispatch) {
        long start = clock.millis();

        // Setup failures abort the run; there is nothing meaningful to summarize.
        if (!alertStore.isAvailable()) {
            throw new PersistenceException("Alert store is unavailable, " + runType + " run aborted");
        }
        List<Campaign> campaigns = source.get();
        long deadline = start + config.getBatch().getMaxDuration().toMillis();

        log.info("{} run started: {} eligible campaigns", runType, campaigns.size());

        List<CompletableFuture<CampaignTask>> tasks = new ArrayList<>(campaigns.size());
        for (Campaign campaign : campaigns) {
            tasks.add(CompletableFuture.supplyAsync(
                    () -> runCampaign(campaign, types, thresholds, keep, dispatch, deadline), campaignExecutor));
        }

        BatchSummary summary = BatchSummary.builder().runType(runType).build();
        for (CompletableFuture<CampaignTask> future : tasks) {
            CampaignTask task = future.join();
            if (task.skipped) {
                summary.setSkippedCampaigns(summary.getSkippedCampaigns() + 1);
                continue;
            }
            summary.setCampaignsAnalyzed(summary.getCampaignsAnalyzed() + 1);
            if (task.outcome.isSuccess()) {
                CampaignRun run = task.outcome.getValue();
                summary.setAlertsGenerated(summary.getAlertsGenerated() + run.results.size());
                summary.setDroppedAlerts(summary.getDroppedAlerts() + run.dropped);
            } else {
                summary.setErrors(summary.getErrors() + 1);
                summary.getFailedCampaignIds().add(task.campaignId);
            }
        }

        summary.setPartial(summary.getSkippedCampaigns() > 0);
        summary.setDurationMs(clock.millis() - start);
        metricsConfig.recordBatchRun(runType, Duration.ofMillis(summary.getDurationMs()),
                summary.getErrors(), summary.isPartial());

        log.info("{} run complete: analyzed={}, alerts={}, errors={}, dropped={}, skipped={}, duration={}ms",
                runType, summary.getCampaignsAnalyzed(), summary.getAlertsGenerated(), summary.getErrors(),
                summary.getDroppedAlerts(), summary.getSkippedCampaigns(), summary.getDurationMs());
        if (summary.isPartial()) {
            log.warn("{} run hit its deadline; {} campaigns were not analyzed", runType, summary.getSkippedCampaigns());
        }
        return summary;
    }

    private CampaignTask runCampaign(Campaign campaign, Set<AlertType> types,
                                     Function<Campaign, AlertThresholds> thresholds,
                                     Predicate<AlertCandidate> keep, boolean dispatch, long deadline) {
        if (clock.millis() >= deadline) {
            return CampaignTask.skipped(campaign.getId());
        }

        StageOutcome<CampaignRun> outcome;
        try {
            outcome = StageOutcome.of(() -> analyze(campaign, types, thresholds.apply(campaign), keep));
        } catch (RuntimeException e) {
            log.error("Unexpected failure analyzing campaign {}", campaign.getId(), e);
            outcome = StageOutcome.failure(new AlertEngineException("Unexpected failure: " + e.getMessage(), e));
        }

        if (outcome.isSuccess()) {
            for (UpsertResult result : outcome.getValue().results) {
                if (dispatch && result.changed()) {
                    dispatcher.dispatch(result.alert());
                }
            }
        } else {
            AlertEngineException failure = outcome.getFailure().orElseThrow();
            metricsConfig.recordCampaignFailure(failure.getClass().getSimpleName());
            log.warn("Campaign {} failed: {}", campaign.getId(), failure.getMessage());
        }
        return CampaignTask.ran(campaign.getId(), outcome);
    }

    private CampaignRun analyze(Campaign campaign, Set<AlertType> types,
                                AlertThresholds thresholds, Predicate<AlertCandidate> keep) {
        DetectionContext context = loadContext(campaign);

        List<AlertCandidate> candidates = detectorSet.detect(types, campaign, context, thresholds).stream()
                .filter(keep)
                .collect(Collectors.toList());

        CampaignRun run = new CampaignRun();
        for (AlertCandidate candidate : candidates) {
            StageOutcome<UpsertResult> upsert = StageOutcome.of(
                    () -> deduplicator.apply(candidate, campaign.getId(), campaign.getRecipientId()));
            if (upsert.isSuccess()) {
                run.results.add(upsert.getValue());
                continue;
            }

            AlertEngineException failure = upsert.getFailure().orElseThrow();
            if (!(failure instanceof PersistenceException)) {
                throw failure;
            }
            run.dropped++;
            log.warn("Dropped {} alert for campaign {}: {}", candidate.getType(), campaign.getId(), failure.getMessage());
        }
        return run;
    }

    private DetectionContext loadContext(Campaign campaign) {
        String id = campaign.getId();
        LocalDate asOf = LocalDate.now(clock.withZone(ZoneId.of(config.getSchedule().getZone())));

        return DetectionContext.builder()
                .current(metricsProvider.getCurrent(id))
                .previous(metricsProvider.getPrevious(id, config.getPreviousLookbackDays()))
                .weekly(metricsProvider.getWeekly(id, config.getWeeklyHistoryWeeks()))
                .monthToDate(metricsProvider.getMonthToDate(id, asOf))
                .asOf(asOf)
                .build();
    }

    private static final class CampaignRun {
        private final List<UpsertResult> results = new ArrayList<>();
        private int dropped;
    }

    private static final class CampaignTask {
        private final String campaignId;
        private final boolean skipped;
        private final StageOutcome<CampaignRun> outcome;

        private CampaignTask(String campaignId, boolean skipped, StageOutcome<CampaignRun> outcome) {
            this.campaignId = campaignId;
            this.skipped = skipped;
            this.outcome = outcome;
        }

        static CampaignTask skipped(String campaignId) {
            return new CampaignTask(campaignId, true, null);
        }

        static CampaignTask ran(String campaignId, StageOutcome<CampaignRun> outcome) {
            return new CampaignTask(campaignId, false, outcome);
        }
    }
}
