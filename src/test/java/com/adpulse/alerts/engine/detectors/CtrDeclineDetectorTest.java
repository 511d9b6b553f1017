package com.adpulse.alerts.engine.detectors;

import com.adpulse.alerts.engine.DetectionContext;
import com.adpulse.alerts.model.*;
import com.adpulse.alerts.model.detail.CtrDeclineDetail;
import com.adpulse.alerts.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CtrDeclineDetectorTest {

    private final CtrDeclineDetector detector = new CtrDeclineDetector();
    private final Campaign campaign = TestDataFactory.createCampaign("camp-1");
    private final AlertThresholds thresholds = TestDataFactory.defaultThresholds();

    @Test
    void detect_twoQualifyingDropsWithThreeWeekSetting_triggersAtBoundary() {
        // Week-over-week changes, newest first: -15%, -12%, -8%
        List<MetricsSnapshot> weeks = TestDataFactory.createWeeklyCtr(0.02064, 0.02429, 0.0276, 0.03);
        DetectionContext context = TestDataFactory.contextBuilder().weekly(weeks).build();

        Optional<AlertCandidate> result = detector.detect(campaign, context, thresholds);

        assertThat(result).isPresent();
        AlertCandidate candidate = result.get();
        assertThat(candidate.getType()).isEqualTo(AlertType.CTR_DECLINE);
        assertThat(candidate.getThreshold()).isEqualTo(3.0);
        assertThat(candidate.getCurrentValue()).isCloseTo(2.064, within(1e-6));
        assertThat(candidate.getPreviousValue()).isCloseTo(2.76, within(1e-6));
        assertThat(candidate.getMagnitude()).isCloseTo(25.217, within(0.01));
        assertThat(candidate.getPriority()).isEqualTo(AlertPriority.MEDIUM);

        CtrDeclineDetail detail = (CtrDeclineDetail) candidate.getDetail();
        assertThat(detail.consecutiveWeeks()).isEqualTo(3);
        assertThat(detail.weeklyCtr()).hasSize(3);
        assertThat(detail.weeklyCtr().get(0).period()).isEqualTo("2026-W41");
    }

    @Test
    void detect_onlyOneQualifyingWeek_doesNotTrigger() {
        // -15%, then a 4.8% dip that does not qualify
        List<MetricsSnapshot> weeks = TestDataFactory.createWeeklyCtr(0.017, 0.02, 0.021, 0.03);
        DetectionContext context = TestDataFactory.contextBuilder().weekly(weeks).build();

        assertThat(detector.detect(campaign, context, thresholds)).isEmpty();
    }

    @Test
    void detect_seriesShorterThanWindow_doesNotTrigger() {
        List<MetricsSnapshot> weeks = TestDataFactory.createWeeklyCtr(0.01, 0.02);
        DetectionContext context = TestDataFactory.contextBuilder().weekly(weeks).build();

        assertThat(detector.detect(campaign, context, thresholds)).isEmpty();
    }

    @Test
    void detect_weekWithoutImpressionsBreaksTheStreak() {
        List<MetricsSnapshot> weeks = List.of(
                TestDataFactory.createWeeklyCtr(0.017).get(0),
                MetricsSnapshot.empty(),
                TestDataFactory.createWeeklyCtr(0.03).get(0));
        DetectionContext context = TestDataFactory.contextBuilder().weekly(weeks).build();

        assertThat(detector.detect(campaign, context, thresholds)).isEmpty();
    }

    @Test
    void detect_windowSettingBelowTwo_isClampedToTwo() {
        List<MetricsSnapshot> weeks = TestDataFactory.createWeeklyCtr(0.017, 0.02);
        DetectionContext context = TestDataFactory.contextBuilder().weekly(weeks).build();
        AlertThresholds oneWeek = thresholds.toBuilder().ctrDropWeeks(1).build();

        Optional<AlertCandidate> result = detector.detect(campaign, context, oneWeek);

        assertThat(result).isPresent();
        assertThat(result.get().getThreshold()).isEqualTo(2.0);
        assertThat(((CtrDeclineDetail) result.get().getDetail()).consecutiveWeeks()).isEqualTo(2);
    }
}
