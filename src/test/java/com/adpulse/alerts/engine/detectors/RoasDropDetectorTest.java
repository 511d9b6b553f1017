package com.adpulse.alerts.engine.detectors;

import com.adpulse.alerts.engine.DetectionContext;
import com.adpulse.alerts.model.*;
import com.adpulse.alerts.model.detail.RoasDropDetail;
import com.adpulse.alerts.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RoasDropDetectorTest {

    private final RoasDropDetector detector = new RoasDropDetector();
    private final Campaign campaign = TestDataFactory.createCampaign("camp-1");
    private final AlertThresholds thresholds = TestDataFactory.defaultThresholds();

    @Test
    void detect_roasFellFortyPercent_triggersHigh() {
        DetectionContext context = TestDataFactory.contextBuilder()
                .current(TestDataFactory.createRoasSnapshot(1.8))
                .previous(TestDataFactory.createRoasSnapshot(3.0))
                .build();

        Optional<AlertCandidate> result = detector.detect(campaign, context, thresholds);

        assertThat(result).isPresent();
        AlertCandidate candidate = result.get();
        assertThat(candidate.getType()).isEqualTo(AlertType.ROAS_DROP);
        assertThat(candidate.getMagnitude()).isCloseTo(40.0, within(1e-6));
        assertThat(candidate.getPriority()).isEqualTo(AlertPriority.HIGH);
        assertThat(candidate.getCurrentValue()).isCloseTo(1.8, within(1e-9));
        assertThat(candidate.getPreviousValue()).isCloseTo(3.0, within(1e-9));
        assertThat(candidate.getThreshold()).isEqualTo(20.0);
        assertThat(candidate.getDetail()).isInstanceOf(RoasDropDetail.class);
    }

    @Test
    void detect_smallDrop_doesNotTrigger() {
        DetectionContext context = TestDataFactory.contextBuilder()
                .current(TestDataFactory.createRoasSnapshot(2.7))
                .previous(TestDataFactory.createRoasSnapshot(3.0))
                .build();

        assertThat(detector.detect(campaign, context, thresholds)).isEmpty();
    }

    @Test
    void detect_roasImproved_doesNotTrigger() {
        DetectionContext context = TestDataFactory.contextBuilder()
                .current(TestDataFactory.createRoasSnapshot(4.0))
                .previous(TestDataFactory.createRoasSnapshot(3.0))
                .build();

        assertThat(detector.detect(campaign, context, thresholds)).isEmpty();
    }

    @Test
    void detect_noSpendInPreviousPeriod_doesNotTrigger() {
        DetectionContext context = TestDataFactory.contextBuilder()
                .current(TestDataFactory.createRoasSnapshot(1.0))
                .previous(MetricsSnapshot.empty())
                .build();

        assertThat(detector.detect(campaign, context, thresholds)).isEmpty();
    }

    @Test
    void detect_tenantOverrideRaisesThreshold_doesNotTrigger() {
        DetectionContext context = TestDataFactory.contextBuilder()
                .current(TestDataFactory.createRoasSnapshot(1.8))
                .previous(TestDataFactory.createRoasSnapshot(3.0))
                .build();
        AlertThresholds relaxed = thresholds.toBuilder().roasDropPercent(50.0).build();

        assertThat(detector.detect(campaign, context, relaxed)).isEmpty();
    }
}
