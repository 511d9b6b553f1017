package com.adpulse.alerts.engine;

import com.adpulse.alerts.config.MetricsConfig;
import com.adpulse.alerts.model.AlertCandidate;
import com.adpulse.alerts.model.AlertThresholds;
import com.adpulse.alerts.model.AlertType;
import com.adpulse.alerts.model.Campaign;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed set of detectors, one per AlertType.
 * Detectors are stateless, so the same instances serve every campaign concurrently.
 */
@Component
public class DetectorSet {

    private static final Logger log = LoggerFactory.getLogger(DetectorSet.class);

    private final Map<AlertType, AlertDetector> detectors;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public DetectorSet(List<AlertDetector> detectors, Tracer tracer, MetricsConfig metricsConfig) {
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        Map<AlertType, AlertDetector> byType = new EnumMap<>(AlertType.class);
        for (AlertDetector detector : detectors) {
            AlertDetector previous = byType.put(detector.getSupportedType(), detector);
            if (previous != null) {
                throw new IllegalStateException("Two detectors registered for " + detector.getSupportedType()
                        + ": " + previous.getClass().getSimpleName() + ", " + detector.getClass().getSimpleName());
            }
        }

        Set<AlertType> missing = EnumSet.allOf(AlertType.class);
        missing.removeAll(byType.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No detector registered for " + missing);
        }

        this.detectors = Collections.unmodifiableMap(byType);
        byType.forEach((type, detector) ->
                log.info("Registered detector: {} -> {}", type, detector.getClass().getSimpleName()));
    }

    /**
     * Run every detector.
     */
    public List<AlertCandidate> detectAll(Campaign campaign, DetectionContext context, AlertThresholds thresholds) {
        return detect(EnumSet.allOf(AlertType.class), campaign, context, thresholds);
    }

    /**
     * Run the detectors for the given types, in AlertType order.
     *
     * A detector that throws is logged and skipped; the others still run.
     */
    public List<AlertCandidate> detect(Set<AlertType> types, Campaign campaign,
                                       DetectionContext context, AlertThresholds thresholds) {
        List<AlertCandidate> candidates = new ArrayList<>();
        if (types.isEmpty()) {
            return candidates;
        }

        for (AlertType type : EnumSet.copyOf(types)) {
            AlertDetector detector = detectors.get(type);

            Span span = tracer.nextSpan()
                    .name("detector." + type)
                    .tag("campaign.id", campaign.getId())
                    .tag("alert.type", type.name())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                Optional<AlertCandidate> candidate = detector.detect(campaign, context, thresholds);
                span.tag("detector.triggered", String.valueOf(candidate.isPresent()));

                candidate.ifPresent(c -> {
                    candidates.add(c);
                    metricsConfig.recordDetection(type.name(), c.getPriority().name());
                    log.debug("Detector {} triggered for campaign {}: priority={}, magnitude={}",
                            type, campaign.getId(), c.getPriority(), c.getMagnitude());
                });
            } catch (RuntimeException e) {
                span.error(e);
                log.error("Detector {} failed for campaign {}: {}", type, campaign.getId(), e.getMessage(), e);
            } finally {
                span.end();
            }
        }

        return candidates;
    }
}
