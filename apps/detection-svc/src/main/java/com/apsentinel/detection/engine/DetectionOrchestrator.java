package com.apsentinel.detection.engine;

import com.apsentinel.detection.model.AnomalyKind;
import com.apsentinel.detection.model.VendorBaseline;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs one detection pass for a tenant: recompute vendor baselines, then every registered
 * {@link AnomalyDetector} in order. The whole pass is one transaction.
 */
@Component
public class DetectionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DetectionOrchestrator.class);

    private final BaselineCalculator baselineCalculator;
    private final List<AnomalyDetector> detectors;
    private final Clock clock;

    @Autowired
    public DetectionOrchestrator(BaselineCalculator baselineCalculator, List<AnomalyDetector> detectors) {
        this(baselineCalculator, detectors, Clock.systemUTC());
    }

    DetectionOrchestrator(BaselineCalculator baselineCalculator, List<AnomalyDetector> detectors, Clock clock) {
        if (detectors.isEmpty()) {
            throw new IllegalArgumentException("at least one detector must be registered");
        }
        this.baselineCalculator = baselineCalculator;
        this.detectors = List.copyOf(detectors);
        this.clock = clock;
        log.info("Detection pipeline: {}", this.detectors.stream().map(d -> d.kind().code()).toList());
    }

    @Transactional
    public DetectionRunResult run(UUID tenantId) {
        Instant startedAt = clock.instant();
        LocalDate asOf = LocalDate.ofInstant(startedAt, ZoneOffset.UTC);

        List<VendorBaseline> baselines = baselineCalculator.computeBaselines(tenantId, asOf, startedAt);
        DetectionContext context = new DetectionContext(tenantId, asOf, startedAt, baselines);

        Map<AnomalyKind, Integer> createdByKind = new LinkedHashMap<>();
        for (AnomalyDetector detector : detectors) {
            int created = detector.detect(context);
            createdByKind.merge(detector.kind(), created, Integer::sum);
            log.debug("Tenant {}: {} check done, {} new", tenantId, detector.kind().code(), created);
        }
        return new DetectionRunResult(tenantId, baselines.size(), createdByKind);
    }
}
