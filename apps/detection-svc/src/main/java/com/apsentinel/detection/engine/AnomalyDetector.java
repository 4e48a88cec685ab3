package com.apsentinel.detection.engine;

import com.apsentinel.detection.model.AnomalyKind;

/**
 * One stateless detection step. Implementations are registered as beans and run in
 * {@link org.springframework.core.annotation.Order} order by {@link DetectionOrchestrator}.
 */
public interface AnomalyDetector {

    /**
     * The anomaly kind this detector records.
     */
    AnomalyKind kind();

    /**
     * Scan the tenant's bills and record new findings.
     *
     * @return number of anomalies newly created by this call
     */
    int detect(DetectionContext context);
}
