package com.apsentinel.detection.engine;

import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.repository.AnomalyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes detector findings while keeping at most one anomaly per (tenant, bill, kind).
 */
@Component
public class AnomalyRecorder {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRecorder.class);

    private final AnomalyRepository anomalyRepository;

    public AnomalyRecorder(AnomalyRepository anomalyRepository) {
        this.anomalyRepository = anomalyRepository;
    }

    public boolean alreadyFlagged(Anomaly candidate) {
        return candidate.billId() != null
                && anomalyRepository.existsByTenantIdAndBillIdAndKind(candidate.tenantId(), candidate.billId(), candidate.kind());
    }

    /**
     * @return {@code true} when the candidate was stored as a new anomaly
     */
    public boolean record(Anomaly candidate) {
        if (alreadyFlagged(candidate)) {
            log.debug("Skipping {} for bill {}: already flagged", candidate.kind().code(), candidate.billId());
            return false;
        }
        boolean inserted = anomalyRepository.insertIfAbsent(candidate);
        if (!inserted) {
            // a concurrent writer stored the same finding between the check and the insert
            log.debug("Skipping {} for bill {}: unique constraint hit on insert", candidate.kind().code(), candidate.billId());
        }
        return inserted;
    }
}
