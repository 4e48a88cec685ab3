package com.apsentinel.detection.repository;

import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.model.AnomalyKind;
import com.apsentinel.detection.model.AnomalyStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AnomalyRepository {

    boolean existsByTenantIdAndBillIdAndKind(UUID tenantId, UUID billId, AnomalyKind kind);

    /**
     * Inserts the anomaly unless one already exists for its (tenant, bill, kind).
     *
     * @return {@code true} when a row was written
     */
    boolean insertIfAbsent(Anomaly anomaly);

    Optional<Anomaly> findByIdAndTenantId(UUID anomalyId, UUID tenantId);

    /**
     * Anomalies of a tenant, newest first. An empty status matches every status.
     */
    List<Anomaly> findByTenantId(UUID tenantId, Optional<AnomalyStatus> status, int offset, int limit);

    List<Anomaly> findOpenAlerts(UUID tenantId, int limit);

    long countByTenantId(UUID tenantId);

    long countAlertWorthyByTenantId(UUID tenantId);

    Anomaly updateStatus(Anomaly anomaly);
}
