package com.apsentinel.detection.repository;

import com.apsentinel.detection.entity.AnomalyEntity;
import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.model.AnomalyKind;
import com.apsentinel.detection.model.AnomalyStatus;
import com.apsentinel.detection.model.Severity;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLAnomalyRepository implements AnomalyRepository {

    private final JpaAnomalyRepository jpaAnomalyRepository;
    private final AnomalyMetadataCodec metadataCodec;

    public PostgreSQLAnomalyRepository(JpaAnomalyRepository jpaAnomalyRepository, AnomalyMetadataCodec metadataCodec) {
        this.jpaAnomalyRepository = jpaAnomalyRepository;
        this.metadataCodec = metadataCodec;
    }

    @Override
    public boolean existsByTenantIdAndBillIdAndKind(UUID tenantId, UUID billId, AnomalyKind kind) {
        return jpaAnomalyRepository.existsByTenantIdAndBillIdAndKind(tenantId, billId, kind.code());
    }

    @Override
    public boolean insertIfAbsent(Anomaly anomaly) {
        int inserted = jpaAnomalyRepository.insertIgnoringConflict(
                anomaly.id(),
                anomaly.tenantId(),
                anomaly.billId(),
                anomaly.kind().code(),
                anomaly.severity().code(),
                anomaly.amount(),
                anomaly.confidenceScore(),
                anomaly.description(),
                metadataCodec.encode(anomaly.metadata()),
                anomaly.shouldAlert(),
                anomaly.status().code(),
                anomaly.createdAt()
        );
        return inserted > 0;
    }

    @Override
    public Optional<Anomaly> findByIdAndTenantId(UUID anomalyId, UUID tenantId) {
        return jpaAnomalyRepository.findByIdAndTenantId(anomalyId, tenantId).map(this::toModel);
    }

    @Override
    public List<Anomaly> findByTenantId(UUID tenantId, Optional<AnomalyStatus> status, int offset, int limit) {
        List<AnomalyEntity> entities = status
                .map(value -> jpaAnomalyRepository.findPageByStatus(tenantId, value.code(), offset, limit))
                .orElseGet(() -> jpaAnomalyRepository.findPage(tenantId, offset, limit));
        return entities.stream().map(this::toModel).toList();
    }

    @Override
    public List<Anomaly> findOpenAlerts(UUID tenantId, int limit) {
        return jpaAnomalyRepository.findByTenantIdAndStatusAndShouldAlertTrueOrderByCreatedAtDesc(
                        tenantId, AnomalyStatus.OPEN.code(), PageRequest.of(0, Math.max(1, limit)))
                .stream()
                .map(this::toModel)
                .toList();
    }

    @Override
    public long countByTenantId(UUID tenantId) {
        return jpaAnomalyRepository.countByTenantId(tenantId);
    }

    @Override
    public long countAlertWorthyByTenantId(UUID tenantId) {
        return jpaAnomalyRepository.countByTenantIdAndShouldAlertTrue(tenantId);
    }

    @Override
    public Anomaly updateStatus(Anomaly anomaly) {
        AnomalyEntity entity = jpaAnomalyRepository.findByIdAndTenantId(anomaly.id(), anomaly.tenantId())
                .orElseThrow(() -> new IllegalStateException("Anomaly " + anomaly.id() + " no longer exists"));
        entity.applyStatus(
                anomaly.status().code(),
                anomaly.resolutionNotes(),
                anomaly.acknowledgedAt(),
                anomaly.updatedAt()
        );
        return toModel(jpaAnomalyRepository.save(entity));
    }

    private Anomaly toModel(AnomalyEntity entity) {
        AnomalyKind kind = AnomalyKind.fromCode(entity.getKind());
        return new Anomaly(
                entity.getId(),
                entity.getTenantId(),
                entity.getBillId(),
                kind,
                Severity.fromCode(entity.getSeverity()),
                entity.getAmount(),
                entity.getConfidenceScore(),
                entity.getDescription(),
                metadataCodec.decode(kind, entity.getMetadataJson()),
                entity.isShouldAlert(),
                AnomalyStatus.fromCode(entity.getStatus()),
                entity.getResolutionNotes(),
                entity.getCreatedAt(),
                entity.getAcknowledgedAt(),
                entity.getUpdatedAt()
        );
    }
}
