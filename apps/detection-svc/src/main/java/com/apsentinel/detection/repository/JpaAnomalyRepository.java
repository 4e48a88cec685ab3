package com.apsentinel.detection.repository;

import com.apsentinel.detection.entity.AnomalyEntity;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaAnomalyRepository extends JpaRepository<AnomalyEntity, UUID> {

    boolean existsByTenantIdAndBillIdAndKind(UUID tenantId, UUID billId, String kind);

    Optional<AnomalyEntity> findByIdAndTenantId(UUID id, UUID tenantId);

    long countByTenantId(UUID tenantId);

    long countByTenantIdAndShouldAlertTrue(UUID tenantId);

    List<AnomalyEntity> findByTenantIdAndStatusAndShouldAlertTrueOrderByCreatedAtDesc(UUID tenantId, String status, Pageable pageable);

    @Query(value = """
            SELECT * FROM anomalies a
            WHERE a.tenant_id = :tenantId
            ORDER BY a.created_at DESC, a.id
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<AnomalyEntity> findPage(@Param("tenantId") UUID tenantId,
                                 @Param("offset") int offset,
                                 @Param("limit") int limit);

    @Query(value = """
            SELECT * FROM anomalies a
            WHERE a.tenant_id = :tenantId AND a.status = :status
            ORDER BY a.created_at DESC, a.id
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<AnomalyEntity> findPageByStatus(@Param("tenantId") UUID tenantId,
                                         @Param("status") String status,
                                         @Param("offset") int offset,
                                         @Param("limit") int limit);

    @Modifying(flushAutomatically = true)
    @Query(value = """
            INSERT INTO anomalies (id, tenant_id, bill_id, kind, severity, amount, confidence_score,
                                   description, metadata_json, should_alert, status, created_at)
            VALUES (:id, :tenantId, :billId, :kind, :severity, :amount, :confidenceScore,
                    :description, :metadataJson, :shouldAlert, :status, :createdAt)
            ON CONFLICT (tenant_id, bill_id, kind) DO NOTHING
            """, nativeQuery = true)
    int insertIgnoringConflict(@Param("id") UUID id,
                               @Param("tenantId") UUID tenantId,
                               @Param("billId") UUID billId,
                               @Param("kind") String kind,
                               @Param("severity") String severity,
                               @Param("amount") BigDecimal amount,
                               @Param("confidenceScore") double confidenceScore,
                               @Param("description") String description,
                               @Param("metadataJson") String metadataJson,
                               @Param("shouldAlert") boolean shouldAlert,
                               @Param("status") String status,
                               @Param("createdAt") Instant createdAt);
}
