package com.apsentinel.detection.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted finding. (tenant_id, bill_id, kind) is unique; detection inserts through
 * {@code ON CONFLICT DO NOTHING} and only the status columns change afterwards.
 */
@Entity
@Table(name = "anomalies", uniqueConstraints = {
        @UniqueConstraint(name = "uq_anomaly_tenant_bill_kind", columnNames = {"tenant_id", "bill_id", "kind"})
})
public class AnomalyEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "bill_id", updatable = false)
    private UUID billId;

    @Column(name = "kind", nullable = false, length = 50, updatable = false)
    private String kind;

    @Column(name = "severity", nullable = false, length = 20)
    private String severity;

    @Column(name = "amount", precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(name = "confidence_score", nullable = false)
    private double confidenceScore;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "metadata_json", columnDefinition = "text")
    private String metadataJson;

    @Column(name = "should_alert", nullable = false)
    private boolean shouldAlert;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "resolution_notes", columnDefinition = "text")
    private String resolutionNotes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected AnomalyEntity() {}

    public AnomalyEntity(UUID id, UUID tenantId, UUID billId, String kind, String severity, BigDecimal amount,
                         double confidenceScore, String description, String metadataJson, boolean shouldAlert,
                         String status, String resolutionNotes, Instant createdAt, Instant acknowledgedAt,
                         Instant updatedAt) {
        this.id = id;
        this.tenantId = tenantId;
        this.billId = billId;
        this.kind = kind;
        this.severity = severity;
        this.amount = amount;
        this.confidenceScore = confidenceScore;
        this.description = description;
        this.metadataJson = metadataJson;
        this.shouldAlert = shouldAlert;
        this.status = status;
        this.resolutionNotes = resolutionNotes;
        this.createdAt = createdAt;
        this.acknowledgedAt = acknowledgedAt;
        this.updatedAt = updatedAt;
    }

    public UUID getId() { return id; }
    public UUID getTenantId() { return tenantId; }
    public UUID getBillId() { return billId; }
    public String getKind() { return kind; }
    public String getSeverity() { return severity; }
    public BigDecimal getAmount() { return amount; }
    public double getConfidenceScore() { return confidenceScore; }
    public String getDescription() { return description; }
    public String getMetadataJson() { return metadataJson; }
    public boolean isShouldAlert() { return shouldAlert; }
    public String getStatus() { return status; }
    public String getResolutionNotes() { return resolutionNotes; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getAcknowledgedAt() { return acknowledgedAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void applyStatus(String status, String resolutionNotes, Instant acknowledgedAt, Instant updatedAt) {
        this.status = status;
        this.resolutionNotes = resolutionNotes;
        this.acknowledgedAt = acknowledgedAt;
        this.updatedAt = updatedAt;
    }
}
