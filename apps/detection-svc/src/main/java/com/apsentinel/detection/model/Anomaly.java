package com.apsentinel.detection.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record Anomaly(
        UUID id,
        UUID tenantId,
        UUID billId,
        AnomalyKind kind,
        Severity severity,
        BigDecimal amount,
        double confidenceScore,
        String description,
        AnomalyMetadata metadata,
        boolean shouldAlert,
        AnomalyStatus status,
        String resolutionNotes,
        Instant createdAt,
        Instant acknowledgedAt,
        Instant updatedAt
) {
    public Anomaly {
        if (kind == null) {
            throw new IllegalArgumentException("kind must be provided");
        }
        if (metadata != null && metadata.kind() != kind) {
            throw new IllegalArgumentException("metadata " + metadata.kind() + " does not match kind " + kind);
        }
        if (confidenceScore < 0d || confidenceScore > 1d) {
            throw new IllegalArgumentException("confidenceScore must be within [0, 1]");
        }
        if (status == null) {
            status = AnomalyStatus.OPEN;
        }
    }

    public static Anomaly open(
            UUID tenantId,
            UUID billId,
            Severity severity,
            BigDecimal amount,
            double confidenceScore,
            String description,
            AnomalyMetadata metadata,
            boolean shouldAlert,
            Instant createdAt
    ) {
        return new Anomaly(
                UUID.randomUUID(),
                tenantId,
                billId,
                metadata.kind(),
                severity,
                amount,
                confidenceScore,
                description,
                metadata,
                shouldAlert,
                AnomalyStatus.OPEN,
                null,
                createdAt,
                null,
                null
        );
    }

    public Anomaly withStatus(AnomalyStatus newStatus, String notes, Instant now) {
        Instant acknowledged = newStatus == AnomalyStatus.ACKNOWLEDGED && acknowledgedAt == null ? now : acknowledgedAt;
        return new Anomaly(
                id,
                tenantId,
                billId,
                kind,
                severity,
                amount,
                confidenceScore,
                description,
                metadata,
                shouldAlert,
                newStatus,
                notes != null ? notes : resolutionNotes,
                createdAt,
                acknowledged,
                now
        );
    }
}
