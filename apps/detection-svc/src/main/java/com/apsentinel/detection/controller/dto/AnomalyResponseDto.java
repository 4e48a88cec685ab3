package com.apsentinel.detection.controller.dto;

import com.apsentinel.detection.model.AnomalyMetadata;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnomalyResponseDto(
        String id,
        String billId,
        String vendorName,
        String billNumber,
        String type,
        String severity,
        BigDecimal amount,
        double confidenceScore,
        String description,
        AnomalyMetadata metadata,
        boolean shouldAlert,
        String status,
        String resolutionNotes,
        Instant createdAt,
        Instant acknowledgedAt
) {
}
