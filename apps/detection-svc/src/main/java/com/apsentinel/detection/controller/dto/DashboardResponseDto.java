package com.apsentinel.detection.controller.dto;

import java.math.BigDecimal;

public record DashboardResponseDto(
        long vendorCount,
        long billCount,
        long anomalyCount,
        BigDecimal totalAnomalyAmount,
        long highConfidenceCount
) {
}
