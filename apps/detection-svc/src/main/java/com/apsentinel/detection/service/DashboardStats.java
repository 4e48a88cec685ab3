package com.apsentinel.detection.service;

import java.math.BigDecimal;
import java.util.UUID;

public record DashboardStats(
        UUID tenantId,
        long vendorCount,
        long billCount,
        long anomalyCount,
        BigDecimal totalAnomalyAmount,
        long highConfidenceCount
) {
}
