package com.apsentinel.detection.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Rolling amount statistics for one vendor over {@code [windowStart, windowEnd]}.
 * At most one row exists per (vendor, windowStart, windowEnd).
 */
public record VendorBaseline(
        UUID id,
        UUID vendorId,
        LocalDate windowStart,
        LocalDate windowEnd,
        int sampleCount,
        double meanAmount,
        double stdDevAmount,
        BigDecimal minAmount,
        BigDecimal maxAmount,
        Instant createdAt
) {
    public VendorBaseline withStatistics(int sampleCount, double meanAmount, double stdDevAmount,
                                         BigDecimal minAmount, BigDecimal maxAmount) {
        return new VendorBaseline(
                id,
                vendorId,
                windowStart,
                windowEnd,
                sampleCount,
                meanAmount,
                stdDevAmount,
                minAmount,
                maxAmount,
                createdAt
        );
    }

    public boolean hasSpread() {
        return Double.isFinite(stdDevAmount) && stdDevAmount > 0;
    }
}
