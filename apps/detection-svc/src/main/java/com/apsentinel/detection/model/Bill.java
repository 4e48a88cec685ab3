package com.apsentinel.detection.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Payable bill as mapped by the ingestion pipeline. Read-only for detection.
 */
public record Bill(
        UUID id,
        UUID tenantId,
        UUID vendorId,
        String externalId,
        String billNumber,
        BigDecimal totalAmount,
        LocalDate txnDate,
        boolean hasLineItems
) {
}
