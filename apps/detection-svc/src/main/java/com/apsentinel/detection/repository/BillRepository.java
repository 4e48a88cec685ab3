package com.apsentinel.detection.repository;

import com.apsentinel.detection.model.Bill;
import com.apsentinel.detection.model.Vendor;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the ingested payables. Bills and vendors are written by the ingestion
 * pipeline only.
 */
public interface BillRepository {

    List<Vendor> findVendorsByTenantId(UUID tenantId);

    /**
     * All bills of a tenant ordered by transaction date, then id.
     */
    List<Bill> findByTenantId(UUID tenantId);

    List<Bill> findByVendorId(UUID vendorId);

    List<Bill> findByVendorIdAndDateRange(UUID vendorId, LocalDate fromInclusive, LocalDate toInclusive);
}
