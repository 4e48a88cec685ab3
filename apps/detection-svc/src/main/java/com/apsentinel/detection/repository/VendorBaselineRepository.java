package com.apsentinel.detection.repository;

import com.apsentinel.detection.model.VendorBaseline;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

public interface VendorBaselineRepository {

    Optional<VendorBaseline> findByVendorIdAndWindow(UUID vendorId, LocalDate windowStart, LocalDate windowEnd);

    /**
     * Inserts the baseline, or overwrites the statistics of the row with the same id.
     */
    VendorBaseline save(VendorBaseline baseline);
}
