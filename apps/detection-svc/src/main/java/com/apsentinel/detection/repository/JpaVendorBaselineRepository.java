package com.apsentinel.detection.repository;

import com.apsentinel.detection.entity.VendorBaselineEntity;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaVendorBaselineRepository extends JpaRepository<VendorBaselineEntity, UUID> {

    Optional<VendorBaselineEntity> findByVendorIdAndWindowStartAndWindowEnd(UUID vendorId, LocalDate windowStart, LocalDate windowEnd);
}
