package com.apsentinel.detection.repository;

import com.apsentinel.detection.entity.BillEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaBillRepository extends JpaRepository<BillEntity, UUID> {

    @Query("SELECT b FROM BillEntity b WHERE b.tenantId = :tenantId ORDER BY b.txnDate ASC, b.id ASC")
    List<BillEntity> findByTenantIdOrdered(@Param("tenantId") UUID tenantId);

    @Query("SELECT b FROM BillEntity b WHERE b.vendorId = :vendorId ORDER BY b.txnDate ASC, b.id ASC")
    List<BillEntity> findByVendorIdOrdered(@Param("vendorId") UUID vendorId);

    @Query("SELECT b FROM BillEntity b WHERE b.vendorId = :vendorId AND b.txnDate >= :from AND b.txnDate <= :to ORDER BY b.txnDate ASC, b.id ASC")
    List<BillEntity> findByVendorIdAndRange(@Param("vendorId") UUID vendorId,
                                            @Param("from") LocalDate from,
                                            @Param("to") LocalDate to);
}
