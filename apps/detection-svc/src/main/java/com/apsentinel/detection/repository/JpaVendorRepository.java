package com.apsentinel.detection.repository;

import com.apsentinel.detection.entity.VendorEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaVendorRepository extends JpaRepository<VendorEntity, UUID> {

    List<VendorEntity> findByTenantIdOrderByNameAsc(UUID tenantId);
}
