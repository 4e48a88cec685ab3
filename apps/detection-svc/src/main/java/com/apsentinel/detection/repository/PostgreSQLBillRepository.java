package com.apsentinel.detection.repository;

import com.apsentinel.detection.entity.BillEntity;
import com.apsentinel.detection.entity.VendorEntity;
import com.apsentinel.detection.model.Bill;
import com.apsentinel.detection.model.Vendor;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLBillRepository implements BillRepository {

    private final JpaBillRepository jpaBillRepository;
    private final JpaVendorRepository jpaVendorRepository;

    public PostgreSQLBillRepository(JpaBillRepository jpaBillRepository, JpaVendorRepository jpaVendorRepository) {
        this.jpaBillRepository = jpaBillRepository;
        this.jpaVendorRepository = jpaVendorRepository;
    }

    @Override
    public List<Vendor> findVendorsByTenantId(UUID tenantId) {
        return jpaVendorRepository.findByTenantIdOrderByNameAsc(tenantId).stream()
                .map(this::toModel)
                .toList();
    }

    @Override
    public List<Bill> findByTenantId(UUID tenantId) {
        return toModels(jpaBillRepository.findByTenantIdOrdered(tenantId));
    }

    @Override
    public List<Bill> findByVendorId(UUID vendorId) {
        return toModels(jpaBillRepository.findByVendorIdOrdered(vendorId));
    }

    @Override
    public List<Bill> findByVendorIdAndDateRange(UUID vendorId, LocalDate fromInclusive, LocalDate toInclusive) {
        return toModels(jpaBillRepository.findByVendorIdAndRange(vendorId, fromInclusive, toInclusive));
    }

    private List<Bill> toModels(List<BillEntity> entities) {
        if (entities.isEmpty()) {
            return List.of();
        }
        return entities.stream().map(this::toModel).toList();
    }

    private Bill toModel(BillEntity entity) {
        return new Bill(
                entity.getId(),
                entity.getTenantId(),
                entity.getVendorId(),
                entity.getExternalId(),
                entity.getBillNumber(),
                entity.getTotalAmount(),
                entity.getTxnDate(),
                entity.isHasLineItems()
        );
    }

    private Vendor toModel(VendorEntity entity) {
        return new Vendor(entity.getId(), entity.getTenantId(), entity.getName(), entity.getExternalId());
    }
}
