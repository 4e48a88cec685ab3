package com.apsentinel.detection.repository;

import com.apsentinel.detection.entity.VendorBaselineEntity;
import com.apsentinel.detection.model.VendorBaseline;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLVendorBaselineRepository implements VendorBaselineRepository {

    private final JpaVendorBaselineRepository jpaVendorBaselineRepository;

    public PostgreSQLVendorBaselineRepository(JpaVendorBaselineRepository jpaVendorBaselineRepository) {
        this.jpaVendorBaselineRepository = jpaVendorBaselineRepository;
    }

    @Override
    public Optional<VendorBaseline> findByVendorIdAndWindow(UUID vendorId, LocalDate windowStart, LocalDate windowEnd) {
        return jpaVendorBaselineRepository.findByVendorIdAndWindowStartAndWindowEnd(vendorId, windowStart, windowEnd)
                .map(this::toModel);
    }

    @Override
    public VendorBaseline save(VendorBaseline baseline) {
        VendorBaselineEntity entity = jpaVendorBaselineRepository.findById(baseline.id())
                .map(existing -> {
                    existing.updateStatistics(
                            baseline.sampleCount(),
                            baseline.meanAmount(),
                            baseline.stdDevAmount(),
                            baseline.minAmount(),
                            baseline.maxAmount()
                    );
                    return existing;
                })
                .orElseGet(() -> toEntity(baseline));
        return toModel(jpaVendorBaselineRepository.save(entity));
    }

    private VendorBaseline toModel(VendorBaselineEntity entity) {
        return new VendorBaseline(
                entity.getId(),
                entity.getVendorId(),
                entity.getWindowStart(),
                entity.getWindowEnd(),
                entity.getPaymentCount(),
                entity.getAvgAmount(),
                entity.getStdAmount(),
                entity.getMinAmount(),
                entity.getMaxAmount(),
                entity.getCreatedAt()
        );
    }

    private VendorBaselineEntity toEntity(VendorBaseline model) {
        return new VendorBaselineEntity(
                model.id(),
                model.vendorId(),
                model.windowStart(),
                model.windowEnd(),
                model.sampleCount(),
                model.meanAmount(),
                model.stdDevAmount(),
                model.minAmount(),
                model.maxAmount(),
                model.createdAt()
        );
    }
}
