package com.apsentinel.detection.repository;

import com.apsentinel.detection.model.VendorBaseline;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryVendorBaselineRepository implements VendorBaselineRepository {

    private record WindowKey(UUID vendorId, LocalDate windowStart, LocalDate windowEnd) {}

    private final Map<WindowKey, VendorBaseline> storage = new ConcurrentHashMap<>();

    @Override
    public Optional<VendorBaseline> findByVendorIdAndWindow(UUID vendorId, LocalDate windowStart, LocalDate windowEnd) {
        return Optional.ofNullable(storage.get(new WindowKey(vendorId, windowStart, windowEnd)));
    }

    @Override
    public VendorBaseline save(VendorBaseline baseline) {
        storage.put(new WindowKey(baseline.vendorId(), baseline.windowStart(), baseline.windowEnd()), baseline);
        return baseline;
    }

    public List<VendorBaseline> findAll() {
        return List.copyOf(storage.values());
    }
}
