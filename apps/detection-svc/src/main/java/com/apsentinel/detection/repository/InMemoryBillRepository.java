package com.apsentinel.detection.repository;

import com.apsentinel.detection.model.Bill;
import com.apsentinel.detection.model.Vendor;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryBillRepository implements BillRepository {

    private static final Comparator<Bill> BY_DATE_THEN_ID = Comparator.comparing(Bill::txnDate)
            .thenComparing(Bill::id);

    private final Map<UUID, Vendor> vendors = new ConcurrentHashMap<>();
    private final Map<UUID, Bill> bills = new ConcurrentHashMap<>();

    public Vendor saveVendor(Vendor vendor) {
        vendors.put(vendor.id(), vendor);
        return vendor;
    }

    public Bill save(Bill bill) {
        boolean externalIdTaken = bills.values().stream()
                .anyMatch(existing -> !existing.id().equals(bill.id())
                        && existing.tenantId().equals(bill.tenantId())
                        && existing.externalId().equals(bill.externalId()));
        if (externalIdTaken) {
            throw new IllegalArgumentException("externalId " + bill.externalId() + " already used by tenant " + bill.tenantId());
        }
        bills.put(bill.id(), bill);
        return bill;
    }

    @Override
    public List<Vendor> findVendorsByTenantId(UUID tenantId) {
        return vendors.values().stream()
                .filter(vendor -> vendor.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(Vendor::name))
                .toList();
    }

    @Override
    public List<Bill> findByTenantId(UUID tenantId) {
        return select(bill -> bill.tenantId().equals(tenantId));
    }

    @Override
    public List<Bill> findByVendorId(UUID vendorId) {
        return select(bill -> bill.vendorId().equals(vendorId));
    }

    @Override
    public List<Bill> findByVendorIdAndDateRange(UUID vendorId, LocalDate fromInclusive, LocalDate toInclusive) {
        return select(bill -> bill.vendorId().equals(vendorId)
                && !bill.txnDate().isBefore(fromInclusive)
                && !bill.txnDate().isAfter(toInclusive));
    }

    private List<Bill> select(Predicate<Bill> filter) {
        return bills.values().stream()
                .filter(filter)
                .sorted(BY_DATE_THEN_ID)
                .toList();
    }
}
