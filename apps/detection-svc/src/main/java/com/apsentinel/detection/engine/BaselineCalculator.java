package com.apsentinel.detection.engine;

import com.apsentinel.detection.config.ApSentinelProperties;
import com.apsentinel.detection.model.Bill;
import com.apsentinel.detection.model.Vendor;
import com.apsentinel.detection.model.VendorBaseline;
import com.apsentinel.detection.repository.BillRepository;
import com.apsentinel.detection.repository.VendorBaselineRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes per-vendor amount statistics over the trailing {@code baselineDays} window and
 * upserts them by (vendor, windowStart, windowEnd).
 */
@Component
public class BaselineCalculator {

    private static final Logger log = LoggerFactory.getLogger(BaselineCalculator.class);

    private final BillRepository billRepository;
    private final VendorBaselineRepository baselineRepository;
    private final ApSentinelProperties properties;

    public BaselineCalculator(BillRepository billRepository,
                              VendorBaselineRepository baselineRepository,
                              ApSentinelProperties properties) {
        this.billRepository = billRepository;
        this.baselineRepository = baselineRepository;
        this.properties = properties;
    }

    public List<VendorBaseline> computeBaselines(UUID tenantId, LocalDate today, Instant now) {
        LocalDate end = today;
        LocalDate start = today.minusDays(properties.detection().baselineDays());
        List<VendorBaseline> baselines = new ArrayList<>();
        for (Vendor vendor : billRepository.findVendorsByTenantId(tenantId)) {
            List<BigDecimal> amounts = billRepository.findByVendorIdAndDateRange(vendor.id(), start, end).stream()
                    .map(Bill::totalAmount)
                    .toList();
            if (amounts.isEmpty()) {
                continue;
            }
            Statistics stats = summarize(amounts);
            VendorBaseline baseline = baselineRepository.findByVendorIdAndWindow(vendor.id(), start, end)
                    .map(existing -> existing.withStatistics(stats.count(), stats.mean(), stats.stdDev(), stats.min(), stats.max()))
                    .orElseGet(() -> new VendorBaseline(
                            UUID.randomUUID(),
                            vendor.id(),
                            start,
                            end,
                            stats.count(),
                            stats.mean(),
                            stats.stdDev(),
                            stats.min(),
                            stats.max(),
                            now
                    ));
            baselines.add(baselineRepository.save(baseline));
        }
        log.debug("Baselines for tenant {} over [{}, {}]: {} vendors", tenantId, start, end, baselines.size());
        return baselines;
    }

    /**
     * Mean and sample standard deviation (Bessel's correction, zero for a single sample).
     */
    static Statistics summarize(List<BigDecimal> amounts) {
        int n = amounts.size();
        double mean = amounts.stream().mapToDouble(BigDecimal::doubleValue).sum() / n;
        double variance = n > 1
                ? amounts.stream().mapToDouble(amount -> Math.pow(amount.doubleValue() - mean, 2)).sum() / (n - 1)
                : 0d;
        BigDecimal min = amounts.stream().min(Comparator.naturalOrder()).orElseThrow();
        BigDecimal max = amounts.stream().max(Comparator.naturalOrder()).orElseThrow();
        return new Statistics(n, mean, Math.sqrt(variance), min, max);
    }

    record Statistics(int count, double mean, double stdDev, BigDecimal min, BigDecimal max) {
    }
}
