package com.apsentinel.detection.engine;

import com.apsentinel.detection.config.ApSentinelProperties;
import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.model.AnomalyKind;
import com.apsentinel.detection.model.AnomalyMetadata;
import com.apsentinel.detection.model.Bill;
import com.apsentinel.detection.model.Severity;
import com.apsentinel.detection.model.VendorBaseline;
import com.apsentinel.detection.repository.BillRepository;
import java.util.Locale;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Detects price creep: a bill whose amount is strictly above
 * {@code mean + alertSigmaThreshold * stddev} of its vendor's baseline.
 *
 * <p>Confidence grows with the z-score as {@code min(0.99, 0.5 + z / 10)}. Vendors without
 * spread in their baseline are never flagged.
 */
@Component
@Order(2)
public class PriceOutlierDetector implements AnomalyDetector {

    static final double HIGH_SEVERITY_Z = 3.0d;
    static final double MAX_CONFIDENCE = 0.99d;

    private final BillRepository billRepository;
    private final AnomalyRecorder recorder;
    private final ApSentinelProperties properties;

    public PriceOutlierDetector(BillRepository billRepository, AnomalyRecorder recorder, ApSentinelProperties properties) {
        this.billRepository = billRepository;
        this.recorder = recorder;
        this.properties = properties;
    }

    @Override
    public AnomalyKind kind() {
        return AnomalyKind.PRICE_CREEP;
    }

    @Override
    public int detect(DetectionContext context) {
        double sigma = properties.detection().alertSigmaThreshold();
        int created = 0;
        for (VendorBaseline baseline : context.baselines()) {
            if (!baseline.hasSpread()) {
                continue;
            }
            double threshold = baseline.meanAmount() + sigma * baseline.stdDevAmount();
            for (Bill bill : billRepository.findByVendorId(baseline.vendorId())) {
                if (bill.totalAmount().doubleValue() <= threshold) {
                    continue;
                }
                if (recorder.record(toAnomaly(context, bill, baseline, sigma))) {
                    created++;
                }
            }
        }
        return created;
    }

    private Anomaly toAnomaly(DetectionContext context, Bill bill, VendorBaseline baseline, double sigma) {
        double amount = bill.totalAmount().doubleValue();
        double z = zScore(amount, baseline);
        boolean shouldAlert = bill.totalAmount().compareTo(properties.detection().alertMinAmount()) >= 0 || z >= sigma;
        return Anomaly.open(
                context.tenantId(),
                bill.id(),
                z >= HIGH_SEVERITY_Z ? Severity.HIGH : Severity.MEDIUM,
                bill.totalAmount(),
                confidenceFor(z),
                String.format(Locale.ROOT, "Amount %.2f is %.1fσ above vendor baseline (%.2f)",
                        amount, z, baseline.meanAmount()),
                new AnomalyMetadata.PriceCreep(z, baseline.meanAmount(), baseline.stdDevAmount()),
                shouldAlert,
                context.startedAt()
        );
    }

    static double zScore(double amount, VendorBaseline baseline) {
        return (amount - baseline.meanAmount()) / baseline.stdDevAmount();
    }

    static double confidenceFor(double z) {
        return Math.min(MAX_CONFIDENCE, 0.5d + z / 10d);
    }
}
