package com.apsentinel.detection.engine;

import com.apsentinel.detection.config.ApSentinelProperties;
import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.model.AnomalyKind;
import com.apsentinel.detection.model.AnomalyMetadata;
import com.apsentinel.detection.model.Bill;
import com.apsentinel.detection.model.Severity;
import com.apsentinel.detection.repository.BillRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Flags bills that share vendor and amount (to the cent) with another bill dated within
 * {@code duplicateDayWindow} days.
 *
 * <p>Pairs are examined in bill order (transaction date, then id) and the anomaly is recorded
 * against the earlier bill of each qualifying pair. A bill keeps only the first duplicate
 * anomaly it receives, so in a cluster of three or more not every member is necessarily flagged.
 */
@Component
@Order(1)
public class DuplicateDetector implements AnomalyDetector {

    static final double CONFIDENCE = 0.95d;
    static final BigDecimal HIGH_SEVERITY_AMOUNT = BigDecimal.valueOf(1000);

    private final BillRepository billRepository;
    private final AnomalyRecorder recorder;
    private final ApSentinelProperties properties;

    public DuplicateDetector(BillRepository billRepository, AnomalyRecorder recorder, ApSentinelProperties properties) {
        this.billRepository = billRepository;
        this.recorder = recorder;
        this.properties = properties;
    }

    @Override
    public AnomalyKind kind() {
        return AnomalyKind.DUPLICATE;
    }

    @Override
    public int detect(DetectionContext context) {
        int window = properties.detection().duplicateDayWindow();
        Map<GroupKey, List<Bill>> groups = new LinkedHashMap<>();
        for (Bill bill : billRepository.findByTenantId(context.tenantId())) {
            groups.computeIfAbsent(GroupKey.of(bill), key -> new ArrayList<>()).add(bill);
        }
        int created = 0;
        for (List<Bill> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            for (int i = 0; i < group.size(); i++) {
                for (int j = i + 1; j < group.size(); j++) {
                    Bill first = group.get(i);
                    Bill second = group.get(j);
                    long daysApart = Math.abs(ChronoUnit.DAYS.between(first.txnDate(), second.txnDate()));
                    if (daysApart > window) {
                        continue;
                    }
                    if (recorder.record(toAnomaly(context, first, second, window))) {
                        created++;
                    }
                }
            }
        }
        return created;
    }

    private Anomaly toAnomaly(DetectionContext context, Bill bill, Bill related, int window) {
        BigDecimal amount = bill.totalAmount();
        return Anomaly.open(
                context.tenantId(),
                bill.id(),
                severityFor(amount),
                amount,
                CONFIDENCE,
                "Possible duplicate: same vendor and amount within " + window + " days",
                new AnomalyMetadata.Duplicate(related.id(), bill.id()),
                amount.compareTo(properties.detection().alertMinAmount()) >= 0,
                context.startedAt()
        );
    }

    static Severity severityFor(BigDecimal amount) {
        return amount.compareTo(HIGH_SEVERITY_AMOUNT) >= 0 ? Severity.HIGH : Severity.MEDIUM;
    }

    private record GroupKey(UUID vendorId, BigDecimal amount) {
        static GroupKey of(Bill bill) {
            return new GroupKey(bill.vendorId(), bill.totalAmount().setScale(2, RoundingMode.HALF_UP));
        }
    }
}
