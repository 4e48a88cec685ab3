package com.apsentinel.detection.engine;

import com.apsentinel.detection.config.ApSentinelProperties;
import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.model.AnomalyKind;
import com.apsentinel.detection.model.AnomalyMetadata;
import com.apsentinel.detection.model.Bill;
import com.apsentinel.detection.model.Severity;
import com.apsentinel.detection.repository.BillRepository;
import java.math.BigDecimal;
import java.util.Locale;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Flags un-itemized bills whose total is a whole multiple of 500 and at least
 * {@code alertMinAmount}.
 */
@Component
@Order(3)
public class RoundNumberDetector implements AnomalyDetector {

    static final BigDecimal ROUND_UNIT = BigDecimal.valueOf(500);
    static final double CONFIDENCE = 0.6d;

    private final BillRepository billRepository;
    private final AnomalyRecorder recorder;
    private final ApSentinelProperties properties;

    public RoundNumberDetector(BillRepository billRepository, AnomalyRecorder recorder, ApSentinelProperties properties) {
        this.billRepository = billRepository;
        this.recorder = recorder;
        this.properties = properties;
    }

    @Override
    public AnomalyKind kind() {
        return AnomalyKind.ROUND_NUMBER;
    }

    @Override
    public int detect(DetectionContext context) {
        BigDecimal minAmount = properties.detection().alertMinAmount();
        int created = 0;
        for (Bill bill : billRepository.findByTenantId(context.tenantId())) {
            if (bill.hasLineItems()) {
                continue;
            }
            BigDecimal amount = bill.totalAmount();
            if (amount.compareTo(minAmount) < 0 || !isRound(amount)) {
                continue;
            }
            Anomaly candidate = Anomaly.open(
                    context.tenantId(),
                    bill.id(),
                    Severity.LOW,
                    amount,
                    CONFIDENCE,
                    String.format(Locale.ROOT,
                            "Round number ($%,.0f) with no line-item detail — consider verifying against source invoice", amount),
                    new AnomalyMetadata.RoundNumber(amount),
                    amount.compareTo(minAmount) >= 0,
                    context.startedAt()
            );
            if (recorder.record(candidate)) {
                created++;
            }
        }
        return created;
    }

    static boolean isRound(BigDecimal amount) {
        return amount.remainder(ROUND_UNIT).signum() == 0;
    }
}
