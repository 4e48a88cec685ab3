package com.apsentinel.detection.service;

import com.apsentinel.detection.config.ApSentinelProperties;
import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.model.AnomalyStatus;
import com.apsentinel.detection.model.Bill;
import com.apsentinel.detection.model.Vendor;
import com.apsentinel.detection.repository.AnomalyRepository;
import com.apsentinel.detection.repository.BillRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Review side of detection results: listing, status changes, export and the alert hand-off
 * query used by the notification component.
 */
@Service
public class AnomalyService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyService.class);

    public static final String STATUS_ALL = "all";
    private static final String CSV_HEADER = "Date,Vendor,Bill #,Anomaly Type,Severity,Amount,Confidence %,Description,Status";

    private final AnomalyRepository anomalyRepository;
    private final BillRepository billRepository;
    private final ApSentinelProperties properties;
    private final Clock clock;

    @Autowired
    public AnomalyService(AnomalyRepository anomalyRepository,
                          BillRepository billRepository,
                          ApSentinelProperties properties) {
        this(anomalyRepository, billRepository, properties, Clock.systemUTC());
    }

    AnomalyService(AnomalyRepository anomalyRepository,
                   BillRepository billRepository,
                   ApSentinelProperties properties,
                   Clock clock) {
        this.anomalyRepository = anomalyRepository;
        this.billRepository = billRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<AnomalyView> listAnomalies(UUID tenantId, String status, int limit, int offset) {
        Optional<AnomalyStatus> statusFilter = parseStatusFilter(status);
        if (limit < 1 || limit > 500) {
            throw new IllegalArgumentException("limit must be between 1 and 500");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return enrich(tenantId, anomalyRepository.findByTenantId(tenantId, statusFilter, offset, limit));
    }

    /**
     * Open, alert-worthy anomalies, newest first, capped at {@code apsentinel.alerts.max-batch}.
     */
    @Transactional(readOnly = true)
    public List<AnomalyView> openAlerts(UUID tenantId) {
        return enrich(tenantId, anomalyRepository.findOpenAlerts(tenantId, properties.alerts().maxBatch()));
    }

    /**
     * Acknowledge or dismiss an anomaly. Repeating the current status only updates the notes.
     */
    @Transactional
    public AnomalyView updateStatus(UUID tenantId, UUID anomalyId, String status, String resolutionNotes) {
        AnomalyStatus target = AnomalyStatus.fromCode(status);
        Anomaly anomaly = anomalyRepository.findByIdAndTenantId(anomalyId, tenantId)
                .orElseThrow(() -> new AnomalyNotFoundException(tenantId, anomalyId));
        if (anomaly.status() != target && (anomaly.status().isTerminal() || !target.isTerminal())) {
            throw new IllegalArgumentException("cannot change status from " + anomaly.status().code() + " to " + target.code());
        }
        Anomaly updated = anomalyRepository.updateStatus(anomaly.withStatus(target, resolutionNotes, clock.instant()));
        log.info("Anomaly {} of tenant {} marked {}", anomalyId, tenantId, target.code());
        return enrich(tenantId, List.of(updated)).get(0);
    }

    @Transactional(readOnly = true)
    public String exportCsv(UUID tenantId) {
        List<AnomalyView> views = enrich(tenantId,
                anomalyRepository.findByTenantId(tenantId, Optional.empty(), 0, Integer.MAX_VALUE));
        StringBuilder csv = new StringBuilder(CSV_HEADER).append('\n');
        for (AnomalyView view : views) {
            Anomaly anomaly = view.anomaly();
            csv.append(anomaly.createdAt() != null ? LocalDate.ofInstant(anomaly.createdAt(), ZoneOffset.UTC) : "").append(',')
                    .append(escape(view.vendorName())).append(',')
                    .append(escape(view.billNumber())).append(',')
                    .append(anomaly.kind().code()).append(',')
                    .append(anomaly.severity().code()).append(',')
                    .append(anomaly.amount() != null ? anomaly.amount().setScale(2, RoundingMode.HALF_UP).toPlainString() : "").append(',')
                    .append(Math.round(anomaly.confidenceScore() * 100)).append(',')
                    .append(escape(anomaly.description())).append(',')
                    .append(anomaly.status().code())
                    .append('\n');
        }
        return csv.toString();
    }

    public String exportFilename() {
        return "anomalies_" + LocalDate.now(clock) + ".csv";
    }

    @Transactional(readOnly = true)
    public DashboardStats dashboard(UUID tenantId) {
        List<Bill> bills = billRepository.findByTenantId(tenantId);
        Map<UUID, BigDecimal> amountByBill = bills.stream()
                .collect(Collectors.toMap(Bill::id, Bill::totalAmount));
        // every anomalous bill counts once, however many kinds flagged it
        BigDecimal anomalousTotal = anomalyRepository.findByTenantId(tenantId, Optional.empty(), 0, Integer.MAX_VALUE).stream()
                .map(Anomaly::billId)
                .filter(Objects::nonNull)
                .distinct()
                .map(amountByBill::get)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        return new DashboardStats(
                tenantId,
                billRepository.findVendorsByTenantId(tenantId).size(),
                bills.size(),
                anomalyRepository.countByTenantId(tenantId),
                anomalousTotal,
                anomalyRepository.countAlertWorthyByTenantId(tenantId)
        );
    }

    static Optional<AnomalyStatus> parseStatusFilter(String status) {
        if (status == null || status.isBlank() || STATUS_ALL.equalsIgnoreCase(status)) {
            return Optional.empty();
        }
        try {
            return Optional.of(AnomalyStatus.fromCode(status));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("status must be one of: open, acknowledged, dismissed, all", ex);
        }
    }

    private List<AnomalyView> enrich(UUID tenantId, List<Anomaly> anomalies) {
        if (anomalies.isEmpty()) {
            return List.of();
        }
        Map<UUID, Bill> bills = billRepository.findByTenantId(tenantId).stream()
                .collect(Collectors.toMap(Bill::id, Function.identity()));
        Map<UUID, String> vendorNames = billRepository.findVendorsByTenantId(tenantId).stream()
                .collect(Collectors.toMap(Vendor::id, Vendor::name));
        return anomalies.stream()
                .map(anomaly -> {
                    Bill bill = anomaly.billId() != null ? bills.get(anomaly.billId()) : null;
                    String vendorName = bill != null ? vendorNames.get(bill.vendorId()) : null;
                    String billNumber = bill != null ? bill.billNumber() : null;
                    return new AnomalyView(anomaly, vendorName, billNumber);
                })
                .toList();
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
