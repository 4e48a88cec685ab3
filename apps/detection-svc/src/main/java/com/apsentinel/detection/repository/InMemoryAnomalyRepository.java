package com.apsentinel.detection.repository;

import com.apsentinel.detection.model.Anomaly;
import com.apsentinel.detection.model.AnomalyKind;
import com.apsentinel.detection.model.AnomalyStatus;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryAnomalyRepository implements AnomalyRepository {

    private static final Comparator<Anomaly> NEWEST_FIRST = Comparator.comparing(Anomaly::createdAt).reversed()
            .thenComparing(Anomaly::id);

    private record FindingKey(UUID tenantId, UUID billId, AnomalyKind kind) {}

    private final Map<FindingKey, Anomaly> byFinding = new ConcurrentHashMap<>();
    private final Map<UUID, Anomaly> byId = new ConcurrentHashMap<>();

    @Override
    public boolean existsByTenantIdAndBillIdAndKind(UUID tenantId, UUID billId, AnomalyKind kind) {
        return byFinding.containsKey(new FindingKey(tenantId, billId, kind));
    }

    @Override
    public boolean insertIfAbsent(Anomaly anomaly) {
        if (anomaly.billId() == null) {
            byId.put(anomaly.id(), anomaly);
            return true;
        }
        Anomaly previous = byFinding.putIfAbsent(new FindingKey(anomaly.tenantId(), anomaly.billId(), anomaly.kind()), anomaly);
        if (previous != null) {
            return false;
        }
        byId.put(anomaly.id(), anomaly);
        return true;
    }

    @Override
    public Optional<Anomaly> findByIdAndTenantId(UUID anomalyId, UUID tenantId) {
        return Optional.ofNullable(byId.get(anomalyId))
                .filter(anomaly -> anomaly.tenantId().equals(tenantId));
    }

    @Override
    public List<Anomaly> findByTenantId(UUID tenantId, Optional<AnomalyStatus> status, int offset, int limit) {
        return ofTenant(tenantId)
                .filter(anomaly -> status.map(value -> value == anomaly.status()).orElse(true))
                .sorted(NEWEST_FIRST)
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public List<Anomaly> findOpenAlerts(UUID tenantId, int limit) {
        return ofTenant(tenantId)
                .filter(anomaly -> anomaly.shouldAlert() && anomaly.status() == AnomalyStatus.OPEN)
                .sorted(NEWEST_FIRST)
                .limit(Math.max(1, limit))
                .toList();
    }

    @Override
    public long countByTenantId(UUID tenantId) {
        return ofTenant(tenantId).count();
    }

    @Override
    public long countAlertWorthyByTenantId(UUID tenantId) {
        return ofTenant(tenantId).filter(Anomaly::shouldAlert).count();
    }

    @Override
    public Anomaly updateStatus(Anomaly anomaly) {
        if (!byId.containsKey(anomaly.id())) {
            throw new IllegalStateException("Anomaly " + anomaly.id() + " no longer exists");
        }
        byId.put(anomaly.id(), anomaly);
        if (anomaly.billId() != null) {
            byFinding.put(new FindingKey(anomaly.tenantId(), anomaly.billId(), anomaly.kind()), anomaly);
        }
        return anomaly;
    }

    private Stream<Anomaly> ofTenant(UUID tenantId) {
        return byId.values().stream().filter(anomaly -> anomaly.tenantId().equals(tenantId));
    }
}
