package com.apsentinel.detection.service;

import com.apsentinel.detection.engine.DetectionOrchestrator;
import com.apsentinel.detection.engine.DetectionRunException;
import com.apsentinel.detection.engine.DetectionRunResult;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

@Service
public class DetectionService {

    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    private final DetectionOrchestrator orchestrator;
    private final ApplicationEventPublisher eventPublisher;
    private final Map<UUID, TenantLock> tenantLocks = new ConcurrentHashMap<>();

    public DetectionService(DetectionOrchestrator orchestrator, ApplicationEventPublisher eventPublisher) {
        this.orchestrator = orchestrator;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Run detection for one tenant. Runs for the same tenant are serialized; the lock is held
     * until the run's transaction has committed or rolled back.
     *
     * @return number of anomalies created by this run
     */
    public int runDetection(UUID tenantId) {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId must be provided");
        }
        TenantLock tenantLock = acquire(tenantId);
        try {
            DetectionRunResult result = orchestrator.run(tenantId);
            int created = result.totalCreated();
            log.info("Detection run for tenant {}: {} anomalies found (baselines={}, byKind={})",
                    tenantId, created, result.baselinesComputed(), result.createdByKind());
            if (created > 0) {
                eventPublisher.publishEvent(new DetectionCompletedEvent(tenantId, created));
            }
            return created;
        } catch (DataAccessException | TransactionException ex) {
            log.error("Detection run failed for tenant {}", tenantId, ex);
            throw new DetectionRunException(tenantId, ex);
        } finally {
            release(tenantId, tenantLock);
        }
    }

    private TenantLock acquire(UUID tenantId) {
        TenantLock tenantLock = tenantLocks.compute(tenantId, (id, existing) -> {
            TenantLock current = existing != null ? existing : new TenantLock();
            current.holders++;
            return current;
        });
        tenantLock.lock.lock();
        return tenantLock;
    }

    private void release(UUID tenantId, TenantLock tenantLock) {
        tenantLock.lock.unlock();
        // the entry goes away once no run holds or waits for it
        tenantLocks.computeIfPresent(tenantId, (id, current) -> --current.holders == 0 ? null : current);
    }

    int trackedTenantCount() {
        return tenantLocks.size();
    }

    /**
     * Per-tenant lock plus the number of runs holding or waiting for it. {@code holders} is only
     * touched inside map compute calls for the tenant's key.
     */
    private static final class TenantLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
