package com.apsentinel.detection.engine;

import com.apsentinel.detection.model.AnomalyKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of one detection run. {@code createdByKind} preserves detector execution order.
 */
public record DetectionRunResult(
        UUID tenantId,
        int baselinesComputed,
        Map<AnomalyKind, Integer> createdByKind
) {
    public DetectionRunResult {
        createdByKind = Collections.unmodifiableMap(new LinkedHashMap<>(createdByKind));
    }

    public int totalCreated() {
        return createdByKind.values().stream().mapToInt(Integer::intValue).sum();
    }
}
