package com.apsentinel.detection.engine;

import com.apsentinel.detection.model.VendorBaseline;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Inputs shared by every detector of one run.
 *
 * @param asOf      the run date; baseline windows end on it
 * @param startedAt timestamp stamped on every anomaly the run creates
 * @param baselines baselines recomputed at the start of this run
 */
public record DetectionContext(
        UUID tenantId,
        LocalDate asOf,
        Instant startedAt,
        List<VendorBaseline> baselines
) {
    public DetectionContext {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId must be provided");
        }
        baselines = baselines == null ? List.of() : List.copyOf(baselines);
    }
}
