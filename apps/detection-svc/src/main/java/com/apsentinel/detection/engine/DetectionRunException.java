package com.apsentinel.detection.engine;

import java.util.UUID;

/**
 * A detection run failed and none of its writes were committed.
 */
public class DetectionRunException extends RuntimeException {

    private final UUID tenantId;

    public DetectionRunException(UUID tenantId, Throwable cause) {
        super("Detection run failed for tenant " + tenantId, cause);
        this.tenantId = tenantId;
    }

    public UUID getTenantId() {
        return tenantId;
    }
}
