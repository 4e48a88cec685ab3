package com.apsentinel.detection.service;

import java.util.UUID;

public class AnomalyNotFoundException extends RuntimeException {

    public AnomalyNotFoundException(UUID tenantId, UUID anomalyId) {
        super("Anomaly " + anomalyId + " not found for tenant " + tenantId);
    }
}
