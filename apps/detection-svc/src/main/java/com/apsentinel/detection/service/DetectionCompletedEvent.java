package com.apsentinel.detection.service;

import java.util.UUID;

/**
 * Published after a committed detection run that created at least one anomaly.
 */
public record DetectionCompletedEvent(UUID tenantId, int newAnomalies) {
}
