package com.apsentinel.detection.model;

import java.util.UUID;

public record Vendor(
        UUID id,
        UUID tenantId,
        String name,
        String externalId
) {
}
