package com.apsentinel.detection.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "vendors")
public class VendorEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "external_id", nullable = false, length = 100)
    private String externalId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected VendorEntity() {}

    public VendorEntity(UUID id, UUID tenantId, String externalId, String name, Instant createdAt) {
        this.id = id;
        this.tenantId = tenantId;
        this.externalId = externalId;
        this.name = name;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public UUID getTenantId() { return tenantId; }
    public String getExternalId() { return externalId; }
    public String getName() { return name; }
    public Instant getCreatedAt() { return createdAt; }
}
