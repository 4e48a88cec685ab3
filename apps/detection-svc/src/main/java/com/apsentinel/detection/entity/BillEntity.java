package com.apsentinel.detection.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "bills", uniqueConstraints = {
        @UniqueConstraint(name = "uq_bill_tenant_external", columnNames = {"tenant_id", "external_id"})
})
public class BillEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "vendor_id", nullable = false)
    private UUID vendorId;

    @Column(name = "external_id", nullable = false, length = 100)
    private String externalId;

    @Column(name = "bill_number", length = 100)
    private String billNumber;

    @Column(name = "total_amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "txn_date", nullable = false)
    private LocalDate txnDate;

    @Column(name = "has_line_items", nullable = false)
    private boolean hasLineItems;

    @Column(name = "synced_at")
    private Instant syncedAt;

    // Default constructor for JPA
    protected BillEntity() {}

    public BillEntity(UUID id, UUID tenantId, UUID vendorId, String externalId, String billNumber,
                      BigDecimal totalAmount, LocalDate txnDate, boolean hasLineItems, Instant syncedAt) {
        this.id = id;
        this.tenantId = tenantId;
        this.vendorId = vendorId;
        this.externalId = externalId;
        this.billNumber = billNumber;
        this.totalAmount = totalAmount;
        this.txnDate = txnDate;
        this.hasLineItems = hasLineItems;
        this.syncedAt = syncedAt;
    }

    public UUID getId() { return id; }
    public UUID getTenantId() { return tenantId; }
    public UUID getVendorId() { return vendorId; }
    public String getExternalId() { return externalId; }
    public String getBillNumber() { return billNumber; }
    public BigDecimal getTotalAmount() { return totalAmount; }
    public LocalDate getTxnDate() { return txnDate; }
    public boolean isHasLineItems() { return hasLineItems; }
    public Instant getSyncedAt() { return syncedAt; }
}
