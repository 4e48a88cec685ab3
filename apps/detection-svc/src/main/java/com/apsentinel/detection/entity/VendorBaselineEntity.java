package com.apsentinel.detection.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "vendor_baselines", uniqueConstraints = {
        @UniqueConstraint(name = "uq_baseline_vendor_window", columnNames = {"vendor_id", "window_start", "window_end"})
})
public class VendorBaselineEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "vendor_id", nullable = false)
    private UUID vendorId;

    @Column(name = "window_start", nullable = false)
    private LocalDate windowStart;

    @Column(name = "window_end", nullable = false)
    private LocalDate windowEnd;

    @Column(name = "payment_count", nullable = false)
    private int paymentCount;

    @Column(name = "avg_amount", nullable = false)
    private double avgAmount;

    @Column(name = "std_amount", nullable = false)
    private double stdAmount;

    @Column(name = "min_amount", precision = 14, scale = 2)
    private BigDecimal minAmount;

    @Column(name = "max_amount", precision = 14, scale = 2)
    private BigDecimal maxAmount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected VendorBaselineEntity() {}

    public VendorBaselineEntity(UUID id, UUID vendorId, LocalDate windowStart, LocalDate windowEnd,
                                int paymentCount, double avgAmount, double stdAmount,
                                BigDecimal minAmount, BigDecimal maxAmount, Instant createdAt) {
        this.id = id;
        this.vendorId = vendorId;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.paymentCount = paymentCount;
        this.avgAmount = avgAmount;
        this.stdAmount = stdAmount;
        this.minAmount = minAmount;
        this.maxAmount = maxAmount;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public UUID getVendorId() { return vendorId; }
    public LocalDate getWindowStart() { return windowStart; }
    public LocalDate getWindowEnd() { return windowEnd; }
    public int getPaymentCount() { return paymentCount; }
    public double getAvgAmount() { return avgAmount; }
    public double getStdAmount() { return stdAmount; }
    public BigDecimal getMinAmount() { return minAmount; }
    public BigDecimal getMaxAmount() { return maxAmount; }
    public Instant getCreatedAt() { return createdAt; }

    public void updateStatistics(int paymentCount, double avgAmount, double stdAmount,
                                 BigDecimal minAmount, BigDecimal maxAmount) {
        this.paymentCount = paymentCount;
        this.avgAmount = avgAmount;
        this.stdAmount = stdAmount;
        this.minAmount = minAmount;
        this.maxAmount = maxAmount;
    }
}
