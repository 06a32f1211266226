package com.chargedesk.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Merchant on the acquiring side of a dispute. Immutable once registered.
 */
@Entity
@Table(name = "merchants")
@org.hibernate.annotations.Immutable
public class Merchant extends AssignedIdEntity {

    @Id
    @Column(name = "merchant_id", length = 50, nullable = false, updatable = false)
    private String merchantId;

    @NotNull
    @Column(name = "merchant_name", nullable = false)
    private String merchantName;

    @Column(name = "acquiring_bank", length = 100)
    private String acquiringBank;

    @DecimalMin("0.00")
    @DecimalMax("100.00")
    @Column(name = "win_rate", precision = 5, scale = 2)
    private BigDecimal winRate;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected Merchant() {}

    /**
     * @param winRate historical dispute win rate as a percentage, or null when unknown
     */
    public static Merchant register(String merchantId, String merchantName, String acquiringBank,
                                    BigDecimal winRate, Instant createdAt) {
        if (merchantId == null || merchantId.isBlank()) {
            throw new IllegalArgumentException("Merchant ID is required");
        }
        if (merchantName == null || merchantName.isBlank()) {
            throw new IllegalArgumentException("Merchant name is required");
        }
        if (winRate != null && (winRate.signum() < 0 || winRate.compareTo(BigDecimal.valueOf(100)) > 0)) {
            throw new IllegalArgumentException("Win rate must be between 0 and 100, was " + winRate);
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Merchant creation time is required");
        }
        var merchant = new Merchant();
        merchant.merchantId = merchantId;
        merchant.merchantName = merchantName;
        merchant.acquiringBank = acquiringBank;
        merchant.winRate = winRate;
        merchant.createdAt = createdAt;
        return merchant;
    }

    @Override
    public String getId() { return merchantId; }

    public String getMerchantId() { return merchantId; }
    public String getMerchantName() { return merchantName; }
    public String getAcquiringBank() { return acquiringBank; }
    public BigDecimal getWinRate() { return winRate; }
    public Instant getCreatedAt() { return createdAt; }
}
