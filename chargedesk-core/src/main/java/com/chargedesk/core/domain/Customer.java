package com.chargedesk.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Cardholder who files disputes.
 *
 * {@code totalChargebacks} and {@code totalRefunds} are a cached projection of the
 * customer's chargebacks. They are written only by the reconciliation step and are
 * never incremented by ordinary writes.
 */
@Entity
@Table(name = "customers")
public class Customer extends AssignedIdEntity {

    @Id
    @Column(name = "customer_id", length = 50, nullable = false, updatable = false)
    private String customerId;

    @NotNull
    @Column(nullable = false)
    private String name;

    @Column
    private String email;

    @Column(length = 100)
    private String region;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "total_chargebacks", nullable = false, insertable = false, updatable = false)
    private int totalChargebacks;

    @Column(name = "total_refunds", nullable = false, precision = 10, scale = 2,
            insertable = false, updatable = false)
    private BigDecimal totalRefunds = BigDecimal.ZERO;

    protected Customer() {}

    public static Customer register(String customerId, String name, String email, String region, Instant createdAt) {
        requireText(customerId, "Customer ID");
        requireText(name, "Customer name");
        if (createdAt == null) {
            throw new IllegalArgumentException("Customer creation time is required");
        }
        var customer = new Customer();
        customer.customerId = customerId;
        customer.name = name;
        customer.email = email;
        customer.region = region;
        customer.createdAt = createdAt;
        return customer;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    @Override
    public String getId() { return customerId; }

    public String getCustomerId() { return customerId; }
    public String getName() { return name; }
    public String getEmail() { return email; }
    public String getRegion() { return region; }
    public Instant getCreatedAt() { return createdAt; }
    public int getTotalChargebacks() { return totalChargebacks; }
    public BigDecimal getTotalRefunds() { return totalRefunds; }
}
