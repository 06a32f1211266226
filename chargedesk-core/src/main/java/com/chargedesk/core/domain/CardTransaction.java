package com.chargedesk.core.domain;

import com.chargedesk.core.evidence.VelocitySnapshot;
import com.chargedesk.core.evidence.VelocitySnapshotConverter;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Card payment between one customer and one merchant, with the gateway
 * verification results and the risk assessment taken at authorization time.
 *
 * The only state change after insertion is {@code completed -> disputed}.
 */
@Entity
@Table(name = "transactions", indexes = {
    @Index(name = "idx_transactions_customer", columnList = "customer_id"),
    @Index(name = "idx_transactions_merchant", columnList = "merchant_id"),
    @Index(name = "idx_transactions_date", columnList = "transaction_date"),
    @Index(name = "idx_transactions_risk_level", columnList = "risk_level"),
    @Index(name = "idx_transactions_status", columnList = "status")
})
public class CardTransaction extends AssignedIdEntity {

    private static final Pattern CARD_SUFFIX = Pattern.compile("\\d{4}");
    private static final BigDecimal MAX_FRAUD_SCORE = BigDecimal.valueOf(100);

    @Id
    @Column(name = "transaction_id", length = 50, nullable = false, updatable = false)
    private String transactionId;

    @NotNull
    @Column(name = "customer_id", length = 50, nullable = false, updatable = false)
    private String customerId;

    @NotNull
    @Column(name = "merchant_id", length = 50, nullable = false, updatable = false)
    private String merchantId;

    @NotNull
    @Positive
    @Column(nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal amount;

    @NotNull
    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Column(name = "payment_method", length = 50, updatable = false)
    private String paymentMethod;

    @Column(name = "card_last_4", length = 4, updatable = false)
    private String cardLast4;

    @NotNull
    @Column(name = "transaction_date", nullable = false, updatable = false)
    private Instant transactionDate;

    @NotNull
    @Convert(converter = StatusConverter.class)
    @Column(nullable = false, length = 20)
    private Status status;

    @Column(name = "avs_check", length = 10, updatable = false)
    private String avsCheck;

    @Column(name = "cvv_check", length = 10, updatable = false)
    private String cvvCheck;

    @Column(name = "three_ds_used", nullable = false, updatable = false)
    private boolean threeDsUsed;

    @Column(name = "auth_code", length = 20, updatable = false)
    private String authCode;

    @Column(name = "ip_address", length = 45, updatable = false)
    private String ipAddress;

    @Column(name = "device_fingerprint", updatable = false)
    private String deviceFingerprint;

    @Column(name = "fraud_score", precision = 5, scale = 2, updatable = false)
    private BigDecimal fraudScore;

    @Convert(converter = RiskLevelConverter.class)
    @Column(name = "risk_level", length = 20, updatable = false)
    private RiskLevel riskLevel;

    @Column(name = "velocity_flag", nullable = false, updatable = false)
    private boolean velocityFlag;

    @Convert(converter = VelocitySnapshotConverter.class)
    @Column(name = "velocity_data", updatable = false)
    private VelocitySnapshot velocityData;

    @Column(name = "risk_assessed_at", updatable = false)
    private Instant riskAssessedAt;

    public enum Status implements CodedEnum {
        COMPLETED("completed"),
        DISPUTED("disputed");

        private final String code;

        Status(String code) { this.code = code; }

        @Override
        public String code() { return code; }
    }

    public enum RiskLevel implements CodedEnum {
        LOW("low"),
        MEDIUM("medium"),
        HIGH("high"),
        CRITICAL("critical");

        private final String code;

        RiskLevel(String code) { this.code = code; }

        @Override
        public String code() { return code; }
    }

    @Converter
    public static class StatusConverter extends CodedEnumConverter<Status> {
        public StatusConverter() { super(Status.class); }
    }

    @Converter
    public static class RiskLevelConverter extends CodedEnumConverter<RiskLevel> {
        public RiskLevelConverter() { super(RiskLevel.class); }
    }

    protected CardTransaction() {}

    private CardTransaction(Builder builder) {
        this.transactionId = builder.transactionId;
        this.customerId = builder.customerId;
        this.merchantId = builder.merchantId;
        this.amount = builder.amount;
        this.currency = builder.currency;
        this.paymentMethod = builder.paymentMethod;
        this.cardLast4 = builder.cardLast4;
        this.transactionDate = builder.transactionDate;
        this.status = Status.COMPLETED;
        this.avsCheck = builder.avsCheck;
        this.cvvCheck = builder.cvvCheck;
        this.threeDsUsed = builder.threeDsUsed;
        this.authCode = builder.authCode;
        this.ipAddress = builder.ipAddress;
        this.deviceFingerprint = builder.deviceFingerprint;
        this.fraudScore = builder.fraudScore;
        this.riskLevel = builder.riskLevel;
        this.velocityFlag = builder.velocityFlag;
        this.velocityData = builder.velocityData;
        this.riskAssessedAt = builder.riskAssessedAt;
    }

    public static Builder builder(String transactionId, String customerId, String merchantId) {
        return new Builder(transactionId, customerId, merchantId);
    }

    /**
     * Records that a chargeback has been filed against this transaction.
     *
     * @throws IllegalStateException if the transaction is already disputed
     */
    public void markDisputed() {
        if (status == Status.DISPUTED) {
            throw new IllegalStateException("Transaction " + transactionId + " is already disputed");
        }
        this.status = Status.DISPUTED;
    }

    public boolean isDisputed() {
        return status == Status.DISPUTED;
    }

    @Override
    public String getId() { return transactionId; }

    public String getTransactionId() { return transactionId; }
    public String getCustomerId() { return customerId; }
    public String getMerchantId() { return merchantId; }
    public BigDecimal getAmount() { return amount; }
    public String getCurrency() { return currency; }
    public String getPaymentMethod() { return paymentMethod; }
    public String getCardLast4() { return cardLast4; }
    public Instant getTransactionDate() { return transactionDate; }
    public Status getStatus() { return status; }
    public String getAvsCheck() { return avsCheck; }
    public String getCvvCheck() { return cvvCheck; }
    public boolean isThreeDsUsed() { return threeDsUsed; }
    public String getAuthCode() { return authCode; }
    public String getIpAddress() { return ipAddress; }
    public String getDeviceFingerprint() { return deviceFingerprint; }
    public BigDecimal getFraudScore() { return fraudScore; }
    public RiskLevel getRiskLevel() { return riskLevel; }
    public boolean isVelocityFlag() { return velocityFlag; }
    public VelocitySnapshot getVelocityData() { return velocityData; }
    public Instant getRiskAssessedAt() { return riskAssessedAt; }

    public static class Builder {
        private final String transactionId;
        private final String customerId;
        private final String merchantId;
        private BigDecimal amount;
        private String currency = "USD";
        private String paymentMethod;
        private String cardLast4;
        private Instant transactionDate;
        private String avsCheck;
        private String cvvCheck;
        private boolean threeDsUsed;
        private String authCode;
        private String ipAddress;
        private String deviceFingerprint;
        private BigDecimal fraudScore;
        private RiskLevel riskLevel;
        private boolean velocityFlag;
        private VelocitySnapshot velocityData;
        private Instant riskAssessedAt;

        private Builder(String transactionId, String customerId, String merchantId) {
            this.transactionId = transactionId;
            this.customerId = customerId;
            this.merchantId = merchantId;
        }

        public Builder amount(BigDecimal amount) { this.amount = amount; return this; }
        public Builder currency(String currency) { this.currency = currency; return this; }
        public Builder paymentMethod(String paymentMethod) { this.paymentMethod = paymentMethod; return this; }
        public Builder cardLast4(String cardLast4) { this.cardLast4 = cardLast4; return this; }
        public Builder transactionDate(Instant transactionDate) { this.transactionDate = transactionDate; return this; }
        public Builder avsCheck(String avsCheck) { this.avsCheck = avsCheck; return this; }
        public Builder cvvCheck(String cvvCheck) { this.cvvCheck = cvvCheck; return this; }
        public Builder threeDsUsed(boolean threeDsUsed) { this.threeDsUsed = threeDsUsed; return this; }
        public Builder authCode(String authCode) { this.authCode = authCode; return this; }
        public Builder ipAddress(String ipAddress) { this.ipAddress = ipAddress; return this; }
        public Builder deviceFingerprint(String deviceFingerprint) { this.deviceFingerprint = deviceFingerprint; return this; }
        public Builder fraudScore(BigDecimal fraudScore) { this.fraudScore = fraudScore; return this; }
        public Builder riskLevel(RiskLevel riskLevel) { this.riskLevel = riskLevel; return this; }
        public Builder velocityFlag(boolean velocityFlag) { this.velocityFlag = velocityFlag; return this; }
        public Builder velocityData(VelocitySnapshot velocityData) { this.velocityData = velocityData; return this; }
        public Builder riskAssessedAt(Instant riskAssessedAt) { this.riskAssessedAt = riskAssessedAt; return this; }

        public CardTransaction build() {
            if (transactionId == null || transactionId.isBlank()) {
                throw new IllegalArgumentException("Transaction ID is required");
            }
            if (customerId == null || customerId.isBlank() || merchantId == null || merchantId.isBlank()) {
                throw new IllegalArgumentException("Transaction " + transactionId + " requires a customer and a merchant");
            }
            if (amount == null || amount.signum() <= 0) {
                throw new IllegalArgumentException("Transaction amount must be positive, was " + amount);
            }
            if (currency == null || currency.length() != 3) {
                throw new IllegalArgumentException("Currency must be a three-letter ISO code, was " + currency);
            }
            currency = currency.toUpperCase(Locale.ROOT);
            if (cardLast4 != null && !CARD_SUFFIX.matcher(cardLast4).matches()) {
                throw new IllegalArgumentException("Card suffix must be four digits, was " + cardLast4);
            }
            if (fraudScore != null && (fraudScore.signum() < 0 || fraudScore.compareTo(MAX_FRAUD_SCORE) > 0)) {
                throw new IllegalArgumentException("Fraud score must be between 0 and 100, was " + fraudScore);
            }
            if (transactionDate == null) {
                throw new IllegalArgumentException("Transaction date is required");
            }
            return new CardTransaction(this);
        }
    }
}
