package com.chargedesk.api.generator;

import com.chargedesk.api.generator.RandomDates.DayWindow;
import com.chargedesk.core.domain.CardTransaction.RiskLevel;
import com.chargedesk.core.domain.Chargeback.CaseCategory;
import com.chargedesk.core.domain.Chargeback.Outcome;
import com.chargedesk.core.evidence.VelocitySnapshot;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Blueprint of one generated dispute case: the disputed transaction's attributes,
 * the chargeback's metadata and resolution, and the day windows its dates are drawn from.
 */
public final class CaseScenario {

    private final String chargebackId;
    private final CaseCategory category;
    private final String customerId;
    private final String merchantId;
    private final BigDecimal amount;
    private final String paymentMethod;
    private final String cardLast4;
    private final String authCode;
    private final String avsCheck;
    private final String cvvCheck;
    private final boolean threeDsUsed;
    private final String ipAddress;
    private final String deviceFingerprint;
    private final BigDecimal fraudScore;
    private final RiskLevel riskLevel;
    private final boolean velocityFlag;
    private final VelocitySnapshot velocity;
    private final DayWindow transactionWindow;
    private final String reasonCode;
    private final String disputeType;
    private final String issuingBank;
    private final String analystId;
    private final DayWindow disputeWindow;
    private final DayWindow openedWindow;
    private final Outcome outcome;
    private final DayWindow closedWindow;
    private final BigDecimal chargebackAmount;
    private final String notes;

    private CaseScenario(Builder b) {
        this.chargebackId = b.chargebackId;
        this.category = b.category;
        this.customerId = b.customerId;
        this.merchantId = b.merchantId;
        this.amount = b.amount;
        this.paymentMethod = b.paymentMethod;
        this.cardLast4 = b.cardLast4;
        this.authCode = b.authCode;
        this.avsCheck = b.avsCheck;
        this.cvvCheck = b.cvvCheck;
        this.threeDsUsed = b.threeDsUsed;
        this.ipAddress = b.ipAddress;
        this.deviceFingerprint = b.deviceFingerprint;
        this.fraudScore = b.fraudScore;
        this.riskLevel = b.riskLevel;
        this.velocityFlag = b.velocityFlag;
        this.velocity = b.velocity;
        this.transactionWindow = b.transactionWindow;
        this.reasonCode = b.reasonCode;
        this.disputeType = b.disputeType;
        this.issuingBank = b.issuingBank;
        this.analystId = b.analystId;
        this.disputeWindow = b.disputeWindow;
        this.openedWindow = b.openedWindow;
        this.outcome = b.outcome;
        this.closedWindow = b.closedWindow;
        this.chargebackAmount = b.chargebackAmount != null ? b.chargebackAmount : b.amount;
        this.notes = b.notes;
    }

    public static Builder builder(String chargebackId, CaseCategory category) {
        return new Builder(chargebackId, category);
    }

    public String chargebackId() { return chargebackId; }
    public CaseCategory category() { return category; }
    public String customerId() { return customerId; }
    public String merchantId() { return merchantId; }
    public BigDecimal amount() { return amount; }
    public String paymentMethod() { return paymentMethod; }
    public String cardLast4() { return cardLast4; }
    public String authCode() { return authCode; }
    public String avsCheck() { return avsCheck; }
    public String cvvCheck() { return cvvCheck; }
    public boolean threeDsUsed() { return threeDsUsed; }
    public String ipAddress() { return ipAddress; }
    public String deviceFingerprint() { return deviceFingerprint; }
    public BigDecimal fraudScore() { return fraudScore; }
    public RiskLevel riskLevel() { return riskLevel; }
    public boolean velocityFlag() { return velocityFlag; }
    public VelocitySnapshot velocity() { return velocity; }
    public DayWindow transactionWindow() { return transactionWindow; }
    public String reasonCode() { return reasonCode; }
    public String disputeType() { return disputeType; }
    public String issuingBank() { return issuingBank; }
    public String analystId() { return analystId; }
    public DayWindow disputeWindow() { return disputeWindow; }
    public DayWindow openedWindow() { return openedWindow; }
    public Outcome outcome() { return outcome; }
    public DayWindow closedWindow() { return closedWindow; }
    public BigDecimal chargebackAmount() { return chargebackAmount; }
    public String notes() { return notes; }

    public boolean isClosed() {
        return outcome != null;
    }

    public static final class Builder {
        private final String chargebackId;
        private final CaseCategory category;
        private String customerId;
        private String merchantId;
        private BigDecimal amount;
        private String paymentMethod;
        private String cardLast4;
        private String authCode;
        private String avsCheck;
        private String cvvCheck;
        private boolean threeDsUsed;
        private String ipAddress;
        private String deviceFingerprint;
        private BigDecimal fraudScore;
        private RiskLevel riskLevel;
        private boolean velocityFlag;
        private VelocitySnapshot velocity;
        private DayWindow transactionWindow;
        private String reasonCode;
        private String disputeType;
        private String issuingBank;
        private String analystId;
        private DayWindow disputeWindow;
        private DayWindow openedWindow;
        private Outcome outcome;
        private DayWindow closedWindow;
        private BigDecimal chargebackAmount;
        private String notes;

        private Builder(String chargebackId, CaseCategory category) {
            this.chargebackId = chargebackId;
            this.category = category;
        }

        public Builder party(String customerId, String merchantId) {
            this.customerId = customerId;
            this.merchantId = merchantId;
            return this;
        }

        public Builder payment(String amount, String paymentMethod, String cardLast4, String authCode) {
            this.amount = new BigDecimal(amount);
            this.paymentMethod = paymentMethod;
            this.cardLast4 = cardLast4;
            this.authCode = authCode;
            return this;
        }

        public Builder verification(String avsCheck, String cvvCheck, boolean threeDsUsed) {
            this.avsCheck = avsCheck;
            this.cvvCheck = cvvCheck;
            this.threeDsUsed = threeDsUsed;
            return this;
        }

        public Builder session(String ipAddress, String deviceFingerprint) {
            this.ipAddress = ipAddress;
            this.deviceFingerprint = deviceFingerprint;
            return this;
        }

        public Builder risk(String fraudScore, RiskLevel riskLevel, boolean velocityFlag, VelocitySnapshot velocity) {
            this.fraudScore = new BigDecimal(fraudScore);
            this.riskLevel = riskLevel;
            this.velocityFlag = velocityFlag;
            this.velocity = velocity;
            return this;
        }

        public Builder transactionDaysAgo(int oldest, int newest) {
            this.transactionWindow = new DayWindow(oldest, newest);
            return this;
        }

        public Builder dispute(String reasonCode, String disputeType, String issuingBank, String analystId) {
            this.reasonCode = reasonCode;
            this.disputeType = disputeType;
            this.issuingBank = issuingBank;
            this.analystId = analystId;
            return this;
        }

        public Builder disputeDaysAgo(int oldest, int newest) {
            this.disputeWindow = new DayWindow(oldest, newest);
            return this;
        }

        public Builder openedDaysAgo(int oldest, int newest) {
            this.openedWindow = new DayWindow(oldest, newest);
            return this;
        }

        public Builder closed(Outcome outcome, int oldest, int newest) {
            this.outcome = outcome;
            this.closedWindow = new DayWindow(oldest, newest);
            return this;
        }

        /** Disputed amount when it differs from the transaction amount. */
        public Builder chargebackAmount(String chargebackAmount) {
            this.chargebackAmount = new BigDecimal(chargebackAmount);
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public CaseScenario build() {
            Objects.requireNonNull(chargebackId, "chargebackId");
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(customerId, "customerId");
            Objects.requireNonNull(merchantId, "merchantId");
            Objects.requireNonNull(amount, "amount");
            Objects.requireNonNull(transactionWindow, "transactionWindow");
            Objects.requireNonNull(disputeWindow, "disputeWindow");
            Objects.requireNonNull(openedWindow, "openedWindow");
            if (disputeWindow.oldest() > transactionWindow.newest()
                    || openedWindow.oldest() > disputeWindow.newest()) {
                throw new IllegalArgumentException("Scenario " + chargebackId + " dates run backwards");
            }
            if (closedWindow != null && closedWindow.oldest() > openedWindow.newest()) {
                throw new IllegalArgumentException("Scenario " + chargebackId + " closes before it opens");
            }
            return new CaseScenario(this);
        }
    }
}
