package com.chargedesk.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Dispute case filed against exactly one transaction.
 *
 * Lifecycle: {@code open -> under_review -> {won, lost}}, with {@code open -> {won, lost}}
 * allowed for cases resolved without a review. {@code outcome} and {@code closedAt} are
 * assigned together on entry into a terminal status and never change afterwards.
 */
@Entity
@Table(name = "chargebacks", indexes = {
    @Index(name = "idx_chargebacks_transaction", columnList = "transaction_id"),
    @Index(name = "idx_chargebacks_status", columnList = "status"),
    @Index(name = "idx_chargebacks_opened", columnList = "opened_at"),
    @Index(name = "idx_chargebacks_outcome", columnList = "outcome"),
    @Index(name = "idx_chargebacks_category", columnList = "case_category")
})
public class Chargeback extends AssignedIdEntity {

    @Id
    @Column(name = "chargeback_id", length = 50, nullable = false, updatable = false)
    private String chargebackId;

    @NotNull
    @Column(name = "transaction_id", length = 50, nullable = false, unique = true, updatable = false)
    private String transactionId;

    @NotNull
    @Column(name = "dispute_date", nullable = false, updatable = false)
    private Instant disputeDate;

    @Column(name = "reason_code", length = 10, updatable = false)
    private String reasonCode;

    @Column(name = "dispute_type", length = 50, updatable = false)
    private String disputeType;

    @Column(name = "issuing_bank", length = 100, updatable = false)
    private String issuingBank;

    @NotNull
    @Positive
    @Column(name = "chargeback_amount", nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal chargebackAmount;

    @Column(name = "analyst_id", length = 50)
    private String analystId;

    @NotNull
    @Convert(converter = StatusConverter.class)
    @Column(nullable = false, length = 20)
    private Status status;

    @NotNull
    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Convert(converter = OutcomeConverter.class)
    @Column(length = 20)
    private Outcome outcome;

    @Convert(converter = CaseCategoryConverter.class)
    @Column(name = "case_category", length = 30, updatable = false)
    private CaseCategory caseCategory;

    @Column(name = "retrieval_request_date", updatable = false)
    private Instant retrievalRequestDate;

    @Column(name = "response_deadline", updatable = false)
    private Instant responseDeadline;

    @Column
    private String notes;

    public enum Status implements CodedEnum {
        OPEN("open"),
        UNDER_REVIEW("under_review"),
        WON("won"),
        LOST("lost");

        private final String code;

        Status(String code) { this.code = code; }

        @Override
        public String code() { return code; }

        public boolean isTerminal() {
            return this == WON || this == LOST;
        }
    }

    /**
     * Resolution of a closed case. {@code WON} reverses the dispute in the merchant's
     * favour; {@code LOST} leaves the disputed amount with the filer.
     */
    public enum Outcome implements CodedEnum {
        WON("won"),
        LOST("lost");

        private final String code;

        Outcome(String code) { this.code = code; }

        @Override
        public String code() { return code; }

        public Status toStatus() {
            return this == WON ? Status.WON : Status.LOST;
        }
    }

    public enum CaseCategory implements CodedEnum {
        TRUE_FRAUD("true_fraud"),
        FRIENDLY_FRAUD("friendly_fraud"),
        MERCHANT_ERROR("merchant_error"),
        NOT_GUILTY("not_guilty");

        private final String code;

        CaseCategory(String code) { this.code = code; }

        @Override
        public String code() { return code; }
    }

    @Converter
    public static class StatusConverter extends CodedEnumConverter<Status> {
        public StatusConverter() { super(Status.class); }
    }

    @Converter
    public static class OutcomeConverter extends CodedEnumConverter<Outcome> {
        public OutcomeConverter() { super(Outcome.class); }
    }

    @Converter
    public static class CaseCategoryConverter extends CodedEnumConverter<CaseCategory> {
        public CaseCategoryConverter() { super(CaseCategory.class); }
    }

    protected Chargeback() {}

    public static Builder open(String chargebackId, String transactionId) {
        return new Builder(chargebackId, transactionId);
    }

    public void startReview() {
        if (status != Status.OPEN) {
            throw new IllegalCaseTransitionException(chargebackId, status, Status.UNDER_REVIEW);
        }
        this.status = Status.UNDER_REVIEW;
    }

    /**
     * Moves the case into the terminal status matching {@code outcome}.
     *
     * @throws IllegalCaseTransitionException if the case is already closed
     * @throws IllegalArgumentException if {@code closedAt} precedes {@code openedAt}
     */
    public void close(Outcome outcome, Instant closedAt) {
        if (outcome == null || closedAt == null) {
            throw new IllegalArgumentException("Outcome and closing time are both required");
        }
        if (status.isTerminal()) {
            throw new IllegalCaseTransitionException(chargebackId, status, outcome.toStatus());
        }
        if (closedAt.isBefore(openedAt)) {
            throw new IllegalArgumentException(
                    "Chargeback " + chargebackId + " cannot close at " + closedAt + " before it opened at " + openedAt);
        }
        this.status = outcome.toStatus();
        this.outcome = outcome;
        this.closedAt = closedAt;
    }

    public boolean isClosed() {
        return status.isTerminal();
    }

    @Override
    public String getId() { return chargebackId; }

    public String getChargebackId() { return chargebackId; }
    public String getTransactionId() { return transactionId; }
    public Instant getDisputeDate() { return disputeDate; }
    public String getReasonCode() { return reasonCode; }
    public String getDisputeType() { return disputeType; }
    public String getIssuingBank() { return issuingBank; }
    public BigDecimal getChargebackAmount() { return chargebackAmount; }
    public String getAnalystId() { return analystId; }
    public Status getStatus() { return status; }
    public Instant getOpenedAt() { return openedAt; }
    public Instant getClosedAt() { return closedAt; }
    public Outcome getOutcome() { return outcome; }
    public CaseCategory getCaseCategory() { return caseCategory; }
    public Instant getRetrievalRequestDate() { return retrievalRequestDate; }
    public Instant getResponseDeadline() { return responseDeadline; }
    public String getNotes() { return notes; }

    public static class Builder {
        private final String chargebackId;
        private final String transactionId;
        private Instant disputeDate;
        private String reasonCode;
        private String disputeType;
        private String issuingBank;
        private BigDecimal chargebackAmount;
        private String analystId;
        private Instant openedAt;
        private CaseCategory caseCategory;
        private Instant retrievalRequestDate;
        private Instant responseDeadline;
        private String notes;

        private Builder(String chargebackId, String transactionId) {
            this.chargebackId = chargebackId;
            this.transactionId = transactionId;
        }

        public Builder disputeDate(Instant disputeDate) { this.disputeDate = disputeDate; return this; }
        public Builder reasonCode(String reasonCode) { this.reasonCode = reasonCode; return this; }
        public Builder disputeType(String disputeType) { this.disputeType = disputeType; return this; }
        public Builder issuingBank(String issuingBank) { this.issuingBank = issuingBank; return this; }
        public Builder chargebackAmount(BigDecimal chargebackAmount) { this.chargebackAmount = chargebackAmount; return this; }
        public Builder analystId(String analystId) { this.analystId = analystId; return this; }
        public Builder openedAt(Instant openedAt) { this.openedAt = openedAt; return this; }
        public Builder caseCategory(CaseCategory caseCategory) { this.caseCategory = caseCategory; return this; }
        public Builder retrievalRequestDate(Instant retrievalRequestDate) { this.retrievalRequestDate = retrievalRequestDate; return this; }
        public Builder responseDeadline(Instant responseDeadline) { this.responseDeadline = responseDeadline; return this; }
        public Builder notes(String notes) { this.notes = notes; return this; }

        public Chargeback build() {
            if (chargebackId == null || chargebackId.isBlank()) {
                throw new IllegalArgumentException("Chargeback ID is required");
            }
            if (transactionId == null || transactionId.isBlank()) {
                throw new IllegalArgumentException("Chargeback " + chargebackId + " requires a transaction");
            }
            if (chargebackAmount == null || chargebackAmount.signum() <= 0) {
                throw new IllegalArgumentException("Chargeback amount must be positive, was " + chargebackAmount);
            }
            if (disputeDate == null) {
                throw new IllegalArgumentException("Dispute date is required");
            }
            var chargeback = new Chargeback();
            chargeback.chargebackId = chargebackId;
            chargeback.transactionId = transactionId;
            chargeback.disputeDate = disputeDate;
            chargeback.reasonCode = reasonCode;
            chargeback.disputeType = disputeType;
            chargeback.issuingBank = issuingBank;
            chargeback.chargebackAmount = chargebackAmount;
            chargeback.analystId = analystId;
            chargeback.status = Status.OPEN;
            chargeback.openedAt = openedAt != null ? openedAt : disputeDate;
            chargeback.caseCategory = caseCategory;
            chargeback.retrievalRequestDate = retrievalRequestDate;
            chargeback.responseDeadline = responseDeadline;
            chargeback.notes = notes;
            return chargeback;
        }
    }

    public static class IllegalCaseTransitionException extends RuntimeException {
        private final String chargebackId;
        private final Status from;
        private final Status to;

        public IllegalCaseTransitionException(String chargebackId, Status from, Status to) {
            super("Chargeback " + chargebackId + " cannot move from " + from.code() + " to " + to.code());
            this.chargebackId = chargebackId;
            this.from = from;
            this.to = to;
        }

        public String getChargebackId() { return chargebackId; }
        public Status getFrom() { return from; }
        public Status getTo() { return to; }
    }
}
