package com.chargedesk.core.evidence;

import java.math.BigDecimal;
import java.time.Instant;

public record RefundAction(
        Boolean refundOffered,
        Boolean refundProcessed,
        Instant refundDate,
        BigDecimal refundAmount,
        String refundStatus,
        String refundMethod,
        String refundConfirmation,
        String customerResponse,
        Boolean evidenceSubmitted) implements CasePayload {

    public static RefundAction offered(Instant date, BigDecimal amount, String status, String customerResponse) {
        return new RefundAction(true, false, date, amount, status, "original_payment", null, customerResponse, null);
    }

    public static RefundAction processed(Instant date, BigDecimal amount, String confirmation) {
        return new RefundAction(true, true, date, amount, "completed", "credit_card", confirmation, null, null);
    }

    /** Representment: the merchant answers the chargeback with evidence rather than money. */
    public static RefundAction evidenceSubmitted(Instant date) {
        return new RefundAction(false, false, date, null, "not_applicable", null, null, null, true);
    }
}
