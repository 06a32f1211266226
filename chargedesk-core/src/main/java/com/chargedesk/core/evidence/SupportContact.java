package com.chargedesk.core.evidence;

import java.math.BigDecimal;
import java.time.Instant;

/** Customer's first contact about the disputed charge. */
public record SupportContact(
        String ticketId,
        Instant customerContactDate,
        String contactMethod,
        String customerStatement,
        String orderNumber,
        BigDecimal amount,
        Boolean cardCancelled,
        Boolean accountLocked) implements CasePayload {

    public static SupportContact ticket(String ticketId, Instant contactDate, String contactMethod, String statement) {
        return new SupportContact(ticketId, contactDate, contactMethod, statement, null, null, null, null);
    }

    public SupportContact withOrder(String orderNumber, BigDecimal amount) {
        return new SupportContact(ticketId, customerContactDate, contactMethod, customerStatement,
                orderNumber, amount, cardCancelled, accountLocked);
    }

    public SupportContact withCardCancelled() {
        return new SupportContact(ticketId, customerContactDate, contactMethod, customerStatement,
                orderNumber, amount, true, accountLocked);
    }

    public SupportContact withAccountLocked() {
        return new SupportContact(ticketId, customerContactDate, contactMethod, customerStatement,
                orderNumber, amount, cardCancelled, true);
    }
}
