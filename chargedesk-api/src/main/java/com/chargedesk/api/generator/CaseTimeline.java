package com.chargedesk.api.generator;

import java.time.Duration;
import java.time.Instant;

/**
 * Resolved dates and identifiers of one generated case, available to its evidence template.
 *
 * @param closedAt null while the case is open
 */
public record CaseTimeline(
        String transactionId,
        Instant transactionDate,
        Instant disputeDate,
        Instant openedAt,
        Instant closedAt,
        Instant now) {

    public Instant afterTransaction(int days) {
        return transactionDate.plus(Duration.ofDays(days));
    }

    public Instant beforeTransaction(int days) {
        return transactionDate.minus(Duration.ofDays(days));
    }

    public Instant afterDispute(int days) {
        return disputeDate.plus(Duration.ofDays(days));
    }

    /** End of the evidence window: the closing date, or now for an open case. */
    public Instant trailEnd() {
        return closedAt != null ? closedAt : now;
    }
}
