package com.chargedesk.core.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/**
 * Recent card, IP and transaction counts for a cardholder. Stored on the transaction
 * as {@code velocity_data} and appended to a case as a {@code velocity_check} event.
 */
public record VelocitySnapshot(
        @JsonProperty("cards_last_24h") int cardsLast24h,
        int sameIpCount,
        int transactionsLastWeek,
        @JsonProperty("amount_last_24h") BigDecimal amountLast24h) implements CasePayload {

    public static VelocitySnapshot of(int cardsLast24h, int sameIpCount, int transactionsLastWeek) {
        return new VelocitySnapshot(cardsLast24h, sameIpCount, transactionsLastWeek, null);
    }

    public VelocitySnapshot withAmountLast24h(BigDecimal amount) {
        return new VelocitySnapshot(cardsLast24h, sameIpCount, transactionsLastWeek, amount);
    }
}
