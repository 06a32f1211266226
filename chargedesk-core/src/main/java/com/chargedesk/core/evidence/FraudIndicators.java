package com.chargedesk.core.evidence;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/**
 * Gateway verification and device signals captured at authorization.
 * {@code avsMatch} and {@code cvvMatch} carry the raw result codes ({@code Y}, {@code N}, {@code Z}).
 */
public record FraudIndicators(
        String avsMatch,
        String cvvMatch,
        @JsonProperty("3ds_used") Boolean threeDsUsed,
        String deviceFingerprint,
        Boolean deviceKnown,
        String ipReputation,
        String transactionPattern,
        BigDecimal fraudScore) implements CasePayload {

    /** True when neither the address nor the card code matched. */
    @JsonIgnore
    public boolean verificationFailed() {
        return !"Y".equals(avsMatch) && !"Y".equals(cvvMatch);
    }
}
