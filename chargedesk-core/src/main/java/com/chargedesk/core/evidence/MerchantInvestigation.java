package com.chargedesk.core.evidence;

import java.math.BigDecimal;
import java.util.List;

/** Merchant's own finding on a dispute, usually an admitted processing fault. */
public record MerchantInvestigation(
        String orderNumber,
        boolean merchantConfirmed,
        String errorType,
        String rootCause,
        BigDecimal chargedAmount,
        BigDecimal correctAmount,
        List<String> relatedTransactionIds) implements CasePayload {

    public MerchantInvestigation {
        relatedTransactionIds = relatedTransactionIds == null ? null : List.copyOf(relatedTransactionIds);
    }
}
