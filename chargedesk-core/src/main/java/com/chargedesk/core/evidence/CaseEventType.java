package com.chargedesk.core.evidence;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event type tags with a typed payload shape. The tag vocabulary itself is open:
 * tags not listed here are stored as-is and decode to {@link OpaquePayload}.
 */
public enum CaseEventType {
    SUPPORT_TICKET("support_ticket", SupportContact.class),
    TRANSACTION_ANALYSIS("transaction_analysis", TransactionAnalysis.class),
    TRANSACTION_EVIDENCE("transaction_evidence", TransactionAnalysis.class),
    LOGIN("login", LoginActivity.class),
    LOGIN_ANALYSIS("login_analysis", LoginActivity.class),
    FRAUD_INDICATORS("fraud_indicators", FraudIndicators.class),
    VELOCITY_CHECK("velocity_check", VelocitySnapshot.class),
    SHIPPING_EVIDENCE("shipping_evidence", DeliveryEvidence.class),
    DELIVERY_EVIDENCE("delivery_evidence", DeliveryEvidence.class),
    REFUND("refund", RefundAction.class),
    SUBSCRIPTION_EVIDENCE("subscription_evidence", SubscriptionEvidence.class),
    USAGE_ANALYTICS("usage_analytics", UsageEvidence.class),
    PRODUCT_EVIDENCE("product_evidence", ProductEvidence.class),
    RETURN_POLICY_EVIDENCE("return_policy_evidence", ProductEvidence.class),
    MERCHANT_INVESTIGATION("merchant_investigation", MerchantInvestigation.class),
    SYSTEM_FIX("system_fix", SystemFix.class),
    PREVIOUS_DISPUTE("previous_dispute", PriorDisputeHistory.class);

    private final String tag;
    private final Class<? extends CasePayload> payloadType;

    CaseEventType(String tag, Class<? extends CasePayload> payloadType) {
        this.tag = tag;
        this.payloadType = payloadType;
    }

    public String tag() { return tag; }

    public Class<? extends CasePayload> payloadType() { return payloadType; }

    public static Optional<CaseEventType> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(type -> type.tag.equals(tag))
                .findFirst();
    }

    /**
     * Whether a payload may be stored under {@code tag}. Unknown tags accept only
     * {@link OpaquePayload}; known tags accept only their own record.
     */
    public static boolean accepts(String tag, CasePayload payload) {
        return fromTag(tag)
                .map(type -> type.payloadType.isInstance(payload))
                .orElse(payload instanceof OpaquePayload);
    }
}
