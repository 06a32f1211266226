package com.chargedesk.core.evidence;

/**
 * Structured body of a case event, selected by the event's type tag.
 *
 * @see CaseEventType
 * @see CasePayloadCodec
 */
public sealed interface CasePayload permits
        SupportContact,
        TransactionAnalysis,
        LoginActivity,
        FraudIndicators,
        VelocitySnapshot,
        DeliveryEvidence,
        RefundAction,
        SubscriptionEvidence,
        UsageEvidence,
        ProductEvidence,
        MerchantInvestigation,
        SystemFix,
        PriorDisputeHistory,
        OpaquePayload {
}
