package com.chargedesk.core.evidence;

/** Product condition and return-policy facts for quality and return disputes. */
public record ProductEvidence(
        String productSku,
        Integer returnWindowDays,
        Integer daysSincePurchase,
        Boolean returnWindowExpired,
        String productCondition,
        String returnPolicyUrl,
        Boolean policyAcknowledged) implements CasePayload {
}
