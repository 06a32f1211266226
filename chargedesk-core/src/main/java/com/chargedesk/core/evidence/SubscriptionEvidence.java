package com.chargedesk.core.evidence;

import java.time.Instant;

public record SubscriptionEvidence(
        String subscriptionId,
        Instant subscriptionStart,
        String billingCycle,
        Instant cancellationDateClaimed,
        Instant cancellationDateActual,
        Instant lastBillingDate,
        String tosAgreement,
        String cancellationPolicy) implements CasePayload {
}
