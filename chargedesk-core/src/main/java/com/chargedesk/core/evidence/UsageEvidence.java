package com.chargedesk.core.evidence;

import java.time.Instant;
import java.util.List;

/** Post-purchase product usage logged by the merchant. */
public record UsageEvidence(
        Boolean productActivated,
        Instant activationDate,
        String activationIp,
        Integer usageSessions,
        Instant lastUsageDate,
        Integer usageDurationHours,
        List<String> featureUsage) implements CasePayload {

    public UsageEvidence {
        featureUsage = featureUsage == null ? null : List.copyOf(featureUsage);
    }
}
