package com.chargedesk.api.generator;

import com.chargedesk.core.evidence.CaseEventType;
import com.chargedesk.core.evidence.CasePayload;

/**
 * One authored entry of a case trail, before it is dated and stored.
 */
public record EvidenceItem(String eventType, CasePayload payload, String description) {

    public static EvidenceItem of(CaseEventType type, CasePayload payload, String description) {
        return new EvidenceItem(type.tag(), payload, description);
    }
}
