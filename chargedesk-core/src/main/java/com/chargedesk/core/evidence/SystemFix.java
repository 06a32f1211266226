package com.chargedesk.core.evidence;

import java.time.Instant;

public record SystemFix(
        boolean issueResolved,
        Instant fixDate,
        String fixDescription,
        String preventionMeasures) implements CasePayload {
}
