package com.chargedesk.core.evidence;

/** Filer's dispute record before this case. */
public record PriorDisputeHistory(
        int totalDisputes,
        Integer similarDisputes,
        String disputePattern,
        String customerStanding,
        String previousCase) implements CasePayload {

    public static PriorDisputeHistory firstDispute(String customerStanding) {
        return new PriorDisputeHistory(0, 0, null, customerStanding, null);
    }
}
