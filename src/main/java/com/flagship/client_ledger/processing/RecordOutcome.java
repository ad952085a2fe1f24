package com.flagship.client_ledger.processing;

import lombok.Value;

/**
 * Result of applying one record: either applied, or rejected with a reason.
 */
@Value
public class RecordOutcome {

    private static final RecordOutcome APPLIED = new RecordOutcome(null, null);

    RejectionReason rejectionReason;
    String message;

    public static RecordOutcome applied() {
        return APPLIED;
    }

    public static RecordOutcome rejected(RejectionReason reason, String message) {
        return new RecordOutcome(reason, message);
    }

    public boolean isApplied() {
        return rejectionReason == null;
    }
}
