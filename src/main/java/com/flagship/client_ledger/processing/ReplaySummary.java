package com.flagship.client_ledger.processing;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts of what happened during one replay run.
 */
@Getter
@ToString
public class ReplaySummary {

    private long appliedCount;
    private final Map<RejectionReason, Long> rejectedCounts = new EnumMap<>(RejectionReason.class);

    void count(RecordOutcome outcome) {
        if (outcome.isApplied()) {
            appliedCount++;
        } else {
            rejectedCounts.merge(outcome.getRejectionReason(), 1L, Long::sum);
        }
    }

    public long getRejectedCount() {
        return rejectedCounts.values().stream().mapToLong(Long::longValue).sum();
    }

    public long getRejectedCount(RejectionReason reason) {
        return rejectedCounts.getOrDefault(reason, 0L);
    }

    public long getRecordCount() {
        return appliedCount + getRejectedCount();
    }

    public Map<RejectionReason, Long> getRejectedCounts() {
        return Collections.unmodifiableMap(rejectedCounts);
    }
}
