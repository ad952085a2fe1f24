package com.flagship.client_ledger.observability;

import com.flagship.client_ledger.ledger.TransactionType;
import com.flagship.client_ledger.processing.RejectionReason;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for ledger replays.
 *
 * Metrics exposed:
 * - ledger.records.applied: Counter of applied records, tagged by type
 * - ledger.records.rejected: Counter of rejected records, tagged by reason
 * - ledger.replay.failed: Counter of runs aborted by a fatal error, tagged by error code
 * - ledger.replay.duration: Timer for whole replay runs
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer replayTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.replayTimer = Timer.builder("ledger.replay.duration")
                .description("Time taken to replay a transaction source")
                .register(registry);
    }

    public void recordApplied(TransactionType type) {
        registry.counter("ledger.records.applied",
                "type", tagValue(type.name())
        ).increment();
    }

    public void recordRejected(RejectionReason reason) {
        registry.counter("ledger.records.rejected",
                "reason", tagValue(reason.name())
        ).increment();
    }

    public void recordReplayFailed(String errorCode) {
        registry.counter("ledger.replay.failed",
                "error", tagValue(errorCode)
        ).increment();
    }

    public void recordReplayDuration(Duration duration) {
        replayTimer.record(duration);
    }

    public double appliedCount(TransactionType type) {
        return registry.counter("ledger.records.applied", "type", tagValue(type.name())).count();
    }

    public double rejectedCount(RejectionReason reason) {
        return registry.counter("ledger.records.rejected", "reason", tagValue(reason.name())).count();
    }

    private String tagValue(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
