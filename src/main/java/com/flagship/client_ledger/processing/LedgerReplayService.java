package com.flagship.client_ledger.processing;

import com.flagship.client_ledger.ledger.Account;
import com.flagship.client_ledger.ledger.Ledger;
import com.flagship.client_ledger.ledger.TransactionHistory;
import com.flagship.client_ledger.ledger.TransactionRecord;
import com.flagship.client_ledger.observability.LedgerMetrics;
import com.flagship.client_ledger.observability.ReplayContext;
import com.flagship.client_ledger.processing.exception.TransactionProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Replays a sequence of transaction records into a fresh ledger.
 *
 * Each call to {@link #process} owns its own ledger and history, so independent
 * runs never share state. Records are applied strictly in source order.
 *
 * The first fatal error (malformed record, missing amount, unknown type) stops
 * the run and is rethrown; records before it have already been applied.
 */
@Service
@Slf4j
public class LedgerReplayService {

    private final TransactionProcessor processor;
    private final LedgerMetrics metrics;
    private final boolean sortedOutput;

    public LedgerReplayService(TransactionProcessor processor,
                               LedgerMetrics metrics,
                               @Value("${ledger.output.sorted:false}") boolean sortedOutput) {
        this.processor = processor;
        this.metrics = metrics;
        this.sortedOutput = sortedOutput;
    }

    public ReplayResult process(Iterable<TransactionRecord> source) {
        return process(source.iterator(), null);
    }

    /**
     * Folds the processor over every record of the source.
     *
     * @param source lazy record source; read errors it throws propagate unchanged
     * @param sourceName name of the input, for log context (may be null)
     * @return the final ledger with a summary of applied and rejected records
     * @throws TransactionProcessingException on the first fatal error
     */
    public ReplayResult process(Iterator<TransactionRecord> source, String sourceName) {
        String replayId = ReplayContext.start(sourceName);
        long startNanos = System.nanoTime();
        Ledger ledger = new Ledger();
        TransactionHistory history = new TransactionHistory();
        ReplaySummary summary = new ReplaySummary();

        try {
            log.info("Starting replay {} of {}", replayId, sourceName != null ? sourceName : "records");

            while (source.hasNext()) {
                summary.count(processor.apply(ledger, history, source.next()));
            }

            log.info("Finished replay {}: {} records applied, {} rejected, {} accounts",
                    replayId, summary.getAppliedCount(), summary.getRejectedCount(), ledger.size());
            return new ReplayResult(replayId, ledger, summary);

        } catch (TransactionProcessingException e) {
            metrics.recordReplayFailed(e.getErrorCode().name());
            log.error("Replay {} aborted after {} records: {} ({})",
                    replayId, summary.getRecordCount(), e.getMessage(), e.getErrorCode());
            throw e;
        } finally {
            metrics.recordReplayDuration(Duration.ofNanos(System.nanoTime() - startNanos));
            ReplayContext.clear();
        }
    }

    /**
     * Final per-client state for output.
     * Map order by default; ascending client id when {@code ledger.output.sorted} is set.
     */
    public Stream<AccountSnapshot> snapshot(Ledger ledger) {
        Stream<Account> accounts = ledger.accounts().stream();
        if (sortedOutput) {
            accounts = accounts.sorted(Comparator.comparingInt(Account::getClientId));
        }
        return accounts.map(AccountSnapshot::of);
    }
}
