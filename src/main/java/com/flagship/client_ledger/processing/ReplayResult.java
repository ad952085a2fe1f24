package com.flagship.client_ledger.processing;

import com.flagship.client_ledger.ledger.Ledger;
import lombok.Value;

/**
 * Final ledger of a completed replay, with its summary.
 */
@Value
public class ReplayResult {
    String replayId;
    Ledger ledger;
    ReplaySummary summary;
}
