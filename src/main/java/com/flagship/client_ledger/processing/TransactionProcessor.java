package com.flagship.client_ledger.processing;

import com.flagship.client_ledger.ledger.Account;
import com.flagship.client_ledger.ledger.Amounts;
import com.flagship.client_ledger.ledger.Ledger;
import com.flagship.client_ledger.ledger.TransactionHistory;
import com.flagship.client_ledger.ledger.TransactionRecord;
import com.flagship.client_ledger.ledger.TransactionType;
import com.flagship.client_ledger.observability.LedgerMetrics;
import com.flagship.client_ledger.processing.exception.ErrorCode;
import com.flagship.client_ledger.processing.exception.TransactionProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Applies transaction records to a ledger, one at a time.
 *
 * Per-type rules:
 * - DEPOSIT: available += amount, unless the account is locked
 * - WITHDRAWAL: available -= amount, unless locked or available funds are short
 * - DISPUTE: moves the referenced amount from available to held
 * - RESOLVE: moves the referenced amount from held back to available
 * - CHARGEBACK: removes the referenced deposit from held and locks the account
 *
 * The processor holds no ledger state; ledger and history are passed in by the caller.
 * Every check runs before the first balance change, so a record is applied
 * completely or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionProcessor {

    private final LedgerMetrics metrics;

    /**
     * Applies a record and reports what happened.
     *
     * Rejections are logged as warnings and returned; they leave the ledger unchanged.
     *
     * @throws TransactionProcessingException if a deposit or withdrawal has no amount
     */
    public RecordOutcome apply(Ledger ledger, TransactionHistory history, TransactionRecord record) {
        RecordOutcome outcome = evaluate(ledger, history, record);

        if (outcome.isApplied()) {
            metrics.recordApplied(record.getType());
            log.debug("Applied {} tx={} for client {}",
                    record.getType(), record.getTransactionId(), record.getClientId());
        } else {
            metrics.recordRejected(outcome.getRejectionReason());
            log.warn("Rejected {} tx={} for client {}: {}",
                    record.getType(), record.getTransactionId(), record.getClientId(), outcome.getMessage());
        }
        return outcome;
    }

    RecordOutcome evaluate(Ledger ledger, TransactionHistory history, TransactionRecord record) {
        Account account = ledger.getOrCreate(record.getClientId());

        return switch (record.getType()) {
            case DEPOSIT -> deposit(account, history, record);
            case WITHDRAWAL -> withdraw(account, history, record);
            case DISPUTE -> dispute(account, history, record);
            case RESOLVE -> resolve(account, history, record);
            case CHARGEBACK -> chargeBack(account, history, record);
        };
    }

    private RecordOutcome deposit(Account account, TransactionHistory history, TransactionRecord record) {
        BigDecimal amount = requireAmount(record);

        if (account.isLocked()) {
            return RecordOutcome.rejected(RejectionReason.ACCOUNT_LOCKED,
                String.format("Cannot deposit - client account %d is locked", account.getClientId()));
        }

        account.credit(amount);
        history.record(record.withAmount(amount));
        return RecordOutcome.applied();
    }

    private RecordOutcome withdraw(Account account, TransactionHistory history, TransactionRecord record) {
        BigDecimal amount = requireAmount(record);

        if (account.isLocked()) {
            return RecordOutcome.rejected(RejectionReason.ACCOUNT_LOCKED,
                String.format("Cannot withdraw - client account %d is locked", account.getClientId()));
        }
        if (Amounts.isLessThan(account.getAvailable(), amount)) {
            return RecordOutcome.rejected(RejectionReason.INSUFFICIENT_AVAILABLE_FUNDS,
                String.format("Insufficient balance for withdrawal of %s from client account %d (available=%s)",
                    amount, account.getClientId(), account.getAvailable()));
        }

        account.debit(amount);
        history.record(record.withAmount(amount));
        return RecordOutcome.applied();
    }

    private RecordOutcome dispute(Account account, TransactionHistory history, TransactionRecord record) {
        Optional<TransactionRecord> disputed = history.lookup(record.getTransactionId());
        if (disputed.isEmpty()) {
            return unknownReference("dispute", record);
        }

        BigDecimal amount = disputed.get().getAmount();
        if (Amounts.isLessThan(account.getAvailable(), amount)) {
            return RecordOutcome.rejected(RejectionReason.INSUFFICIENT_AVAILABLE_FUNDS,
                String.format("Cannot dispute %s, only %s is available", amount, account.getAvailable()));
        }

        account.hold(amount);
        return RecordOutcome.applied();
    }

    private RecordOutcome resolve(Account account, TransactionHistory history, TransactionRecord record) {
        Optional<TransactionRecord> disputed = history.lookup(record.getTransactionId());
        if (disputed.isEmpty()) {
            return unknownReference("resolve", record);
        }

        BigDecimal amount = disputed.get().getAmount();
        if (Amounts.isLessThan(account.getHeld(), amount)) {
            return RecordOutcome.rejected(RejectionReason.INSUFFICIENT_HELD_FUNDS,
                String.format("Cannot resolve %s, only %s is held", amount, account.getHeld()));
        }

        account.release(amount);
        return RecordOutcome.applied();
    }

    private RecordOutcome chargeBack(Account account, TransactionHistory history, TransactionRecord record) {
        // Taking the entry out of history makes a second chargeback on the same tx a no-op
        Optional<TransactionRecord> removed = history.remove(record.getTransactionId());
        if (removed.isEmpty()) {
            return unknownReference("chargeback", record);
        }

        TransactionRecord chargedBack = removed.get();
        if (chargedBack.getType() != TransactionType.DEPOSIT) {
            history.record(chargedBack);
            return RecordOutcome.rejected(RejectionReason.NOT_A_DEPOSIT,
                String.format("Ignoring chargeback of tx %d, which is a %s and not a deposit",
                    chargedBack.getTransactionId(), chargedBack.getType().getCode()));
        }

        account.chargeBack(chargedBack.getAmount());
        return RecordOutcome.applied();
    }

    private BigDecimal requireAmount(TransactionRecord record) {
        if (!record.hasAmount()) {
            throw new TransactionProcessingException(ErrorCode.MISSING_AMOUNT,
                String.format("%s entry without the amount (client=%d, tx=%d)",
                    record.getType().getCode(), record.getClientId(), record.getTransactionId()));
        }
        return Amounts.normalize(record.getAmount());
    }

    private RecordOutcome unknownReference(String operation, TransactionRecord record) {
        return RecordOutcome.rejected(RejectionReason.UNKNOWN_TRANSACTION_REFERENCE,
            String.format("Ignoring %s that references unknown transaction %d",
                operation, record.getTransactionId()));
    }
}
