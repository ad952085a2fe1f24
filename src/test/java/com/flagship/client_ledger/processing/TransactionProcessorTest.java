package com.flagship.client_ledger.processing;

import com.flagship.client_ledger.ledger.Account;
import com.flagship.client_ledger.ledger.Ledger;
import com.flagship.client_ledger.ledger.TransactionHistory;
import com.flagship.client_ledger.ledger.TransactionRecord;
import com.flagship.client_ledger.ledger.TransactionType;
import com.flagship.client_ledger.observability.LedgerMetrics;
import com.flagship.client_ledger.processing.exception.ErrorCode;
import com.flagship.client_ledger.processing.exception.TransactionProcessingException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the per-type rules of the transaction processor.
 *
 * These tests verify that:
 * - Deposits and withdrawals move funds and are kept in history
 * - Disputes, resolves and chargebacks act on history entries only
 * - Rejected records leave the ledger untouched
 * - A missing amount is fatal
 * - total == available + held after every record
 */
class TransactionProcessorTest {

    private static final int CLIENT = 1;

    private TransactionProcessor processor;
    private LedgerMetrics metrics;
    private Ledger ledger;
    private TransactionHistory history;

    @BeforeEach
    void setUp() {
        metrics = new LedgerMetrics(new SimpleMeterRegistry());
        processor = new TransactionProcessor(metrics);
        ledger = new Ledger();
        history = new TransactionHistory();
    }

    private RecordOutcome apply(TransactionRecord record) {
        RecordOutcome outcome = processor.apply(ledger, history, record);
        for (Account account : ledger.accounts()) {
            assertEquals(0, account.getTotal().compareTo(account.getAvailable().add(account.getHeld())),
                "total must equal available + held");
        }
        return outcome;
    }

    private Account account() {
        return ledger.find(CLIENT).orElseThrow();
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            () -> "expected " + expected + " but was " + actual);
    }

    private static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }

    // ==================== Deposit ====================

    @Test
    @DisplayName("Deposit credits available and total and is kept in history")
    void testDeposit() {
        RecordOutcome outcome = apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));

        assertTrue(outcome.isApplied());
        assertAmount("5.0", account().getAvailable());
        assertAmount("0.0", account().getHeld());
        assertAmount("5.0", account().getTotal());
        assertTrue(history.contains(1));
    }

    @Test
    @DisplayName("Deposit amount is normalized to four decimal places before use")
    void testDepositNormalized() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("1.23456")));

        assertEquals(amount("1.2346"), account().getAvailable());
        assertEquals(amount("1.2346"), history.lookup(1).orElseThrow().getAmount());
    }

    @Test
    @DisplayName("Deposit without amount is fatal MISSING_AMOUNT")
    void testDepositWithoutAmount() {
        TransactionRecord record = new TransactionRecord(TransactionType.DEPOSIT, CLIENT, 1, null);

        TransactionProcessingException e = assertThrows(TransactionProcessingException.class,
            () -> processor.apply(ledger, history, record));

        assertEquals(ErrorCode.MISSING_AMOUNT, e.getErrorCode());
        assertFalse(history.contains(1));
    }

    @Test
    @DisplayName("Deposit into a locked account is rejected and not recorded")
    void testDepositLocked() {
        lockClient();

        RecordOutcome outcome = apply(TransactionRecord.deposit(CLIENT, 10, amount("7.0")));

        assertEquals(RejectionReason.ACCOUNT_LOCKED, outcome.getRejectionReason());
        assertAmount("0.0", account().getAvailable());
        assertAmount("0.0", account().getTotal());
        assertFalse(history.contains(10));
    }

    // ==================== Withdrawal ====================

    @Test
    @DisplayName("Withdrawal debits available and total and is kept in history")
    void testWithdrawal() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));

        RecordOutcome outcome = apply(TransactionRecord.withdrawal(CLIENT, 2, amount("1.5")));

        assertTrue(outcome.isApplied());
        assertAmount("3.5", account().getAvailable());
        assertAmount("3.5", account().getTotal());
        assertTrue(history.contains(2));
    }

    @Test
    @DisplayName("Withdrawal of exactly the available balance is allowed")
    void testWithdrawalOfWholeBalance() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("2.0")));

        assertTrue(apply(TransactionRecord.withdrawal(CLIENT, 2, amount("2.0"))).isApplied());
        assertAmount("0.0", account().getAvailable());
    }

    @Test
    @DisplayName("Withdrawal beyond available funds is rejected and not recorded")
    void testWithdrawalInsufficientFunds() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("2.0")));

        RecordOutcome outcome = apply(TransactionRecord.withdrawal(CLIENT, 2, amount("3.0")));

        assertEquals(RejectionReason.INSUFFICIENT_AVAILABLE_FUNDS, outcome.getRejectionReason());
        assertAmount("2.0", account().getAvailable());
        assertFalse(history.contains(2));
    }

    @Test
    @DisplayName("Withdrawal without amount is fatal MISSING_AMOUNT")
    void testWithdrawalWithoutAmount() {
        TransactionRecord record = new TransactionRecord(TransactionType.WITHDRAWAL, CLIENT, 1, null);

        TransactionProcessingException e = assertThrows(TransactionProcessingException.class,
            () -> processor.apply(ledger, history, record));

        assertEquals(ErrorCode.MISSING_AMOUNT, e.getErrorCode());
    }

    // ==================== Dispute / Resolve ====================

    @Test
    @DisplayName("Dispute moves the referenced amount from available to held")
    void testDispute() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));

        RecordOutcome outcome = apply(TransactionRecord.dispute(CLIENT, 1));

        assertTrue(outcome.isApplied());
        assertAmount("0.0", account().getAvailable());
        assertAmount("5.0", account().getHeld());
        assertAmount("5.0", account().getTotal());
        assertTrue(history.contains(1));
    }

    @Test
    @DisplayName("Dispute of an unknown transaction is ignored")
    void testDisputeUnknownTransaction() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));

        RecordOutcome outcome = apply(TransactionRecord.dispute(CLIENT, 99));

        assertEquals(RejectionReason.UNKNOWN_TRANSACTION_REFERENCE, outcome.getRejectionReason());
        assertAmount("5.0", account().getAvailable());
        assertAmount("0.0", account().getHeld());
    }

    @Test
    @DisplayName("Dispute larger than the available balance is rejected")
    void testDisputeInsufficientAvailable() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));
        apply(TransactionRecord.withdrawal(CLIENT, 2, amount("4.0")));

        RecordOutcome outcome = apply(TransactionRecord.dispute(CLIENT, 1));

        assertEquals(RejectionReason.INSUFFICIENT_AVAILABLE_FUNDS, outcome.getRejectionReason());
        assertAmount("1.0", account().getAvailable());
        assertAmount("0.0", account().getHeld());
    }

    @Test
    @DisplayName("A withdrawal can be disputed, using the same available-funds rule")
    void testDisputeWithdrawal() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));
        apply(TransactionRecord.withdrawal(CLIENT, 2, amount("2.0")));

        assertTrue(apply(TransactionRecord.dispute(CLIENT, 2)).isApplied());

        assertAmount("1.0", account().getAvailable());
        assertAmount("2.0", account().getHeld());
        assertAmount("3.0", account().getTotal());
    }

    @Test
    @DisplayName("Disputing the same tx twice shifts the amount to held twice")
    void testDisputeTwice() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("2.0")));
        apply(TransactionRecord.deposit(CLIENT, 2, amount("3.0")));

        assertTrue(apply(TransactionRecord.dispute(CLIENT, 1)).isApplied());
        assertTrue(apply(TransactionRecord.dispute(CLIENT, 1)).isApplied());

        assertAmount("1.0", account().getAvailable());
        assertAmount("4.0", account().getHeld());
        assertAmount("5.0", account().getTotal());
    }

    @Test
    @DisplayName("Second dispute is rejected once available no longer covers the amount")
    void testDisputeTwiceWithoutFunds() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("2.0")));

        apply(TransactionRecord.dispute(CLIENT, 1));
        RecordOutcome second = apply(TransactionRecord.dispute(CLIENT, 1));

        assertEquals(RejectionReason.INSUFFICIENT_AVAILABLE_FUNDS, second.getRejectionReason());
        assertAmount("0.0", account().getAvailable());
        assertAmount("2.0", account().getHeld());
    }

    @Test
    @DisplayName("Deposit, dispute, resolve returns balances to their pre-dispute values")
    void testDisputeResolveRoundTrip() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));

        apply(TransactionRecord.dispute(CLIENT, 1));
        assertAmount("5.0", account().getTotal());
        RecordOutcome outcome = apply(TransactionRecord.resolve(CLIENT, 1));

        assertTrue(outcome.isApplied());
        assertAmount("5.0", account().getAvailable());
        assertAmount("0.0", account().getHeld());
        assertAmount("5.0", account().getTotal());
        assertTrue(history.contains(1));
    }

    @Test
    @DisplayName("Resolve of an unknown transaction is ignored")
    void testResolveUnknownTransaction() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));

        RecordOutcome outcome = apply(TransactionRecord.resolve(CLIENT, 42));

        assertEquals(RejectionReason.UNKNOWN_TRANSACTION_REFERENCE, outcome.getRejectionReason());
    }

    @Test
    @DisplayName("Resolve without enough held funds is rejected")
    void testResolveWithoutDispute() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));

        RecordOutcome outcome = apply(TransactionRecord.resolve(CLIENT, 1));

        assertEquals(RejectionReason.INSUFFICIENT_HELD_FUNDS, outcome.getRejectionReason());
        assertAmount("5.0", account().getAvailable());
        assertAmount("0.0", account().getHeld());
    }

    // ==================== Chargeback ====================

    @Test
    @DisplayName("Chargeback removes held funds, locks the account and drops the history entry")
    void testChargeback() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));
        apply(TransactionRecord.deposit(CLIENT, 2, amount("1.0")));
        apply(TransactionRecord.dispute(CLIENT, 1));

        RecordOutcome outcome = apply(TransactionRecord.chargeback(CLIENT, 1));

        assertTrue(outcome.isApplied());
        assertTrue(account().isLocked());
        assertAmount("1.0", account().getAvailable());
        assertAmount("0.0", account().getHeld());
        assertAmount("1.0", account().getTotal());
        assertFalse(history.contains(1));
    }

    @Test
    @DisplayName("Second chargeback on the same tx is a no-op")
    void testChargebackFinality() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));
        apply(TransactionRecord.dispute(CLIENT, 1));
        apply(TransactionRecord.chargeback(CLIENT, 1));

        RecordOutcome second = apply(TransactionRecord.chargeback(CLIENT, 1));

        assertEquals(RejectionReason.UNKNOWN_TRANSACTION_REFERENCE, second.getRejectionReason());
        assertTrue(account().isLocked());
        assertAmount("0.0", account().getAvailable());
        assertAmount("0.0", account().getHeld());
        assertAmount("0.0", account().getTotal());
    }

    @Test
    @DisplayName("Chargeback of a withdrawal is rejected and the entry stays in history")
    void testChargebackOfWithdrawal() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));
        apply(TransactionRecord.withdrawal(CLIENT, 2, amount("1.0")));
        apply(TransactionRecord.dispute(CLIENT, 2));

        RecordOutcome outcome = apply(TransactionRecord.chargeback(CLIENT, 2));

        assertEquals(RejectionReason.NOT_A_DEPOSIT, outcome.getRejectionReason());
        assertFalse(account().isLocked());
        assertAmount("1.0", account().getHeld());
        assertEquals(TransactionType.WITHDRAWAL, history.lookup(2).orElseThrow().getType());
    }

    @Test
    @DisplayName("Chargeback of an undisputed deposit drives held and total negative")
    void testChargebackWithoutDispute() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));
        apply(TransactionRecord.withdrawal(CLIENT, 2, amount("5.0")));

        assertTrue(apply(TransactionRecord.chargeback(CLIENT, 1)).isApplied());

        assertTrue(account().isLocked());
        assertAmount("0.0", account().getAvailable());
        assertAmount("-5.0", account().getHeld());
        assertAmount("-5.0", account().getTotal());
    }

    @Test
    @DisplayName("Once locked, deposits and withdrawals no longer change the account")
    void testLockFinality() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));
        apply(TransactionRecord.deposit(CLIENT, 2, amount("3.0")));
        apply(TransactionRecord.dispute(CLIENT, 1));
        apply(TransactionRecord.chargeback(CLIENT, 1));
        BigDecimal available = account().getAvailable();
        BigDecimal total = account().getTotal();

        assertEquals(RejectionReason.ACCOUNT_LOCKED,
            apply(TransactionRecord.deposit(CLIENT, 3, amount("10.0"))).getRejectionReason());
        assertEquals(RejectionReason.ACCOUNT_LOCKED,
            apply(TransactionRecord.withdrawal(CLIENT, 4, amount("1.0"))).getRejectionReason());

        assertEquals(available, account().getAvailable());
        assertEquals(total, account().getTotal());
    }

    @Test
    @DisplayName("Disputes and resolves still apply to a locked account")
    void testDisputeOnLockedAccount() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("5.0")));
        apply(TransactionRecord.deposit(CLIENT, 2, amount("3.0")));
        apply(TransactionRecord.dispute(CLIENT, 1));
        apply(TransactionRecord.chargeback(CLIENT, 1));

        assertTrue(apply(TransactionRecord.dispute(CLIENT, 2)).isApplied());
        assertAmount("3.0", account().getHeld());
        assertTrue(apply(TransactionRecord.resolve(CLIENT, 2)).isApplied());
        assertAmount("3.0", account().getAvailable());
    }

    @Test
    @DisplayName("Dispute, resolve and chargeback act on the account of the client named in the record")
    void testReferenceFromOtherClient() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("2.0")));
        apply(TransactionRecord.deposit(2, 2, amount("5.0")));

        assertTrue(apply(TransactionRecord.dispute(2, 1)).isApplied());
        Account other = ledger.find(2).orElseThrow();
        assertAmount("3.0", other.getAvailable());
        assertAmount("2.0", other.getHeld());
        assertAmount("2.0", account().getAvailable());
        assertAmount("0.0", account().getHeld());

        assertTrue(apply(TransactionRecord.resolve(2, 1)).isApplied());
        assertAmount("5.0", other.getAvailable());
        assertAmount("0.0", other.getHeld());

        apply(TransactionRecord.dispute(2, 1));
        assertTrue(apply(TransactionRecord.chargeback(2, 1)).isApplied());
        assertTrue(other.isLocked());
        assertAmount("3.0", other.getTotal());
        assertFalse(account().isLocked());
        assertAmount("2.0", account().getTotal());
    }

    // ==================== Accounts & metrics ====================

    @Test
    @DisplayName("Referencing a new client opens an empty account even when rejected")
    void testAccountCreatedOnRejection() {
        apply(TransactionRecord.dispute(5, 1));

        Account opened = ledger.find(5).orElseThrow();
        assertAmount("0.0", opened.getTotal());
        assertFalse(opened.isLocked());
    }

    @Test
    @DisplayName("Applied and rejected records are counted per type and reason")
    void testMetrics() {
        apply(TransactionRecord.deposit(CLIENT, 1, amount("1.0")));
        apply(TransactionRecord.deposit(CLIENT, 2, amount("1.0")));
        apply(TransactionRecord.withdrawal(CLIENT, 3, amount("9.0")));
        apply(TransactionRecord.dispute(CLIENT, 77));

        assertEquals(2.0, metrics.appliedCount(TransactionType.DEPOSIT));
        assertEquals(0.0, metrics.appliedCount(TransactionType.WITHDRAWAL));
        assertEquals(1.0, metrics.rejectedCount(RejectionReason.INSUFFICIENT_AVAILABLE_FUNDS));
        assertEquals(1.0, metrics.rejectedCount(RejectionReason.UNKNOWN_TRANSACTION_REFERENCE));
    }

    private void lockClient() {
        apply(TransactionRecord.deposit(CLIENT, 100, amount("1.0")));
        apply(TransactionRecord.dispute(CLIENT, 100));
        apply(TransactionRecord.chargeback(CLIENT, 100));
        assertTrue(account().isLocked());
    }
}
