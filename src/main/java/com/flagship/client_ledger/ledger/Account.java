package com.flagship.client_ledger.ledger;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Balance record of a single client.
 *
 * Total is derived, never stored: {@code total == available + held} always holds.
 * The mutators below do not check funds or the lock; {@code TransactionProcessor}
 * decides whether a movement is allowed before calling them.
 */
@Getter
@ToString
public class Account {

    private final int clientId;
    private BigDecimal available;
    private BigDecimal held;
    private boolean locked;

    public Account(int clientId) {
        this.clientId = clientId;
        this.available = Amounts.ZERO;
        this.held = Amounts.ZERO;
        this.locked = false;
    }

    public BigDecimal getTotal() {
        return available.add(held);
    }

    /**
     * Adds funds to the available balance.
     */
    public void credit(BigDecimal amount) {
        available = available.add(amount);
    }

    /**
     * Removes funds from the available balance.
     */
    public void debit(BigDecimal amount) {
        available = available.subtract(amount);
    }

    /**
     * Moves funds from available to held.
     */
    public void hold(BigDecimal amount) {
        available = available.subtract(amount);
        held = held.add(amount);
    }

    /**
     * Moves funds from held back to available.
     */
    public void release(BigDecimal amount) {
        held = held.subtract(amount);
        available = available.add(amount);
    }

    /**
     * Removes held funds for good and locks the account.
     * Held (and so total) may go negative here.
     */
    public void chargeBack(BigDecimal amount) {
        held = held.subtract(amount);
        locked = true;
    }
}
