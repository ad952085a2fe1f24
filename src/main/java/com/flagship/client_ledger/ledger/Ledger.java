package com.flagship.client_ledger.ledger;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-client account store of one replay run.
 *
 * Accounts are created on first reference and never removed.
 * Iteration order is unspecified.
 */
public class Ledger {

    private final Map<Integer, Account> accounts = new HashMap<>();

    /**
     * Returns the account of the client, opening an empty one if none exists yet.
     */
    public Account getOrCreate(int clientId) {
        return accounts.computeIfAbsent(clientId, Account::new);
    }

    public Optional<Account> find(int clientId) {
        return Optional.ofNullable(accounts.get(clientId));
    }

    public Collection<Account> accounts() {
        return Collections.unmodifiableCollection(accounts.values());
    }

    public int size() {
        return accounts.size();
    }
}
