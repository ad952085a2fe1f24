package com.flagship.client_ledger.processing;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.client_ledger.ledger.Account;
import com.flagship.client_ledger.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Output view of an account at the end of a replay.
 * Amounts carry exactly four fractional digits.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountSnapshot {

    @JsonProperty("client")
    int clientId;
    BigDecimal available;
    BigDecimal held;
    BigDecimal total;
    boolean locked;

    public static AccountSnapshot of(Account account) {
        return new AccountSnapshot(
            account.getClientId(),
            Amounts.normalize(account.getAvailable()),
            Amounts.normalize(account.getHeld()),
            Amounts.normalize(account.getTotal()),
            account.isLocked()
        );
    }
}
