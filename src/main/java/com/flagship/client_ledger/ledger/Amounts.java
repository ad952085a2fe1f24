package com.flagship.client_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point money arithmetic for the ledger.
 *
 * All balances and history amounts carry exactly four fractional digits.
 * Input amounts with more precision are rounded half away from zero.
 */
public final class Amounts {

    public static final int SCALE = 4;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Amounts() {
        // Utility class
    }

    /**
     * Rounds an amount to the ledger precision.
     */
    public static BigDecimal normalize(BigDecimal amount) {
        return amount.setScale(SCALE, ROUNDING);
    }

    public static boolean isLessThan(BigDecimal left, BigDecimal right) {
        return left.compareTo(right) < 0;
    }
}
