package com.omnigovernor.common.unit;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Exact conversions between human-readable ether/gwei strings and wei.
 */
public final class Units {

    private static final int ETHER_DECIMALS = 18;
    private static final int GWEI_DECIMALS  = 9;

    private Units() {}

    /** {@code "0.005"} → 5000000000000000. Rejects values with sub-wei precision. */
    public static BigInteger etherToWei(String ether) {
        return scale(ether, ETHER_DECIMALS);
    }

    /** {@code "1.6"} → 1600000000. */
    public static BigInteger gweiToWei(String gwei) {
        return scale(gwei, GWEI_DECIMALS);
    }

    /** Renders wei as plain ether, trailing zeros stripped. */
    public static String formatEther(BigInteger wei) {
        BigDecimal ether = new BigDecimal(wei).movePointLeft(ETHER_DECIMALS).stripTrailingZeros();
        return ether.signum() == 0 ? "0.0" : ether.toPlainString();
    }

    private static BigInteger scale(String amount, int decimals) {
        if (amount == null || amount.isBlank()) {
            throw new IllegalArgumentException("amount must not be blank");
        }
        try {
            return new BigDecimal(amount.trim()).movePointRight(decimals).toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("amount has more than " + decimals + " decimals: " + amount, e);
        }
    }
}
