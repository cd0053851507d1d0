package com.omnigovernor.common.model;

import java.math.BigInteger;

/**
 * Sizing for one attempt against one network. All amounts in wei.
 *
 * <p>Valid only for immediate use: balance and fee conditions may have moved by the next tick.
 *
 * @param loanAmount    flash-loan principal, {@code premiumAmount * 10000 / 9}
 * @param premiumAmount value attached to the action (balance above overhead)
 * @param feeRate       max fee per gas unit
 * @param priorityFee   max priority fee per gas unit
 */
public record StrikePlan(
    BigInteger loanAmount,
    BigInteger premiumAmount,
    BigInteger feeRate,
    BigInteger priorityFee
) {}
