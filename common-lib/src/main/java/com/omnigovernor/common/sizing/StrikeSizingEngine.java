package com.omnigovernor.common.sizing;

import com.omnigovernor.common.model.FeeData;
import com.omnigovernor.common.model.NetworkConfig;
import com.omnigovernor.common.model.StrikePlan;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Bounded strike sizing from observed balance and fee conditions.
 *
 * <h3>Formula (integer wei arithmetic throughout)</h3>
 * <pre>
 *   effectiveFee = gasPrice * 120 / 100 + priorityFeeHint
 *   overhead     = 2_000_000 * effectiveFee + safetyMargin + 100_000
 *   premium      = balance - overhead          (only when balance &gt; overhead)
 *   loan         = premium * 10000 / 9
 * </pre>
 *
 * <p>A balance at or below the overhead yields no plan. That is the common case, not an error.
 */
public final class StrikeSizingEngine {

    public static final BigInteger GAS_BUDGET     = BigInteger.valueOf(2_000_000L);
    public static final BigInteger FIXED_BUFFER   = BigInteger.valueOf(100_000L);
    /** Used when the node reports no gas price: 0.01 gwei. */
    public static final BigInteger FALLBACK_GAS_PRICE = BigInteger.valueOf(10_000_000L);

    private static final BigInteger FEE_MARKUP_NUM = BigInteger.valueOf(120);
    private static final BigInteger FEE_MARKUP_DEN = BigInteger.valueOf(100);
    private static final BigInteger LEVERAGE_NUM   = BigInteger.valueOf(10_000);
    private static final BigInteger LEVERAGE_DEN   = BigInteger.valueOf(9);

    private StrikeSizingEngine() {}

    public static BigInteger effectiveFee(FeeData feeData, NetworkConfig config) {
        BigInteger gasPrice = feeData != null && feeData.gasPrice() != null
            ? feeData.gasPrice() : FALLBACK_GAS_PRICE;
        return gasPrice.multiply(FEE_MARKUP_NUM).divide(FEE_MARKUP_DEN).add(config.priorityFeeHint());
    }

    public static BigInteger overhead(BigInteger effectiveFee, NetworkConfig config) {
        return GAS_BUDGET.multiply(effectiveFee).add(config.safetyMargin()).add(FIXED_BUFFER);
    }

    public static BigInteger loanFor(BigInteger premium) {
        return premium.multiply(LEVERAGE_NUM).divide(LEVERAGE_DEN);
    }

    /**
     * @return the plan, or empty when {@code balance <= overhead}
     */
    public static Optional<StrikePlan> compute(BigInteger balance, FeeData feeData, NetworkConfig config) {
        BigInteger fee      = effectiveFee(feeData, config);
        BigInteger overhead = overhead(fee, config);
        if (balance.compareTo(overhead) <= 0) {
            return Optional.empty();
        }
        BigInteger premium = balance.subtract(overhead);
        return Optional.of(new StrikePlan(loanFor(premium), premium, fee, config.priorityFeeHint()));
    }

    /** Wei missing before a plan becomes possible; zero when already sufficient. */
    public static BigInteger shortfall(BigInteger balance, FeeData feeData, NetworkConfig config) {
        BigInteger overhead = overhead(effectiveFee(feeData, config), config);
        BigInteger missing  = overhead.subtract(balance);
        return missing.signum() >= 0 ? missing.add(BigInteger.ONE) : BigInteger.ZERO;
    }
}
