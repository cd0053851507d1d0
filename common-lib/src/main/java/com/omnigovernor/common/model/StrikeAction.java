package com.omnigovernor.common.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Fully parameterised contract call ready to be simulated and submitted.
 *
 * @param executor             target contract address
 * @param operation            contract function name
 * @param path                 asset route passed as the first argument
 * @param amount               amount argument (the loan)
 * @param value                native value attached to the call (the premium)
 * @param gasLimit             maximum gas for the call
 * @param maxFeePerGas         EIP-1559 fee cap
 * @param maxPriorityFeePerGas EIP-1559 tip cap
 */
public record StrikeAction(
    String executor,
    String operation,
    List<String> path,
    BigInteger amount,
    BigInteger value,
    BigInteger gasLimit,
    BigInteger maxFeePerGas,
    BigInteger maxPriorityFeePerGas
) {
    public static final String EXECUTE_COMPLEX_PATH = "executeComplexPath";
    public static final List<String> DEFAULT_PATH = List.of("ETH", "USDC", "ETH");
    public static final BigInteger STRIKE_GAS_LIMIT = BigInteger.valueOf(2_000_000L);

    public StrikeAction {
        path = List.copyOf(path);
    }

    /** The fixed action shape: {@code executeComplexPath(["ETH","USDC","ETH"], loan)} carrying the premium. */
    public static StrikeAction fromPlan(String executor, StrikePlan plan) {
        return new StrikeAction(executor, EXECUTE_COMPLEX_PATH, DEFAULT_PATH,
            plan.loanAmount(), plan.premiumAmount(), STRIKE_GAS_LIMIT,
            plan.feeRate(), plan.priorityFee());
    }
}
