package com.omnigovernor.common.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Static configuration of one remote network. Built once at startup, never mutated.
 *
 * @param name            registry key (e.g. {@code "ETHEREUM"})
 * @param chainId         EIP-155 chain identifier
 * @param rpcUrl          JSON-RPC endpoint
 * @param safetyMargin    minimum reserve kept on the account, in wei
 * @param priorityFeeHint priority fee added on top of the base fee, in wei
 */
public record NetworkConfig(
    String name,
    long chainId,
    String rpcUrl,
    BigInteger safetyMargin,
    BigInteger priorityFeeHint
) {
    public NetworkConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rpcUrl, "rpcUrl");
        if (safetyMargin == null || safetyMargin.signum() < 0) {
            throw new IllegalArgumentException("safetyMargin must be >= 0 for network " + name);
        }
        if (priorityFeeHint == null || priorityFeeHint.signum() < 0) {
            throw new IllegalArgumentException("priorityFeeHint must be >= 0 for network " + name);
        }
    }
}
