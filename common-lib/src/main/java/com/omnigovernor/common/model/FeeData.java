package com.omnigovernor.common.model;

import java.math.BigInteger;

/**
 * Fee conditions reported by a network.
 *
 * @param gasPrice current base gas price in wei, or {@code null} when the node did not report one
 */
public record FeeData(BigInteger gasPrice) {}
