package com.omnigovernor.common.model;

/**
 * Reference to a transaction accepted into a node's pool.
 */
public record SubmissionHandle(String network, String transactionHash) {}
