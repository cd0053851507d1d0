package com.omnigovernor.common.model;

/**
 * Status reported by an included transaction's receipt.
 */
public enum ConfirmationStatus {
    ACCEPTED,
    REVERTED
}
