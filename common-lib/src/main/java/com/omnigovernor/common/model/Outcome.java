package com.omnigovernor.common.model;

/**
 * Result of one submitted action, consumed once by the trust ledger.
 */
public record Outcome(boolean success) {

    public static Outcome from(ConfirmationStatus status) {
        return new Outcome(status == ConfirmationStatus.ACCEPTED);
    }

    public static Outcome failed() {
        return new Outcome(false);
    }
}
