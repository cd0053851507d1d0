package com.omnigovernor.common.exception;

/**
 * Submission rejected because the account cannot cover value plus gas.
 * Expected whenever a plan goes stale between sizing and submission.
 */
public class InsufficientFundsException extends GovernorException {

    public InsufficientFundsException(String network, String message) {
        super(network, message);
    }

    /** Matches the wording nodes use for this rejection. */
    public static boolean matches(String message) {
        return message != null && message.toLowerCase().contains("insufficient funds");
    }
}
