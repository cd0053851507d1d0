package com.omnigovernor.common.exception;

/**
 * Failure talking to one network. The message is prefixed with the network name,
 * e.g. {@code [BASE] rpc error -32000: nonce too low}.
 */
public class GovernorException extends RuntimeException {

    public GovernorException(String network, String message) {
        super("[" + network + "] " + message);
    }

    public GovernorException(String network, String message, Throwable cause) {
        super("[" + network + "] " + message, cause);
    }
}
