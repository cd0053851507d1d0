package com.omnigovernor.common.exception;

/**
 * JSON-RPC error object returned by a node.
 */
public class RpcException extends GovernorException {
    private final int code;

    public RpcException(String network, int code, String message) {
        super(network, "rpc error " + code + ": " + message);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
