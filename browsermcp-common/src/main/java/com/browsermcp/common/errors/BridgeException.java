package com.browsermcp.common.errors;

/**
 * Root of every failure raised by the bridge.
 */
public class BridgeException extends RuntimeException {

    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
