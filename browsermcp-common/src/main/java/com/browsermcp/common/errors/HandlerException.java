package com.browsermcp.common.errors;

/**
 * A tool handler failed, either on argument validation or on the call it made.
 */
public class HandlerException extends BridgeException {

    public HandlerException(String message) {
        super(message);
    }

    public HandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
