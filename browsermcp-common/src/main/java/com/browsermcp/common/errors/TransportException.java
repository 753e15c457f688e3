package com.browsermcp.common.errors;

/**
 * The socket or the front door became unreachable while a call was in flight.
 */
public class TransportException extends BridgeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
