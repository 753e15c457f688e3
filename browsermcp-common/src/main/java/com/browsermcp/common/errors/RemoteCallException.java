package com.browsermcp.common.errors;

/**
 * The extension answered the call with an {@code error} field.
 */
public class RemoteCallException extends BridgeException {

    public RemoteCallException(String message) {
        super(message);
    }
}
