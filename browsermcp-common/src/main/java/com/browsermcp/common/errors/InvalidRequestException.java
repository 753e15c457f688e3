package com.browsermcp.common.errors;

/**
 * Malformed input at the front door, rejected before reaching the tool bridge.
 */
public class InvalidRequestException extends BridgeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
