package com.browsermcp.common.errors;

import lombok.Getter;

/**
 * No matching response arrived within the call budget.
 */
@Getter
public class BridgeTimeoutException extends BridgeException {

    private final long timeoutMs;

    public BridgeTimeoutException(long timeoutMs) {
        super("WebSocket response timeout after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }
}
