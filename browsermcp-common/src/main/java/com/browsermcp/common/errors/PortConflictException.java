package com.browsermcp.common.errors;

import lombok.Getter;

/**
 * A listening port stayed occupied after eviction was attempted.
 */
@Getter
public class PortConflictException extends BridgeException {

    private final int port;

    public PortConflictException(int port, long waitedMs) {
        super("Port " + port + " is still in use after " + waitedMs + "ms. Unable to start server.");
        this.port = port;
    }

    public PortConflictException(int port, Throwable cause) {
        super("Failed to bind port " + port + ": " + cause.getMessage(), cause);
        this.port = port;
    }
}
