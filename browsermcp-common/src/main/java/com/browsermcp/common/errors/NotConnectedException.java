package com.browsermcp.common.errors;

/**
 * No extension socket is attached. Raised before any write is attempted.
 */
public class NotConnectedException extends BridgeException {

    public static final String MESSAGE = "No tab is connected. Open the Browser MCP extension "
            + "and click \"Connect\" on the tab you want to automate.";

    public NotConnectedException() {
        super(MESSAGE);
    }
}
