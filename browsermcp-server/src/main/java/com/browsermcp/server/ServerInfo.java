package com.browsermcp.server;

/**
 * Identity reported to protocol clients and on {@code /health}.
 */
public final class ServerInfo {

    public static final String NAME = "Browser MCP";
    public static final String VERSION = "0.1.3";

    private ServerInfo() {
    }
}
