package com.browsermcp.common.infra;

/**
 * Frees a listening port held by another process. Best effort and time bounded:
 * implementations log failures instead of throwing.
 */
@FunctionalInterface
public interface PortEvictor {

    PortEvictor NOOP = port -> {
    };

    void evict(int port);
}
