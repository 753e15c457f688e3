package com.browsermcp.server.lifecycle;

import java.util.List;

/**
 * Diagnostic view of the lifecycle at one instant.
 */
public record StateInfo(LifecycleState state,
                        int retryCount,
                        int maxRetries,
                        boolean shuttingDown,
                        boolean hasServer,
                        boolean hasTransport,
                        List<TransitionRecord> recentHistory) {
}
