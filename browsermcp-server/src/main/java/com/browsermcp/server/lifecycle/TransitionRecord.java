package com.browsermcp.server.lifecycle;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of the lifecycle transition history.
 */
public record TransitionRecord(LifecycleState from,
                               LifecycleState to,
                               Instant timestamp,
                               Map<String, Object> context,
                               int retryCount) {
}
