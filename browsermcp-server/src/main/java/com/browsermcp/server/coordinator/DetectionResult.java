package com.browsermcp.server.coordinator;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one probe for a running bridge: {@code {exists, healthy, ports}}.
 * Recomputed on every {@link InstanceCoordinator#detect()} and never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionResult {

    /** Either port accepted a connection. */
    private boolean exists;

    /** The front door answered {@code /health} with a non-5xx status. */
    private boolean healthy;

    private boolean httpListening;
    private boolean wsListening;
    private Ports ports;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Ports {
        private int http;
        private int mcp;
    }

    /** Another healthy bridge owns the ports; this process should forward to it. */
    public boolean shouldForward() {
        return exists && healthy;
    }
}
