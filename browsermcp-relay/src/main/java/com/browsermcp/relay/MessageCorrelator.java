package com.browsermcp.relay;

import com.browsermcp.common.errors.BridgeTimeoutException;
import com.browsermcp.common.errors.RemoteCallException;
import com.browsermcp.common.errors.TransportException;
import com.browsermcp.common.infra.Futures;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Request/response correlation over one {@link ExtensionSocket}.
 *
 * <p>Every call gets a fresh UUID. A pending entry leaves the table on the first of: matching
 * response, timeout, socket close, socket error. Removal from the table is the single
 * settlement point, so the future completes and the timer is cancelled exactly once.
 * Responses that find no pending entry (late or duplicate) are dropped.
 */
@Slf4j
public class MessageCorrelator {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final ExtensionSocket socket;
    private final ScheduledExecutorService timer;
    private final ConcurrentMap<String, PendingRequest> pending = new ConcurrentHashMap<>();

    public MessageCorrelator(ExtensionSocket socket, ScheduledExecutorService timer) {
        this.socket = socket;
        this.timer = timer;
    }

    public ExtensionSocket getSocket() {
        return socket;
    }

    /**
     * Send {@code {id, type, payload}} and wait for the matching {@code messageResponse}.
     *
     * @return future completed with the response's {@code result} ({@link NullNode} when absent)
     */
    public CompletableFuture<JsonNode> call(String type, Object payload, long timeoutMs) {
        if (!socket.isOpen()) {
            return Futures.failed(new TransportException("WebSocket is not open"));
        }

        String id = UUID.randomUUID().toString();
        String text;
        try {
            text = mapper.writeValueAsString(RelayTypes.RequestMessage.create(id, type, payload));
        } catch (JsonProcessingException e) {
            return Futures.failed(new TransportException("Failed to encode " + type + " request", e));
        }

        PendingRequest request = new PendingRequest(id, type);
        pending.put(id, request);
        request.timeoutHandle = timer.schedule(
                () -> settle(id, null, new BridgeTimeoutException(timeoutMs)),
                timeoutMs, TimeUnit.MILLISECONDS);

        try {
            socket.send(text);
        } catch (RuntimeException e) {
            settle(id, null, e instanceof TransportException
                    ? e : new TransportException("WebSocket send failed: " + e.getMessage(), e));
        }
        return request.future;
    }

    /**
     * Route one inbound text frame. Only {@code messageResponse} frames carrying a
     * {@code requestId} are acted on. A non-string {@code error} is rendered as JSON.
     */
    public void onMessage(String text) {
        JsonNode msg;
        try {
            msg = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unparsable extension message: {}", e.getOriginalMessage());
            return;
        }
        if (msg == null || !RelayTypes.MESSAGE_RESPONSE_TYPE.equals(msg.path("type").asText(null))) {
            return;
        }

        JsonNode payload = msg.path("payload");
        JsonNode requestId = payload.get("requestId");
        if (requestId == null || !requestId.isTextual()) {
            log.debug("Ignoring messageResponse without requestId");
            return;
        }

        JsonNode error = payload.get("error");
        if (error != null && !error.isNull()) {
            String message = error.isTextual() ? error.asText() : error.toString();
            settle(requestId.asText(), null, new RemoteCallException(message));
        } else {
            JsonNode result = payload.get("result");
            settle(requestId.asText(), result != null ? result : NullNode.getInstance(), null);
        }
    }

    public void onClose() {
        failAll(new TransportException("WebSocket connection closed"));
    }

    public void onError(Throwable cause) {
        log.debug("Extension socket error: {}", cause.getMessage());
        failAll(new TransportException("WebSocket error occurred", cause));
    }

    /** Fail every pending call with {@code error}. */
    public void failAll(RuntimeException error) {
        for (String id : pending.keySet()) {
            settle(id, null, error);
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    private boolean settle(String id, JsonNode result, Throwable error) {
        PendingRequest request = pending.remove(id);
        if (request == null) {
            log.debug("No pending request for {}, response discarded", id);
            return false;
        }
        ScheduledFuture<?> handle = request.timeoutHandle;
        if (handle != null) {
            handle.cancel(false);
        }
        if (error != null) {
            log.debug("Call {} ({}) failed after {}ms: {}", request.type, id,
                    System.currentTimeMillis() - request.createdAt, error.getMessage());
            request.future.completeExceptionally(error);
        } else {
            request.future.complete(result);
        }
        return true;
    }

    private static final class PendingRequest {
        final String id;
        final String type;
        final long createdAt = System.currentTimeMillis();
        final CompletableFuture<JsonNode> future = new CompletableFuture<>();
        volatile ScheduledFuture<?> timeoutHandle;

        PendingRequest(String id, String type) {
            this.id = id;
            this.type = type;
        }
    }
}
