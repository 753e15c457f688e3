package com.browsermcp.relay;

import com.browsermcp.common.errors.TransportException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory socket that records every write.
 */
class StubExtensionSocket implements ExtensionSocket {

    private static final ObjectMapper mapper = new ObjectMapper();

    final List<String> sent = new CopyOnWriteArrayList<>();
    volatile boolean open = true;
    volatile int closeCount;
    volatile boolean failOnClose;

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String text) {
        if (!open) {
            throw new TransportException("WebSocket is not open");
        }
        sent.add(text);
    }

    @Override
    public void close() {
        closeCount++;
        open = false;
        if (failOnClose) {
            throw new IllegalStateException("close failed");
        }
    }

    JsonNode sentMessage(int index) {
        try {
            return mapper.readTree(sent.get(index));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    static String response(String requestId, String resultJson) {
        return "{\"type\":\"messageResponse\",\"payload\":{\"requestId\":\"" + requestId
                + "\",\"result\":" + resultJson + "}}";
    }

    static String errorResponse(String requestId, String error) {
        return "{\"type\":\"messageResponse\",\"payload\":{\"requestId\":\"" + requestId
                + "\",\"error\":\"" + error + "\"}}";
    }
}
