package com.browsermcp.server.mcp;

import com.browsermcp.common.infra.Futures;
import com.browsermcp.common.model.JsonRpcMessage;
import com.browsermcp.server.ServerInfo;
import com.browsermcp.tools.CallToolResult;
import com.browsermcp.tools.ResourceRegistry;
import com.browsermcp.tools.ToolExecutor;
import com.browsermcp.tools.ToolRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * MCP server over newline-delimited JSON-RPC 2.0 on stdin/stdout.
 *
 * <p>One reader thread parses requests; {@code tools/call} completes asynchronously, so
 * calls overlap. Each response is written whole under a lock. End of input is reported to
 * {@code onInputClosed}; a failed write is reported to {@code onWriteFailure}.
 */
@Slf4j
public class McpStdioServer implements AutoCloseable {

    public static final String PROTOCOL_VERSION = "2024-11-05";

    private static final ObjectMapper mapper = new ObjectMapper();

    private final ToolRegistry tools;
    private final ResourceRegistry resources;
    private final ToolExecutor executor;
    private final InputStream in;
    private final OutputStream out;
    private final Object writeLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile Runnable onInputClosed = () -> {
    };
    private volatile Consumer<Throwable> onWriteFailure = error -> {
    };

    public McpStdioServer(ToolRegistry tools, ResourceRegistry resources, ToolExecutor executor,
                          InputStream in, OutputStream out) {
        this.tools = tools;
        this.resources = resources;
        this.executor = executor;
        this.in = in;
        this.out = out;
    }

    public void setOnInputClosed(Runnable onInputClosed) {
        this.onInputClosed = onInputClosed;
    }

    public void setOnWriteFailure(Consumer<Throwable> onWriteFailure) {
        this.onWriteFailure = onWriteFailure;
    }

    /**
     * Start reading. Calling again after the reader is running is a no-op.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        Thread reader = new Thread(this::readLoop, "browsermcp-stdio");
        reader.setDaemon(true);
        reader.start();
        log.info("MCP stdio transport attached");
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("MCP stdio transport closed");
        }
    }

    private void readLoop() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while (!closed.get() && (line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    handleLine(line);
                }
            }
        } catch (IOException e) {
            log.warn("stdin read failed: {}", e.getMessage());
        }
        if (!closed.get()) {
            log.info("stdin closed");
            onInputClosed.run();
        }
    }

    void handleLine(String line) {
        JsonRpcMessage.Request request;
        try {
            request = mapper.readValue(line, JsonRpcMessage.Request.class);
        } catch (JsonProcessingException e) {
            write(JsonRpcMessage.Response.error(NullNode.getInstance(),
                    JsonRpcMessage.PARSE_ERROR, "Parse error: " + e.getOriginalMessage()));
            return;
        }
        if (request.getMethod() == null) {
            if (!request.isNotification()) {
                write(JsonRpcMessage.Response.error(request.getId(),
                        JsonRpcMessage.INVALID_REQUEST, "Invalid request: missing method"));
            }
            return;
        }

        try {
            dispatch(request);
        } catch (RuntimeException e) {
            log.error("Failed to handle {}", request.getMethod(), e);
            if (!request.isNotification()) {
                write(JsonRpcMessage.Response.error(request.getId(),
                        JsonRpcMessage.INTERNAL_ERROR, String.valueOf(e.getMessage())));
            }
        }
    }

    private void dispatch(JsonRpcMessage.Request request) {
        JsonNode id = request.getId();
        JsonNode params = request.getParams() != null ? request.getParams() : mapper.createObjectNode();

        switch (request.getMethod()) {
            case "initialize" -> respond(request, initializeResult(params));
            case "ping" -> respond(request, Map.of());
            case "tools/list" -> respond(request, Map.of("tools", tools.definitions()));
            case "resources/list" -> respond(request, Map.of("resources", resources.definitions()));
            case "resources/read" -> {
                String uri = params.path("uri").asText(null);
                List<JsonNode> contents = resources.read(uri).orElse(List.of());
                respond(request, Map.of("contents", contents));
            }
            case "tools/call" -> callTool(request, params);
            default -> {
                if (request.isNotification()) {
                    log.debug("Ignoring notification {}", request.getMethod());
                } else {
                    write(JsonRpcMessage.Response.error(id, JsonRpcMessage.METHOD_NOT_FOUND,
                            "Method not found: " + request.getMethod()));
                }
            }
        }
    }

    private void callTool(JsonRpcMessage.Request request, JsonNode params) {
        JsonNode name = params.get("name");
        if (name == null || !name.isTextual()) {
            write(JsonRpcMessage.Response.error(request.getId(), JsonRpcMessage.INVALID_PARAMS,
                    "tools/call requires a string \"name\""));
            return;
        }
        executor.execute(name.asText(), params.get("arguments")).whenComplete((result, error) -> {
            CallToolResult answer = error == null
                    ? result
                    : CallToolResult.error(Futures.describe(error));
            respond(request, answer);
        });
    }

    private Map<String, Object> initializeResult(JsonNode params) {
        String requested = params.path("protocolVersion").asText(null);

        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("tools", Map.of());
        capabilities.put("resources", Map.of());

        Map<String, Object> serverInfo = new LinkedHashMap<>();
        serverInfo.put("name", ServerInfo.NAME);
        serverInfo.put("version", ServerInfo.VERSION);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", requested != null ? requested : PROTOCOL_VERSION);
        result.put("capabilities", capabilities);
        result.put("serverInfo", serverInfo);
        return result;
    }

    private void respond(JsonRpcMessage.Request request, Object result) {
        if (request.isNotification()) {
            return;
        }
        write(JsonRpcMessage.Response.success(request.getId(), result));
    }

    private void write(JsonRpcMessage.Response response) {
        String json;
        try {
            json = mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("Failed to encode response {}: {}", response.getId(), e.getMessage());
            return;
        }
        synchronized (writeLock) {
            try {
                out.write(json.getBytes(StandardCharsets.UTF_8));
                out.write('\n');
                out.flush();
            } catch (IOException e) {
                log.error("stdout write failed: {}", e.getMessage());
                onWriteFailure.accept(e);
            }
        }
    }
}
