package com.browsermcp.server.frontdoor;

import com.browsermcp.common.errors.InvalidRequestException;
import com.browsermcp.common.errors.PortConflictException;
import com.browsermcp.common.infra.Futures;
import com.browsermcp.relay.ExtensionClient;
import com.browsermcp.server.ServerInfo;
import com.browsermcp.tools.CallToolResult;
import com.browsermcp.tools.ToolCallBridge;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.CharsetUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.OK;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Local HTTP front door: {@code GET /health}, {@code GET /tools}, {@code POST /tool}.
 *
 * <p>Other bridge processes on this machine forward their tool calls here. Cross-origin
 * requests are accepted from anywhere; the server binds to the loopback host only.
 */
@Slf4j
public class FrontDoorServer implements AutoCloseable {

    private static final ObjectMapper mapper = new ObjectMapper();

    static final List<String> ENDPOINTS = List.of("/health", "/tool", "/tools");

    private static final Map<String, String> EXPECTED_FORMAT = expectedFormat();

    private final String host;
    private final int port;
    private final int wsPort;
    private final ToolCallBridge bridge;
    private final ExtensionClient extension;
    private final long startedAtMs = System.currentTimeMillis();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private volatile Channel serverChannel;
    @Getter private volatile int boundPort = -1;

    public FrontDoorServer(String host, int port, int wsPort, ToolCallBridge bridge,
                           ExtensionClient extension) {
        this.host = host;
        this.port = port;
        this.wsPort = wsPort;
        this.bridge = bridge;
        this.extension = extension;
    }

    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(2);
        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(
                                new HttpServerCodec(),
                                new HttpObjectAggregator(1048576), // 1MB
                                new FrontDoorHandler());
                    }
                });
        try {
            serverChannel = b.bind(host, port).sync().channel();
        } catch (InterruptedException e) {
            shutdown();
            throw e;
        } catch (Exception e) {
            log.error("Front door failed to bind {}:{}: {}", host, port, e.getMessage());
            shutdown();
            throw new PortConflictException(port, e);
        }
        boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("Front door listening on http://{}:{}/", host, boundPort);
    }

    public boolean isRunning() {
        Channel channel = serverChannel;
        return channel != null && channel.isActive();
    }

    /**
     * Completes when the listening channel closes, for whatever reason.
     */
    public ChannelFuture closeFuture() {
        Channel channel = serverChannel;
        if (channel == null) {
            throw new IllegalStateException("Front door is not started");
        }
        return channel.closeFuture();
    }

    @Override
    public void close() {
        shutdown();
        log.info("Front door stopped");
    }

    private void shutdown() {
        if (serverChannel != null) {
            try {
                serverChannel.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            serverChannel = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }

    Map<String, Object> health() {
        Map<String, Object> ports = new LinkedHashMap<>();
        ports.put("http", boundPort > 0 ? boundPort : port);
        ports.put("mcp", wsPort);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", Instant.now().toString());
        body.put("uptimeSeconds", (System.currentTimeMillis() - startedAtMs) / 1000.0);
        body.put("version", ServerInfo.VERSION);
        body.put("ports", ports);
        body.put("toolCount", bridge.getRegistry().size());
        body.put("resourceCount", bridge.getResources().size());
        body.put("extensionConnected", extension.hasConnection());
        return body;
    }

    private static Map<String, String> expectedFormat() {
        Map<String, String> format = new LinkedHashMap<>();
        format.put("name", "string (required) - Tool name to execute");
        format.put("arguments", "object (optional) - Tool arguments");
        return format;
    }

    // =========================================================================
    // Netty Handler
    // =========================================================================

    private class FrontDoorHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            String path = new QueryStringDecoder(request.uri()).path();
            HttpMethod method = request.method();
            boolean keepAlive = HttpUtil.isKeepAlive(request);

            try {
                if (method == HttpMethod.OPTIONS) {
                    send(ctx, OK, null, keepAlive);
                } else if ("/health".equals(path)) {
                    send(ctx, OK, health(), keepAlive);
                } else if ("/tools".equals(path) && method == HttpMethod.GET) {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("success", true);
                    body.put("tools", bridge.listTools());
                    send(ctx, OK, body, keepAlive);
                } else if ("/tool".equals(path) && method == HttpMethod.POST) {
                    handleToolCall(ctx, request.content().toString(CharsetUtil.UTF_8), keepAlive);
                } else {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("error", "Not Found");
                    body.put("message", "Endpoint " + path + " not found");
                    body.put("availableEndpoints", ENDPOINTS);
                    send(ctx, NOT_FOUND, body, keepAlive);
                }
            } catch (Exception e) {
                log.error("Front door error on {}: {}", path, e.getMessage(), e);
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("error", "Internal Server Error");
                body.put("message", Futures.describe(e));
                send(ctx, INTERNAL_SERVER_ERROR, body, keepAlive);
            }
        }

        private void handleToolCall(ChannelHandlerContext ctx, String rawBody, boolean keepAlive) {
            ToolCallRequest call;
            try {
                call = ToolCallRequest.parse(rawBody);
            } catch (InvalidRequestException e) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("success", false);
                body.put("error", "Bad Request");
                body.put("message", e.getMessage());
                body.put("expectedFormat", EXPECTED_FORMAT);
                send(ctx, BAD_REQUEST, body, keepAlive);
                return;
            }

            log.debug("Front door call: {}", call.name());
            bridge.execute(call.name(), call.arguments()).whenComplete((result, error) -> {
                if (error == null && !result.isErrorResult()) {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("success", true);
                    body.put("tool", call.name());
                    body.put("result", result);
                    send(ctx, OK, body, keepAlive);
                    return;
                }
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("success", false);
                body.put("error", "Tool Execution Error");
                body.put("message", error != null ? Futures.describe(error) : failureText(result));
                body.put("tool", call.name());
                if (result != null) {
                    body.put("result", result);
                }
                send(ctx, INTERNAL_SERVER_ERROR, body, keepAlive);
            });
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("Front door channel error: {}", cause.getMessage());
            ctx.close();
        }

        private void send(ChannelHandlerContext ctx, HttpResponseStatus status, Object body,
                          boolean keepAlive) {
            try {
                byte[] bytes = body != null ? mapper.writeValueAsBytes(body) : new byte[0];
                ByteBuf buf = Unpooled.wrappedBuffer(bytes);
                FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, buf);
                HttpHeaders headers = response.headers();
                if (body != null) {
                    headers.set(CONTENT_TYPE, "application/json");
                }
                headers.setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
                headers.set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
                headers.set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS");
                headers.set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type");
                HttpUtil.setKeepAlive(response, keepAlive);
                ChannelFuture written = ctx.writeAndFlush(response);
                if (!keepAlive) {
                    written.addListener(ChannelFutureListener.CLOSE);
                }
            } catch (Exception e) {
                log.error("Failed to serialize response: {}", e.getMessage());
                ctx.close();
            }
        }
    }

    private static String failureText(CallToolResult result) {
        String text = result.firstText();
        return text != null ? text : "Tool reported an error";
    }
}
