package com.browsermcp.relay;

import com.browsermcp.common.errors.PortConflictException;
import com.browsermcp.common.infra.PortEvictor;
import com.browsermcp.common.infra.PortProbe;
import io.netty.bootstrap.ServerBootstrap;
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
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;
import io.netty.util.CharsetUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;

/**
 * WebSocket endpoint the browser extension connects to.
 *
 * <p>Startup frees the port first: stale holders are evicted, then the port is polled until
 * bindable. Every completed handshake is handed to {@link ConnectionManager#attach} on the
 * channel's event loop, so the newest connection always wins.
 */
@Slf4j
public class ExtensionSocketListener implements AutoCloseable {

    /** Screenshots arrive as base64 in a single frame. */
    static final int MAX_FRAME_BYTES = 64 * 1024 * 1024;

    @Getter private final String host;
    private final int port;
    private final ConnectionManager connections;
    private final PortEvictor evictor;
    private final PortProbe probe;
    private final long portFreeWaitMs;

    private volatile Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    @Getter private volatile int boundPort = -1;

    public ExtensionSocketListener(String host, int port, ConnectionManager connections,
                                   PortEvictor evictor, PortProbe probe, long portFreeWaitMs) {
        this.host = host;
        this.port = port;
        this.connections = connections;
        this.evictor = evictor;
        this.probe = probe;
        this.portFreeWaitMs = portFreeWaitMs;
    }

    /**
     * Free the port and start accepting connections.
     *
     * @throws PortConflictException if the port is still held after eviction, or bind fails
     */
    public void start() throws InterruptedException {
        if (port > 0) {
            evictor.evict(port);
            if (!probe.awaitBindable(port, portFreeWaitMs)) {
                throw new PortConflictException(port, portFreeWaitMs);
            }
        }

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
                                new HttpObjectAggregator(65536),
                                new WebSocketFrameAggregator(MAX_FRAME_BYTES),
                                new ExtensionHandler());
                    }
                });

        try {
            serverChannel = b.bind(host, port).sync().channel();
        } catch (InterruptedException e) {
            shutdownGroups();
            throw e;
        } catch (Exception e) {
            shutdownGroups();
            throw new PortConflictException(port, e);
        }
        boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("Extension WebSocket listening on ws://{}:{}", host, boundPort);
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
            throw new IllegalStateException("Listener is not started");
        }
        return channel.closeFuture();
    }

    /**
     * Stop accepting connections. The attached connection, if any, is left to the
     * {@link ConnectionManager}.
     */
    @Override
    public void close() {
        if (serverChannel != null) {
            try {
                serverChannel.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            serverChannel = null;
        }
        shutdownGroups();
        log.info("Extension WebSocket listener stopped");
    }

    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
    }

    // ==================== Handler ====================

    private class ExtensionHandler extends SimpleChannelInboundHandler<Object> {

        private WebSocketServerHandshaker handshaker;
        private NettyExtensionSocket socket;
        private MessageCorrelator correlator;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof FullHttpRequest request) {
                handleHttpRequest(ctx, request);
            } else if (msg instanceof WebSocketFrame frame) {
                handleWebSocketFrame(ctx, frame);
            }
        }

        private void handleHttpRequest(ChannelHandlerContext ctx, FullHttpRequest req) {
            if (!req.headers().contains(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true)) {
                sendResponse(ctx, HttpResponseStatus.UPGRADE_REQUIRED, "Upgrade Required");
                return;
            }

            WebSocketServerHandshakerFactory wsFactory = new WebSocketServerHandshakerFactory(
                    "ws://" + req.headers().get(HttpHeaderNames.HOST) + req.uri(), null, true,
                    MAX_FRAME_BYTES);
            handshaker = wsFactory.newHandshaker(req);
            if (handshaker == null) {
                WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
                return;
            }
            handshaker.handshake(ctx.channel(), req);
            socket = new NettyExtensionSocket(ctx.channel());
            correlator = connections.attach(socket);
        }

        private void handleWebSocketFrame(ChannelHandlerContext ctx, WebSocketFrame frame) {
            if (frame instanceof CloseWebSocketFrame) {
                handshaker.close(ctx.channel(), (CloseWebSocketFrame) frame.retain());
                return;
            }
            if (frame instanceof PingWebSocketFrame) {
                ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
                return;
            }
            if (frame instanceof TextWebSocketFrame textFrame && correlator != null) {
                correlator.onMessage(textFrame.text());
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (socket != null) {
                connections.detach(socket);
                correlator.onClose();
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("Extension socket error: {}", cause.getMessage());
            if (correlator != null) {
                correlator.onError(cause);
            }
            ctx.close();
        }

        private void sendResponse(ChannelHandlerContext ctx, HttpResponseStatus status, String body) {
            FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                    Unpooled.copiedBuffer(body, CharsetUtil.UTF_8));
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
