package com.browsermcp.relay;

import com.browsermcp.common.errors.TransportException;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ExtensionSocket} over a Netty channel that completed the WebSocket handshake.
 */
@Slf4j
class NettyExtensionSocket implements ExtensionSocket {

    private final Channel channel;

    NettyExtensionSocket(Channel channel) {
        this.channel = channel;
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public void send(String text) {
        if (!channel.isActive()) {
            throw new TransportException("WebSocket is not open");
        }
        channel.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                // closing fires channelInactive, which fails whatever is pending
                log.debug("Extension write failed: {}", f.cause().getMessage());
                f.channel().close();
            }
        });
    }

    @Override
    public void close() {
        channel.close();
    }

    @Override
    public String toString() {
        return "NettyExtensionSocket[" + channel.remoteAddress() + "]";
    }
}
