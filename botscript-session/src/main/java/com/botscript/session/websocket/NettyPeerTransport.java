package com.botscript.session.websocket;

import com.botscript.session.ConnectionEvent;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link PeerTransport} over an upgraded Netty channel.
 */
public class NettyPeerTransport implements PeerTransport {

    private final Channel channel;
    private final AtomicBoolean closeSent = new AtomicBoolean();

    public NettyPeerTransport(Channel channel) {
        this.channel = channel;
    }

    @Override
    public CompletableFuture<Void> send(int messageType, Object payload) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        if (!channel.isActive()) {
            result.completeExceptionally(new IllegalStateException("peer is disconnected"));
            return result;
        }
        channel.writeAndFlush(frameOf(messageType, payload)).addListener(f -> {
            if (f.isSuccess()) {
                result.complete(null);
            } else {
                result.completeExceptionally(f.cause());
            }
        });
        return result;
    }

    static WebSocketFrame frameOf(int messageType, Object payload) {
        if (messageType == ConnectionEvent.TEXT_MESSAGE) {
            String text = payload instanceof byte[] bytes
                    ? new String(bytes, StandardCharsets.UTF_8)
                    : String.valueOf(payload);
            return new TextWebSocketFrame(text);
        }
        if (messageType == ConnectionEvent.BINARY_MESSAGE) {
            byte[] bytes = payload instanceof byte[] raw
                    ? raw
                    : String.valueOf(payload).getBytes(StandardCharsets.UTF_8);
            return new BinaryWebSocketFrame(Unpooled.wrappedBuffer(bytes));
        }
        throw new IllegalArgumentException("unsupported websocket message type " + messageType);
    }

    /**
     * Reserve the one close frame this side may send. Returns false once a
     * close frame was sent, or reserved for echoing the peer's.
     */
    boolean claimClose() {
        return closeSent.compareAndSet(false, true);
    }

    @Override
    public void close() {
        if (claimClose() && channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.remoteAddress());
    }
}
