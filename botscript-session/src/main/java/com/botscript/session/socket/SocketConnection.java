package com.botscript.session.socket;

import com.botscript.runtime.event.EventBus;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.session.Connection;
import com.botscript.session.ConnectionKind;
import com.botscript.session.ConnectionState;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Outbound TCP connection. Received chunks are raised as {@code net.data}
 * with a {@code byte[]} payload.
 */
@Slf4j
public class SocketConnection extends Connection {

    private final SocketParams params;
    private final EventLoopGroup group;
    private final int connectTimeoutMs;
    private volatile Channel channel;

    public SocketConnection(String id, ScriptContext owner, EventBus bus, Executor ioPool,
            EventLoopGroup group, SocketParams params, int connectTimeoutMs) {
        super(id, ConnectionKind.STREAM_SOCKET, owner, bus, ioPool, ConnectionState.CONNECTING);
        this.params = params;
        this.group = group;
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public SocketParams getParams() {
        return params;
    }

    @Override
    protected void connect(CompletableFuture<Void> opened) {
        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
        ChannelFuture future = b.connect(params.host(), params.port());
        future.addListener((ChannelFuture f) -> {
            if (f.isSuccess()) {
                channel = f.channel();
                opened.complete(null);
            } else {
                opened.completeExceptionally(f.cause());
            }
        });
    }

    @Override
    protected void doWrite(int messageType, Object data) {
        byte[] bytes = data instanceof byte[] raw
                ? raw
                : String.valueOf(data).getBytes(StandardCharsets.UTF_8);
        channel.writeAndFlush(Unpooled.wrappedBuffer(bytes)).addListener((ChannelFuture f) -> {
            if (!f.isSuccess()) {
                operationFailed(f.cause());
            }
        });
    }

    @Override
    protected void doClose() {
        Channel ch = channel;
        if (ch != null && ch.isOpen()) {
            ch.close();
        }
    }

    private class InboundHandler extends SimpleChannelInboundHandler<ByteBuf> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
            received(0, ByteBufUtil.getBytes(msg));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            remoteClosed();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("Socket {} error: {}", getId(), cause.getMessage());
            transportFailed(cause);
            ctx.close();
        }
    }
}
