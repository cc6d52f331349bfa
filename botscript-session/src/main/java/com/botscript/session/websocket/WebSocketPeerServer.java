package com.botscript.session.websocket;

import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.host.ScriptHost;
import com.botscript.runtime.instance.Instance;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.session.ConnectionEvent;
import com.botscript.session.SessionManager;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBufUtil;
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
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts websocket peers for scripts.
 * <p>
 * A peer connects to {@code /api/v1/b/{botId}/i/{instanceId}/ws/{scriptName}}
 * and is handed to that script, which must be loaded and have resolved the
 * {@code ws} module.
 */
@Slf4j
public class WebSocketPeerServer implements AutoCloseable {

    static final Pattern PEER_PATH = Pattern.compile("^/api/v1/b/([^/]+)/i/([^/]+)/ws/([^/]+)/?$");
    private static final int MAX_MESSAGE_BYTES = 1 << 20;

    private final ScriptHost scriptHost;
    private final SessionManager sessions;
    private final String host;
    private final int requestedPort;

    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public WebSocketPeerServer(ScriptHost scriptHost, SessionManager sessions, String host, int port) {
        this.scriptHost = scriptHost;
        this.sessions = sessions;
        this.host = host;
        this.requestedPort = port;
    }

    /**
     * Bind and start accepting peers.
     */
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
                                new HttpObjectAggregator(65536),
                                new WebSocketFrameAggregator(MAX_MESSAGE_BYTES),
                                new PeerHandler());
                    }
                });

        serverChannel = b.bind(host, requestedPort).sync().channel();
        log.info("Websocket peer server started on {}:{}", host, getPort());
    }

    /** Bound port; differs from the requested one when that was 0. */
    public int getPort() {
        if (serverChannel == null) {
            return requestedPort;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public String getHost() {
        return host;
    }

    /**
     * Stop accepting peers and drop the open ones.
     */
    @Override
    public void close() {
        if (serverChannel != null) {
            try {
                serverChannel.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (bossGroup != null) bossGroup.shutdownGracefully();
        if (workerGroup != null) workerGroup.shutdownGracefully();
        log.info("Websocket peer server stopped");
    }

    /** The live, ws-enabled script context a request path addresses. */
    Optional<ScriptContext> resolveOwner(String path) {
        Matcher m = PEER_PATH.matcher(path);
        if (!m.matches() || !m.group(1).equals(scriptHost.getConfig().getBotId())) {
            return Optional.empty();
        }
        return scriptHost.getInstance(m.group(2))
                .filter(Instance::isRunning)
                .flatMap(instance -> instance.getContext(m.group(3)))
                .filter(ScriptContext::isActive)
                .filter(ctx -> ctx.getResolvedModules().contains(ModuleKind.WS));
    }

    // ==================== Peer Handler ====================

    private class PeerHandler extends SimpleChannelInboundHandler<Object> {

        private WebSocketServerHandshaker handshaker;
        private volatile NettyPeerTransport transport;
        private volatile WebSocketPeerConnection peer;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof FullHttpRequest request) {
                handleHttpRequest(ctx, request);
            } else if (msg instanceof WebSocketFrame frame) {
                handleWebSocketFrame(ctx, frame);
            }
        }

        private void handleHttpRequest(ChannelHandlerContext ctx, FullHttpRequest req) {
            if (!req.decoderResult().isSuccess()) {
                sendResponse(ctx, HttpResponseStatus.BAD_REQUEST, "Bad Request");
                return;
            }
            String path = new QueryStringDecoder(req.uri()).path();
            if (!PEER_PATH.matcher(path).matches()) {
                sendResponse(ctx, HttpResponseStatus.NOT_FOUND, "Not Found");
                return;
            }
            if (!req.headers().contains(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true)) {
                sendResponse(ctx, HttpResponseStatus.BAD_REQUEST, "Expected a websocket upgrade");
                return;
            }
            Optional<ScriptContext> owner = resolveOwner(path);
            if (owner.isEmpty()) {
                sendResponse(ctx, HttpResponseStatus.NOT_FOUND, "No websocket-enabled script at " + path);
                return;
            }

            WebSocketServerHandshakerFactory wsFactory = new WebSocketServerHandshakerFactory(
                    "ws://" + req.headers().get(HttpHeaderNames.HOST) + path, null, true, MAX_MESSAGE_BYTES);
            handshaker = wsFactory.newHandshaker(req);
            if (handshaker == null) {
                WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
                return;
            }
            ScriptContext context = owner.get();
            handshaker.handshake(ctx.channel(), req).addListener((ChannelFuture f) -> {
                if (!f.isSuccess()) {
                    log.debug("Websocket handshake failed for {}: {}", context.getId(), f.cause().getMessage());
                    return;
                }
                try {
                    transport = new NettyPeerTransport(ctx.channel());
                    peer = sessions.acceptPeer(context, transport);
                } catch (IllegalStateException e) {
                    log.debug("Refusing peer for {}: {}", context.getId(), e.getMessage());
                    ctx.close();
                }
            });
        }

        private void handleWebSocketFrame(ChannelHandlerContext ctx, WebSocketFrame frame) {
            if (frame instanceof CloseWebSocketFrame) {
                NettyPeerTransport t = transport;
                if (t == null || t.claimClose()) {
                    handshaker.close(ctx.channel(), (CloseWebSocketFrame) frame.retain());
                } else {
                    // reply to our own close frame
                    ctx.close();
                }
                WebSocketPeerConnection p = peer;
                if (p != null) {
                    p.onRemoteClose();
                }
                return;
            }
            if (frame instanceof PingWebSocketFrame) {
                ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
                return;
            }
            WebSocketPeerConnection p = peer;
            if (p == null) {
                return;
            }
            if (frame instanceof TextWebSocketFrame text) {
                p.onMessage(ConnectionEvent.TEXT_MESSAGE, text.text());
            } else if (frame instanceof BinaryWebSocketFrame binary) {
                p.onMessage(ConnectionEvent.BINARY_MESSAGE, ByteBufUtil.getBytes(binary.content()));
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            WebSocketPeerConnection p = peer;
            if (p != null) {
                p.onRemoteClose();
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("Peer handler error: {}", cause.getMessage());
            WebSocketPeerConnection p = peer;
            if (p != null) {
                p.onError(cause);
            }
            ctx.close();
        }
    }

    private static void sendResponse(ChannelHandlerContext ctx, HttpResponseStatus status, String body) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer(body, CharsetUtil.UTF_8));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        HttpUtil.setContentLength(response, response.content().readableBytes());
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }
}
