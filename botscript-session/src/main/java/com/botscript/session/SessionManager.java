package com.botscript.session;

import com.botscript.common.config.BotScriptConfig.SessionsConfig;
import com.botscript.common.config.ConfigDefaults;
import com.botscript.runtime.error.ValidationError;
import com.botscript.runtime.event.EventBus;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.session.database.DatabaseConnection;
import com.botscript.session.database.DatabaseParams;
import com.botscript.session.socket.SocketConnection;
import com.botscript.session.socket.SocketParams;
import com.botscript.session.websocket.PeerTransport;
import com.botscript.session.websocket.WebSocketPeerConnection;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Owns every externally driven connection: outbound sockets, database
 * sessions and accepted websocket peers.
 * <p>
 * Each connection belongs to one script context and is registered as one of
 * its resources, so unloading the script closes it. Connect work happens on
 * Netty's event loop or the shared I/O pool, never on an instance queue; the
 * single open result is posted back to the owner's queue.
 */
@Slf4j
public class SessionManager implements AutoCloseable {

    private final EventBus bus;
    private final long connectTimeoutMs;
    private final EventLoopGroup group;
    private final ExecutorService ioPool;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicBoolean closed = new AtomicBoolean();

    public SessionManager(EventBus bus, SessionsConfig config) {
        this.bus = Objects.requireNonNull(bus, "bus");
        SessionsConfig cfg = config != null ? config : new SessionsConfig();
        this.connectTimeoutMs = cfg.getConnectTimeoutMs() != null && cfg.getConnectTimeoutMs() > 0
                ? cfg.getConnectTimeoutMs() : ConfigDefaults.DEFAULT_CONNECT_TIMEOUT_MS;
        int threads = cfg.getIoThreads() != null && cfg.getIoThreads() > 0
                ? cfg.getIoThreads() : ConfigDefaults.DEFAULT_IO_THREADS;
        this.group = new NioEventLoopGroup(threads);
        AtomicInteger counter = new AtomicInteger();
        this.ioPool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "session-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Session manager started ({} I/O threads, connect timeout {} ms)", threads, connectTimeoutMs);
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    // =========================================================================
    // Open
    // =========================================================================

    /**
     * Open a connection of {@code kind} from script-supplied parameters.
     *
     * @throws ValidationError if the parameters are malformed; nothing is
     *                         allocated and the callback is never called
     */
    public Connection open(ScriptContext owner, ConnectionKind kind, Map<String, ?> params, OpenCallback callback) {
        return switch (kind) {
            case STREAM_SOCKET -> openSocket(owner, SocketParams.from(params), callback);
            case DATABASE -> openDatabase(owner, DatabaseParams.from(params), callback);
            case WEBSOCKET_PEER -> throw new ValidationError("websocket peers are accepted, not opened");
        };
    }

    public SocketConnection openSocket(ScriptContext owner, SocketParams params, OpenCallback callback) {
        return start(owner, callback, id -> new SocketConnection(id, owner, bus, ioPool, group, params,
                (int) Math.min(Integer.MAX_VALUE, connectTimeoutMs)));
    }

    public DatabaseConnection openDatabase(ScriptContext owner, DatabaseParams params, OpenCallback callback) {
        return start(owner, callback, id -> new DatabaseConnection(id, owner, bus, ioPool, params, connectTimeoutMs));
    }

    <C extends Connection> C start(ScriptContext owner, OpenCallback callback, Function<String, C> factory) {
        ensureOpen();
        C conn = factory.apply(newId());
        conn.setOpenCallback(callback);
        if (!register(owner, conn)) {
            return conn;
        }

        CompletableFuture<Void> opened = new CompletableFuture<>();
        ScheduledFuture<?> timeout = group.schedule(() -> {
            if (conn.failOpen(new ConnectionError(conn.getId(), "connect timed out after " + connectTimeoutMs + " ms"))) {
                log.debug("Connection {} timed out", conn.getId());
            }
        }, connectTimeoutMs, TimeUnit.MILLISECONDS);

        opened.whenComplete((v, err) -> {
            timeout.cancel(false);
            if (err != null) {
                conn.failOpen(ConnectionError.of(conn.getId(), err));
            } else if (!conn.completeOpen()) {
                conn.discardLate();
            }
        });
        try {
            conn.connect(opened);
        } catch (RuntimeException e) {
            opened.completeExceptionally(e);
        }
        return conn;
    }

    /**
     * Adopt a websocket peer the web layer accepted on behalf of {@code owner}
     * and raise {@code ws.connect}.
     */
    public WebSocketPeerConnection acceptPeer(ScriptContext owner, PeerTransport transport) {
        ensureOpen();
        WebSocketPeerConnection peer = new WebSocketPeerConnection(newId(), owner, bus, ioPool, transport);
        if (register(owner, peer)) {
            log.debug("Websocket peer {} from {} accepted for {}", peer.getId(), transport.remoteAddress(), owner.getId());
            peer.announce();
        }
        return peer;
    }

    private boolean register(ScriptContext owner, Connection conn) {
        connections.put(conn.getId(), conn);
        conn.setOnTerminal(c -> {
            connections.remove(c.getId());
            owner.removeResource(c);
        });
        if (!owner.addResource(conn)) {
            // owner was unloaded meanwhile; addResource already closed it
            connections.remove(conn.getId());
            return false;
        }
        if (conn.getState().isTerminal()) {
            owner.removeResource(conn);
        }
        return true;
    }

    private String newId() {
        return "conn-" + nextId.getAndIncrement();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("session manager is closed");
        }
    }

    // =========================================================================
    // Operations by id
    // =========================================================================

    public Optional<Connection> get(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    /** A live connection of {@code owner} with the given id and kind. */
    public Optional<Connection> find(ScriptContext owner, ConnectionKind kind, String connectionId) {
        Connection conn = connectionId != null ? connections.get(connectionId) : null;
        if (conn == null || conn.getOwner() != owner || conn.getKind() != kind) {
            return Optional.empty();
        }
        return Optional.of(conn);
    }

    /**
     * Queue a write on a connection of {@code owner}.
     *
     * @return false if the connection is unknown, closed or owned by another script
     */
    public boolean write(ScriptContext owner, ConnectionKind kind, String connectionId, int messageType, Object data) {
        Optional<Connection> conn = find(owner, kind, connectionId);
        conn.ifPresent(c -> c.write(messageType, data));
        return conn.isPresent();
    }

    /** Close a connection of {@code owner}. Idempotent. */
    public boolean close(ScriptContext owner, ConnectionKind kind, String connectionId) {
        Optional<Connection> conn = find(owner, kind, connectionId);
        conn.ifPresent(Connection::close);
        return conn.isPresent();
    }

    /** Live connections of {@code owner} of the given kind, oldest first. */
    public List<Connection> connectionsOf(ScriptContext owner, ConnectionKind kind) {
        return connections.values().stream()
                .filter(c -> c.getOwner() == owner && c.getKind() == kind)
                .sorted((a, b) -> Long.compare(sequenceOf(a), sequenceOf(b)))
                .toList();
    }

    private static long sequenceOf(Connection conn) {
        return Long.parseLong(conn.getId().substring("conn-".length()));
    }

    public int size() {
        return connections.size();
    }

    // =========================================================================
    // Shutdown
    // =========================================================================

    /** Close every connection and stop the I/O threads. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<Connection> open = List.copyOf(connections.values());
        open.forEach(Connection::close);
        connections.clear();
        ioPool.shutdown();
        try {
            if (!ioPool.awaitTermination(5, TimeUnit.SECONDS)) {
                ioPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ioPool.shutdownNow();
        }
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        log.info("Session manager stopped ({} connections closed)", open.size());
    }
}
