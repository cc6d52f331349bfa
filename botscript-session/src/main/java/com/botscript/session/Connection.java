package com.botscript.session;

import com.botscript.runtime.event.EventBus;
import com.botscript.runtime.exec.SerialExecutor;
import com.botscript.runtime.script.ScriptContext;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * An externally driven connection owned by one script context.
 * <p>
 * Writes and other blocking work run on the connection's own serial worker,
 * never on the owner's instance queue. Inbound notifications become local
 * events for the owner. After {@link #close()} no further event for this
 * connection reaches the owner, including events already queued.
 */
@Slf4j
public abstract class Connection implements AutoCloseable {

    private final String id;
    private final ConnectionKind kind;
    private final ScriptContext owner;
    private final EventBus bus;
    private final AtomicReference<ConnectionState> state;
    private final AtomicBoolean completed = new AtomicBoolean();
    private final AtomicBoolean released = new AtomicBoolean();
    protected final SerialExecutor worker;
    private volatile boolean suppressed;
    private volatile OpenCallback openCallback;
    private volatile Consumer<Connection> onTerminal;

    protected Connection(String id, ConnectionKind kind, ScriptContext owner, EventBus bus,
            Executor ioPool, ConnectionState initial) {
        this.id = id;
        this.kind = kind;
        this.owner = owner;
        this.bus = bus;
        this.state = new AtomicReference<>(initial);
        this.worker = new SerialExecutor("conn-worker-" + id, ioPool);
    }

    public String getId() {
        return id;
    }

    public ConnectionKind getKind() {
        return kind;
    }

    public ScriptContext getOwner() {
        return owner;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    /** Whether the script closed this connection. */
    public boolean isSuppressed() {
        return suppressed;
    }

    void setOpenCallback(OpenCallback openCallback) {
        this.openCallback = openCallback;
    }

    void setOnTerminal(Consumer<Connection> onTerminal) {
        this.onTerminal = onTerminal;
    }

    // =========================================================================
    // Transport hooks
    // =========================================================================

    /**
     * Start the underlying connect and complete {@code opened} once the
     * transport is usable, or exceptionally when it cannot be established.
     */
    protected abstract void connect(CompletableFuture<Void> opened);

    /**
     * Send one message. Runs on the worker, only while the connection is open.
     * Asynchronous failures should be reported with {@link #operationFailed}.
     */
    protected abstract void doWrite(int messageType, Object data) throws Exception;

    /**
     * Release the transport. Runs on the worker; may run a second time when a
     * connect attempt completes after it was abandoned, so it must be idempotent.
     */
    protected abstract void doClose() throws Exception;

    // =========================================================================
    // Writes
    // =========================================================================

    /**
     * Queue a message on the connection's worker. Writes go out in call order,
     * and writes issued before {@link #close()} go out before the transport is
     * released. Failures surface as an {@code error} event, never as an exception.
     */
    public void write(int messageType, Object data) {
        if (suppressed) {
            log.debug("Dropping write on closed connection {}", id);
            return;
        }
        execute(() -> {
            ConnectionState current = state.get();
            if (current == ConnectionState.CONNECTING || current == ConnectionState.FAILED) {
                operationFailed(new ConnectionError(id, "connection is not open"));
                return;
            }
            try {
                doWrite(messageType, data);
            } catch (Exception e) {
                operationFailed(e);
            }
        });
    }

    /** Run blocking work for this connection on its worker. */
    protected void execute(Runnable task) {
        try {
            worker.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Connection {} dropped a task: I/O pool is shut down", id);
        }
    }

    // =========================================================================
    // State machine
    // =========================================================================

    protected boolean transition(ConnectionState from, ConnectionState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("illegal transition " + from + " -> " + to + " on " + id);
        }
        if (!state.compareAndSet(from, to)) {
            return false;
        }
        log.debug("Connection {} {} -> {}", id, from, to);
        if (to.isTerminal()) {
            Consumer<Connection> callback = onTerminal;
            if (callback != null) {
                callback.accept(this);
            }
        }
        return true;
    }

    /** CONNECTING to OPEN and post the success callback. False if the attempt already ended. */
    boolean completeOpen() {
        if (!transition(ConnectionState.CONNECTING, ConnectionState.OPEN)) {
            return false;
        }
        postResult(null);
        return true;
    }

    /** CONNECTING to FAILED, post the error callback and release the transport. */
    boolean failOpen(ConnectionError error) {
        if (!transition(ConnectionState.CONNECTING, ConnectionState.FAILED)) {
            return false;
        }
        postResult(error);
        release();
        return true;
    }

    private void postResult(ConnectionError error) {
        OpenCallback callback = openCallback;
        if (callback == null || !completed.compareAndSet(false, true)) {
            return;
        }
        owner.post(() -> {
            ConnectionError result = error == null && suppressed ? abandoned() : error;
            try {
                callback.onResult(result);
            } catch (Exception e) {
                log.error("Connect callback error [{} in {}]: {}", id, owner.getId(),
                        e.getMessage() != null ? e.getMessage() : e.toString());
            }
        });
    }

    // =========================================================================
    // Events
    // =========================================================================

    /** Emit {@code <prefix>.<name>} to the owner unless the script closed the connection. */
    protected void emit(String name, int messageType, Object data) {
        if (suppressed) {
            return;
        }
        bus.emitTo(owner, kind.eventPrefix() + "." + name, new ConnectionEvent(id, messageType, data),
                () -> !suppressed);
    }

    /** Inbound data; dropped unless the connection is open. */
    protected void received(int messageType, Object data) {
        if (isOpen()) {
            emit("data", messageType, data);
        }
    }

    /** The peer closed the connection. */
    protected void remoteClosed() {
        if (transition(ConnectionState.OPEN, ConnectionState.CLOSED)) {
            emit("close", 0, null);
            release();
        }
    }

    /** The transport failed while open. */
    protected void transportFailed(Throwable cause) {
        if (transition(ConnectionState.OPEN, ConnectionState.ERRORED)) {
            log.debug("Connection {} failed: {}", id, cause.toString());
            emit("error", 0, ConnectionError.of(id, cause).getMessage());
            release();
        }
    }

    /** A single operation failed; the connection stays open. */
    protected void operationFailed(Throwable cause) {
        emit("error", 0, ConnectionError.of(id, cause).getMessage());
    }

    // =========================================================================
    // Close
    // =========================================================================

    /**
     * Close the connection. Idempotent. No event for this connection is
     * delivered afterwards. A connection still connecting fails, and its open
     * callback receives an error, also when the connect succeeded concurrently.
     */
    @Override
    public void close() {
        suppressed = true;
        // completeOpen may move CONNECTING to OPEN between the read and the CAS
        while (true) {
            ConnectionState current = state.get();
            if (current == ConnectionState.CONNECTING) {
                if (failOpen(abandoned())) {
                    break;
                }
            } else if (current == ConnectionState.OPEN) {
                if (transition(ConnectionState.OPEN, ConnectionState.CLOSED)) {
                    break;
                }
            } else {
                break;
            }
        }
        release();
    }

    private ConnectionError abandoned() {
        return new ConnectionError(id, "connection closed before it was established");
    }

    /** A connect attempt finished after it was abandoned; drop whatever it produced. */
    void discardLate() {
        log.debug("Discarding late connect result of {}", id);
        execute(this::closeTransport);
    }

    protected void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            worker.execute(this::closeTransport);
        } catch (RejectedExecutionException e) {
            closeTransport();
        }
    }

    private void closeTransport() {
        try {
            doClose();
        } catch (Exception e) {
            log.warn("Failed to release connection {}: {}", id, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + id + ", " + state.get() + ", owner=" + owner.getId() + "}";
    }
}
