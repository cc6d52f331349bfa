package com.botscript.runtime.instance;

import com.botscript.common.logging.LogLevel;
import com.botscript.runtime.script.ScriptContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One running connection context to a backend, hosting the scripts loaded
 * into it.
 */
@Slf4j
public class Instance {

    private final String id;
    private final String botId;
    private final BackendKind backend;
    private final InstanceQueue queue;
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicInteger logLevel;
    private final Map<String, ScriptContext> contexts = Collections.synchronizedMap(new LinkedHashMap<>());
    private volatile String nick;
    private volatile String defaultChannelId;
    private volatile BackendAdapter backendAdapter;
    private volatile Throwable failure;

    public Instance(String id, String botId, BackendKind backend, int logLevel, Executor dispatchPool) {
        this.id = id;
        this.botId = botId;
        this.backend = backend;
        this.logLevel = new AtomicInteger(LogLevel.isValidNumeric(logLevel) ? logLevel : 3);
        this.queue = new InstanceQueue(id, dispatchPool, this::markFailed);
    }

    public String getId() {
        return id;
    }

    public String getBotId() {
        return botId;
    }

    public BackendKind getBackend() {
        return backend;
    }

    public InstanceQueue getQueue() {
        return queue;
    }

    // =========================================================================
    // State
    // =========================================================================

    public boolean isRunning() {
        return running.get();
    }

    /** Returns the previous value. */
    public boolean setRunning(boolean value) {
        return running.getAndSet(value);
    }

    public int getLogLevel() {
        return logLevel.get();
    }

    /**
     * Change the instance log level. Returns false and keeps the old level if
     * {@code level} is outside 0..11.
     */
    public boolean setLogLevel(int level) {
        if (!LogLevel.isValidNumeric(level)) {
            return false;
        }
        logLevel.set(level);
        return true;
    }

    public LogLevel getLogThreshold() {
        return LogLevel.fromNumeric(logLevel.get());
    }

    public String getNick() {
        return nick;
    }

    public void setNick(String nick) {
        this.nick = nick;
    }

    public String getDefaultChannelId() {
        return defaultChannelId;
    }

    public void setDefaultChannelId(String defaultChannelId) {
        this.defaultChannelId = defaultChannelId;
    }

    public BackendAdapter getBackendAdapter() {
        return backendAdapter;
    }

    public void setBackendAdapter(BackendAdapter backendAdapter) {
        this.backendAdapter = backendAdapter;
    }

    /** Unrecoverable failure: the execution queue can no longer be scheduled. */
    public void markFailed(Throwable cause) {
        failure = cause;
        running.set(false);
        log.error("Instance {} failed: {}", id, cause.toString());
    }

    public boolean isFailed() {
        return failure != null;
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    // =========================================================================
    // Script contexts
    // =========================================================================

    public Optional<ScriptContext> getContext(String scriptName) {
        return Optional.ofNullable(contexts.get(scriptName));
    }

    /** Contexts in load order. */
    public List<ScriptContext> getContexts() {
        synchronized (contexts) {
            return new ArrayList<>(contexts.values());
        }
    }

    /** Returns false if a context for the same script is already present. */
    public boolean addContext(ScriptContext context) {
        return contexts.putIfAbsent(context.getScriptName(), context) == null;
    }

    public void removeContext(ScriptContext context) {
        contexts.remove(context.getScriptName(), context);
    }

    @Override
    public String toString() {
        return "Instance{" + id + ", " + backend + "}";
    }
}
