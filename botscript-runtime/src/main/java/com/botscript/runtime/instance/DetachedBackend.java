package com.botscript.runtime.instance;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Backend used when no protocol client is installed. It connects instantly,
 * keeps chat messages in memory and reports its state changes as regular
 * backend events.
 */
@Slf4j
public class DetachedBackend implements BackendAdapter {

    private final String clientId = UUID.randomUUID().toString();
    private final List<String> chatLog = new CopyOnWriteArrayList<>();
    private volatile BackendEventBridge bridge;
    private volatile boolean connected;
    private volatile String nick;

    public DetachedBackend(String nick) {
        this.nick = nick;
    }

    @Override
    public void attach(BackendEventBridge bridge) {
        this.bridge = bridge;
    }

    @Override
    public boolean connect() {
        if (connected) {
            return true;
        }
        connected = true;
        if (bridge != null) {
            bridge.connected();
        }
        return true;
    }

    @Override
    public boolean disconnect() {
        if (!connected) {
            return false;
        }
        connected = false;
        if (bridge != null) {
            bridge.disconnected("requested");
        }
        return true;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public String getBotClientId() {
        return clientId;
    }

    @Override
    public String getNick() {
        return nick;
    }

    @Override
    public boolean setNick(String nick) {
        if (nick == null || nick.isBlank()) {
            return false;
        }
        this.nick = nick;
        return true;
    }

    @Override
    public void chat(String message) {
        chatLog.add(message);
        log.debug("chat: {}", message);
        if (bridge != null) {
            bridge.publish("chat", Map.of("text", message, "client", clientId));
        }
    }

    /** Messages sent through {@link #chat}, oldest first. */
    public List<String> getChatLog() {
        return List.copyOf(chatLog);
    }
}
