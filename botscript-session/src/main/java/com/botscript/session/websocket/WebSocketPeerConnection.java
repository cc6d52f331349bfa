package com.botscript.session.websocket;

import com.botscript.runtime.event.EventBus;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.session.Connection;
import com.botscript.session.ConnectionKind;
import com.botscript.session.ConnectionState;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * An accepted websocket peer. It starts open; the owner sees {@code ws.connect},
 * then {@code ws.data} per message and finally {@code ws.close} or
 * {@code ws.error}.
 */
public class WebSocketPeerConnection extends Connection {

    private final PeerTransport transport;

    public WebSocketPeerConnection(String id, ScriptContext owner, EventBus bus, Executor ioPool,
            PeerTransport transport) {
        super(id, ConnectionKind.WEBSOCKET_PEER, owner, bus, ioPool, ConnectionState.OPEN);
        this.transport = transport;
    }

    public PeerTransport getTransport() {
        return transport;
    }

    @Override
    protected void connect(CompletableFuture<Void> opened) {
        opened.complete(null);
    }

    /** Raise {@code ws.connect}; called once the peer is registered with its owner. */
    public void announce() {
        emit("connect", 0, null);
    }

    public void onMessage(int messageType, Object data) {
        received(messageType, data);
    }

    public void onRemoteClose() {
        remoteClosed();
    }

    public void onError(Throwable cause) {
        transportFailed(cause);
    }

    @Override
    protected void doWrite(int messageType, Object data) {
        transport.send(messageType, data).whenComplete((v, err) -> {
            if (err != null) {
                operationFailed(err);
            }
        });
    }

    @Override
    protected void doClose() {
        transport.close();
    }
}
