package com.botscript.session.websocket;

import java.util.concurrent.CompletableFuture;

/**
 * The network side of an accepted websocket peer, as provided by the web
 * layer.
 */
public interface PeerTransport {

    /**
     * Send one message.
     *
     * @param messageType 1 for text, 2 for binary
     * @param payload     {@code String} or {@code byte[]}
     */
    CompletableFuture<Void> send(int messageType, Object payload);

    /** Close the peer. Idempotent. */
    void close();

    String remoteAddress();
}
