package com.botscript.runtime.instance;

/**
 * Boundary to the protocol client of a backend (TS3, Discord, ...). The
 * adapter reports what happens on the network through the bridge it is
 * attached to.
 */
public interface BackendAdapter {

    /** Called once when the adapter is installed on an instance. */
    void attach(BackendEventBridge bridge);

    /** Start connecting; returns false if a connection attempt cannot start. */
    boolean connect();

    boolean disconnect();

    boolean isConnected();

    String getBotClientId();

    String getNick();

    boolean setNick(String nick);

    /** Send a message to the server chat. */
    void chat(String message);
}
