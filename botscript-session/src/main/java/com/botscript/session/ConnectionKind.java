package com.botscript.session;

public enum ConnectionKind {
    STREAM_SOCKET("net"),
    WEBSOCKET_PEER("ws"),
    DATABASE("db");

    private final String eventPrefix;

    ConnectionKind(String eventPrefix) {
        this.eventPrefix = eventPrefix;
    }

    /** Prefix of the events raised for connections of this kind, e.g. {@code net.data}. */
    public String eventPrefix() {
        return eventPrefix;
    }
}
