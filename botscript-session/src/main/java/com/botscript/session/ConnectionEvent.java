package com.botscript.session;

/**
 * Payload of every connection event ({@code net.*}, {@code ws.*}).
 *
 * @param messageType websocket message type (1 text, 2 binary); 0 for other kinds
 * @param data        received bytes or text, the error message for error
 *                    events, null for connect and close events
 */
public record ConnectionEvent(String connectionId, int messageType, Object data) {

    public static final int TEXT_MESSAGE = 1;
    public static final int BINARY_MESSAGE = 2;

    public ConnectionEvent(String connectionId, Object data) {
        this(connectionId, 0, data);
    }
}
