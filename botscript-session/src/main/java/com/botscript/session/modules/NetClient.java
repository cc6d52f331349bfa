package com.botscript.session.modules;

import com.botscript.runtime.error.ValidationError;
import com.botscript.runtime.event.EventBus;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.session.ConnectionEvent;
import com.botscript.session.ConnectionKind;
import com.botscript.session.socket.SocketConnection;

import java.util.List;
import java.util.Set;

/**
 * Script handle of one TCP connection.
 */
public class NetClient {

    private static final Set<String> EVENTS = Set.of("data", "close", "error");

    private final SocketConnection connection;
    private final EventBus bus;
    private final ScriptContext context;

    NetClient(SocketConnection connection, EventBus bus, ScriptContext context) {
        this.connection = connection;
        this.bus = bus;
        this.context = context;
    }

    /** Receives a {@code byte[]} for data, the message for errors and null on close. */
    @FunctionalInterface
    public interface Handler {
        void handle(Object data) throws Exception;
    }

    public String getId() {
        return connection.getId();
    }

    public boolean isOpen() {
        return connection.isOpen();
    }

    public void write(byte[] data) {
        connection.write(0, data.clone());
    }

    /** UTF-8 text. */
    public void write(String data) {
        write(data, null);
    }

    /**
     * @param format {@code hex}, {@code base64} or null for UTF-8 text
     * @throws ValidationError on an unknown format or undecodable data
     */
    public void write(String data, String format) {
        connection.write(0, Payloads.decode(data, format));
    }

    public void write(List<? extends Number> bytes) {
        connection.write(0, Payloads.fromNumbers(bytes));
    }

    /**
     * Listen for {@code data}, {@code close} or {@code error} on this connection.
     */
    public void on(String event, Handler handler) {
        if (!EVENTS.contains(event)) {
            throw new ValidationError("unknown net event: " + event);
        }
        String id = connection.getId();
        bus.on(context, ConnectionKind.STREAM_SOCKET.eventPrefix() + "." + event, e -> {
            if (e.payload() instanceof ConnectionEvent ce && id.equals(ce.connectionId())) {
                handler.handle(ce.data());
            }
        });
    }

    public void close() {
        connection.close();
    }
}
