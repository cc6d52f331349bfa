package com.botscript.session.modules;

import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.capability.ScriptModule;
import com.botscript.runtime.error.ValidationError;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.session.Connection;
import com.botscript.session.ConnectionEvent;
import com.botscript.session.ConnectionKind;
import com.botscript.session.SessionManager;

import java.util.List;

/**
 * Privileged {@code ws} module: talk to the websocket peers connected to
 * this script. Peers are announced with {@code ws.connect}.
 */
public class WsModule implements ScriptModule {

    private final SessionManager sessions;
    private final ScriptContext context;

    public WsModule(SessionManager sessions, ScriptContext context) {
        this.sessions = sessions;
        this.context = context;
    }

    @Override
    public ModuleKind kind() {
        return ModuleKind.WS;
    }

    /**
     * @param messageType 1 for text, 2 for binary
     * @return false if no such peer is connected to this script
     */
    public boolean write(String connectionId, int messageType, Object message) {
        checkType(messageType);
        return sessions.write(context, ConnectionKind.WEBSOCKET_PEER, connectionId, messageType, message);
    }

    /** Send to every peer of this script; returns how many were addressed. */
    public int broadcast(int messageType, Object message) {
        checkType(messageType);
        List<Connection> peers = sessions.connectionsOf(context, ConnectionKind.WEBSOCKET_PEER);
        peers.forEach(p -> p.write(messageType, message));
        return peers.size();
    }

    public boolean close(String connectionId) {
        return sessions.close(context, ConnectionKind.WEBSOCKET_PEER, connectionId);
    }

    /** Ids of the peers currently connected to this script. */
    public List<String> getConnections() {
        return sessions.connectionsOf(context, ConnectionKind.WEBSOCKET_PEER).stream()
                .map(Connection::getId)
                .toList();
    }

    private static void checkType(int messageType) {
        if (messageType != ConnectionEvent.TEXT_MESSAGE && messageType != ConnectionEvent.BINARY_MESSAGE) {
            throw new ValidationError("websocket message type must be 1 (text) or 2 (binary), got " + messageType);
        }
    }
}
