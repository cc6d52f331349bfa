package com.botscript.session.modules;

import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.capability.ScriptModule;
import com.botscript.runtime.event.EventBus;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.session.OpenCallback;
import com.botscript.session.SessionManager;
import com.botscript.session.socket.SocketConnection;
import com.botscript.session.socket.SocketParams;

import java.util.Map;

/**
 * Privileged {@code net} module: outbound TCP connections.
 */
public class NetModule implements ScriptModule {

    private final SessionManager sessions;
    private final EventBus bus;
    private final ScriptContext context;

    public NetModule(SessionManager sessions, EventBus bus, ScriptContext context) {
        this.sessions = sessions;
        this.bus = bus;
        this.context = context;
    }

    @Override
    public ModuleKind kind() {
        return ModuleKind.NET;
    }

    /**
     * Connect to {@code host}:{@code port}. The callback runs once on the
     * script's queue with null on success or the connect error.
     *
     * @throws com.botscript.runtime.error.ValidationError if host or port is missing or malformed
     */
    public NetClient connect(Map<String, ?> params, OpenCallback callback) {
        SocketConnection conn = sessions.openSocket(context, SocketParams.from(params), callback);
        return new NetClient(conn, bus, context);
    }
}
