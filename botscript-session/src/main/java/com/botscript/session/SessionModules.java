package com.botscript.session;

import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.host.ScriptHost;
import com.botscript.session.modules.DbModule;
import com.botscript.session.modules.NetModule;
import com.botscript.session.modules.WsModule;

/**
 * Wires the privileged {@code net}, {@code ws} and {@code db} modules into a
 * host.
 */
public final class SessionModules {

    private SessionModules() {
    }

    /**
     * Create a session manager from the host's config, register the modules
     * and hand the manager to the host for shutdown.
     */
    public static SessionManager install(ScriptHost host) {
        SessionManager sessions = new SessionManager(host.getBus(), host.getConfig().getSessions());
        install(host, sessions);
        return sessions;
    }

    public static void install(ScriptHost host, SessionManager sessions) {
        host.registerModule(ModuleKind.NET, ctx -> new NetModule(sessions, host.getBus(), ctx));
        host.registerModule(ModuleKind.WS, ctx -> new WsModule(sessions, ctx));
        host.registerModule(ModuleKind.DB, ctx -> new DbModule(sessions, ctx));
        host.addService(sessions);
    }
}
