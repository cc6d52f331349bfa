package com.botscript.session.modules;

import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.capability.ScriptModule;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.session.OpenCallback;
import com.botscript.session.SessionManager;
import com.botscript.session.database.DatabaseConnection;
import com.botscript.session.database.DatabaseParams;

import java.util.Map;

/**
 * Privileged {@code db} module: JDBC sessions.
 */
public class DbModule implements ScriptModule {

    private final SessionManager sessions;
    private final ScriptContext context;

    public DbModule(SessionManager sessions, ScriptContext context) {
        this.sessions = sessions;
        this.context = context;
    }

    @Override
    public ModuleKind kind() {
        return ModuleKind.DB;
    }

    /**
     * Open a session. Statements may be issued right away; they run once the
     * connect finishes, or fail with its error.
     *
     * @throws com.botscript.runtime.error.ValidationError on an unknown driver or a missing host
     */
    public DbConnection connect(Map<String, ?> params, OpenCallback callback) {
        DatabaseConnection conn = sessions.openDatabase(context, DatabaseParams.from(params), callback);
        return new DbConnection(conn);
    }
}
