package com.botscript.session.modules;

import com.botscript.runtime.error.ValidationError;
import com.botscript.session.database.DatabaseConnection;
import com.botscript.session.database.QueryCallback;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Script handle of one database session.
 */
public class DbConnection {

    private final DatabaseConnection connection;

    DbConnection(DatabaseConnection connection) {
        this.connection = connection;
    }

    public String getId() {
        return connection.getId();
    }

    public boolean isOpen() {
        return connection.isOpen();
    }

    /**
     * Run {@code sql} with positional parameters; rows arrive in
     * {@code callback} as column-name maps in column order.
     */
    public void query(String sql, List<?> params, QueryCallback callback) {
        if (sql == null || sql.isBlank()) {
            throw new ValidationError("sql is required");
        }
        if (callback == null) {
            throw new ValidationError("query callback is required");
        }
        connection.query(sql, params != null ? new ArrayList<>(params) : List.of(), callback);
    }

    public void query(String sql, QueryCallback callback) {
        query(sql, List.of(), callback);
    }

    public void exec(String sql, Object... params) {
        if (sql == null || sql.isBlank()) {
            throw new ValidationError("sql is required");
        }
        connection.exec(sql, Arrays.asList(params));
    }

    public void close() {
        connection.close();
    }
}
