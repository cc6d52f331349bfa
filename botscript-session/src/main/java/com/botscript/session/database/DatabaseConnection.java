package com.botscript.session.database;

import com.botscript.runtime.event.EventBus;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.session.Connection;
import com.botscript.session.ConnectionError;
import com.botscript.session.ConnectionKind;
import com.botscript.session.ConnectionState;
import lombok.extern.slf4j.Slf4j;

import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * JDBC session. The connect and every statement run on the connection's
 * serial worker, so results come back in the order the statements were
 * issued. Statements issued while connecting wait for the connect.
 */
@Slf4j
public class DatabaseConnection extends Connection {

    private final DatabaseParams params;
    private final long connectTimeoutMs;
    private volatile java.sql.Connection jdbc;

    public DatabaseConnection(String id, ScriptContext owner, EventBus bus, Executor ioPool,
            DatabaseParams params, long connectTimeoutMs) {
        super(id, ConnectionKind.DATABASE, owner, bus, ioPool, ConnectionState.CONNECTING);
        this.params = params;
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public DatabaseParams getParams() {
        return params;
    }

    @Override
    protected void connect(CompletableFuture<Void> opened) {
        execute(() -> {
            try {
                jdbc = DriverManager.getConnection(params.jdbcUrl(), params.jdbcProperties(connectTimeoutMs));
                log.debug("Database session {} connected to {}", getId(), params);
                opened.complete(null);
            } catch (SQLException | RuntimeException e) {
                opened.completeExceptionally(e);
            }
        });
    }

    /**
     * Run a statement and hand its rows to {@code callback}. Statements that
     * produce no result set yield an empty row list.
     */
    public void query(String sql, List<?> args, QueryCallback callback) {
        execute(() -> {
            List<Map<String, Object>> rows;
            try {
                rows = run(sql, args);
            } catch (SQLException | RuntimeException e) {
                log.debug("Query failed on {}: {}", getId(), e.getMessage());
                deliver(callback, ConnectionError.of(getId(), e), null);
                return;
            }
            deliver(callback, null, rows);
        });
    }

    /** Run a statement whose result is not needed. Failures surface as {@code db.error}. */
    public void exec(String sql, List<?> args) {
        execute(() -> {
            try {
                run(sql, args);
            } catch (SQLException | RuntimeException e) {
                log.debug("Statement failed on {}: {}", getId(), e.getMessage());
                operationFailed(e);
            }
        });
    }

    private List<Map<String, Object>> run(String sql, List<?> args) throws SQLException {
        java.sql.Connection conn = jdbc;
        if (!isOpen() || conn == null) {
            throw new ConnectionError(getId(), "database session is " + getState().name().toLowerCase(Locale.ROOT));
        }
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < args.size(); i++) {
                stmt.setObject(i + 1, args.get(i));
            }
            if (!stmt.execute()) {
                return Collections.emptyList();
            }
            try (ResultSet rs = stmt.getResultSet()) {
                return readRows(rs);
            }
        }
    }

    static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 1; c <= columns; c++) {
                row.put(meta.getColumnLabel(c), rs.getObject(c));
            }
            rows.add(row);
        }
        return rows;
    }

    private void deliver(QueryCallback callback, ConnectionError error, List<Map<String, Object>> rows) {
        getOwner().post(() -> {
            if (isSuppressed()) {
                return;
            }
            try {
                callback.onResult(error, rows);
            } catch (Exception e) {
                log.error("Query callback error [{} in {}]: {}", getId(), getOwner().getId(),
                        e.getMessage() != null ? e.getMessage() : e.toString());
            }
        });
    }

    @Override
    protected void doWrite(int messageType, Object data) {
        throw new UnsupportedOperationException("database sessions accept statements, not raw writes");
    }

    @Override
    protected void doClose() throws SQLException {
        java.sql.Connection conn = jdbc;
        if (conn != null && !conn.isClosed()) {
            conn.close();
            log.debug("Database session {} closed", getId());
        }
    }
}
