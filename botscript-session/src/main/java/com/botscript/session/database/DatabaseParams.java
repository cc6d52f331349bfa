package com.botscript.session.database;

import com.botscript.runtime.error.ValidationError;

import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Connection parameters of a database session.
 * <p>
 * {@code sqlite3} opens a private in-memory database (served by H2);
 * {@code h2} takes the H2 database name from {@code database};
 * {@code mysql} and {@code postgres} require a host.
 */
public record DatabaseParams(String driver, String host, Integer port, String username,
        String password, String database) {

    public static final String SQLITE3 = "sqlite3";
    public static final String H2 = "h2";
    public static final String MYSQL = "mysql";
    public static final String POSTGRES = "postgres";

    public DatabaseParams {
        if (driver == null || driver.isBlank()) {
            throw new ValidationError("database driver is required");
        }
        driver = driver.trim().toLowerCase(Locale.ROOT);
        switch (driver) {
            case SQLITE3, H2 -> {
            }
            case MYSQL, POSTGRES -> {
                if (host == null || host.isBlank()) {
                    throw new ValidationError("database host is required for driver " + driver);
                }
            }
            default -> throw new ValidationError("unknown database driver: " + driver);
        }
        if (port != null && (port < 1 || port > 65535)) {
            throw new ValidationError("database port must be between 1 and 65535, got " + port);
        }
    }

    /**
     * Read the parameters a script passes to {@code db.connect}.
     *
     * @throws ValidationError on a missing or unknown driver, or a missing host
     */
    public static DatabaseParams from(Map<String, ?> params) {
        if (params == null) {
            throw new ValidationError("database parameters are required");
        }
        return new DatabaseParams(
                text(params, "driver"),
                text(params, "host"),
                port(params.get("port")),
                text(params, "username"),
                text(params, "password"),
                text(params, "database"));
    }

    private static String text(Map<String, ?> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw new ValidationError("database " + key + " must be a string");
        }
        return s;
    }

    private static Integer port(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationError("database port is not a number: " + value);
        }
    }

    public String jdbcUrl() {
        String db = database != null ? database : "";
        return switch (driver) {
            case SQLITE3 -> "jdbc:h2:mem:";
            case H2 -> db.isEmpty() ? "jdbc:h2:mem:" : "jdbc:h2:" + db;
            case MYSQL -> "jdbc:mysql://" + host + ":" + (port != null ? port : 3306) + "/" + db;
            case POSTGRES -> "jdbc:postgresql://" + host + ":" + (port != null ? port : 5432) + "/" + db;
            default -> throw new IllegalStateException("unknown driver " + driver);
        };
    }

    /**
     * Driver properties: credentials plus a connect timeout where the driver
     * accepts one.
     */
    public Properties jdbcProperties(long connectTimeoutMs) {
        Properties props = new Properties();
        if (username != null) {
            props.setProperty("user", username);
        }
        if (password != null) {
            props.setProperty("password", password);
        }
        switch (driver) {
            case POSTGRES -> props.setProperty("connectTimeout",
                    String.valueOf(Math.max(1, connectTimeoutMs / 1000)));
            case MYSQL -> props.setProperty("connectTimeout", String.valueOf(connectTimeoutMs));
            default -> {
            }
        }
        return props;
    }

    @Override
    public String toString() {
        // keep the password out of logs
        return "DatabaseParams{" + driver + ", host=" + host + ", port=" + port
                + ", database=" + database + ", username=" + username + "}";
    }
}
