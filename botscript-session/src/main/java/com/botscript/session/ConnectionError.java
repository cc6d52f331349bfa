package com.botscript.session;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Transport-level failure of a connection. Handed to scripts as the error
 * argument of a callback or carried by an error event; never thrown at them.
 */
public class ConnectionError extends RuntimeException {

    private final String connectionId;

    public ConnectionError(String connectionId, String message) {
        super(message);
        this.connectionId = connectionId;
    }

    public ConnectionError(String connectionId, String message, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
    }

    /** Wrap any failure, keeping a useful message. */
    public static ConnectionError of(String connectionId, Throwable cause) {
        if (cause instanceof ConnectionError ce) {
            return ce;
        }
        Throwable root = cause;
        while (root.getCause() != null && root.getCause() != root
                && (root instanceof CompletionException
                || root instanceof ExecutionException)) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        return new ConnectionError(connectionId, message, root);
    }

    public String getConnectionId() {
        return connectionId;
    }
}
