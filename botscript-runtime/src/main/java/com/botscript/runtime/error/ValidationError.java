package com.botscript.runtime.error;

/**
 * Thrown synchronously to the caller when a value or a set of parameters is
 * malformed: a store value that is not a finite JSON tree, a connection request
 * without a host, an event payload that cannot cross instances.
 */
public class ValidationError extends RuntimeException {

    private final String path;

    public ValidationError(String message) {
        this(message, null);
    }

    public ValidationError(String message, String path) {
        super(path != null ? message + " at " + path : message);
        this.path = path;
    }

    /** Location of the offending element inside a value, e.g. {@code $.items[2]}; may be null. */
    public String getPath() {
        return path;
    }
}
