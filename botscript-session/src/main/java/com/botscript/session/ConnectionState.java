package com.botscript.session;

/**
 * <pre>
 * CONNECTING -> OPEN | FAILED
 * OPEN       -> CLOSED | ERRORED
 * </pre>
 * FAILED, CLOSED and ERRORED are terminal.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    FAILED,
    CLOSED,
    ERRORED;

    public boolean isTerminal() {
        return this == FAILED || this == CLOSED || this == ERRORED;
    }

    public boolean canTransitionTo(ConnectionState next) {
        return switch (this) {
            case CONNECTING -> next == OPEN || next == FAILED;
            case OPEN -> next == CLOSED || next == ERRORED;
            default -> false;
        };
    }
}
