package com.botscript.session;

/**
 * Receives the single outcome of opening a connection, on the owner's
 * instance queue. {@code error} is null on success.
 */
@FunctionalInterface
public interface OpenCallback {

    void onResult(ConnectionError error) throws Exception;
}
