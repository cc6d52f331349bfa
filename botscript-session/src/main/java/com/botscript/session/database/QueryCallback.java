package com.botscript.session.database;

import com.botscript.session.ConnectionError;

import java.util.List;
import java.util.Map;

/**
 * Result of one query, delivered on the owner's instance queue. Exactly one
 * of {@code error} and {@code rows} is non-null.
 */
@FunctionalInterface
public interface QueryCallback {

    void onResult(ConnectionError error, List<Map<String, Object>> rows) throws Exception;
}
