package com.botscript.runtime.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Map;

/**
 * Durable home of the store's entries. The store reads everything once at
 * start and hands over complete snapshots to save.
 */
public interface StoreBacking {

    Map<StoreOwner, Map<String, JsonNode>> load() throws IOException;

    void save(Map<StoreOwner, Map<String, JsonNode>> snapshot) throws IOException;
}
