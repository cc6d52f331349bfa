package com.botscript.runtime.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Backing that keeps the last saved snapshot in memory. Survives a store
 * restart within the same process, which is what tests need.
 */
public class InMemoryStoreBacking implements StoreBacking {

    private final AtomicReference<Map<StoreOwner, Map<String, JsonNode>>> saved =
            new AtomicReference<>(Map.of());
    private final AtomicInteger saveCount = new AtomicInteger();

    @Override
    public Map<StoreOwner, Map<String, JsonNode>> load() {
        return copy(saved.get());
    }

    @Override
    public void save(Map<StoreOwner, Map<String, JsonNode>> snapshot) {
        saved.set(copy(snapshot));
        saveCount.incrementAndGet();
    }

    public int getSaveCount() {
        return saveCount.get();
    }

    private static Map<StoreOwner, Map<String, JsonNode>> copy(Map<StoreOwner, Map<String, JsonNode>> source) {
        Map<StoreOwner, Map<String, JsonNode>> out = new LinkedHashMap<>();
        source.forEach((owner, entries) -> {
            Map<String, JsonNode> values = new LinkedHashMap<>();
            entries.forEach((k, v) -> values.put(k, v.deepCopy()));
            out.put(owner, values);
        });
        return out;
    }
}
