package com.botscript.runtime.store;

import com.botscript.runtime.error.ValidationError;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tiered key/value state shared by every script and instance of the process.
 * <p>
 * Each (scope, owner) partition is an immutable map behind an
 * {@link AtomicReference}. Writers build a new map and install it by
 * compare-and-set, so every operation on a key is atomic and totally ordered
 * with the other operations on that key, readers never block, and
 * {@link #listAll} returns one consistent point in time. There is no
 * transaction spanning several keys.
 * <p>
 * Values go in and come out as deep copies; see {@link StoreValues}.
 */
@Slf4j
public class ScopedStore implements AutoCloseable {

    private final Map<StoreOwner, AtomicReference<Map<String, JsonNode>>> partitions = new ConcurrentHashMap<>();
    private final StoreBacking backing;
    private final AtomicBoolean dirty = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final ScheduledExecutorService flusher;

    /**
     * @param backing       durable storage, read once here
     * @param flushInterval delay between background saves; {@code null} or zero
     *                      disables the background flusher
     * @throws IOException if the backing cannot be read
     */
    public ScopedStore(StoreBacking backing, Duration flushInterval) throws IOException {
        this.backing = backing;
        backing.load().forEach((owner, entries) ->
                partitions.put(owner, new AtomicReference<>(Collections.unmodifiableMap(new LinkedHashMap<>(entries)))));

        if (flushInterval != null && !flushInterval.isZero() && !flushInterval.isNegative()) {
            this.flusher = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "store-flusher");
                t.setDaemon(true);
                return t;
            });
            long ms = flushInterval.toMillis();
            flusher.scheduleWithFixedDelay(this::flushQuietly, ms, ms, TimeUnit.MILLISECONDS);
        } else {
            this.flusher = null;
        }
    }

    /** Store without persistence beyond the process, no background flusher. */
    public static ScopedStore inMemory() {
        try {
            return new ScopedStore(new InMemoryStoreBacking(), null);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    // =========================================================================
    // Operations
    // =========================================================================

    /**
     * Overwrite {@code key} with a copy of {@code value}.
     *
     * @throws ValidationError if the key is null or the value is not a finite
     *                         serializable tree
     */
    public void set(StoreOwner owner, String key, Object value) {
        requireKey(key);
        JsonNode tree = StoreValues.toTree(value);
        partition(owner).updateAndGet(current -> {
            Map<String, JsonNode> next = new LinkedHashMap<>(current);
            next.put(key, tree);
            return Collections.unmodifiableMap(next);
        });
        dirty.set(true);
    }

    /**
     * Copy of the value stored under {@code key}. A stored {@code null} is
     * present and comes back as a JSON null node.
     */
    public Optional<JsonNode> get(StoreOwner owner, String key) {
        requireKey(key);
        AtomicReference<Map<String, JsonNode>> ref = partitions.get(owner);
        if (ref == null) {
            return Optional.empty();
        }
        JsonNode value = ref.get().get(key);
        return value == null ? Optional.empty() : Optional.of(value.deepCopy());
    }

    /** Remove {@code key}; a no-op if it is absent. */
    public void unset(StoreOwner owner, String key) {
        requireKey(key);
        AtomicReference<Map<String, JsonNode>> ref = partitions.get(owner);
        if (ref == null) {
            return;
        }
        Map<String, JsonNode> before = ref.getAndUpdate(current -> {
            if (!current.containsKey(key)) {
                return current;
            }
            Map<String, JsonNode> next = new LinkedHashMap<>(current);
            next.remove(key);
            return Collections.unmodifiableMap(next);
        });
        if (before.containsKey(key)) {
            dirty.set(true);
        }
    }

    /** Keys of the partition in insertion order. */
    public Set<String> listKeys(StoreOwner owner) {
        AtomicReference<Map<String, JsonNode>> ref = partitions.get(owner);
        if (ref == null) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(ref.get().keySet()));
    }

    /** Copy of every entry of the partition, taken from a single snapshot. */
    public Map<String, JsonNode> listAll(StoreOwner owner) {
        AtomicReference<Map<String, JsonNode>> ref = partitions.get(owner);
        if (ref == null) {
            return Map.of();
        }
        Map<String, JsonNode> out = new LinkedHashMap<>();
        ref.get().forEach((k, v) -> out.put(k, v.deepCopy()));
        return out;
    }

    // =========================================================================
    // Persistence
    // =========================================================================

    /**
     * Save a snapshot of all partitions if anything changed since the last
     * save. On failure the store stays dirty and the next flush retries.
     */
    public synchronized void flush() throws IOException {
        if (!dirty.getAndSet(false)) {
            return;
        }
        Map<StoreOwner, Map<String, JsonNode>> snapshot = new LinkedHashMap<>();
        partitions.forEach((owner, ref) -> {
            Map<String, JsonNode> entries = ref.get();
            if (!entries.isEmpty()) {
                snapshot.put(owner, entries);
            }
        });
        try {
            backing.save(snapshot);
        } catch (IOException | RuntimeException e) {
            dirty.set(true);
            throw e;
        }
    }

    public boolean isDirty() {
        return dirty.get();
    }

    /** Stop the background flusher and save what is left. */
    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (flusher != null) {
            flusher.shutdown();
            try {
                if (!flusher.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Store flusher did not stop within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        flush();
    }

    private void flushQuietly() {
        try {
            flush();
        } catch (IOException | RuntimeException e) {
            log.error("Store flush failed: {}", e.getMessage(), e);
        }
    }

    private AtomicReference<Map<String, JsonNode>> partition(StoreOwner owner) {
        return partitions.computeIfAbsent(owner, o -> new AtomicReference<>(Map.of()));
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new ValidationError("store key must not be null");
        }
    }
}
