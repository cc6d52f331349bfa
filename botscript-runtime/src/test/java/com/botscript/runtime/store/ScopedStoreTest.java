package com.botscript.runtime.store;

import com.botscript.runtime.error.ValidationError;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ScopedStoreTest {

    private ScopedStore store;

    @BeforeEach
    void setUp() {
        store = ScopedStore.inMemory();
    }

    @AfterEach
    void tearDown() throws IOException {
        store.close();
    }

    @Nested
    class Operations {

        @Test
        void absentKey_differsFromStoredEmptyValues() {
            var owner = StoreOwner.script("s");
            store.set(owner, "null", null);
            store.set(owner, "empty", "");
            store.set(owner, "obj", Map.of());

            assertTrue(store.get(owner, "missing").isEmpty());
            assertTrue(store.get(owner, "null").orElseThrow().isNull());
            assertEquals("", store.get(owner, "empty").orElseThrow().asText());
            assertTrue(store.get(owner, "obj").orElseThrow().isObject());
        }

        @Test
        void lastWriteWins() {
            var owner = StoreOwner.global();
            store.set(owner, "k", 1);
            store.set(owner, "k", 2);

            assertEquals(2, store.get(owner, "k").orElseThrow().asInt());
        }

        @Test
        void unset_isIdempotent() {
            var owner = StoreOwner.global();
            store.set(owner, "k", 1);

            store.unset(owner, "k");
            store.unset(owner, "k");
            store.unset(StoreOwner.script("never-used"), "k");

            assertTrue(store.get(owner, "k").isEmpty());
        }

        @Test
        void scopes_areIsolated() {
            store.set(StoreOwner.global(), "k", "global");
            store.set(StoreOwner.script("a"), "k", "script-a");
            store.set(StoreOwner.instance("a", "i1"), "k", "a-on-i1");

            assertTrue(store.get(StoreOwner.script("b"), "k").isEmpty());
            assertTrue(store.get(StoreOwner.instance("a", "i2"), "k").isEmpty());
            assertEquals("a-on-i1", store.get(StoreOwner.instance("a", "i1"), "k").orElseThrow().asText());
            assertEquals("global", store.get(StoreOwner.global(), "k").orElseThrow().asText());
        }

        @Test
        void listKeys_andListAll_preserveInsertionOrder() {
            var owner = StoreOwner.script("s");
            store.set(owner, "b", 1);
            store.set(owner, "a", 2);

            assertEquals(List.of("b", "a"), new ArrayList<>(store.listKeys(owner)));
            assertEquals(List.of("b", "a"), new ArrayList<>(store.listAll(owner).keySet()));
            assertEquals(Set.of(), store.listKeys(StoreOwner.script("other")));
        }

        @Test
        void valuesAreCopied_inAndOut() {
            var owner = StoreOwner.global();
            Map<String, Object> value = new LinkedHashMap<>();
            value.put("n", 1);
            store.set(owner, "k", value);
            value.put("n", 99);

            JsonNode first = store.get(owner, "k").orElseThrow();
            ((ObjectNode) first).put("n", 42);

            assertEquals(1, store.get(owner, "k").orElseThrow().get("n").asInt());
        }

        @Test
        void invalidValue_isRejected_andNothingStored() {
            var owner = StoreOwner.global();

            assertThrows(ValidationError.class, () -> store.set(owner, "k", Double.NaN));
            assertThrows(ValidationError.class, () -> store.set(owner, null, 1));
            assertTrue(store.get(owner, "k").isEmpty());
            assertFalse(store.isDirty());
        }
    }

    @Nested
    class Concurrency {

        @Test
        void concurrentWriters_onDistinctKeys_allLand() throws Exception {
            var owner = StoreOwner.global();
            int threads = 8;
            int perThread = 200;
            var start = new CountDownLatch(1);
            List<Thread> workers = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int id = t;
                Thread worker = new Thread(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        return;
                    }
                    for (int i = 0; i < perThread; i++) {
                        store.set(owner, "t" + id + "-" + i, i);
                    }
                });
                workers.add(worker);
                worker.start();
            }
            start.countDown();
            for (Thread worker : workers) {
                worker.join();
            }

            assertEquals(threads * perThread, store.listAll(owner).size());
        }

        @Test
        void perKey_readsNeverGoBackwards() throws Exception {
            var owner = StoreOwner.script("counter");
            var stop = new AtomicBoolean();
            var errors = new ConcurrentLinkedQueue<String>();

            Thread writer = new Thread(() -> {
                for (int i = 1; i <= 5_000; i++) {
                    store.set(owner, "n", i);
                    store.set(owner, "noise-" + (i % 10), i);
                }
                stop.set(true);
            });
            Thread reader = new Thread(() -> {
                int last = 0;
                while (!stop.get()) {
                    int seen = store.get(owner, "n").map(JsonNode::asInt).orElse(0);
                    if (seen < last) {
                        errors.add("read " + seen + " after " + last);
                    }
                    last = seen;
                }
            });
            writer.start();
            reader.start();
            writer.join();
            reader.join();

            assertTrue(errors.isEmpty(), errors.toString());
            assertEquals(5_000, store.get(owner, "n").orElseThrow().asInt());
        }

        @Test
        void listAll_isASinglePointInTime() throws Exception {
            var owner = StoreOwner.global();
            var stop = new AtomicBoolean();
            var torn = new ConcurrentLinkedQueue<Map<String, JsonNode>>();

            Thread writer = new Thread(() -> {
                for (int i = 1; i <= 2_000; i++) {
                    store.set(owner, "k" + i, i);
                }
                stop.set(true);
            });
            Thread reader = new Thread(() -> {
                while (!stop.get()) {
                    Map<String, JsonNode> snapshot = store.listAll(owner);
                    // keys are only ever added in order k1, k2, ..., so a snapshot
                    // holding kN must also hold every key before it
                    for (int i = 1; i <= snapshot.size(); i++) {
                        if (!snapshot.containsKey("k" + i)) {
                            torn.add(snapshot);
                            break;
                        }
                    }
                }
            });
            writer.start();
            reader.start();
            writer.join();
            reader.join();

            assertTrue(torn.isEmpty());
        }
    }

    @Nested
    class Persistence {

        @TempDir
        Path tempDir;

        @Test
        void close_flushes_andReopenRestoresAllScopes() throws Exception {
            Path file = tempDir.resolve("store.json");
            var first = new ScopedStore(new JsonFileStoreBacking(file), null);
            first.set(StoreOwner.global(), "g", Map.of("list", List.of(1, 2)));
            first.set(StoreOwner.script("s"), "k", "v");
            first.set(StoreOwner.instance("s", "i1"), "seen", true);
            first.close();

            assertTrue(Files.exists(file));
            var second = new ScopedStore(new JsonFileStoreBacking(file), null);
            assertEquals(2, second.get(StoreOwner.global(), "g").orElseThrow().get("list").size());
            assertEquals("v", second.get(StoreOwner.script("s"), "k").orElseThrow().asText());
            assertTrue(second.get(StoreOwner.instance("s", "i1"), "seen").orElseThrow().asBoolean());
            second.close();
        }

        @Test
        void storedValues_readBackTheSameAfterReopen() throws Exception {
            Path file = tempDir.resolve("store.json");
            var owner = StoreOwner.script("s");
            var first = new ScopedStore(new JsonFileStoreBacking(file), null);
            assertThrows(ValidationError.class, () -> first.set(owner, "raw", new byte[]{1, 2, 3}));
            first.set(owner, "bytes", List.of(1, 2, 255));
            Object before = StoreValues.toJava(first.get(owner, "bytes").orElseThrow());
            first.close();

            var second = new ScopedStore(new JsonFileStoreBacking(file), null);
            assertTrue(second.get(owner, "raw").isEmpty());
            assertEquals(before, StoreValues.toJava(second.get(owner, "bytes").orElseThrow()));
            assertEquals(List.of(1, 2, 255), before);
            second.close();
        }

        @Test
        void flush_skipsWhenClean() throws Exception {
            var backing = new InMemoryStoreBacking();
            var s = new ScopedStore(backing, null);
            s.flush();
            assertEquals(0, backing.getSaveCount());

            s.set(StoreOwner.global(), "k", 1);
            s.flush();
            s.flush();
            assertEquals(1, backing.getSaveCount());

            s.unset(StoreOwner.global(), "absent");
            s.flush();
            assertEquals(1, backing.getSaveCount());
            s.close();
        }

        @Test
        void failedSave_keepsStoreDirty() throws Exception {
            var s = new ScopedStore(new StoreBacking() {
                @Override
                public Map<StoreOwner, Map<String, JsonNode>> load() {
                    return Map.of();
                }

                @Override
                public void save(Map<StoreOwner, Map<String, JsonNode>> snapshot) throws IOException {
                    throw new IOException("disk full");
                }
            }, null);
            s.set(StoreOwner.global(), "k", 1);

            assertThrows(IOException.class, s::flush);
            assertTrue(s.isDirty());
        }

        @Test
        void backgroundFlusher_savesDirtyState() throws Exception {
            var backing = new InMemoryStoreBacking();
            var s = new ScopedStore(backing, Duration.ofMillis(20));
            s.set(StoreOwner.global(), "k", 1);

            long deadline = System.currentTimeMillis() + 5_000;
            while (backing.getSaveCount() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(1, backing.getSaveCount());
            assertEquals(1, backing.load().get(StoreOwner.global()).get("k").asInt());
            s.close();
        }
    }
}
