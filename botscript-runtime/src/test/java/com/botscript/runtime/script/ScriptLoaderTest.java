package com.botscript.runtime.script;

import com.botscript.runtime.TestScripts;
import com.botscript.runtime.capability.CapabilityRegistry;
import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.capability.PrivilegeGrants;
import com.botscript.runtime.error.ScriptLoadException;
import com.botscript.runtime.event.EventBus;
import com.botscript.runtime.instance.BackendKind;
import com.botscript.runtime.instance.Instance;
import com.botscript.runtime.modules.EventModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.botscript.runtime.TestScripts.drain;
import static org.junit.jupiter.api.Assertions.*;

class ScriptLoaderTest {

    private ExecutorService pool;
    private EventBus bus;
    private CapabilityRegistry registry;
    private ScriptLoader loader;
    private Instance instance;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        bus = new EventBus();
        registry = new CapabilityRegistry(PrivilegeGrants.fromConfig(Map.of("trusted", List.of("db"))));
        registry.register(ModuleKind.EVENT, ctx -> new EventModule(bus, ctx));
        registry.register(ModuleKind.DB, ctx -> () -> ModuleKind.DB);
        loader = new ScriptLoader(registry, bus);
        instance = TestScripts.runningInstance("i1", pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private ScriptContext await(CompletableFuture<ScriptContext> f) throws Exception {
        return f.get(5, TimeUnit.SECONDS);
    }

    private ScriptLoadException failure(CompletableFuture<ScriptContext> f) {
        var e = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
        return assertInstanceOf(ScriptLoadException.class, e.getCause());
    }

    @Nested
    class Load {

        @Test
        void setupRunsOnTheInstanceQueue_andContextBecomesActive() throws Exception {
            var onQueue = new AtomicBoolean();
            var script = TestScripts.script("hello", (api, cfg) -> onQueue.set(instance.getQueue().isCurrentThread()));

            var ctx = await(loader.load(instance, script, Map.of()));

            assertTrue(onQueue.get());
            assertTrue(ctx.isActive());
            assertSame(ctx, instance.getContext("hello").orElseThrow());
        }

        @Test
        void requiredPrivilegedModule_withoutGrant_failsBeforeAnything() {
            var setupCalled = new AtomicBoolean();
            var script = TestScripts.script(TestScripts.manifest("untrusted", "event", "db"), (api, cfg) -> {
                setupCalled.set(true);
                api.require("event", EventModule.class).on("tick", e -> { });
            });

            var e = failure(loader.load(instance, script, Map.of()));

            assertEquals("untrusted", e.getScriptName());
            assertFalse(setupCalled.get());
            assertTrue(instance.getContext("untrusted").isEmpty());
            assertEquals(0, bus.subscriberCount(instance, "tick"));
        }

        @Test
        void requiredPrivilegedModule_withGrant_loads() throws Exception {
            var handle = new AtomicBoolean();
            var script = TestScripts.script(TestScripts.manifest("trusted", "db"),
                    (api, cfg) -> handle.set(api.require("db").isOk()));

            await(loader.load(instance, script, Map.of()));

            assertTrue(handle.get());
        }

        @Test
        void undeclaredPrivilegedRequest_isRecoverable() throws Exception {
            var error = new AtomicBoolean();
            var script = TestScripts.script("curious", (api, cfg) -> error.set(!api.require("db").isOk()));

            var ctx = await(loader.load(instance, script, Map.of()));

            assertTrue(error.get());
            assertTrue(ctx.isActive());
        }

        @Test
        void failingSetup_tearsDownEverything() throws Exception {
            var closed = new AtomicBoolean();
            var script = TestScripts.script("broken", (api, cfg) -> {
                api.require("event", EventModule.class).on("tick", e -> fail("must not fire"));
                instance.getContext("broken").orElseThrow().addResource(() -> closed.set(true));
                throw new IllegalStateException("setup failure");
            });

            var e = failure(loader.load(instance, script, Map.of()));
            bus.emit(instance, "tick", null);
            drain(instance);

            assertTrue(e.getMessage().contains("setup failure"));
            assertTrue(closed.get());
            assertTrue(instance.getContext("broken").isEmpty());
            assertEquals(0, bus.subscriberCount(instance, "tick"));
        }

        @Test
        void sameScriptTwice_isRefused() throws Exception {
            var script = TestScripts.script("once", (api, cfg) -> { });
            await(loader.load(instance, script, Map.of()));

            failure(loader.load(instance, script, Map.of()));
        }

        @Test
        void config_overlaysManifestDefaults() throws Exception {
            var manifest = TestScripts.manifest("vars");
            manifest.setVars(List.of(
                    ScriptManifest.ScriptVariable.builder().name("greeting").type("string").defaultValue("hi").build(),
                    ScriptManifest.ScriptVariable.builder().name("count").type("number").defaultValue(1).build()));
            var seen = new ArrayList<Map<String, Object>>();
            var script = TestScripts.script(manifest, (api, cfg) -> seen.add(cfg));

            await(loader.load(instance, script, Map.of("count", 5)));

            assertEquals(Map.of("greeting", "hi", "count", 5), seen.get(0));
        }

        @Test
        void requireScript_returnsExportOfActiveScript() throws Exception {
            var library = TestScripts.script("lib", (api, cfg) ->
                    instance.getContext("lib").orElseThrow().setExported("exported-value"));
            var seen = new ArrayList<Object>();
            var user = TestScripts.script("user", (api, cfg) -> {
                seen.add(api.requireScript("lib").orElse(null));
                seen.add(api.requireScript("missing").orElse(null));
            });

            await(loader.load(instance, library, Map.of()));
            await(loader.load(instance, user, Map.of()));

            assertEquals("exported-value", seen.get(0));
            assertNull(seen.get(1));
        }
    }

    @Nested
    class ManifestRules {

        @Test
        void unsupportedBackend_isRefused() {
            var discord = new Instance("d1", "bot", BackendKind.DISCORD, 3, pool);
            var script = TestScripts.script("ts3-only", (api, cfg) -> { });

            var e = failure(loader.load(discord, script, Map.of()));

            assertTrue(e.getProblems().get(0).contains("discord"));
        }

        @Test
        void hiddenScriptWithVars_isRefused() {
            var manifest = TestScripts.manifest("hidden");
            manifest.setHidden(true);
            manifest.setVars(List.of(ScriptManifest.ScriptVariable.builder().name("x").build()));

            failure(loader.load(instance, TestScripts.script(manifest, (api, cfg) -> { }), Map.of()));
        }

        @Test
        void engineConstraint_isChecked() {
            var manifest = TestScripts.manifest("future");
            manifest.setEngine(">= 99.0.0");

            failure(loader.load(instance, TestScripts.script(manifest, (api, cfg) -> { }), Map.of()));
        }

        @ParameterizedTest
        @CsvSource({
                ">= 1.0.0, true",
                "> 1.0.0, false",
                "1.0, true",
                "= 1.0.0, true",
                "< 2, true",
                "<= 0.9.9, false",
                ">= x.y, false"
        })
        void engineSatisfies(String constraint, boolean expected) {
            assertEquals(expected, ScriptLoader.engineSatisfies(constraint, "1.0.0"));
        }
    }

    @Nested
    class Unload {

        @Test
        void unloadListenersRun_thenNothingFires() throws Exception {
            var calls = Collections.synchronizedList(new ArrayList<String>());
            var script = TestScripts.script("bye", (api, cfg) -> {
                var events = api.require("event", EventModule.class);
                events.on("tick", e -> calls.add("tick"));
                events.on("unload", e -> calls.add("unload"));
            });
            var ctx = await(loader.load(instance, script, Map.of()));

            bus.emit(instance, "tick", null);
            loader.unload(ctx).get(5, TimeUnit.SECONDS);
            bus.emit(instance, "tick", null);
            drain(instance);

            assertEquals(List.of("tick", "unload"), calls);
            assertTrue(ctx.isDestroyed());
            assertTrue(instance.getContext("bye").isEmpty());
        }

        @Test
        void unload_closesOwnedResources() throws Exception {
            var closes = new AtomicInteger();
            var ctx = await(loader.load(instance, TestScripts.script("owner", (api, cfg) -> { }), Map.of()));
            ctx.addResource(closes::incrementAndGet);
            ctx.addResource(() -> {
                closes.incrementAndGet();
                throw new IllegalStateException("close failure");
            });

            loader.unload(ctx).get(5, TimeUnit.SECONDS);
            loader.unload(ctx).get(5, TimeUnit.SECONDS);

            assertEquals(2, closes.get());
            assertEquals(0, ctx.resourceCount());
            assertFalse(ctx.addResource(closes::incrementAndGet));
            assertEquals(3, closes.get());
        }
    }
}
