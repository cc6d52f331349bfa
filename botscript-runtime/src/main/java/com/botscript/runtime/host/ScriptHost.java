package com.botscript.runtime.host;

import com.botscript.common.config.BotScriptConfig;
import com.botscript.common.config.BotScriptConfig.InstanceConfig;
import com.botscript.common.config.ConfigDefaults;
import com.botscript.common.config.ConfigService;
import com.botscript.common.logging.LogLevel;
import com.botscript.runtime.capability.CapabilityRegistry;
import com.botscript.runtime.capability.ModuleFactory;
import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.capability.PrivilegeGrants;
import com.botscript.runtime.error.ScriptLoadException;
import com.botscript.runtime.event.EventBus;
import com.botscript.runtime.instance.BackendAdapter;
import com.botscript.runtime.instance.BackendEventBridge;
import com.botscript.runtime.instance.BackendKind;
import com.botscript.runtime.instance.DetachedBackend;
import com.botscript.runtime.instance.Instance;
import com.botscript.runtime.instance.NotificationSink;
import com.botscript.runtime.modules.BackendModule;
import com.botscript.runtime.modules.EngineModule;
import com.botscript.runtime.modules.EventModule;
import com.botscript.runtime.modules.StoreModule;
import com.botscript.runtime.script.BotScript;
import com.botscript.runtime.script.ScriptCatalog;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.runtime.script.ScriptLoader;
import com.botscript.runtime.store.InMemoryStoreBacking;
import com.botscript.runtime.store.JsonFileStoreBacking;
import com.botscript.runtime.store.ScopedStore;
import com.botscript.runtime.store.StoreBacking;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide context shared by every instance: the store, the event bus, the
 * capability registry, the script catalog and the dispatch pool running the
 * instance queues.
 * <p>
 * Created once at startup and passed by reference; {@link #close()} stops all
 * instances, closes registered services (session manager, websocket server),
 * flushes the store and stops the dispatch pool.
 */
@Slf4j
public class ScriptHost implements AutoCloseable {

    public static final String LOAD_EVENT = "load";

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final BotScriptConfig config;
    private final ScopedStore store;
    private final EventBus bus = new EventBus();
    private final CapabilityRegistry capabilities;
    private final ScriptCatalog catalog;
    private final ScriptLoader loader;
    private final ExecutorService dispatchPool;
    private final Map<String, Instance> instances = new ConcurrentHashMap<>();
    private final AtomicInteger botLogLevel;
    private final List<AutoCloseable> services = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile ConfigService configService;
    private volatile NotificationSink notifications = NotificationSink.LOGGING;

    public ScriptHost(BotScriptConfig config, ScopedStore store, ScriptCatalog catalog) {
        this.config = ConfigDefaults.applyAllDefaults(config);
        this.store = store;
        this.catalog = catalog;
        this.capabilities = new CapabilityRegistry(PrivilegeGrants.fromConfig(this.config.getScripts().getPrivileges()));
        this.loader = new ScriptLoader(capabilities, bus);
        this.botLogLevel = new AtomicInteger(this.config.getLogLevel());

        int threads = this.config.getRuntime().getDispatchThreads();
        this.dispatchPool = Executors.newFixedThreadPool(threads, namedDaemonThreads("script-dispatch-"));

        capabilities.register(ModuleKind.ENGINE, ctx -> new EngineModule(this, ctx));
        capabilities.register(ModuleKind.EVENT, ctx -> new EventModule(bus, ctx));
        capabilities.register(ModuleKind.STORE, ctx -> new StoreModule(store, ctx));
        capabilities.register(ModuleKind.BACKEND, ctx -> new BackendModule(ctx.getInstance()));
        log.info("Script host started for bot {} ({} dispatch threads)", this.config.getBotId(), threads);
    }

    /**
     * Host with the store configured in {@code config}: a JSON file if
     * {@code store.path} is set, memory otherwise.
     */
    public static ScriptHost create(BotScriptConfig config, ScriptCatalog catalog) throws IOException {
        BotScriptConfig cfg = ConfigDefaults.applyAllDefaults(config);
        String path = cfg.getStore().getPath();
        StoreBacking backing = path != null && !path.isBlank()
                ? new JsonFileStoreBacking(Path.of(path))
                : new InMemoryStoreBacking();
        ScopedStore store = new ScopedStore(backing, Duration.ofMillis(cfg.getStore().getFlushIntervalMs()));
        return new ScriptHost(cfg, store, catalog);
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // =========================================================================
    // Services
    // =========================================================================

    public void registerModule(ModuleKind kind, ModuleFactory factory) {
        capabilities.register(kind, factory);
    }

    /** Closed by {@link #close()} in reverse registration order, after the instances stop. */
    public void addService(AutoCloseable service) {
        services.add(service);
    }

    public void setConfigService(ConfigService configService) {
        this.configService = configService;
    }

    public void setNotifications(NotificationSink notifications) {
        this.notifications = notifications != null ? notifications : NotificationSink.LOGGING;
    }

    public NotificationSink getNotifications() {
        return notifications;
    }

    public BotScriptConfig getConfig() {
        return config;
    }

    public ScopedStore getStore() {
        return store;
    }

    public EventBus getBus() {
        return bus;
    }

    public CapabilityRegistry getCapabilities() {
        return capabilities;
    }

    public ScriptCatalog getCatalog() {
        return catalog;
    }

    public ScriptLoader getLoader() {
        return loader;
    }

    public ExecutorService getDispatchPool() {
        return dispatchPool;
    }

    // =========================================================================
    // Log level
    // =========================================================================

    public int getBotLogLevel() {
        return botLogLevel.get();
    }

    public boolean setBotLogLevel(int level) {
        if (!LogLevel.isValidNumeric(level)) {
            return false;
        }
        botLogLevel.set(level);
        config.setLogLevel(level);
        return true;
    }

    // =========================================================================
    // Instances
    // =========================================================================

    /** Create every instance listed in the configuration. */
    public List<Instance> createConfiguredInstances() {
        List<Instance> created = new ArrayList<>();
        for (InstanceConfig ic : config.getInstances()) {
            created.add(createInstance(ic));
        }
        return created;
    }

    /**
     * Create an instance from its configuration. It has a detached backend
     * until {@link #attachBackend} installs another.
     *
     * @throws IllegalArgumentException if the id is missing or already used
     */
    public Instance createInstance(InstanceConfig ic) {
        ensureOpen();
        if (ic.getId() == null || ic.getId().isBlank()) {
            throw new IllegalArgumentException("instance id is required");
        }
        int level = ic.getLogLevel() != null ? ic.getLogLevel() : botLogLevel.get();
        String backend = ic.getBackend() != null ? ic.getBackend() : ConfigDefaults.DEFAULT_BACKEND;
        Instance instance = new Instance(ic.getId(), config.getBotId(), BackendKind.of(backend), level, dispatchPool);
        instance.setNick(ic.getNick());
        instance.setDefaultChannelId(ic.getDefaultChannelId());
        if (instances.putIfAbsent(instance.getId(), instance) != null) {
            throw new IllegalArgumentException("duplicate instance id: " + instance.getId());
        }
        if (!config.getInstances().contains(ic)) {
            config.getInstances().add(ic);
        }
        attachBackend(instance, new DetachedBackend(ic.getNick()));
        log.info("Created instance {} ({})", instance.getId(), instance.getBackend());
        return instance;
    }

    public void attachBackend(Instance instance, BackendAdapter adapter) {
        adapter.attach(new BackendEventBridge(bus, instance));
        instance.setBackendAdapter(adapter);
    }

    public Optional<Instance> getInstance(String id) {
        return Optional.ofNullable(instances.get(id));
    }

    public Collection<Instance> getInstances() {
        return List.copyOf(instances.values());
    }

    /**
     * Load the autorun scripts and the scripts enabled for the instance, emit
     * {@code load}, then connect the backend. Scripts that fail to load are
     * logged and skipped. The future completes once the {@code load} listeners
     * have run.
     */
    public CompletableFuture<Void> startInstance(String id) {
        Instance instance = requireInstance(id);
        if (instance.setRunning(true)) {
            return CompletableFuture.completedFuture(null);
        }
        Map<String, Map<String, Object>> enabled = instanceConfig(id).map(InstanceConfig::getScripts).orElse(Map.of());

        Set<String> names = new LinkedHashSet<>();
        catalog.autorun().forEach(s -> names.add(s.getManifest().getName()));
        names.addAll(enabled.keySet());

        List<CompletableFuture<?>> loads = new ArrayList<>();
        for (String name : names) {
            Optional<BotScript> script = catalog.get(name);
            if (script.isEmpty()) {
                log.warn("Script {} enabled on instance {} is not installed", name, id);
                continue;
            }
            loads.add(loader.load(instance, script.get(), enabled.get(name))
                    .handle((ctx, err) -> {
                        if (err != null) {
                            log.warn("Instance {}: {}", id, rootMessage(err));
                        }
                        return null;
                    }));
        }

        return CompletableFuture.allOf(loads.toArray(new CompletableFuture<?>[0]))
                .thenCompose(v -> {
                    bus.emit(instance, LOAD_EVENT, null);
                    BackendAdapter adapter = instance.getBackendAdapter();
                    if (adapter != null && !adapter.connect()) {
                        log.warn("Backend of instance {} did not start connecting", id);
                    }
                    return instance.getQueue().flush();
                })
                .whenComplete((v, err) -> {
                    if (err == null) {
                        log.info("Instance {} started with {} scripts", id, instance.getContexts().size());
                    }
                });
    }

    /** Load one installed script into a running instance. */
    public CompletableFuture<ScriptContext> loadScript(String instanceId, String scriptName) {
        Instance instance = requireInstance(instanceId);
        Optional<BotScript> script = catalog.get(scriptName);
        if (script.isEmpty()) {
            return CompletableFuture.failedFuture(new ScriptLoadException(scriptName, List.of("not installed")));
        }
        Map<String, Object> values = instanceConfig(instanceId)
                .map(ic -> ic.getScripts().get(scriptName))
                .orElse(null);
        return loader.load(instance, script.get(), values);
    }

    public CompletableFuture<Void> unloadScript(String instanceId, String scriptName) {
        Instance instance = requireInstance(instanceId);
        return instance.getContext(scriptName)
                .map(loader::unload)
                .orElseGet(() -> CompletableFuture.completedFuture(null));
    }

    /**
     * Unload every script of the instance (newest first), closing their
     * connections, and disconnect the backend.
     */
    public CompletableFuture<Void> stopInstance(String id) {
        Instance instance = requireInstance(id);
        if (!instance.setRunning(false)) {
            return CompletableFuture.completedFuture(null);
        }
        List<ScriptContext> contexts = instance.getContexts();
        Collections.reverse(contexts);
        List<CompletableFuture<Void>> unloads = new ArrayList<>();
        for (ScriptContext ctx : contexts) {
            unloads.add(loader.unload(ctx));
        }
        return CompletableFuture.allOf(unloads.toArray(new CompletableFuture<?>[0]))
                .whenComplete((v, err) -> {
                    BackendAdapter adapter = instance.getBackendAdapter();
                    if (adapter != null && adapter.isConnected()) {
                        adapter.disconnect();
                    }
                    log.info("Instance {} stopped", id);
                });
    }

    public CompletableFuture<Void> reloadInstance(String id) {
        return stopInstance(id).thenCompose(v -> startInstance(id));
    }

    /**
     * Reload requested by a script. Runs asynchronously; returns false without
     * doing anything if {@code scripts.allowReload} is off.
     */
    public boolean requestReload(String instanceId) {
        if (!config.getScripts().isAllowReload()) {
            log.warn("Script reload requested on instance {} but reloading is disabled", instanceId);
            return false;
        }
        reloadInstance(instanceId).whenComplete((v, err) -> {
            if (err != null) {
                log.error("Reload of instance {} failed: {}", instanceId, rootMessage(err));
            }
        });
        return true;
    }

    /** Stop the instance and release its queue and subscriptions. */
    public CompletableFuture<Void> destroyInstance(String id) {
        Instance instance = requireInstance(id);
        return stopInstance(id).whenComplete((v, err) -> {
            bus.removeInstance(instance);
            instance.getQueue().close();
            instances.remove(id, instance);
            log.info("Instance {} destroyed", id);
        });
    }

    // =========================================================================
    // Script configuration
    // =========================================================================

    /**
     * Store new variable values for a script on an instance and write the
     * configuration file if one is attached. Returns false if saving failed.
     */
    public boolean saveScriptConfig(String instanceId, String scriptName, Map<String, Object> values) {
        InstanceConfig ic = instanceConfig(instanceId).orElse(null);
        if (ic == null) {
            return false;
        }
        ic.getScripts().put(scriptName, new LinkedHashMap<>(values));
        ConfigService service = configService;
        if (service == null) {
            return true;
        }
        try {
            synchronized (config) {
                service.saveConfig(config);
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to save configuration for {}/{}: {}", instanceId, scriptName, e.getMessage());
            return false;
        }
    }

    // =========================================================================
    // Shutdown
    // =========================================================================

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down script host");

        List<CompletableFuture<Void>> stops = new ArrayList<>();
        for (String id : instances.keySet()) {
            stops.add(destroyInstance(id));
        }
        try {
            CompletableFuture.allOf(stops.toArray(new CompletableFuture<?>[0]))
                    .get(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Instances did not stop cleanly: {}", e.toString());
        }

        List<AutoCloseable> reversed = new ArrayList<>(services);
        Collections.reverse(reversed);
        for (AutoCloseable service : reversed) {
            try {
                service.close();
            } catch (Exception e) {
                log.error("Failed to close {}: {}", service.getClass().getSimpleName(), e.getMessage());
            }
        }

        try {
            store.close();
        } catch (IOException e) {
            log.error("Final store flush failed: {}", e.getMessage());
        }

        dispatchPool.shutdown();
        try {
            if (!dispatchPool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                dispatchPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatchPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Script host stopped");
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private Instance requireInstance(String id) {
        Instance instance = instances.get(id);
        if (instance == null) {
            throw new IllegalArgumentException("unknown instance: " + id);
        }
        return instance;
    }

    private Optional<InstanceConfig> instanceConfig(String id) {
        return config.getInstances().stream().filter(ic -> id.equals(ic.getId())).findFirst();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("script host is closed");
        }
    }

    private static String rootMessage(Throwable err) {
        Throwable t = err;
        while ((t instanceof CompletionException || t instanceof ExecutionException)
                && t.getCause() != null) {
            t = t.getCause();
        }
        return t.getMessage() != null ? t.getMessage() : t.toString();
    }
}
