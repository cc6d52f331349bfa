package com.botscript.runtime.script;

import com.botscript.common.logging.SubsystemLogger;
import com.botscript.runtime.capability.CapabilityRegistry;
import com.botscript.runtime.capability.ModuleFactory;
import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.capability.ModuleResolution;
import com.botscript.runtime.capability.ScriptModule;
import com.botscript.runtime.instance.Instance;
import com.botscript.runtime.store.StoreOwner;
import com.botscript.runtime.store.StoreScope;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runtime state of one script loaded into one instance.
 * <p>
 * Lifecycle: {@code LOADING} while setup runs, {@code ACTIVE} afterwards,
 * {@code DESTROYED} once torn down. Teardown closes every resource the context
 * registered (connections) and is final.
 */
@Slf4j
public class ScriptContext {

    public enum State {
        LOADING,
        ACTIVE,
        DESTROYED
    }

    private final String scriptName;
    private final Instance instance;
    private final ScriptManifest manifest;
    private final Set<ModuleKind> granted;
    private final CapabilityRegistry capabilities;
    private final Map<String, Object> config;
    private final Map<ModuleKind, ScriptModule> modules = new ConcurrentHashMap<>();
    private final Set<AutoCloseable> resources = ConcurrentHashMap.newKeySet();
    private final AtomicReference<State> state = new AtomicReference<>(State.LOADING);
    private final SubsystemLogger scriptLog;
    private volatile Object exported;

    public ScriptContext(Instance instance, ScriptManifest manifest, Set<ModuleKind> granted,
            CapabilityRegistry capabilities, Map<String, Object> config) {
        this.scriptName = manifest.getName();
        this.instance = instance;
        this.manifest = manifest;
        this.granted = Set.copyOf(granted);
        this.capabilities = capabilities;
        this.config = Collections.synchronizedMap(new LinkedHashMap<>(config));
        this.scriptLog = SubsystemLogger.create("instance/" + instance.getId() + "/" + scriptName)
                .withThreshold(instance::getLogThreshold);
    }

    // =========================================================================
    // Identity
    // =========================================================================

    /** {@code instanceId/scriptName}. */
    public String getId() {
        return instance.getId() + "/" + scriptName;
    }

    public String getScriptName() {
        return scriptName;
    }

    public Instance getInstance() {
        return instance;
    }

    public ScriptManifest getManifest() {
        return manifest;
    }

    public SubsystemLogger getScriptLog() {
        return scriptLog;
    }

    public StoreOwner storeOwner(StoreScope scope) {
        return switch (scope) {
            case GLOBAL -> StoreOwner.global();
            case SCRIPT -> StoreOwner.script(scriptName);
            case INSTANCE -> StoreOwner.instance(scriptName, instance.getId());
        };
    }

    // =========================================================================
    // Modules and capabilities
    // =========================================================================

    public boolean isGranted(ModuleKind kind) {
        return granted.contains(kind);
    }

    /** The context's handle for {@code kind}, created by {@code factory} on first use. */
    public ScriptModule moduleHandle(ModuleKind kind, ModuleFactory factory) {
        return modules.computeIfAbsent(kind, k -> factory.create(this));
    }

    /** Handles resolved so far. */
    public Set<ModuleKind> getResolvedModules() {
        return Set.copyOf(modules.keySet());
    }

    public ScriptApi api() {
        return new ScriptApi() {
            @Override
            public ModuleResolution require(String moduleName) {
                return capabilities.resolve(ScriptContext.this, moduleName);
            }

            @Override
            public Optional<Object> requireScript(String name) {
                return instance.getContext(name)
                        .filter(ScriptContext::isActive)
                        .map(ScriptContext::getExported);
            }

            @Override
            public String getScriptName() {
                return scriptName;
            }

            @Override
            public String getInstanceId() {
                return instance.getId();
            }
        };
    }

    // =========================================================================
    // Configuration and exports
    // =========================================================================

    /** Copy of the variable values. */
    public Map<String, Object> getConfig() {
        synchronized (config) {
            return new LinkedHashMap<>(config);
        }
    }

    public void replaceConfig(Map<String, Object> values) {
        synchronized (config) {
            config.clear();
            config.putAll(values);
        }
    }

    public Object getExported() {
        return exported;
    }

    public void setExported(Object exported) {
        this.exported = exported;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    public State getState() {
        return state.get();
    }

    public boolean isActive() {
        return state.get() == State.ACTIVE;
    }

    public boolean isDestroyed() {
        return state.get() == State.DESTROYED;
    }

    /** LOADING to ACTIVE; false if the context was destroyed meanwhile. */
    public boolean markActive() {
        return state.compareAndSet(State.LOADING, State.ACTIVE);
    }

    /** Move to DESTROYED. Returns false if it already was. */
    public boolean markDestroyed() {
        return state.getAndSet(State.DESTROYED) != State.DESTROYED;
    }

    /**
     * Register something to close at teardown. A resource added to a
     * destroyed context is closed immediately and false is returned.
     */
    public boolean addResource(AutoCloseable resource) {
        resources.add(resource);
        if (isDestroyed() && resources.remove(resource)) {
            closeQuietly(resource);
            return false;
        }
        return true;
    }

    public void removeResource(AutoCloseable resource) {
        resources.remove(resource);
    }

    public int resourceCount() {
        return resources.size();
    }

    /** Close and forget every registered resource. */
    public void closeResources() {
        List<AutoCloseable> toClose = new ArrayList<>(resources);
        resources.clear();
        toClose.forEach(this::closeQuietly);
    }

    /**
     * Run a task on the instance queue unless the context is destroyed by the
     * time it runs.
     */
    public boolean post(Runnable task) {
        return instance.getQueue().post(() -> {
            if (!isDestroyed()) {
                task.run();
            }
        });
    }

    private void closeQuietly(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to close resource of {}: {}", getId(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "ScriptContext{" + getId() + ", " + state.get() + "}";
    }
}
