package com.botscript.runtime.modules;

import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.capability.ScriptModule;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.runtime.store.ScopedStore;
import com.botscript.runtime.store.StoreOwner;
import com.botscript.runtime.store.StoreScope;
import com.botscript.runtime.store.StoreValues;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Script-facing view of the scoped store. Unqualified methods use the script
 * scope, {@code *Global} the global scope and {@code *Instance} the
 * script-in-this-instance scope.
 * <p>
 * Values come back as plain Java values (maps, lists, strings, numbers,
 * booleans). {@code get} returns null both for a stored null and for a missing
 * key; {@code has} tells them apart.
 */
public class StoreModule implements ScriptModule {

    private final ScopedStore store;
    private final StoreOwner scriptOwner;
    private final StoreOwner instanceOwner;

    public StoreModule(ScopedStore store, ScriptContext context) {
        this.store = store;
        this.scriptOwner = context.storeOwner(StoreScope.SCRIPT);
        this.instanceOwner = context.storeOwner(StoreScope.INSTANCE);
    }

    @Override
    public ModuleKind kind() {
        return ModuleKind.STORE;
    }

    // ----- script scope -----

    /** @throws com.botscript.runtime.error.ValidationError if the value is not serializable */
    public boolean set(String key, Object value) {
        return set(scriptOwner, key, value);
    }

    public Object get(String key) {
        return get(scriptOwner, key);
    }

    public boolean has(String key) {
        return store.get(scriptOwner, key).isPresent();
    }

    public void unset(String key) {
        store.unset(scriptOwner, key);
    }

    public List<String> getKeys() {
        return List.copyOf(store.listKeys(scriptOwner));
    }

    public Map<String, Object> getAll() {
        return getAll(scriptOwner);
    }

    // ----- global scope -----

    public boolean setGlobal(String key, Object value) {
        return set(StoreOwner.global(), key, value);
    }

    public Object getGlobal(String key) {
        return get(StoreOwner.global(), key);
    }

    public boolean hasGlobal(String key) {
        return store.get(StoreOwner.global(), key).isPresent();
    }

    public void unsetGlobal(String key) {
        store.unset(StoreOwner.global(), key);
    }

    public List<String> getKeysGlobal() {
        return List.copyOf(store.listKeys(StoreOwner.global()));
    }

    public Map<String, Object> getAllGlobal() {
        return getAll(StoreOwner.global());
    }

    // ----- instance scope -----

    public boolean setInstance(String key, Object value) {
        return set(instanceOwner, key, value);
    }

    public Object getInstance(String key) {
        return get(instanceOwner, key);
    }

    public boolean hasInstance(String key) {
        return store.get(instanceOwner, key).isPresent();
    }

    public void unsetInstance(String key) {
        store.unset(instanceOwner, key);
    }

    public List<String> getKeysInstance() {
        return List.copyOf(store.listKeys(instanceOwner));
    }

    public Map<String, Object> getAllInstance() {
        return getAll(instanceOwner);
    }

    private boolean set(StoreOwner owner, String key, Object value) {
        store.set(owner, key, value);
        return true;
    }

    private Object get(StoreOwner owner, String key) {
        Optional<JsonNode> value = store.get(owner, key);
        return value.map(StoreValues::toJava).orElse(null);
    }

    private Map<String, Object> getAll(StoreOwner owner) {
        Map<String, Object> out = new LinkedHashMap<>();
        store.listAll(owner).forEach((k, v) -> out.put(k, StoreValues.toJava(v)));
        return out;
    }
}
