package com.botscript.runtime.script;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scripts known to the host, by manifest name.
 */
@Slf4j
public class ScriptCatalog {

    private final Map<String, BotScript> scripts = new ConcurrentHashMap<>();

    /**
     * Register a script. Returns false if the manifest has no name or a script
     * with the same name is already registered.
     */
    public boolean register(BotScript script) {
        ScriptManifest manifest = script.getManifest();
        if (manifest == null || manifest.getName() == null || manifest.getName().isBlank()) {
            log.warn("Ignoring script {} without a name", script.getClass().getName());
            return false;
        }
        BotScript existing = scripts.putIfAbsent(manifest.getName(), script);
        if (existing != null) {
            log.warn("Duplicate script name '{}' ({} and {}), keeping the first",
                    manifest.getName(), existing.getClass().getName(), script.getClass().getName());
            return false;
        }
        log.debug("Registered script {} {}", manifest.getName(), manifest.getVersion());
        return true;
    }

    /**
     * Register every {@link BotScript} the class loader provides through
     * {@link ServiceLoader}. Returns the number registered.
     */
    public int discover(ClassLoader classLoader) {
        int count = 0;
        for (ServiceLoader.Provider<BotScript> provider : ServiceLoader.load(BotScript.class, classLoader)
                .stream().toList()) {
            try {
                if (register(provider.get())) {
                    count++;
                }
            } catch (ServiceConfigurationError e) {
                log.error("Failed to instantiate script {}: {}", provider.type().getName(), e.getMessage());
            }
        }
        log.info("Discovered {} scripts", count);
        return count;
    }

    public Optional<BotScript> get(String name) {
        return Optional.ofNullable(scripts.get(name));
    }

    public Collection<BotScript> list() {
        return List.copyOf(scripts.values());
    }

    /** Scripts whose manifest sets {@code autorun}. */
    public List<BotScript> autorun() {
        List<BotScript> out = new ArrayList<>();
        for (BotScript script : scripts.values()) {
            if (script.getManifest().isAutorun()) {
                out.add(script);
            }
        }
        return out;
    }
}
