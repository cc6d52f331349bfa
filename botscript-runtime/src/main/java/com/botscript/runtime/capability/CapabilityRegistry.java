package com.botscript.runtime.capability;

import com.botscript.runtime.error.CapabilityError;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.runtime.script.ScriptManifest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps module kinds to factories and decides which script may use which
 * module.
 * <p>
 * Unprivileged modules are open to every script. Privileged ones require a
 * grant from {@link PrivilegeGrants}. A privileged module listed in a
 * manifest's {@code requiredModules} without a grant fails the load before any
 * script code runs ({@link #checkRequired}); requesting it at runtime instead
 * yields a failed {@link ModuleResolution} the script can react to.
 */
@Slf4j
public class CapabilityRegistry {

    private final Map<ModuleKind, ModuleFactory> factories =
            Collections.synchronizedMap(new EnumMap<>(ModuleKind.class));
    private final PrivilegeGrants grants;

    public CapabilityRegistry(PrivilegeGrants grants) {
        this.grants = grants != null ? grants : PrivilegeGrants.none();
    }

    // =========================================================================
    // Registration
    // =========================================================================

    public void register(ModuleKind kind, ModuleFactory factory) {
        ModuleFactory previous = factories.put(kind, factory);
        if (previous != null) {
            log.warn("Module factory for '{}' replaced", kind.moduleName());
        } else {
            log.debug("Registered module '{}'", kind.moduleName());
        }
    }

    public boolean isRegistered(ModuleKind kind) {
        return factories.containsKey(kind);
    }

    public Set<ModuleKind> grantsFor(String scriptName) {
        return grants.grantsFor(scriptName);
    }

    // =========================================================================
    // Load-time check
    // =========================================================================

    /**
     * Problems with the modules a manifest declares as required, given the
     * script's grants. Empty means the script may load.
     */
    public List<CapabilityError> checkRequired(ScriptManifest manifest, Set<ModuleKind> granted) {
        List<CapabilityError> errors = new ArrayList<>();
        if (manifest.getRequiredModules() == null) {
            return errors;
        }
        for (String name : manifest.getRequiredModules()) {
            Optional<ModuleKind> kind = ModuleKind.fromName(name);
            if (kind.isEmpty()) {
                errors.add(CapabilityError.unknownModule(name));
            } else if (kind.get().isPrivileged() && !granted.contains(kind.get())) {
                errors.add(CapabilityError.notGranted(manifest.getName(), name));
            } else if (!isRegistered(kind.get())) {
                errors.add(CapabilityError.unavailable(name));
            }
        }
        return errors;
    }

    // =========================================================================
    // Resolution
    // =========================================================================

    /**
     * Resolve a module for a script context. Repeated calls for the same kind
     * return the same handle.
     */
    public ModuleResolution resolve(ScriptContext context, String moduleName) {
        Optional<ModuleKind> kind = ModuleKind.fromName(moduleName);
        if (kind.isEmpty()) {
            return ModuleResolution.failed(CapabilityError.unknownModule(moduleName));
        }
        return resolve(context, kind.get());
    }

    public ModuleResolution resolve(ScriptContext context, ModuleKind kind) {
        if (kind.isPrivileged() && !context.isGranted(kind)) {
            log.warn("Script {} requested restricted module '{}' without a grant",
                    context.getId(), kind.moduleName());
            return ModuleResolution.failed(CapabilityError.notGranted(context.getScriptName(), kind.moduleName()));
        }
        ModuleFactory factory = factories.get(kind);
        if (factory == null) {
            return ModuleResolution.failed(CapabilityError.unavailable(kind.moduleName()));
        }
        return ModuleResolution.ok(context.moduleHandle(kind, factory));
    }
}
