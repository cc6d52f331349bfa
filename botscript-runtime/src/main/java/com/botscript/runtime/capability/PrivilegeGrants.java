package com.botscript.runtime.capability;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Restricted modules granted to each script by the host configuration
 * ({@code scripts.privileges}).
 */
@Slf4j
public class PrivilegeGrants {

    private final Map<String, Set<ModuleKind>> grants;

    private PrivilegeGrants(Map<String, Set<ModuleKind>> grants) {
        this.grants = grants;
    }

    public static PrivilegeGrants none() {
        return new PrivilegeGrants(Map.of());
    }

    /**
     * Build grants from the configured script name to module name lists.
     * Unknown module names are logged and ignored.
     */
    public static PrivilegeGrants fromConfig(Map<String, List<String>> privileges) {
        if (privileges == null || privileges.isEmpty()) {
            return none();
        }
        Map<String, Set<ModuleKind>> out = new HashMap<>();
        privileges.forEach((script, modules) -> {
            EnumSet<ModuleKind> kinds = EnumSet.noneOf(ModuleKind.class);
            if (modules != null) {
                for (String name : modules) {
                    ModuleKind.fromName(name).ifPresentOrElse(kinds::add,
                            () -> log.warn("Ignoring unknown module '{}' in privileges of script {}", name, script));
                }
            }
            out.put(script, Collections.unmodifiableSet(kinds));
        });
        return new PrivilegeGrants(Map.copyOf(out));
    }

    /** Modules granted to the script; empty if none. */
    public Set<ModuleKind> grantsFor(String scriptName) {
        return grants.getOrDefault(scriptName, Set.of());
    }
}
