package com.botscript.runtime.capability;

import java.util.Locale;
import java.util.Optional;

/**
 * Modules a script can {@code require}. The name is looked up once; after that
 * the constant selects the factory.
 */
public enum ModuleKind {
    BACKEND("backend", false),
    ENGINE("engine", false),
    EVENT("event", false),
    STORE("store", false),
    NET("net", true),
    WS("ws", true),
    DB("db", true);

    private final String moduleName;
    private final boolean privileged;

    ModuleKind(String moduleName, boolean privileged) {
        this.moduleName = moduleName;
        this.privileged = privileged;
    }

    public String moduleName() {
        return moduleName;
    }

    /** Whether a script needs an explicit grant to use this module. */
    public boolean isPrivileged() {
        return privileged;
    }

    public static Optional<ModuleKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ModuleKind kind : values()) {
            if (kind.moduleName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
