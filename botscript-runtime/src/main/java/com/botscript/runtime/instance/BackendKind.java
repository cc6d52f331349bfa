package com.botscript.runtime.instance;

import java.util.Locale;
import java.util.Objects;

/**
 * Backend network an instance is connected to. Open-ended: any lower-case
 * name is a valid kind, the constants cover the built-in ones.
 */
public record BackendKind(String name) {

    public static final BackendKind TS3 = new BackendKind("ts3");
    public static final BackendKind DISCORD = new BackendKind("discord");

    public BackendKind {
        Objects.requireNonNull(name, "name");
        name = name.trim().toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("backend name must not be blank");
        }
    }

    public static BackendKind of(String name) {
        return new BackendKind(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
