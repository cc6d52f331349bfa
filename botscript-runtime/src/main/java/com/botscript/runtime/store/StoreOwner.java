package com.botscript.runtime.store;

import java.util.Objects;

/**
 * Owner of a store partition. Which fields are set depends on the scope:
 * {@code GLOBAL} has neither, {@code SCRIPT} has the script name,
 * {@code INSTANCE} has both the script name and the instance id.
 */
public record StoreOwner(StoreScope scope, String script, String instance) {

    private static final StoreOwner GLOBAL = new StoreOwner(StoreScope.GLOBAL, null, null);

    public StoreOwner {
        Objects.requireNonNull(scope, "scope");
        switch (scope) {
            case GLOBAL -> {
                script = null;
                instance = null;
            }
            case SCRIPT -> {
                Objects.requireNonNull(script, "script");
                instance = null;
            }
            case INSTANCE -> {
                Objects.requireNonNull(script, "script");
                Objects.requireNonNull(instance, "instance");
            }
        }
    }

    public static StoreOwner global() {
        return GLOBAL;
    }

    public static StoreOwner script(String scriptName) {
        return new StoreOwner(StoreScope.SCRIPT, scriptName, null);
    }

    public static StoreOwner instance(String scriptName, String instanceId) {
        return new StoreOwner(StoreScope.INSTANCE, scriptName, instanceId);
    }

    @Override
    public String toString() {
        return switch (scope) {
            case GLOBAL -> "global";
            case SCRIPT -> "script:" + script;
            case INSTANCE -> "instance:" + instance + "/" + script;
        };
    }
}
