package com.botscript.runtime.capability;

import com.botscript.runtime.error.CapabilityError;

/**
 * Outcome of resolving a module: either the handle or the error explaining
 * why the script may not have it.
 */
public record ModuleResolution(ScriptModule module, CapabilityError error) {

    public static ModuleResolution ok(ScriptModule module) {
        return new ModuleResolution(module, null);
    }

    public static ModuleResolution failed(CapabilityError error) {
        return new ModuleResolution(null, error);
    }

    public boolean isOk() {
        return module != null;
    }

    /**
     * The handle as the given type.
     *
     * @throws CapabilityError if resolution failed
     */
    public <T extends ScriptModule> T as(Class<T> type) {
        if (error != null) {
            throw error;
        }
        return type.cast(module);
    }
}
