package com.botscript.runtime.script;

import com.botscript.runtime.capability.ModuleResolution;
import com.botscript.runtime.capability.ScriptModule;

import java.util.Optional;

/**
 * What a script receives in {@link BotScript#setup}.
 */
public interface ScriptApi {

    /** Resolve a module by name; a failed resolution carries the reason. */
    ModuleResolution require(String moduleName);

    /**
     * Resolve a module and cast it.
     *
     * @throws com.botscript.runtime.error.CapabilityError if the module is not available to this script
     */
    default <T extends ScriptModule> T require(String moduleName, Class<T> type) {
        return require(moduleName).as(type);
    }

    /** Object exported by another active script of the same instance. */
    Optional<Object> requireScript(String scriptName);

    String getScriptName();

    String getInstanceId();
}
