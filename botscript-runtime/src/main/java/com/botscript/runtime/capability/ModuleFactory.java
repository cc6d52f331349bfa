package com.botscript.runtime.capability;

import com.botscript.runtime.script.ScriptContext;

/**
 * Creates the handle of one module kind for one script context.
 */
@FunctionalInterface
public interface ModuleFactory {

    ScriptModule create(ScriptContext context);
}
