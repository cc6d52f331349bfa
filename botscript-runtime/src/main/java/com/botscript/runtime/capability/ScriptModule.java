package com.botscript.runtime.capability;

/**
 * Handle returned to a script by {@code require}. One handle exists per
 * (script context, module kind).
 */
public interface ScriptModule {

    ModuleKind kind();
}
