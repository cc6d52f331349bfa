package com.botscript.runtime.script;

import java.util.Map;

/**
 * A script that can be loaded into an instance. Implementations are found
 * with {@link java.util.ServiceLoader} or registered with a
 * {@link ScriptCatalog}.
 * <p>
 * {@link #setup} runs on the instance's execution queue, like every callback
 * the script registers from it. It should subscribe to events and return; it
 * must not block.
 */
public interface BotScript {

    ScriptManifest getManifest();

    /**
     * @param api    access to modules and other scripts
     * @param config variable values: manifest defaults overlaid with the
     *               values configured for the instance
     */
    void setup(ScriptApi api, Map<String, Object> config) throws Exception;
}
