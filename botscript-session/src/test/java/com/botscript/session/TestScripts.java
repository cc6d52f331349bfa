package com.botscript.session;

import com.botscript.common.config.BotScriptConfig;
import com.botscript.runtime.script.BotScript;
import com.botscript.runtime.script.ScriptApi;
import com.botscript.runtime.script.ScriptManifest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inline scripts for host-level session tests.
 */
public final class TestScripts {

    private TestScripts() {
    }

    @FunctionalInterface
    public interface Setup {
        void run(ScriptApi api) throws Exception;
    }

    public static BotScript script(String name, List<String> requiredModules, Setup setup) {
        ScriptManifest manifest = ScriptManifest.builder()
                .name(name)
                .version("1.0.0")
                .requiredModules(requiredModules)
                .build();
        return new BotScript() {
            @Override
            public ScriptManifest getManifest() {
                return manifest;
            }

            @Override
            public void setup(ScriptApi api, Map<String, Object> config) throws Exception {
                setup.run(api);
            }
        };
    }

    public static BotScriptConfig.InstanceConfig instance(String id, String... scripts) {
        var ic = new BotScriptConfig.InstanceConfig();
        ic.setId(id);
        for (String script : scripts) {
            ic.getScripts().put(script, new LinkedHashMap<>());
        }
        return ic;
    }
}
