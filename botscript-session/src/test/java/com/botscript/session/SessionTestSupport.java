package com.botscript.session;

import com.botscript.common.config.BotScriptConfig;
import com.botscript.runtime.capability.CapabilityRegistry;
import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.capability.PrivilegeGrants;
import com.botscript.runtime.instance.BackendKind;
import com.botscript.runtime.instance.Instance;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.runtime.script.ScriptManifest;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Shared helpers for session tests.
 */
public final class SessionTestSupport {

    private SessionTestSupport() {
    }

    public static BotScriptConfig.SessionsConfig sessionsConfig(long connectTimeoutMs) {
        var cfg = new BotScriptConfig.SessionsConfig();
        cfg.setConnectTimeoutMs(connectTimeoutMs);
        cfg.setIoThreads(2);
        return cfg;
    }

    public static Instance runningInstance(String id, Executor pool) {
        Instance instance = new Instance(id, "bot", BackendKind.TS3, 3, pool);
        instance.setRunning(true);
        return instance;
    }

    /** Active context granted every privileged module. */
    public static ScriptContext context(Instance instance, String scriptName) {
        ScriptManifest manifest = ScriptManifest.builder()
                .name(scriptName)
                .version("1.0.0")
                .requiredModules(List.of())
                .build();
        ScriptContext ctx = new ScriptContext(instance, manifest,
                EnumSet.of(ModuleKind.NET, ModuleKind.WS, ModuleKind.DB),
                new CapabilityRegistry(PrivilegeGrants.none()), Map.of());
        ctx.markActive();
        instance.addContext(ctx);
        return ctx;
    }

    public static void drain(Instance instance) throws Exception {
        instance.getQueue().flush().get(5, TimeUnit.SECONDS);
    }
}
