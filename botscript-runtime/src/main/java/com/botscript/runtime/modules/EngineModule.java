package com.botscript.runtime.modules;

import com.botscript.runtime.capability.ModuleKind;
import com.botscript.runtime.capability.ScriptModule;
import com.botscript.runtime.host.ScriptHost;
import com.botscript.runtime.instance.BackendAdapter;
import com.botscript.runtime.instance.Instance;
import com.botscript.runtime.script.ScriptContext;
import com.botscript.runtime.script.ScriptLoader;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Information about the running bot and instance, logging, and a few
 * instance-level controls.
 */
@Slf4j
public class EngineModule implements ScriptModule {

    private final ScriptHost host;
    private final ScriptContext context;

    public EngineModule(ScriptHost host, ScriptContext context) {
        this.host = host;
        this.context = context;
    }

    @Override
    public ModuleKind kind() {
        return ModuleKind.ENGINE;
    }

    private Instance instance() {
        return context.getInstance();
    }

    // ===== identity =====

    public String getInstanceId() {
        return instance().getId();
    }

    public String getBotId() {
        return instance().getBotId();
    }

    public String getBackend() {
        return instance().getBackend().name();
    }

    public String version() {
        return ScriptLoader.ENGINE_VERSION;
    }

    public boolean isRunning() {
        return instance().isRunning();
    }

    // ===== logging =====

    /** Write to the script's log, subject to the instance log level. */
    public void log(Object... parts) {
        String line = Arrays.stream(parts).map(String::valueOf).collect(Collectors.joining(" "));
        context.getScriptLog().info(line);
    }

    public boolean setInstanceLogLevel(int level) {
        return instance().setLogLevel(level);
    }

    public int getInstanceLogLevel() {
        return instance().getLogLevel();
    }

    public boolean setBotLogLevel(int level) {
        return host.setBotLogLevel(level);
    }

    public int getBotLogLevel() {
        return host.getBotLogLevel();
    }

    // ===== instance controls =====

    /** Ask the host to reload every script of this instance. False if reloading is disabled. */
    public boolean reloadScripts() {
        return host.requestReload(instance().getId());
    }

    public String getNick() {
        BackendAdapter adapter = instance().getBackendAdapter();
        return adapter != null ? adapter.getNick() : instance().getNick();
    }

    public boolean setNick(String nick) {
        if (nick == null || nick.isBlank()) {
            return false;
        }
        BackendAdapter adapter = instance().getBackendAdapter();
        if (adapter != null && !adapter.setNick(nick)) {
            return false;
        }
        instance().setNick(nick);
        return true;
    }

    public boolean setDefaultChannelId(String channelId) {
        if (channelId == null || channelId.isBlank()) {
            return false;
        }
        instance().setDefaultChannelId(channelId);
        return true;
    }

    /** Notify the bot operator. */
    public void notify(String message) {
        host.getNotifications().notify(instance().getId(), context.getScriptName(), message);
    }

    /**
     * Replace the script's variable values for this instance and persist them
     * in the host configuration.
     */
    public boolean saveConfig(Map<String, Object> values) {
        context.replaceConfig(values);
        return host.saveScriptConfig(instance().getId(), context.getScriptName(), values);
    }

    /** Object handed to other scripts that {@code requireScript} this one. */
    public void export(Object exported) {
        context.setExported(exported);
    }
}
