package com.botscript.common.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Default value application for the bot config.
 */
public final class ConfigDefaults {

    private ConfigDefaults() {
    }

    // =========================================================================
    // Constants
    // =========================================================================

    public static final String DEFAULT_BOT_ID = "bot";

    public static final String DEFAULT_BACKEND = "ts3";

    /** Errors, warnings and information. */
    public static final int DEFAULT_LOG_LEVEL = 3;

    public static final long DEFAULT_STORE_FLUSH_INTERVAL_MS = 2_000L;

    public static final int DEFAULT_DISPATCH_THREADS = 4;

    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;

    public static final int DEFAULT_IO_THREADS = 4;

    public static final String DEFAULT_WEBSOCKET_HOST = "127.0.0.1";

    // =========================================================================
    // apply*Defaults
    // =========================================================================

    /**
     * Fill every missing section and value. Mutates and returns the given config.
     */
    public static BotScriptConfig applyAllDefaults(BotScriptConfig cfg) {
        if (cfg == null)
            cfg = new BotScriptConfig();
        if (cfg.getBotId() == null || cfg.getBotId().isBlank())
            cfg.setBotId(DEFAULT_BOT_ID);
        if (cfg.getLogLevel() == null)
            cfg.setLogLevel(DEFAULT_LOG_LEVEL);
        applyScriptsDefaults(cfg);
        applyStoreDefaults(cfg);
        applyRuntimeDefaults(cfg);
        applySessionDefaults(cfg);
        applyInstanceDefaults(cfg);
        return cfg;
    }

    static void applyScriptsDefaults(BotScriptConfig cfg) {
        if (cfg.getScripts() == null)
            cfg.setScripts(new BotScriptConfig.ScriptsConfig());
        if (cfg.getScripts().getPrivileges() == null)
            cfg.getScripts().setPrivileges(new LinkedHashMap<>());
    }

    static void applyStoreDefaults(BotScriptConfig cfg) {
        if (cfg.getStore() == null)
            cfg.setStore(new BotScriptConfig.StoreConfig());
        Long interval = cfg.getStore().getFlushIntervalMs();
        if (interval == null || interval <= 0)
            cfg.getStore().setFlushIntervalMs(DEFAULT_STORE_FLUSH_INTERVAL_MS);
    }

    static void applyRuntimeDefaults(BotScriptConfig cfg) {
        if (cfg.getRuntime() == null)
            cfg.setRuntime(new BotScriptConfig.RuntimeConfig());
        Integer threads = cfg.getRuntime().getDispatchThreads();
        if (threads == null || threads <= 0)
            cfg.getRuntime().setDispatchThreads(DEFAULT_DISPATCH_THREADS);
    }

    static void applySessionDefaults(BotScriptConfig cfg) {
        if (cfg.getSessions() == null)
            cfg.setSessions(new BotScriptConfig.SessionsConfig());
        BotScriptConfig.SessionsConfig sessions = cfg.getSessions();
        if (sessions.getConnectTimeoutMs() == null || sessions.getConnectTimeoutMs() <= 0)
            sessions.setConnectTimeoutMs(DEFAULT_CONNECT_TIMEOUT_MS);
        if (sessions.getIoThreads() == null || sessions.getIoThreads() <= 0)
            sessions.setIoThreads(DEFAULT_IO_THREADS);
        BotScriptConfig.WebSocketConfig ws = sessions.getWebsocket();
        if (ws != null && (ws.getHost() == null || ws.getHost().isBlank()))
            ws.setHost(DEFAULT_WEBSOCKET_HOST);
    }

    static void applyInstanceDefaults(BotScriptConfig cfg) {
        if (cfg.getInstances() == null)
            cfg.setInstances(new ArrayList<>());
        for (BotScriptConfig.InstanceConfig instance : cfg.getInstances()) {
            if (instance.getBackend() == null || instance.getBackend().isBlank())
                instance.setBackend(DEFAULT_BACKEND);
            if (instance.getLogLevel() == null)
                instance.setLogLevel(cfg.getLogLevel());
            if (instance.getScripts() == null)
                instance.setScripts(new LinkedHashMap<>());
        }
    }
}
