package com.botscript.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration of a bot process.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BotScriptConfig {

    /** Unique identifier of this bot process. */
    private String botId;

    /** Bot-wide log level (0 = silent ... 11 = most verbose). */
    private Integer logLevel;

    /** Script loading and privilege settings. */
    private ScriptsConfig scripts;

    /** Scoped store persistence settings. */
    private StoreConfig store;

    /** Execution queue settings. */
    private RuntimeConfig runtime;

    /** Async session (socket / websocket / database) settings. */
    private SessionsConfig sessions;

    /** Instances started with the bot. */
    private List<InstanceConfig> instances = new ArrayList<>();

    // --- Nested config types ---

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScriptsConfig {
        /**
         * Restricted modules granted per script, e.g.
         * {@code {"myscript": ["net", "db"]}}.
         */
        private Map<String, List<String>> privileges = new LinkedHashMap<>();

        /** Whether scripts may trigger a reload of their instance. */
        private boolean allowReload;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        /** Path of the JSON file backing the store; in-memory when null. */
        private String path;

        /** Delay between background flushes of dirty store state. */
        private Long flushIntervalMs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuntimeConfig {
        /** Threads shared by all instance execution queues. */
        private Integer dispatchThreads;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SessionsConfig {
        /** Bounded wait for a connection to open before it fails. */
        private Long connectTimeoutMs;

        /** Threads shared by connection workers (database calls, writes). */
        private Integer ioThreads;

        /** Websocket peer listener; disabled when null. */
        private WebSocketConfig websocket;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WebSocketConfig {
        private String host;
        private Integer port;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InstanceConfig {
        private String id;

        /** Backend name, e.g. "ts3" or "discord". */
        private String backend;

        private String nick;

        private String defaultChannelId;

        /** Instance log level (0 = silent ... 11 = most verbose). */
        private Integer logLevel;

        /**
         * Scripts enabled on this instance, keyed by script name, with the
         * variable values the user configured for each.
         */
        private Map<String, Map<String, Object>> scripts = new LinkedHashMap<>();
    }
}
