package com.botscript.runtime.script;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Static description of a script, read once when it is loaded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScriptManifest {

    private String name;
    private String version;
    private String author;
    private String description;

    /** Load on every instance, whether or not the instance enables it. */
    private boolean autorun;

    /** Not listed to users; may not declare variables. */
    private boolean hidden;

    /** Backends the script supports. */
    @Builder.Default
    private List<String> backends = new ArrayList<>(List.of("ts3"));

    /** Whether the script serves websocket peers. */
    private boolean enableWeb;

    /** Required engine version, e.g. {@code ">= 1.0.0"}. */
    private String engine;

    @Builder.Default
    private List<ScriptVariable> vars = new ArrayList<>();

    /** Modules the script cannot run without; checked before any script code runs. */
    @Builder.Default
    private List<String> requiredModules = new ArrayList<>();

    @Builder.Default
    private List<String> voiceCommands = new ArrayList<>();

    /**
     * A configurable variable shown in the configuration UI.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScriptVariable {
        private String name;
        private String title;
        /** strings, number, checkbox, select, password, channel, ... */
        private String type;
        @JsonProperty("default")
        private Object defaultValue;
    }
}
