package com.botscript.common.config;

import com.botscript.common.infra.JsonFile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads, caches and saves the bot configuration file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, BotScriptConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        this(configPath, cacheTtl, System::getenv);
    }

    ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        this.configPath = expandHome(configPath);
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /** Cached for a short TTL so hot paths can call this freely. */
    public BotScriptConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    public BotScriptConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Write changes made to {@code config} back to the file. Only values that
     * differ from what the file currently loads as are written; everything else
     * keeps its raw text, so {@code ${VAR}} placeholders and omitted defaults
     * stay as they are. Unknown keys in the file are kept too.
     *
     * @throws IOException if the existing file cannot be parsed as plain JSON
     *                     (for example an unquoted placeholder), or the write
     *                     fails
     */
    public void saveConfig(BotScriptConfig config) throws IOException {
        JsonNode original = objectMapper.createObjectNode();
        if (Files.isRegularFile(configPath)) {
            try {
                original = objectMapper.readTree(Files.readString(configPath));
            } catch (JsonProcessingException e) {
                throw new IOException("Refusing to rewrite " + configPath
                        + ": existing content is not plain JSON (" + e.getOriginalMessage() + ")", e);
            }
        }
        JsonNode baseline = objectMapper.valueToTree(doLoadConfig());
        JsonNode updated = objectMapper.valueToTree(config);

        JsonFile.save(configPath, merge(original, baseline, updated));
        cache.invalidateAll();
        log.info("Saved bot config {}", configPath);
    }

    /**
     * Overlay the changes between {@code baseline} and {@code updated} onto
     * {@code raw}. Unchanged subtrees come back from {@code raw} untouched.
     */
    static JsonNode merge(JsonNode raw, JsonNode baseline, JsonNode updated) {
        if (raw == null || baseline == null) {
            return updated;
        }
        if (updated.equals(baseline)) {
            return raw;
        }
        if (updated.isObject() && baseline.isObject() && raw.isObject()) {
            ObjectNode out = ((ObjectNode) raw).deepCopy();
            updated.fields().forEachRemaining(field -> {
                String name = field.getKey();
                JsonNode before = baseline.get(name);
                if (before == null || !before.equals(field.getValue())) {
                    out.set(name, merge(raw.get(name), before, field.getValue()));
                }
            });
            return out;
        }
        if (updated.isArray() && baseline.isArray() && raw.isArray()
                && updated.size() == baseline.size() && raw.size() == baseline.size()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode(updated.size());
            for (int i = 0; i < updated.size(); i++) {
                out.add(merge(raw.get(i), baseline.get(i), updated.get(i)));
            }
            return out;
        }
        return updated;
    }

    public Path getConfigPath() {
        return configPath;
    }

    private static Path expandHome(Path path) {
        String text = path.toString();
        if (text.equals("~") || text.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + text.substring(1));
        }
        return path;
    }

    private BotScriptConfig doLoadConfig() {
        BotScriptConfig parsed = null;
        if (Files.isRegularFile(configPath)) {
            try {
                parsed = objectMapper.readValue(
                        substituteEnvVars(Files.readString(configPath)), BotScriptConfig.class);
                log.info("Loaded bot config {}", configPath);
            } catch (IOException e) {
                log.error("Unreadable bot config {}, falling back to defaults", configPath, e);
            }
        } else {
            log.warn("No bot config at {}, running with defaults", configPath);
        }
        return ConfigDefaults.applyAllDefaults(parsed != null ? parsed : new BotScriptConfig());
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = env.apply(matcher.group(1));
            if (value == null) {
                value = Objects.requireNonNullElse(matcher.group(2), "");
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Build a service over a fixed environment map (tests, embedded hosts).
     */
    public static ConfigService withEnvironment(Path configPath, Map<String, String> environment) {
        return new ConfigService(configPath, DEFAULT_CACHE_TTL, environment::get);
    }
}
