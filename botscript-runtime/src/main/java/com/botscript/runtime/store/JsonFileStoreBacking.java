package com.botscript.runtime.store;

import com.botscript.common.infra.JsonFile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Keeps the whole store in one JSON file:
 *
 * <pre>
 * {
 *   "global":    { key: value },
 *   "scripts":   { scriptName: { key: value } },
 *   "instances": { instanceId: { scriptName: { key: value } } }
 * }
 * </pre>
 */
@Slf4j
public class JsonFileStoreBacking implements StoreBacking {

    private static final String GLOBAL = "global";
    private static final String SCRIPTS = "scripts";
    private static final String INSTANCES = "instances";

    private final Path path;

    public JsonFileStoreBacking(Path path) {
        this.path = path;
    }

    @Override
    public Map<StoreOwner, Map<String, JsonNode>> load() throws IOException {
        Map<StoreOwner, Map<String, JsonNode>> out = new LinkedHashMap<>();
        JsonNode root = JsonFile.loadTree(path);
        if (root == null) {
            log.debug("Store file {} does not exist yet", path);
            return out;
        }
        if (!root.isObject()) {
            throw new IOException("store file " + path + " does not contain a JSON object");
        }

        readEntries(root.get(GLOBAL), StoreOwner.global(), out);
        forEachField(root.get(SCRIPTS), (script, entries) ->
                readEntries(entries, StoreOwner.script(script), out));
        forEachField(root.get(INSTANCES), (instance, scripts) ->
                forEachField(scripts, (script, entries) ->
                        readEntries(entries, StoreOwner.instance(script, instance), out)));

        log.info("Loaded {} store partitions from {}", out.size(), path);
        return out;
    }

    @Override
    public void save(Map<StoreOwner, Map<String, JsonNode>> snapshot) throws IOException {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode root = f.objectNode();
        ObjectNode global = root.putObject(GLOBAL);
        ObjectNode scripts = root.putObject(SCRIPTS);
        ObjectNode instances = root.putObject(INSTANCES);

        snapshot.forEach((owner, entries) -> {
            if (entries.isEmpty()) {
                return;
            }
            ObjectNode target = switch (owner.scope()) {
                case GLOBAL -> global;
                case SCRIPT -> child(scripts, owner.script());
                case INSTANCE -> child(child(instances, owner.instance()), owner.script());
            };
            entries.forEach(target::set);
        });

        JsonFile.save(path, root);
        log.debug("Saved store snapshot to {}", path);
    }

    public Path getPath() {
        return path;
    }

    private static ObjectNode child(ObjectNode parent, String name) {
        JsonNode existing = parent.get(name);
        if (existing instanceof ObjectNode node) {
            return node;
        }
        return parent.putObject(name);
    }

    private static void readEntries(JsonNode node, StoreOwner owner, Map<StoreOwner, Map<String, JsonNode>> out) {
        if (node == null || !node.isObject() || node.isEmpty()) {
            return;
        }
        Map<String, JsonNode> entries = new LinkedHashMap<>();
        forEachField(node, entries::put);
        out.put(owner, entries);
    }

    private static void forEachField(JsonNode node, BiConsumer<String, JsonNode> action) {
        if (node == null || !node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            action.accept(e.getKey(), e.getValue());
        }
    }
}
