package com.botscript.runtime.store;

import com.botscript.runtime.error.ValidationError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Conversion between script values and the JSON trees kept by the store and
 * carried by broadcast events.
 * <p>
 * Accepted values: {@code null}, strings, characters, booleans, finite
 * numbers, maps with string keys, collections, object arrays and Jackson
 * {@link JsonNode}s built from those. Raw bytes have no JSON form that reads
 * back as bytes, so {@code byte[]} is rejected like any other unsupported
 * type. So are reference cycles and NaN or infinite numbers; each raises
 * {@link ValidationError}.
 */
public final class StoreValues {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StoreValues() {
    }

    /**
     * Validate and copy a value into a fresh JSON tree. The result shares no
     * mutable state with the argument.
     */
    public static JsonNode toTree(Object value) {
        return convert(value, Collections.newSetFromMap(new IdentityHashMap<>()), "$");
    }

    /**
     * Copy a tree back into plain Java values: {@code LinkedHashMap},
     * {@code ArrayList}, boxed numbers, strings, booleans and {@code null}.
     */
    public static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        try {
            return MAPPER.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new ValidationError("stored value cannot be read back: " + e.getOriginalMessage());
        }
    }

    private static JsonNode convert(Object value, Set<Object> path, String where) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof JsonNode node) {
            requirePlain(node, where);
            return node.deepCopy();
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return NODES.textNode(value.toString());
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof Number number) {
            return number(number, where);
        }
        if (value instanceof byte[]) {
            throw new ValidationError("byte arrays cannot be stored; encode them as a string or a list of numbers", where);
        }
        if (value instanceof Map<?, ?> map) {
            enter(path, value, where);
            ObjectNode out = NODES.objectNode();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new ValidationError("map keys must be strings, got "
                            + (e.getKey() == null ? "null" : e.getKey().getClass().getSimpleName()), where);
                }
                out.set(key, convert(e.getValue(), path, where + "." + key));
            }
            path.remove(value);
            return out;
        }
        if (value instanceof Collection<?> items) {
            enter(path, value, where);
            ArrayNode out = NODES.arrayNode(items.size());
            int i = 0;
            for (Object item : items) {
                out.add(convert(item, path, where + "[" + i++ + "]"));
            }
            path.remove(value);
            return out;
        }
        if (value instanceof Object[] items) {
            enter(path, value, where);
            ArrayNode out = NODES.arrayNode(items.length);
            for (int i = 0; i < items.length; i++) {
                out.add(convert(items[i], path, where + "[" + i + "]"));
            }
            path.remove(value);
            return out;
        }
        throw new ValidationError("value of type " + value.getClass().getName() + " is not serializable", where);
    }

    private static void requirePlain(JsonNode node, String where) {
        switch (node.getNodeType()) {
            case BINARY, POJO -> throw new ValidationError(
                    "JSON node of type " + node.getNodeType() + " cannot be stored", where);
            case OBJECT -> node.fields().forEachRemaining(
                    e -> requirePlain(e.getValue(), where + "." + e.getKey()));
            case ARRAY -> {
                for (int i = 0; i < node.size(); i++) {
                    requirePlain(node.get(i), where + "[" + i + "]");
                }
            }
            default -> {
            }
        }
    }

    private static void enter(Set<Object> path, Object container, String where) {
        if (!path.add(container)) {
            throw new ValidationError("value contains a reference cycle", where);
        }
    }

    private static JsonNode number(Number number, String where) {
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return NODES.numberNode(number.intValue());
        }
        if (number instanceof Long) {
            return NODES.numberNode(number.longValue());
        }
        if (number instanceof BigInteger big) {
            return NODES.numberNode(big);
        }
        if (number instanceof BigDecimal dec) {
            return NODES.numberNode(dec);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (!Double.isFinite(d)) {
                throw new ValidationError("number is not finite: " + d, where);
            }
            return NODES.numberNode(d);
        }
        throw new ValidationError("unsupported number type " + number.getClass().getName(), where);
    }
}
