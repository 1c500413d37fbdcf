package com.tsrouter.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.tsrouter.exception.ConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One raw value of the configuration store. A value is exactly one of:
 * a scalar, a key/value block (a hash record) or an ordered sequence (a list).
 * The shape is fixed when the value is read, so callers ask for the shape they
 * need and get a {@link ConfigException} when the store holds something else.
 */
public abstract class ConfigValue {

    public enum Kind { SCALAR, BLOCK, SEQUENCE }

    private ConfigValue() {
    }

    public abstract Kind kind();

    public Scalar asScalar(String key) {
        throw mismatch(key, Kind.SCALAR);
    }

    public Block asBlock(String key) {
        throw mismatch(key, Kind.BLOCK);
    }

    public Sequence asSequence(String key) {
        throw mismatch(key, Kind.SEQUENCE);
    }

    private ConfigException mismatch(String key, Kind expected) {
        return new ConfigException(key, "expected " + expected.name().toLowerCase() +
                " but found " + kind().name().toLowerCase());
    }

    /**
     * Classifies a JSON node. Objects become blocks, arrays become sequences and
     * value nodes become scalars; blocks and sequences may only contain scalars.
     */
    public static ConfigValue fromJson(String key, JsonNode node) {
        if (node == null || node.isNull()) {
            throw new ConfigException(key, "value is null");
        }
        if (node.isObject()) {
            Map<String, String> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                fields.put(field.getKey().toLowerCase(), scalarText(key + "." + field.getKey(), field.getValue()));
            }
            return new Block(fields);
        }
        if (node.isArray()) {
            List<String> items = new ArrayList<>();
            for (int i = 0; i < node.size(); i++) {
                items.add(scalarText(key + "[" + i + "]", node.get(i)));
            }
            return new Sequence(items);
        }
        return new Scalar(node.asText());
    }

    private static String scalarText(String key, JsonNode node) {
        if (node == null || node.isNull()) {
            throw new ConfigException(key, "value is null");
        }
        if (node.isContainerNode()) {
            throw new ConfigException(key, "nested values are not supported");
        }
        return node.asText();
    }

    public static final class Scalar extends ConfigValue {
        private final String text;

        public Scalar(String text) {
            this.text = text;
        }

        @Override
        public Kind kind() {
            return Kind.SCALAR;
        }

        @Override
        public Scalar asScalar(String key) {
            return this;
        }

        public String getText() {
            return text;
        }
    }

    /**
     * A record of scalar fields. Field names are case-insensitive.
     */
    public static final class Block extends ConfigValue {
        private final Map<String, String> fields;

        public Block(Map<String, String> fields) {
            Map<String, String> lowered = new LinkedHashMap<>();
            fields.forEach((k, v) -> lowered.put(k.toLowerCase(), v));
            this.fields = Collections.unmodifiableMap(lowered);
        }

        @Override
        public Kind kind() {
            return Kind.BLOCK;
        }

        @Override
        public Block asBlock(String key) {
            return this;
        }

        public Map<String, String> getFields() {
            return fields;
        }

        public String getString(String field, String defaultValue) {
            String value = fields.get(field);
            return value != null ? value.trim() : defaultValue;
        }

        /**
         * Reads an integer field. Absent or 0 means the default; negative values are rejected.
         */
        public int getInt(String key, String field, int defaultValue) {
            String value = fields.get(field);
            if (value == null || value.isBlank()) {
                return defaultValue;
            }
            int parsed;
            try {
                parsed = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new ConfigException(key, field + " is not an integer: " + value, e);
            }
            if (parsed < 0) {
                throw new ConfigException(key, field + " must not be negative: " + parsed);
            }
            return parsed == 0 ? defaultValue : parsed;
        }

        public boolean getFlag(String key, String field, boolean defaultValue) {
            String value = fields.get(field);
            if (value == null || value.isBlank()) {
                return defaultValue;
            }
            switch (value.trim().toLowerCase()) {
                case "1":
                case "true":
                    return true;
                case "0":
                case "false":
                    return false;
                default:
                    throw new ConfigException(key, field + " is not a flag: " + value);
            }
        }
    }

    public static final class Sequence extends ConfigValue {
        private final List<String> items;

        public Sequence(List<String> items) {
            this.items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        @Override
        public Kind kind() {
            return Kind.SEQUENCE;
        }

        @Override
        public Sequence asSequence(String key) {
            return this;
        }

        public List<String> getItems() {
            return items;
        }
    }
}
