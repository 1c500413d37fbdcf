package com.tsrouter.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsrouter.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a snapshot of the key/value configuration store from a JSON document.
 * Top-level keys follow the store's key layout:
 * <ul>
 *   <li>{@code default_node}: record with the node defaults</li>
 *   <li>{@code b:<backend>}: backend record</li>
 *   <li>{@code n:<node>}: node record, overriding the defaults</li>
 *   <li>{@code m:<measurement>}: ordered list of backend names</li>
 * </ul>
 */
public class KeyValueConfigSource implements ConfigSource {

    private static final Logger logger = LoggerFactory.getLogger(KeyValueConfigSource.class);

    static final String BACKEND_PREFIX = "b:";
    static final String NODE_PREFIX = "n:";
    static final String MEASUREMENT_PREFIX = "m:";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final File file;

    public KeyValueConfigSource(File file) {
        this.file = file;
    }

    @Override
    public ConfigDocument load() {
        if (!file.isFile()) {
            throw new ConfigException(null, "config store not found: " + file.getAbsolutePath());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(file);
        } catch (IOException e) {
            throw new ConfigException(null, "cannot read config store " + file + ": " + e.getMessage(), e);
        }
        ConfigDocument document = parse(root);
        logger.info("Loaded config store {}: {}", file, document);
        return document;
    }

    /**
     * Types and validates every entry of a store snapshot.
     */
    public ConfigDocument parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigException(null, "config store must be a JSON object");
        }

        Map<String, ConfigException> errors = new LinkedHashMap<>();
        Map<String, ConfigValue> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            try {
                values.put(entry.getKey(), ConfigValue.fromJson(entry.getKey(), entry.getValue()));
            } catch (ConfigException e) {
                errors.put(entry.getKey(), e);
            }
        }

        NodeConfig defaultNode = null;
        if (values.containsKey(NodeConfig.DEFAULT_NODE)) {
            try {
                defaultNode = NodeConfig.fromBlock(NodeConfig.DEFAULT_NODE,
                        values.get(NodeConfig.DEFAULT_NODE).asBlock(NodeConfig.DEFAULT_NODE), null);
            } catch (ConfigException e) {
                errors.put(NodeConfig.DEFAULT_NODE, e);
            }
        }

        Map<String, BackendConfig> backends = new LinkedHashMap<>();
        Map<String, NodeConfig> nodes = new LinkedHashMap<>();
        Map<String, List<String>> measurements = new LinkedHashMap<>();

        for (Map.Entry<String, ConfigValue> entry : values.entrySet()) {
            String key = entry.getKey();
            ConfigValue value = entry.getValue();
            try {
                if (key.equals(NodeConfig.DEFAULT_NODE)) {
                    continue;
                } else if (key.startsWith(BACKEND_PREFIX)) {
                    String name = nameOf(key, BACKEND_PREFIX);
                    backends.put(name, BackendConfig.fromBlock(name, value.asBlock(key)));
                } else if (key.startsWith(NODE_PREFIX)) {
                    String name = nameOf(key, NODE_PREFIX);
                    nodes.put(name, NodeConfig.fromBlock(name, value.asBlock(key), defaultNode));
                } else if (key.startsWith(MEASUREMENT_PREFIX)) {
                    measurements.put(nameOf(key, MEASUREMENT_PREFIX), backendList(key, value.asSequence(key)));
                } else {
                    throw new ConfigException(key, "unknown key");
                }
            } catch (ConfigException e) {
                errors.put(key, e);
            }
        }

        for (ConfigException error : errors.values()) {
            logger.warn("Invalid config entry {}", error.getMessage());
        }
        logger.debug("{} backends, {} nodes, {} measurements read", backends.size(), nodes.size(), measurements.size());
        return new ConfigDocument(defaultNode, backends, nodes, measurements, errors);
    }

    private static String nameOf(String key, String prefix) {
        String name = key.substring(prefix.length());
        if (name.isEmpty()) {
            throw new ConfigException(key, "empty name");
        }
        return name;
    }

    private static List<String> backendList(String key, ConfigValue.Sequence sequence) {
        Set<String> names = new LinkedHashSet<>();
        for (String item : sequence.getItems()) {
            String name = item.trim();
            if (name.isEmpty()) {
                throw new ConfigException(key, "empty backend name");
            }
            names.add(name);
        }
        if (names.isEmpty()) {
            throw new ConfigException(key, "measurement maps to no backend");
        }
        return new ArrayList<>(names);
    }
}
