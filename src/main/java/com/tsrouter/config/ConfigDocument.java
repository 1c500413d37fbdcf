package com.tsrouter.config;

import com.tsrouter.exception.ConfigException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything read from the configuration store in one pass, already typed and
 * validated entry by entry. Entries that failed validation are absent from
 * their map and listed in {@link #getErrors()} under their store key.
 */
public class ConfigDocument {

    private final NodeConfig defaultNode;
    private final Map<String, BackendConfig> backends;
    private final Map<String, NodeConfig> nodes;
    private final Map<String, List<String>> measurements;
    private final Map<String, ConfigException> errors;

    public ConfigDocument(NodeConfig defaultNode,
                          Map<String, BackendConfig> backends,
                          Map<String, NodeConfig> nodes,
                          Map<String, List<String>> measurements,
                          Map<String, ConfigException> errors) {
        this.defaultNode = defaultNode;
        this.backends = Collections.unmodifiableMap(new LinkedHashMap<>(backends));
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.measurements = Collections.unmodifiableMap(new LinkedHashMap<>(measurements));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    /**
     * The default node record, or null when the store has none.
     */
    public NodeConfig getDefaultNode() {
        return defaultNode;
    }

    public Map<String, BackendConfig> getBackends() {
        return backends;
    }

    public Map<String, NodeConfig> getNodes() {
        return nodes;
    }

    public Map<String, List<String>> getMeasurements() {
        return measurements;
    }

    public Map<String, ConfigException> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("ConfigDocument{backends=%d, nodes=%d, measurements=%d, errors=%d}",
                backends.size(), nodes.size(), measurements.size(), errors.size());
    }
}
