package com.tsrouter.config;

/**
 * Read-mostly source of backend, node and routing definitions, loaded wholesale.
 */
public interface ConfigSource {

    /**
     * Reads the whole store. Per-entry problems are reported inside the document;
     * a store that cannot be read at all raises a {@link com.tsrouter.exception.ConfigException}.
     */
    ConfigDocument load();
}
