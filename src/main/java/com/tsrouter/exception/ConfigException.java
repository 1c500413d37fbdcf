package com.tsrouter.exception;

/**
 * A configuration entry is missing, malformed or references something that does not exist.
 * Fatal at startup; on reload only the offending entry is discarded.
 */
public class ConfigException extends RouterException {

    private final String key;

    public ConfigException(String key, String message) {
        super(key != null ? key + ": " + message : message);
        this.key = key;
    }

    public ConfigException(String key, String message, Throwable cause) {
        super(key != null ? key + ": " + message : message, cause);
        this.key = key;
    }

    /**
     * The configuration store key the error belongs to, or null for document-level errors.
     */
    public String getKey() {
        return key;
    }
}
