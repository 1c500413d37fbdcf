package com.tsrouter.exception;

/**
 * Base class for all routing failures.
 * Each subclass maps to one category of the router's error taxonomy.
 */
public class RouterException extends RuntimeException {

    public RouterException(String message) {
        super(message);
    }

    public RouterException(String message, Throwable cause) {
        super(message, cause);
    }
}
