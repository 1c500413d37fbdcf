package com.tsrouter.exception;

/**
 * The measurement has no routing entry.
 */
public class NoRouteException extends RouterException {

    private final String measurement;

    public NoRouteException(String measurement) {
        super("unknown measurement: " + measurement);
        this.measurement = measurement;
    }

    public String getMeasurement() {
        return measurement;
    }
}
