package com.tsrouter.exception;

/**
 * A write flush exceeded the backend's write timeout.
 */
public class BackendTimeoutException extends RouterException {

    private final String backend;
    private final long timeoutMs;

    public BackendTimeoutException(String backend, long timeoutMs, Throwable cause) {
        super(String.format("backend %s did not answer within %dms", backend, timeoutMs), cause);
        this.backend = backend;
        this.timeoutMs = timeoutMs;
    }

    public String getBackend() {
        return backend;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
