package com.tsrouter.exception;

/**
 * A backend refused a write or could not be reached.
 * Client errors (4xx) are not retryable: the same body would be refused again.
 */
public class BackendWriteException extends RouterException {

    private final String backend;
    private final int statusCode;
    private final boolean retryable;

    public BackendWriteException(String backend, int statusCode, String message, boolean retryable) {
        super(String.format("backend %s write failed (status %d): %s", backend, statusCode, message));
        this.backend = backend;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public BackendWriteException(String backend, String message, Throwable cause) {
        super(String.format("backend %s unreachable: %s", backend, message), cause);
        this.backend = backend;
        this.statusCode = 0;
        this.retryable = true;
    }

    public String getBackend() {
        return backend;
    }

    /**
     * HTTP status returned by the backend, 0 for transport failures.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isTransportFailure() {
        return statusCode == 0;
    }
}
