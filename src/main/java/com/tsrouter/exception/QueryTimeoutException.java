package com.tsrouter.exception;

/**
 * A forwarded query exceeded the backend's query timeout. Never retried.
 */
public class QueryTimeoutException extends BackendTimeoutException {

    public QueryTimeoutException(String backend, long timeoutMs, Throwable cause) {
        super(backend, timeoutMs, cause);
    }
}
