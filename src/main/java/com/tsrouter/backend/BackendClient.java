package com.tsrouter.backend;

import java.util.Map;

/**
 * HTTP protocol spoken to one backend. Every call completes or fails within the
 * backend's timeout for that kind of call.
 */
public interface BackendClient {

    /**
     * Sends a batch of line-protocol lines to the backend database.
     *
     * @param body    newline separated lines, gzip compressed if {@code gzipped}
     * @throws com.tsrouter.exception.BackendWriteException   if the backend refused the batch or was unreachable
     * @throws com.tsrouter.exception.BackendTimeoutException if the backend did not answer in time
     */
    void write(byte[] body, boolean gzipped);

    /**
     * Forwards a query. The {@code db} parameter is replaced by the backend database,
     * every other parameter is passed through.
     *
     * @throws com.tsrouter.exception.QueryTimeoutException if the backend did not answer in time
     * @throws com.tsrouter.exception.UnavailableException  if the backend could not be reached
     */
    QueryResult query(Map<String, String> parameters);

    /**
     * Checks the backend's ping endpoint.
     *
     * @throws RuntimeException if the backend did not answer with a 2xx status
     */
    void ping();

    /**
     * Releases connections held for the backend.
     */
    default void close() {
    }
}
