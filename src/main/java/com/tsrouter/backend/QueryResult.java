package com.tsrouter.backend;

import java.nio.charset.StandardCharsets;

/**
 * A backend's answer to a query, passed to the client unchanged.
 */
public class QueryResult {

    private final String backend;
    private final int status;
    private final String contentType;
    private final byte[] body;

    public QueryResult(String backend, int status, String contentType, byte[] body) {
        this.backend = backend;
        this.status = status;
        this.contentType = contentType;
        this.body = body != null ? body : new byte[0];
    }

    /**
     * Name of the backend that answered.
     */
    public String getBackend() {
        return backend;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Content type reported by the backend, or null.
     */
    public String getContentType() {
        return contentType;
    }

    public byte[] getBody() {
        return body;
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return String.format("QueryResult{backend='%s', status=%d, contentType='%s', bytes=%d}",
                backend, status, contentType, body.length);
    }
}
