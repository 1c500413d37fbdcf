package com.tsrouter.backend;

import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.client.HttpClientBuilder;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;

import java.util.function.Supplier;

/**
 * Apache HttpClient request factory whose requests can be aborted from another
 * thread. Aborting closes the connection, so a read blocked on a backend that
 * trickles its response fails at once.
 */
class AbortableRequestFactory extends HttpComponentsClientHttpRequestFactory {

    static final int MAX_CONNECTIONS = 64;

    private static final ThreadLocal<Handle> CURRENT = new ThreadLocal<>();

    AbortableRequestFactory() {
        super(HttpClientBuilder.create()
                .setMaxConnPerRoute(MAX_CONNECTIONS)
                .setMaxConnTotal(MAX_CONNECTIONS)
                .disableAutomaticRetries()
                .build());
    }

    /**
     * Runs an exchange on the calling thread; requests it creates are bound to {@code handle}.
     */
    static <T> T runWith(Handle handle, Supplier<T> exchange) {
        CURRENT.set(handle);
        try {
            return exchange.get();
        } finally {
            CURRENT.remove();
        }
    }

    @Override
    protected void postProcessHttpRequest(HttpUriRequest request) {
        Handle handle = CURRENT.get();
        if (handle != null) {
            handle.bind(request);
        }
    }

    /**
     * Abort switch for the request of one exchange.
     */
    static class Handle {
        private HttpUriRequest request;
        private boolean aborted;

        synchronized void bind(HttpUriRequest request) {
            this.request = request;
            if (aborted) {
                request.abort();
            }
        }

        /**
         * Aborts the bound request, or the next one bound if none is yet.
         */
        void abort() {
            HttpUriRequest bound;
            synchronized (this) {
                aborted = true;
                bound = request;
            }
            if (bound != null) {
                bound.abort();
            }
        }
    }
}
