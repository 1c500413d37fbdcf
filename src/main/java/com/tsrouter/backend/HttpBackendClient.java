package com.tsrouter.backend;

import com.tsrouter.config.BackendConfig;
import com.tsrouter.exception.BackendTimeoutException;
import com.tsrouter.exception.BackendWriteException;
import com.tsrouter.exception.QueryTimeoutException;
import com.tsrouter.exception.UnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * {@link BackendClient} over Spring's {@link RestTemplate}. Writes, queries and
 * probes each use their own template so each gets its own timeout.
 *
 * Socket timeouts only bound each read, so every exchange also runs on the shared
 * IO executor under a deadline of the same length. When the deadline passes the
 * request is aborted and its IO thread released.
 */
public class HttpBackendClient implements BackendClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpBackendClient.class);

    // query responses are relayed whatever their status
    private static final ResponseErrorHandler PASS_THROUGH = new ResponseErrorHandler() {
        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {
        }
    };

    private final BackendConfig config;
    private final RestTemplate writeTemplate;
    private final RestTemplate queryTemplate;
    private final RestTemplate probeTemplate;
    private final URI writeUri;
    private final URI queryUri;
    private final URI pingUri;
    private final ExecutorService ioExecutor;

    /**
     * The query template must not be shared with writes or probes: its error handler
     * is replaced so backend error responses are relayed instead of thrown.
     */
    public HttpBackendClient(BackendConfig config, RestTemplate writeTemplate,
                             RestTemplate queryTemplate, RestTemplate probeTemplate,
                             ExecutorService ioExecutor) {
        this.config = config;
        this.ioExecutor = ioExecutor;
        this.writeTemplate = writeTemplate;
        this.queryTemplate = queryTemplate;
        this.queryTemplate.setErrorHandler(PASS_THROUGH);
        this.probeTemplate = probeTemplate;
        this.writeUri = UriComponentsBuilder.fromHttpUrl(config.getUrl()).path("/write")
                .queryParam("db", config.getDb()).build().encode().toUri();
        this.queryUri = UriComponentsBuilder.fromHttpUrl(config.getUrl()).path("/query").build().toUri();
        this.pingUri = UriComponentsBuilder.fromHttpUrl(config.getUrl()).path("/ping").build().toUri();
    }

    /**
     * Builds a client whose templates carry the backend's write, query and probe timeouts.
     */
    public static HttpBackendClient create(BackendConfig config, RestTemplateBuilder builder,
                                           ExecutorService ioExecutor) {
        builder = builder.requestFactory(AbortableRequestFactory::new);
        RestTemplate write = builder
                .setConnectTimeout(Duration.ofMillis(config.getTimeout()))
                .setReadTimeout(Duration.ofMillis(config.getTimeout()))
                .build();
        RestTemplate query = builder
                .setConnectTimeout(Duration.ofMillis(config.getTimeout()))
                .setReadTimeout(Duration.ofMillis(config.getTimeoutQuery()))
                .build();
        RestTemplate probe = builder
                .setConnectTimeout(Duration.ofMillis(config.getProbeTimeout()))
                .setReadTimeout(Duration.ofMillis(config.getProbeTimeout()))
                .build();
        return new HttpBackendClient(config, write, query, probe, ioExecutor);
    }

    @Override
    public void write(byte[] body, boolean gzipped) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        if (gzipped) {
            headers.set(HttpHeaders.CONTENT_ENCODING, "gzip");
        }
        try {
            exchangeWithin(config.getTimeout(),
                    () -> writeTemplate.exchange(writeUri, HttpMethod.POST, new HttpEntity<>(body, headers), Void.class));
        } catch (TimeoutException e) {
            throw new BackendTimeoutException(config.getName(), config.getTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendWriteException(config.getName(), "write interrupted", e);
        } catch (HttpClientErrorException e) {
            // the same body would be refused again
            throw new BackendWriteException(config.getName(), e.getRawStatusCode(),
                    e.getResponseBodyAsString(), false);
        } catch (HttpServerErrorException e) {
            throw new BackendWriteException(config.getName(), e.getRawStatusCode(),
                    e.getResponseBodyAsString(), true);
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                throw new BackendTimeoutException(config.getName(), config.getTimeout(), e);
            }
            throw new BackendWriteException(config.getName(), e.getMessage(), e);
        } catch (RestClientException e) {
            throw new BackendWriteException(config.getName(), e.getMessage(), e);
        }
    }

    @Override
    public QueryResult query(Map<String, String> parameters) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        parameters.forEach(form::add);
        form.set("db", config.getDb());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        try {
            ResponseEntity<byte[]> response = exchangeWithin(config.getTimeoutQuery(),
                    () -> queryTemplate.exchange(queryUri, HttpMethod.POST, new HttpEntity<>(form, headers), byte[].class));
            MediaType contentType = response.getHeaders().getContentType();
            return new QueryResult(config.getName(), response.getStatusCodeValue(),
                    contentType != null ? contentType.toString() : null, response.getBody());
        } catch (TimeoutException e) {
            throw new QueryTimeoutException(config.getName(), config.getTimeoutQuery(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnavailableException("query to backend " + config.getName() + " interrupted");
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                throw new QueryTimeoutException(config.getName(), config.getTimeoutQuery(), e);
            }
            logger.warn("Query to backend {} failed: {}", config.getName(), e.getMessage());
            throw new UnavailableException("backend " + config.getName() + " unreachable: " + e.getMessage());
        }
    }

    @Override
    public void ping() {
        try {
            exchangeWithin(config.getProbeTimeout(), () -> probeTemplate.getForEntity(pingUri, Void.class));
        } catch (TimeoutException e) {
            throw new BackendTimeoutException(config.getName(), config.getProbeTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnavailableException("ping of backend " + config.getName() + " interrupted");
        }
    }

    /**
     * Releases the connection pools of the templates.
     */
    @Override
    public void close() {
        for (RestTemplate template : new RestTemplate[]{writeTemplate, queryTemplate, probeTemplate}) {
            if (template.getRequestFactory() instanceof DisposableBean) {
                try {
                    ((DisposableBean) template.getRequestFactory()).destroy();
                } catch (Exception e) {
                    logger.warn("Closing HTTP client of backend {} failed: {}", config.getName(), e.getMessage());
                }
            }
        }
    }

    /**
     * Runs an exchange on the IO executor and waits at most {@code timeoutMs} for it.
     * On timeout or interrupt the request is aborted, which fails the exchange on its
     * IO thread. Exceptions of the exchange are rethrown as they are.
     */
    private <T> T exchangeWithin(long timeoutMs, Supplier<T> exchange) throws TimeoutException, InterruptedException {
        AbortableRequestFactory.Handle handle = new AbortableRequestFactory.Handle();
        Future<T> call = ioExecutor.submit(() -> AbortableRequestFactory.runWith(handle, exchange));
        try {
            return call.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            handle.abort();
            call.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    public BackendConfig getConfig() {
        return config;
    }
}
