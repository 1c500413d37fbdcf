package com.tsrouter.backend;

import com.tsrouter.config.BackendConfig;
import com.tsrouter.exception.BackendTimeoutException;
import com.tsrouter.exception.BackendWriteException;
import com.tsrouter.exception.QueryTimeoutException;
import com.tsrouter.exception.UnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

public class HttpBackendClientTest {

    private MockRestServiceServer writeServer;
    private MockRestServiceServer queryServer;
    private MockRestServiceServer probeServer;
    private ExecutorService ioExecutor;
    private HttpBackendClient client;

    @BeforeEach
    void setUp() {
        ioExecutor = Executors.newCachedThreadPool();
        RestTemplate writeTemplate = new RestTemplate();
        RestTemplate queryTemplate = new RestTemplate();
        RestTemplate probeTemplate = new RestTemplate();
        writeServer = MockRestServiceServer.bindTo(writeTemplate).build();
        queryServer = MockRestServiceServer.bindTo(queryTemplate).build();
        probeServer = MockRestServiceServer.bindTo(probeTemplate).build();

        BackendConfig config = new BackendConfig("local", "http://localhost:8086", "test", "local");
        client = new HttpBackendClient(config, writeTemplate, queryTemplate, probeTemplate, ioExecutor);
    }

    @AfterEach
    void tearDown() {
        ioExecutor.shutdownNow();
    }

    @Test
    public void testWritePostsLinesToBackendDatabase() {
        writeServer.expect(requestTo("http://localhost:8086/write?db=test"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().string("cpu value=1 1\n"))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        client.write("cpu value=1 1\n".getBytes(StandardCharsets.UTF_8), false);

        writeServer.verify();
    }

    @Test
    public void testGzippedWriteCarriesContentEncoding() {
        writeServer.expect(requestTo("http://localhost:8086/write?db=test"))
                .andExpect(header("Content-Encoding", "gzip"))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        client.write(new byte[]{31, -117}, true);

        writeServer.verify();
    }

    @Test
    public void testClientErrorIsNotRetryable() {
        writeServer.expect(requestTo("http://localhost:8086/write?db=test"))
                .andRespond(withBadRequest().body("unable to parse"));

        BackendWriteException e = assertThrows(BackendWriteException.class,
                () -> client.write(new byte[0], false));
        assertEquals(400, e.getStatusCode());
        assertFalse(e.isRetryable());
        assertFalse(e.isTransportFailure());
    }

    @Test
    public void testServerErrorIsRetryable() {
        writeServer.expect(requestTo("http://localhost:8086/write?db=test"))
                .andRespond(withServerError());

        BackendWriteException e = assertThrows(BackendWriteException.class,
                () -> client.write(new byte[0], false));
        assertEquals(500, e.getStatusCode());
        assertTrue(e.isRetryable());
    }

    @Test
    public void testTransportFailures() {
        writeServer.expect(requestTo("http://localhost:8086/write?db=test"))
                .andRespond(withException(new ConnectException("connection refused")));
        writeServer.expect(requestTo("http://localhost:8086/write?db=test"))
                .andRespond(withException(new SocketTimeoutException("read timed out")));

        BackendWriteException refused = assertThrows(BackendWriteException.class,
                () -> client.write(new byte[0], false));
        assertTrue(refused.isTransportFailure());
        assertTrue(refused.isRetryable());

        BackendTimeoutException timeout = assertThrows(BackendTimeoutException.class,
                () -> client.write(new byte[0], false));
        assertEquals(BackendConfig.DEFAULT_TIMEOUT_MS, timeout.getTimeoutMs());
    }

    @Test
    public void testQueryRewritesDatabaseAndRelaysResponse() {
        queryServer.expect(requestTo("http://localhost:8086/query"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().string(containsString("db=test")))
                .andExpect(content().string(not(containsString("db=client"))))
                .andExpect(content().string(containsString("epoch=ms")))
                .andRespond(withSuccess("{\"results\":[]}", MediaType.APPLICATION_JSON));

        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("q", "select * from cpu");
        parameters.put("db", "client");
        parameters.put("epoch", "ms");
        QueryResult result = client.query(parameters);

        assertEquals(200, result.getStatus());
        assertEquals("local", result.getBackend());
        assertTrue(result.getContentType().startsWith("application/json"));
        assertEquals("{\"results\":[]}", result.getBodyAsString());
        queryServer.verify();
    }

    @Test
    public void testQueryErrorStatusIsRelayed() {
        queryServer.expect(requestTo("http://localhost:8086/query"))
                .andRespond(withBadRequest().body("{\"error\":\"bad query\"}"));

        QueryResult result = client.query(Map.of("q", "select * from cpu"));

        assertEquals(400, result.getStatus());
        assertEquals("{\"error\":\"bad query\"}", result.getBodyAsString());
    }

    @Test
    public void testQueryTimeoutAndUnreachable() {
        queryServer.expect(requestTo("http://localhost:8086/query"))
                .andRespond(withException(new SocketTimeoutException("read timed out")));
        queryServer.expect(requestTo("http://localhost:8086/query"))
                .andRespond(withException(new ConnectException("connection refused")));

        assertThrows(QueryTimeoutException.class, () -> client.query(Map.of("q", "select * from cpu")));
        assertThrows(UnavailableException.class, () -> client.query(Map.of("q", "select * from cpu")));
    }

    @Test
    public void testPing() {
        probeServer.expect(requestTo("http://localhost:8086/ping"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));
        probeServer.expect(requestTo("http://localhost:8086/ping"))
                .andRespond(withServerError());

        client.ping();
        assertThrows(RestClientException.class, client::ping);
        probeServer.verify();
    }
}
