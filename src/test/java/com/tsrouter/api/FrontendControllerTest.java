package com.tsrouter.api;

import com.tsrouter.backend.QueryResult;
import com.tsrouter.config.NodeConfig;
import com.tsrouter.exception.ConfigException;
import com.tsrouter.exception.MalformedQueryException;
import com.tsrouter.exception.NoRouteException;
import com.tsrouter.exception.QueryTimeoutException;
import com.tsrouter.exception.UnavailableException;
import com.tsrouter.model.Precision;
import com.tsrouter.registry.RegistrySnapshot;
import com.tsrouter.service.RouterService;
import com.tsrouter.service.RouterStatistics;
import com.tsrouter.service.WriteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class FrontendControllerTest {

    @Mock
    private RouterService routerService;

    private RouterStatistics statistics;
    private FrontendController controller;
    private MockHttpServletRequest request;
    private NodeConfig node;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        statistics = new RouterStatistics();
        controller = new FrontendController();
        ReflectionTestUtils.setField(controller, "routerService", routerService);
        ReflectionTestUtils.setField(controller, "statistics", statistics);

        node = new NodeConfig("l1", ":6666", "test", "local", 10, 10, false, false);
        request = new MockHttpServletRequest();
        request.setLocalPort(6666);
        when(routerService.resolveNode("127.0.0.1", 6666)).thenReturn(node);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static WriteResult complete() {
        WriteResult result = mock(WriteResult.class);
        when(result.isComplete()).thenReturn(true);
        return result;
    }

    @Test
    public void testWriteAccepted() {
        WriteResult result = complete();
        when(routerService.write(eq(node), anyString(), eq(Precision.SECONDS))).thenReturn(result);

        ResponseEntity<Map<String, Object>> response =
                controller.write("test", "s", null, bytes("cpu value=1 1"), request);

        assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode());
        verify(routerService).write(node, "cpu value=1 1", Precision.SECONDS);
    }

    @Test
    public void testWriteToWrongDatabase() {
        ResponseEntity<Map<String, Object>> response =
                controller.write("other", null, null, bytes("cpu value=1 1"), request);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("Database not found", response.getBody().get("error"));
        verify(routerService, never()).write(any(), anyString(), any());
    }

    @Test
    public void testGzippedWriteIsDecoded() throws IOException {
        WriteResult result = complete();
        when(routerService.write(eq(node), anyString(), any())).thenReturn(result);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(bytes("cpu value=1 1\n"));
        }

        ResponseEntity<Map<String, Object>> response =
                controller.write("test", null, "gzip", out.toByteArray(), request);

        assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode());
        verify(routerService).write(node, "cpu value=1 1\n", Precision.NANOSECONDS);
    }

    @Test
    public void testWriteRejectsBadInput() {
        assertEquals(HttpStatus.BAD_REQUEST,
                controller.write("test", "fortnight", null, bytes("cpu value=1 1"), request).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
                controller.write("test", null, "gzip", bytes("not gzip"), request).getStatusCode());
    }

    @Test
    public void testPartialWriteReportsLineErrors() {
        WriteResult result = mock(WriteResult.class);
        when(result.isComplete()).thenReturn(false);
        when(result.getAccepted()).thenReturn(1);
        when(result.getRejected()).thenReturn(1);
        when(result.getHttpStatus()).thenReturn(503);
        when(routerService.write(eq(node), anyString(), any())).thenReturn(result);

        ResponseEntity<Map<String, Object>> response =
                controller.write("test", null, null, bytes("cpu value=1 1\ncpu value=2 2"), request);

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals(1, response.getBody().get("accepted"));
        assertEquals(1, response.getBody().get("rejected"));
    }

    @Test
    public void testQueryRelaysBackendResponse() {
        byte[] body = bytes("{\"results\":[]}");
        when(routerService.query(eq(node), anyMap()))
                .thenReturn(new QueryResult("local", 200, "application/json", body));

        ResponseEntity<?> response = controller.query(Map.of("db", "test", "q", "select * from cpu"), request);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(MediaType.APPLICATION_JSON, response.getHeaders().getContentType());
        assertSame(body, response.getBody());
    }

    @Test
    public void testQueryFailureStatuses() {
        Map<String, String> parameters = Map.of("db", "test", "q", "select * from cpu");

        when(routerService.query(eq(node), anyMap())).thenThrow(new MalformedQueryException("query forbidden"));
        assertEquals(HttpStatus.BAD_REQUEST, controller.query(parameters, request).getStatusCode());

        reset(routerService);
        when(routerService.resolveNode("127.0.0.1", 6666)).thenReturn(node);
        when(routerService.query(eq(node), anyMap())).thenThrow(new NoRouteException("cpu"));
        assertEquals(HttpStatus.BAD_REQUEST, controller.query(parameters, request).getStatusCode());

        reset(routerService);
        when(routerService.resolveNode("127.0.0.1", 6666)).thenReturn(node);
        when(routerService.query(eq(node), anyMap())).thenThrow(new UnavailableException("no healthy backend for query"));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, controller.query(parameters, request).getStatusCode());

        reset(routerService);
        when(routerService.resolveNode("127.0.0.1", 6666)).thenReturn(node);
        when(routerService.query(eq(node), anyMap())).thenThrow(new QueryTimeoutException("local", 600000, null));
        assertEquals(HttpStatus.GATEWAY_TIMEOUT, controller.query(parameters, request).getStatusCode());
    }

    @Test
    public void testQueryToWrongDatabase() {
        ResponseEntity<?> response = controller.query(Map.of("db", "other", "q", "select * from cpu"), request);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        verify(routerService, never()).query(any(), anyMap());
    }

    @Test
    public void testPing() {
        ResponseEntity<Void> response = controller.ping();

        assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode());
        assertEquals(FrontendController.VERSION, response.getHeaders().getFirst(FrontendController.VERSION_HEADER));
        assertEquals(1, statistics.getTotal().getPingRequests());
    }

    @Test
    public void testReload() {
        when(routerService.reload()).thenReturn(RegistrySnapshot.empty());
        assertEquals(HttpStatus.NO_CONTENT, controller.reload().getStatusCode());

        when(routerService.reload()).thenThrow(new ConfigException(null, "config store not found: router.json"));
        assertEquals(HttpStatus.BAD_REQUEST, controller.reload().getStatusCode());
    }

    @Test
    public void testHealth() {
        when(routerService.getSnapshot()).thenReturn(RegistrySnapshot.empty());

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals("UP", response.getBody().get("status"));
        assertEquals(0L, response.getBody().get("version"));
    }
}
