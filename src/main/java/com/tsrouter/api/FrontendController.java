package com.tsrouter.api;

import com.tsrouter.backend.BackendRuntime;
import com.tsrouter.backend.QueryResult;
import com.tsrouter.config.NodeConfig;
import com.tsrouter.exception.ConfigException;
import com.tsrouter.exception.MalformedInputException;
import com.tsrouter.exception.NoRouteException;
import com.tsrouter.exception.QueryTimeoutException;
import com.tsrouter.exception.UnavailableException;
import com.tsrouter.model.Precision;
import com.tsrouter.registry.RegistrySnapshot;
import com.tsrouter.service.RouterService;
import com.tsrouter.service.RouterStatistics;
import com.tsrouter.service.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.servlet.http.HttpServletRequest;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Client-facing HTTP API of every node. The node a request belongs to is the
 * one listening on the port the request arrived on.
 */
@RestController
public class FrontendController {

    private static final Logger logger = LoggerFactory.getLogger(FrontendController.class);

    static final String VERSION_HEADER = "X-Influxdb-Version";
    static final String VERSION = "1.8-tsrouter";

    @Autowired
    private RouterService routerService;

    @Autowired
    private RouterStatistics statistics;

    /**
     * Write line-protocol points.
     * POST /write?db=...&precision=...
     */
    @PostMapping("/write")
    public ResponseEntity<Map<String, Object>> write(
            @RequestParam(value = "db", required = false) String db,
            @RequestParam(value = "precision", required = false) String precision,
            @RequestHeader(value = HttpHeaders.CONTENT_ENCODING, required = false) String contentEncoding,
            @RequestBody(required = false) byte[] body,
            HttpServletRequest request) {

        NodeConfig node = routerService.resolveNode(request.getLocalAddr(), request.getLocalPort());
        if (!node.acceptsDatabase(db)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(createErrorResponse("Database not found", "database not exist"));
        }

        try {
            Precision unit = Precision.fromParameter(precision);
            String lines = decodeBody(body, contentEncoding);
            WriteResult result = routerService.write(node, lines, unit);
            if (result.isComplete()) {
                return ResponseEntity.noContent().build();
            }

            Map<String, Object> response = new HashMap<>();
            response.put("accepted", result.getAccepted());
            response.put("rejected", result.getRejected());
            response.put("errors", result.getErrors());
            return ResponseEntity.status(result.getHttpStatus()).body(response);

        } catch (MalformedInputException e) {
            logger.debug("Write rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(createErrorResponse("Malformed request", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error writing points", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(createErrorResponse("Write failed", e.getMessage()));
        }
    }

    /**
     * Forward a query to one backend.
     * GET|POST /query?db=...&q=...
     */
    @RequestMapping(value = "/query", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<?> query(@RequestParam Map<String, String> parameters, HttpServletRequest request) {
        NodeConfig node = routerService.resolveNode(request.getLocalAddr(), request.getLocalPort());
        if (!node.acceptsDatabase(parameters.get("db"))) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(createErrorResponse("Database not found", "database not exist"));
        }

        try {
            QueryResult result = routerService.query(node, parameters);
            ResponseEntity.BodyBuilder builder = ResponseEntity.status(result.getStatus());
            if (result.getContentType() != null) {
                builder.contentType(MediaType.parseMediaType(result.getContentType()));
            }
            return builder.body(result.getBody());

        } catch (MalformedInputException | NoRouteException e) {
            logger.debug("Query rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(createErrorResponse("Query rejected", e.getMessage()));
        } catch (UnavailableException e) {
            logger.warn("Query unavailable: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(createErrorResponse("Service unavailable", e.getMessage()));
        } catch (QueryTimeoutException e) {
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                    .body(createErrorResponse("Query timeout", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error routing query", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(createErrorResponse("Query failed", e.getMessage()));
        }
    }

    /**
     * GET|HEAD /ping
     */
    @RequestMapping(value = "/ping", method = {RequestMethod.GET, RequestMethod.HEAD})
    public ResponseEntity<Void> ping() {
        statistics.recordPing();
        return ResponseEntity.noContent().header(VERSION_HEADER, VERSION).build();
    }

    /**
     * Re-read the configuration store.
     * POST /reload
     */
    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        try {
            RegistrySnapshot snapshot = routerService.reload();
            logger.info("Reloaded configuration: {}", snapshot);
            return ResponseEntity.noContent().build();
        } catch (ConfigException e) {
            logger.warn("Reload failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(createErrorResponse("Reload failed", e.getMessage()));
        }
    }

    /**
     * GET /stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> backends = new LinkedHashMap<>();
        for (BackendRuntime runtime : routerService.getSnapshot().getRuntimes().values()) {
            backends.put(runtime.getName(), runtime.getBatcher().getStats());
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("router", statistics.toMap());
        response.put("backends", backends);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        RegistrySnapshot snapshot = routerService.getSnapshot();
        Map<String, Object> backends = new LinkedHashMap<>();
        for (BackendRuntime runtime : snapshot.getRuntimes().values()) {
            Map<String, Object> backend = new LinkedHashMap<>();
            backend.put("health", runtime.getState().getHealth());
            backend.put("url", runtime.getConfig().getUrl());
            backend.put("zone", runtime.getConfig().getZone());
            backends.put(runtime.getName(), backend);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("version", snapshot.getVersion());
        response.put("backends", backends);
        return ResponseEntity.ok(response);
    }

    private static String decodeBody(byte[] body, String contentEncoding) {
        if (body == null) {
            return "";
        }
        if (!"gzip".equalsIgnoreCase(contentEncoding)) {
            return new String(body, StandardCharsets.UTF_8);
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MalformedInputException("invalid gzip body", e);
        }
    }

    private Map<String, Object> createErrorResponse(String error, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("error", error);
        response.put("message", message);
        return response;
    }
}
