package com.tsrouter.service;

import com.tsrouter.backend.BackendManager;
import com.tsrouter.backend.BackendRuntime;
import com.tsrouter.backend.QueryResult;
import com.tsrouter.config.ConfigDocument;
import com.tsrouter.config.ConfigSource;
import com.tsrouter.config.NodeConfig;
import com.tsrouter.config.RouterProperties;
import com.tsrouter.exception.MalformedInputException;
import com.tsrouter.exception.NoRouteException;
import com.tsrouter.exception.RouterException;
import com.tsrouter.exception.UnavailableException;
import com.tsrouter.model.LineProtocol;
import com.tsrouter.model.Point;
import com.tsrouter.model.Precision;
import com.tsrouter.query.QueryRouter;
import com.tsrouter.registry.BackendRegistry;
import com.tsrouter.registry.RegistrySnapshot;
import com.tsrouter.registry.SnapshotAssembler;
import com.tsrouter.registry.SnapshotLease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Entry point for everything a node serves: writes fan out to the batchers
 * of every backend mapped for a point's measurement and of the node's
 * {@code nexts} backends, queries go through the query router, and reloads
 * swap in a new registry snapshot.
 */
@Service
public class RouterService {

    private static final Logger logger = LoggerFactory.getLogger(RouterService.class);

    @Autowired
    private RouterProperties properties;

    @Autowired
    private ConfigSource configSource;

    @Autowired
    private BackendRegistry registry;

    @Autowired
    private BackendManager backendManager;

    @Autowired
    private LineProtocol lineProtocol;

    @Autowired
    private QueryRouter queryRouter;

    @Autowired
    private RouterStatistics statistics;

    private final AtomicLong versions = new AtomicLong(0);
    private final Object reloadLock = new Object();
    private SnapshotAssembler assembler;
    private ScheduledExecutorService reloadExecutor;

    /**
     * Loads the configuration store. Any invalid entry stops startup.
     */
    @PostConstruct
    public void initialize() {
        logger.info("Initializing RouterService with config: {}", properties);
        assembler = new SnapshotAssembler(properties.getNode());

        ConfigDocument document = configSource.load();
        RegistrySnapshot snapshot = assembler.assembleStrict(document, versions.incrementAndGet());
        registry.load(snapshot.withRuntimes(
                backendManager.materialize(snapshot.getBackends(), Collections.emptyMap())));

        if (properties.getReloadIntervalMs() > 0) {
            reloadExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-reload");
                t.setDaemon(true);
                return t;
            });
            reloadExecutor.scheduleWithFixedDelay(
                this::reloadQuietly,
                properties.getReloadIntervalMs(),
                properties.getReloadIntervalMs(),
                TimeUnit.MILLISECONDS
            );
        }
        logger.info("RouterService initialized successfully");
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Shutting down RouterService");
        if (reloadExecutor != null) {
            reloadExecutor.shutdownNow();
        }
        synchronized (reloadLock) {
            RegistrySnapshot last = registry.load(RegistrySnapshot.empty());
            backendManager.retire(last.getRuntimes().values());
        }
        logger.info("RouterService shutdown complete");
    }

    /**
     * Re-reads the configuration store and publishes the result. Invalid entries keep
     * their previous definition; runtimes of unchanged backends are kept, those of
     * removed or changed backends are retired once in-flight requests are done with them.
     *
     * @throws com.tsrouter.exception.ConfigException if the store cannot be read at all
     */
    public RegistrySnapshot reload() {
        synchronized (reloadLock) {
            RegistrySnapshot previous = registry.current();
            RegistrySnapshot next;
            try {
                ConfigDocument document = configSource.load();
                next = assembler.assembleOnReload(document, previous, versions.incrementAndGet());
            } catch (RouterException e) {
                statistics.recordReload(false);
                throw e;
            }
            if (!next.getNodes().keySet().equals(previous.getNodes().keySet()) ||
                !listenAddresses(next).equals(listenAddresses(previous))) {
                logger.warn("Listen addresses changed on reload; new addresses take effect after a restart");
            }

            Map<String, BackendRuntime> runtimes = backendManager.materialize(next.getBackends(),
                                                                              previous.getRuntimes());
            next = next.withRuntimes(runtimes);
            registry.load(next);

            List<BackendRuntime> obsolete = BackendManager.obsolete(previous.getRuntimes(), runtimes);
            if (!obsolete.isEmpty()) {
                try {
                    if (!registry.awaitQuiescence(previous, properties.getRetireTimeoutMs())) {
                        logger.warn("Requests still use snapshot {} after {}ms, retiring anyway",
                                    previous.getVersion(), properties.getRetireTimeoutMs());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                backendManager.retire(obsolete);
            }
            statistics.recordReload(true);
            return next;
        }
    }

    private void reloadQuietly() {
        try {
            reload();
        } catch (RuntimeException e) {
            logger.error("Periodic reload failed, keeping current configuration", e);
        }
    }

    private static Set<String> listenAddresses(RegistrySnapshot snapshot) {
        return snapshot.getNodes().values().stream()
                .map(NodeConfig::getListenAddr)
                .collect(Collectors.toSet());
    }

    /**
     * Node serving requests that arrive on the given local address and port.
     */
    public NodeConfig resolveNode(String localAddress, int localPort) {
        return registry.nodeFor(localAddress, localPort);
    }

    /**
     * Parses a write body line by line and queues every valid point to each
     * non-DOWN backend mapped for its measurement and to each non-DOWN backend
     * the node names in {@code nexts}. A line is rejected on its own when it is
     * malformed, when its measurement is unmapped and the node has no nexts, or
     * when none of its backends is up.
     */
    public WriteResult write(NodeConfig node, String body, Precision precision) {
        long start = System.currentTimeMillis();
        if (node.isWriteTracing()) {
            logger.info("Write on node {}: {}", node.getName(), body);
        }

        WriteResult result = new WriteResult();
        try (SnapshotLease lease = registry.acquire()) {
            RegistrySnapshot snapshot = lease.snapshot();
            String[] lines = body.split("\n");
            for (int i = 0; i < lines.length; i++) {
                if (lines[i].isBlank()) {
                    continue;
                }
                try {
                    Point point = lineProtocol.parseLine(lines[i], precision);
                    dispatch(snapshot, point, node.getNexts());
                    result.accept();
                } catch (MalformedInputException e) {
                    result.reject(i + 1, WriteResult.Reason.MALFORMED, e.getMessage());
                } catch (NoRouteException e) {
                    result.reject(i + 1, WriteResult.Reason.NO_ROUTE, e.getMessage());
                } catch (UnavailableException e) {
                    result.reject(i + 1, WriteResult.Reason.UNAVAILABLE, e.getMessage());
                }
            }
        }

        statistics.recordWrite(result, System.currentTimeMillis() - start);
        if (!result.isComplete()) {
            logger.debug("Write on node {} partially rejected: {}", node.getName(), result.getErrors());
        }
        return result;
    }

    /**
     * Queues a point produced by the router itself. Only mapped backends receive it.
     */
    void writeInternal(Point point) {
        try (SnapshotLease lease = registry.acquire()) {
            dispatch(lease.snapshot(), point, Collections.emptyList());
        }
    }

    private void dispatch(RegistrySnapshot snapshot, Point point, List<String> nexts) {
        List<String> names;
        try {
            names = snapshot.getRoutingTable().resolve(point.getMeasurement());
        } catch (NoRouteException e) {
            if (nexts.isEmpty()) {
                throw e;
            }
            names = Collections.emptyList();
        }
        Set<BackendRuntime> targets = new LinkedHashSet<>();
        for (BackendRuntime runtime : snapshot.runtimesFor(names)) {
            if (!runtime.getState().isDown()) {
                targets.add(runtime);
            }
        }
        for (BackendRuntime runtime : snapshot.runtimesFor(nexts)) {
            if (!runtime.getState().isDown()) {
                targets.add(runtime);
            }
        }
        if (targets.isEmpty()) {
            throw new UnavailableException("all backends of measurement " + point.getMeasurement() + " are down");
        }
        for (BackendRuntime target : targets) {
            target.getBatcher().submit(point);
        }
    }

    /**
     * Routes a query from a node to one backend.
     *
     * @param parameters client parameters, {@code q} holding the query text
     */
    public QueryResult query(NodeConfig node, Map<String, String> parameters) {
        long start = System.currentTimeMillis();
        if (node.isQueryTracing()) {
            logger.info("Query on node {}: {}", node.getName(), parameters.get("q"));
        }
        boolean success = false;
        try (SnapshotLease lease = registry.acquire()) {
            QueryResult result = queryRouter.route(lease.snapshot(), node.getZone(), parameters);
            success = result.getStatus() < 400;
            return result;
        } finally {
            statistics.recordQuery(success, System.currentTimeMillis() - start);
        }
    }

    public RegistrySnapshot getSnapshot() {
        return registry.current();
    }
}
