package com.tsrouter.registry;

import com.tsrouter.config.BackendConfig;
import com.tsrouter.config.NodeConfig;
import com.tsrouter.exception.BackendNotFoundException;
import com.tsrouter.routing.RoutingTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class BackendRegistryTest {

    private BackendRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new BackendRegistry();
    }

    private static RegistrySnapshot snapshot(long version, String... backends) {
        Map<String, BackendConfig> configs = new LinkedHashMap<>();
        for (String name : backends) {
            configs.put(name, new BackendConfig(name, "http://" + name + ":8086", "db", ""));
        }
        NodeConfig node = NodeConfig.permissive(NodeConfig.DEFAULT_NODE);
        return new RegistrySnapshot(version, configs, Map.of(node.getName(), node), node,
                new RoutingTable(Map.of("cpu", List.of(backends))), Collections.emptyMap());
    }

    @Test
    public void testStartsEmpty() {
        assertEquals(0, registry.current().getVersion());
        assertThrows(BackendNotFoundException.class, () -> registry.lookup("local"));
    }

    @Test
    public void testLoadReplacesEverything() {
        registry.load(snapshot(1, "a", "b"));
        assertEquals("http://a:8086", registry.lookup("a").getUrl());

        RegistrySnapshot previous = registry.load(snapshot(2, "c"));

        assertEquals(1, previous.getVersion());
        assertEquals(2, registry.current().getVersion());
        assertThrows(BackendNotFoundException.class, () -> registry.lookup("a"));
        assertEquals(List.of("c"), registry.current().getRoutingTable().resolve("cpu"));
    }

    @Test
    public void testReadersNeverSeePartialSnapshots() throws Exception {
        registry.load(snapshot(1, "a", "b"));
        ExecutorService readers = Executors.newFixedThreadPool(4);
        AtomicInteger inconsistent = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(4);
        for (int r = 0; r < 4; r++) {
            readers.execute(() -> {
                for (int i = 0; i < 10_000; i++) {
                    RegistrySnapshot s = registry.current();
                    if (!s.getBackends().keySet().equals(new HashSet<>(s.getRoutingTable().resolve("cpu")))) {
                        inconsistent.incrementAndGet();
                    }
                }
                done.countDown();
            });
        }
        for (int v = 2; v < 200; v++) {
            registry.load(v % 2 == 0 ? snapshot(v, "c") : snapshot(v, "a", "b"));
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        readers.shutdown();
        assertEquals(0, inconsistent.get());
    }

    @Test
    public void testAwaitQuiescenceWaitsForLeases() throws Exception {
        registry.load(snapshot(1, "a"));
        SnapshotLease lease = registry.acquire();
        RegistrySnapshot pinned = lease.snapshot();
        registry.load(snapshot(2, "b"));

        assertFalse(registry.awaitQuiescence(pinned, 20));

        lease.close();
        lease.close();
        assertTrue(registry.awaitQuiescence(pinned, 20));
    }

    @Test
    public void testLeaseUsesCurrentSnapshot() {
        registry.load(snapshot(3, "a"));
        try (SnapshotLease lease = registry.acquire()) {
            assertEquals(3, lease.snapshot().getVersion());
        }
    }
}
