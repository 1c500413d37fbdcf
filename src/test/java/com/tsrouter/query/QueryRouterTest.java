package com.tsrouter.query;

import com.tsrouter.backend.BackendClient;
import com.tsrouter.backend.BackendRuntime;
import com.tsrouter.backend.BackendState;
import com.tsrouter.backend.QueryResult;
import com.tsrouter.backend.WriteBatcher;
import com.tsrouter.config.BackendConfig;
import com.tsrouter.config.NodeConfig;
import com.tsrouter.exception.MalformedQueryException;
import com.tsrouter.exception.NoRouteException;
import com.tsrouter.exception.QueryTimeoutException;
import com.tsrouter.exception.UnavailableException;
import com.tsrouter.registry.RegistrySnapshot;
import com.tsrouter.routing.RoutingTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

public class QueryRouterTest {

    private QueryRouter router;
    private Map<String, BackendRuntime> runtimes;

    @BeforeEach
    void setUp() {
        router = new QueryRouter(new QueryValidator(Collections.emptyList(), List.of("(?i)from"), false));
        runtimes = new LinkedHashMap<>();
    }

    private BackendRuntime backend(String name, String zone, boolean writeOnly, boolean up) {
        BackendConfig config = new BackendConfig(name, "http://" + name + ":8086", "test", zone,
                1000, 1000, 1000, 100, 1000, 1000, writeOnly);
        BackendState state = new BackendState(name);
        if (up) {
            state.markUp();
        }
        BackendClient client = mock(BackendClient.class);
        when(client.query(anyMap())).thenReturn(new QueryResult(name, 200, "application/json", new byte[0]));
        BackendRuntime runtime = new BackendRuntime(config, state, client, mock(WriteBatcher.class));
        runtimes.put(name, runtime);
        return runtime;
    }

    private RegistrySnapshot snapshot(String measurement, String... backends) {
        NodeConfig node = NodeConfig.permissive(NodeConfig.DEFAULT_NODE);
        Map<String, BackendConfig> configs = new LinkedHashMap<>();
        runtimes.forEach((name, runtime) -> configs.put(name, runtime.getConfig()));
        return new RegistrySnapshot(1, configs, Map.of(node.getName(), node), node,
                new RoutingTable(Map.of(measurement, List.of(backends))), runtimes);
    }

    private static Map<String, String> query(String q) {
        return Map.of("q", q, "db", "test");
    }

    @Test
    public void testPrefersBackendInNodeZone() {
        backend("east", "east", false, true);
        BackendRuntime west = backend("west", "west", false, true);

        QueryResult result = router.route(snapshot("cpu", "east", "west"), "west", query("select * from cpu"));

        assertEquals("west", result.getBackend());
        verify(west.getClient()).query(anyMap());
        verify(runtimes.get("east").getClient(), never()).query(anyMap());
    }

    @Test
    public void testFallsBackToFirstHealthyBackend() {
        backend("east", "east", false, true);
        backend("west", "west", false, true);

        QueryResult result = router.route(snapshot("cpu", "east", "west"), "north", query("select * from cpu"));

        assertEquals("east", result.getBackend());
    }

    @Test
    public void testSkipsUnhealthyAndWriteOnlyBackends() {
        BackendRuntime down = backend("down", "local", false, true);
        down.getState().markDown("probe failed");
        backend("unknown", "local", false, false);
        backend("archive", "local", true, true);
        backend("remote", "remote", false, true);

        QueryResult result = router.route(snapshot("cpu", "down", "unknown", "archive", "remote"),
                "local", query("select * from cpu"));

        assertEquals("remote", result.getBackend());
    }

    @Test
    public void testNoHealthyBackend() {
        backend("local", "local", false, false);

        assertThrows(UnavailableException.class,
                () -> router.route(snapshot("cpu", "local"), "local", query("select * from cpu")));
    }

    @Test
    public void testRejectedAndUnroutedQueries() {
        backend("local", "local", false, true);
        RegistrySnapshot snapshot = snapshot("cpu", "local");

        assertThrows(MalformedQueryException.class, () -> router.route(snapshot, "local", query("show databases")));
        assertThrows(NoRouteException.class, () -> router.route(snapshot, "local", query("select * from mem")));
        verify(runtimes.get("local").getClient(), never()).query(any());
    }

    @Test
    public void testTimeoutIsNotRetriedElsewhere() {
        BackendRuntime local = backend("local", "local", false, true);
        BackendRuntime remote = backend("remote", "remote", false, true);
        when(local.getClient().query(anyMap())).thenThrow(new QueryTimeoutException("local", 1000, null));

        assertThrows(QueryTimeoutException.class,
                () -> router.route(snapshot("cpu", "local", "remote"), "local", query("select * from cpu")));

        verify(remote.getClient(), never()).query(anyMap());
        assertTrue(local.getState().isUp());
    }

    @Test
    public void testUnreachableBackendIsMarkedDown() {
        BackendRuntime local = backend("local", "local", false, true);
        when(local.getClient().query(anyMap())).thenThrow(new UnavailableException("backend local unreachable"));

        assertThrows(UnavailableException.class,
                () -> router.route(snapshot("cpu", "local"), "local", query("select * from cpu")));

        assertTrue(local.getState().isDown());
    }
}
