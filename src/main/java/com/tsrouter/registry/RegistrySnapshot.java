package com.tsrouter.registry;

import com.tsrouter.backend.BackendRuntime;
import com.tsrouter.config.BackendConfig;
import com.tsrouter.config.NodeConfig;
import com.tsrouter.routing.RoutingTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Point-in-time view of every backend, node and route. Never modified after
 * publication; a reload publishes a new snapshot instead.
 */
public final class RegistrySnapshot {

    private static final RegistrySnapshot EMPTY = new RegistrySnapshot(0, Collections.emptyMap(),
            Collections.emptyMap(), NodeConfig.permissive(NodeConfig.DEFAULT_NODE), RoutingTable.empty(),
            Collections.emptyMap());

    private final long version;
    private final Map<String, BackendConfig> backends;
    private final Map<String, NodeConfig> nodes;
    private final NodeConfig fallbackNode;
    private final RoutingTable routingTable;
    private final Map<String, BackendRuntime> runtimes;

    // in-flight readers, maintained by BackendRegistry leases
    final AtomicInteger readers = new AtomicInteger();

    public RegistrySnapshot(long version,
                            Map<String, BackendConfig> backends,
                            Map<String, NodeConfig> nodes,
                            NodeConfig fallbackNode,
                            RoutingTable routingTable,
                            Map<String, BackendRuntime> runtimes) {
        this.version = version;
        this.backends = Collections.unmodifiableMap(new LinkedHashMap<>(backends));
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.fallbackNode = fallbackNode;
        this.routingTable = routingTable;
        this.runtimes = Collections.unmodifiableMap(new LinkedHashMap<>(runtimes));
    }

    public static RegistrySnapshot empty() {
        return EMPTY;
    }

    /**
     * Same definitions, bound to live backend runtimes.
     */
    public RegistrySnapshot withRuntimes(Map<String, BackendRuntime> runtimes) {
        return new RegistrySnapshot(version, backends, nodes, fallbackNode, routingTable, runtimes);
    }

    public long getVersion() {
        return version;
    }

    public Map<String, BackendConfig> getBackends() {
        return backends;
    }

    /**
     * Nodes that listen for clients, keyed by name.
     */
    public Map<String, NodeConfig> getNodes() {
        return nodes;
    }

    /**
     * Node used for requests that arrive on a port no node claims.
     */
    public NodeConfig getFallbackNode() {
        return fallbackNode;
    }

    public RoutingTable getRoutingTable() {
        return routingTable;
    }

    public Map<String, BackendRuntime> getRuntimes() {
        return runtimes;
    }

    public BackendRuntime getRuntime(String name) {
        return runtimes.get(name);
    }

    /**
     * Runtimes for the given backend names, in the same order.
     */
    public List<BackendRuntime> runtimesFor(List<String> names) {
        List<BackendRuntime> result = new ArrayList<>(names.size());
        for (String name : names) {
            BackendRuntime runtime = runtimes.get(name);
            if (runtime != null) {
                result.add(runtime);
            }
        }
        return result;
    }

    /**
     * Node whose listener accepted a connection on the given local address and port;
     * the fallback node if none claims it.
     */
    public NodeConfig nodeFor(String localAddress, int localPort) {
        for (NodeConfig node : nodes.values()) {
            if (node.listensOn(localAddress, localPort)) {
                return node;
            }
        }
        return fallbackNode;
    }

    @Override
    public String toString() {
        return String.format("RegistrySnapshot{version=%d, backends=%s, nodes=%s, measurements=%d}",
                version, backends.keySet(), nodes.keySet(), routingTable.size());
    }
}
