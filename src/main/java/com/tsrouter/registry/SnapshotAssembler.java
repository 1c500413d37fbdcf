package com.tsrouter.registry;

import com.tsrouter.config.BackendConfig;
import com.tsrouter.config.ConfigDocument;
import com.tsrouter.config.NodeConfig;
import com.tsrouter.exception.ConfigException;
import com.tsrouter.routing.RoutingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a {@link ConfigDocument} into a registry snapshot.
 *
 * At startup ({@link #assembleStrict}) any invalid entry is fatal. On reload
 * ({@link #assembleOnReload}) an invalid entry keeps its previous definition,
 * or is left out if it never had one, and the rest of the reload goes ahead.
 *
 * Two nodes conflict when they would bind the same socket: the same port, and
 * the same host or either of them on all interfaces.
 */
public class SnapshotAssembler {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotAssembler.class);

    private final String preferredNode;

    /**
     * @param preferredNode node record that serves requests on unclaimed ports; empty for the default node
     */
    public SnapshotAssembler(String preferredNode) {
        this.preferredNode = preferredNode != null ? preferredNode : "";
    }

    public RegistrySnapshot assembleStrict(ConfigDocument document, long version) {
        List<String> problems = new ArrayList<>();
        document.getErrors().values().forEach(e -> problems.add(e.getMessage()));

        Map<String, BackendConfig> backends = document.getBackends();
        Map<String, List<String>> routes = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : document.getMeasurements().entrySet()) {
            List<String> missing = missingBackends(entry.getValue(), backends);
            if (!missing.isEmpty()) {
                problems.add("m:" + entry.getKey() + ": unknown backends " + missing);
            } else {
                routes.put(entry.getKey(), entry.getValue());
            }
        }

        Map<String, NodeConfig> nodes = listeningNodes(document.getNodes(), document.getDefaultNode());
        List<NodeConfig> claimed = new ArrayList<>();
        for (NodeConfig node : nodes.values()) {
            NodeConfig owner = owner(claimed, node);
            if (owner != null) {
                problems.add("n:" + node.getName() + ": listenaddr " + node.getListenAddr() +
                             " already used by node " + owner.getName());
            } else {
                claimed.add(node);
            }
        }
        for (NodeConfig node : withDefault(document.getNodes(), document.getDefaultNode())) {
            List<String> missing = missingBackends(node.getNexts(), backends);
            if (!missing.isEmpty()) {
                problems.add(key(node) + ": unknown nexts backends " + missing);
            }
        }

        if (!problems.isEmpty()) {
            throw new ConfigException(null, "invalid configuration: " + String.join("; ", problems));
        }

        return new RegistrySnapshot(version, backends, nodes, fallbackNode(nodes, document.getDefaultNode()),
                                    new RoutingTable(routes), Collections.emptyMap());
    }

    public RegistrySnapshot assembleOnReload(ConfigDocument document, RegistrySnapshot previous, long version) {
        Map<String, ConfigException> errors = document.getErrors();

        Map<String, BackendConfig> backends = new LinkedHashMap<>(document.getBackends());
        for (String key : errors.keySet()) {
            if (key.startsWith("b:")) {
                String name = key.substring(2);
                BackendConfig kept = previous.getBackends().get(name);
                if (kept != null) {
                    backends.put(name, kept);
                    logger.warn("Reload: keeping previous definition of backend {}", name);
                } else {
                    logger.warn("Reload: skipping new backend {}", name);
                }
            }
        }

        Map<String, List<String>> previousRoutes = previous.getRoutingTable().asMap();
        Map<String, List<String>> routes = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : document.getMeasurements().entrySet()) {
            List<String> missing = missingBackends(entry.getValue(), backends);
            if (missing.isEmpty()) {
                routes.put(entry.getKey(), entry.getValue());
            } else {
                logger.warn("Reload: measurement {} references unknown backends {}", entry.getKey(), missing);
                keepPreviousRoute(entry.getKey(), previousRoutes, backends, routes);
            }
        }
        for (String key : errors.keySet()) {
            if (key.startsWith("m:")) {
                keepPreviousRoute(key.substring(2), previousRoutes, backends, routes);
            }
        }

        NodeConfig defaultNode = document.getDefaultNode();
        if (errors.containsKey(NodeConfig.DEFAULT_NODE)) {
            defaultNode = previous.getNodes().get(NodeConfig.DEFAULT_NODE);
        }
        Map<String, NodeConfig> candidates = new LinkedHashMap<>(document.getNodes());
        for (String key : errors.keySet()) {
            if (key.startsWith("n:")) {
                String name = key.substring(2);
                NodeConfig kept = previous.getNodes().get(name);
                if (kept != null) {
                    candidates.put(name, kept);
                }
            }
        }
        Map<String, NodeConfig> nodes = new LinkedHashMap<>();
        List<NodeConfig> claimed = new ArrayList<>();
        for (NodeConfig node : listeningNodes(candidates, defaultNode).values()) {
            NodeConfig owner = owner(claimed, node);
            if (owner == null) {
                claimed.add(node);
                nodes.put(node.getName(), node);
                continue;
            }
            NodeConfig kept = previous.getNodes().get(node.getName());
            if (kept != null && owner(claimed, kept) == null) {
                claimed.add(kept);
                nodes.put(kept.getName(), kept);
            }
            logger.warn("Reload: node {} listenaddr {} already used by node {}", node.getName(),
                        node.getListenAddr(), owner.getName());
        }
        for (NodeConfig node : withDefault(nodes, defaultNode)) {
            List<String> missing = missingBackends(node.getNexts(), backends);
            if (!missing.isEmpty()) {
                logger.warn("Reload: node {} forwards to unknown backends {}, they are skipped",
                            node.getName(), missing);
            }
        }

        return new RegistrySnapshot(version, backends, nodes, fallbackNode(nodes, defaultNode),
                                    new RoutingTable(routes), Collections.emptyMap());
    }

    private static void keepPreviousRoute(String measurement, Map<String, List<String>> previousRoutes,
                                          Map<String, BackendConfig> backends, Map<String, List<String>> routes) {
        List<String> kept = previousRoutes.get(measurement);
        if (kept != null && missingBackends(kept, backends).isEmpty()) {
            routes.put(measurement, kept);
            logger.warn("Reload: keeping previous route for measurement {}", measurement);
        } else {
            routes.remove(measurement);
            logger.warn("Reload: dropping route for measurement {}", measurement);
        }
    }

    private static NodeConfig owner(List<NodeConfig> claimed, NodeConfig node) {
        for (NodeConfig other : claimed) {
            if (other.sharesListenAddress(node)) {
                return other;
            }
        }
        return null;
    }

    private static List<NodeConfig> withDefault(Map<String, NodeConfig> nodes, NodeConfig defaultNode) {
        List<NodeConfig> all = new ArrayList<>(nodes.values());
        if (defaultNode != null && !nodes.containsKey(defaultNode.getName())) {
            all.add(defaultNode);
        }
        return all;
    }

    private static String key(NodeConfig node) {
        return NodeConfig.DEFAULT_NODE.equals(node.getName()) ? node.getName() : "n:" + node.getName();
    }

    private static List<String> missingBackends(List<String> names, Map<String, BackendConfig> backends) {
        return names.stream().filter(n -> !backends.containsKey(n)).collect(Collectors.toList());
    }

    /**
     * Nodes with their own record listen; the default node listens only when there are none.
     */
    private static Map<String, NodeConfig> listeningNodes(Map<String, NodeConfig> nodes, NodeConfig defaultNode) {
        if (!nodes.isEmpty()) {
            return nodes;
        }
        Map<String, NodeConfig> single = new LinkedHashMap<>();
        NodeConfig node = defaultNode != null ? defaultNode : NodeConfig.permissive(NodeConfig.DEFAULT_NODE);
        single.put(node.getName(), node);
        return single;
    }

    private NodeConfig fallbackNode(Map<String, NodeConfig> nodes, NodeConfig defaultNode) {
        if (!preferredNode.isEmpty()) {
            NodeConfig preferred = nodes.get(preferredNode);
            if (preferred != null) {
                return preferred;
            }
            logger.warn("Preferred node {} is not configured, using the default node", preferredNode);
        }
        if (defaultNode != null) {
            return defaultNode;
        }
        return nodes.isEmpty() ? NodeConfig.permissive(NodeConfig.DEFAULT_NODE) : nodes.values().iterator().next();
    }
}
