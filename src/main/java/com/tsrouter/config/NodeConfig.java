package com.tsrouter.config;

import com.tsrouter.exception.ConfigException;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A client-facing node: the address it listens on, the database name clients
 * must use, and the zone whose backends it prefers for queries. Backends named
 * in {@code nexts} receive every point written through the node, whatever its
 * measurement.
 */
public final class NodeConfig {

    public static final String DEFAULT_NODE = "default_node";
    public static final String DEFAULT_LISTEN_ADDR = ":6666";
    public static final int DEFAULT_INTERVAL_SECONDS = 10;
    public static final int DEFAULT_IDLE_TIMEOUT_SECONDS = 10;

    private final String name;
    private final String listenAddr;
    private final String host;
    private final int port;
    private final String db;
    private final String zone;
    private final int interval;
    private final int idleTimeout;
    private final boolean writeTracing;
    private final boolean queryTracing;
    private final List<String> nexts;

    public NodeConfig(String name, String listenAddr, String db, String zone, int interval, int idleTimeout,
                      boolean writeTracing, boolean queryTracing) {
        this(name, listenAddr, db, zone, interval, idleTimeout, writeTracing, queryTracing, Collections.emptyList());
    }

    public NodeConfig(String name, String listenAddr, String db, String zone, int interval, int idleTimeout,
                      boolean writeTracing, boolean queryTracing, List<String> nexts) {
        String key = DEFAULT_NODE.equals(name) ? name : "n:" + name;
        this.name = Objects.requireNonNull(name, "Node name cannot be null");
        this.listenAddr = listenAddr == null || listenAddr.isBlank() ? DEFAULT_LISTEN_ADDR : listenAddr.trim();
        int colon = this.listenAddr.lastIndexOf(':');
        this.host = colon > 0 ? this.listenAddr.substring(0, colon) : "";
        try {
            this.port = Integer.parseInt(this.listenAddr.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new ConfigException(key, "invalid listenaddr: " + this.listenAddr, e);
        }
        if (port <= 0 || port > 65535) {
            throw new ConfigException(key, "listenaddr port out of range: " + this.listenAddr);
        }
        if (interval <= 0 || idleTimeout <= 0) {
            throw new ConfigException(key, "interval and idletimeout must be positive");
        }
        this.db = db != null ? db : "";
        this.zone = zone != null ? zone : "";
        this.interval = interval;
        this.idleTimeout = idleTimeout;
        this.writeTracing = writeTracing;
        this.queryTracing = queryTracing;
        this.nexts = nexts != null ? List.copyOf(nexts) : Collections.emptyList();
    }

    /**
     * A node that accepts any database on the default address.
     */
    public static NodeConfig permissive(String name) {
        return new NodeConfig(name, DEFAULT_LISTEN_ADDR, "", "", DEFAULT_INTERVAL_SECONDS,
                              DEFAULT_IDLE_TIMEOUT_SECONDS, false, false);
    }

    /**
     * Builds a node from its store record; fields the record leaves out are taken from {@code defaults}.
     */
    public static NodeConfig fromBlock(String name, ConfigValue.Block block, NodeConfig defaults) {
        String key = DEFAULT_NODE.equals(name) ? name : "n:" + name;
        NodeConfig base = defaults != null ? defaults : permissive(name);
        return new NodeConfig(
            name,
            block.getString("listenaddr", base.listenAddr),
            block.getString("db", base.db),
            block.getString("zone", base.zone),
            block.getInt(key, "interval", base.interval),
            block.getInt(key, "idletimeout", base.idleTimeout),
            block.getFlag(key, "writetracing", base.writeTracing),
            block.getFlag(key, "querytracing", base.queryTracing),
            parseNames(block.getString("nexts", null), base.nexts)
        );
    }

    // comma separated backend names; blank entries are ignored
    private static List<String> parseNames(String value, List<String> defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        List<String> names = new ArrayList<>();
        for (String name : value.split(",")) {
            if (!name.isBlank() && !names.contains(name.trim())) {
                names.add(name.trim());
            }
        }
        return names;
    }

    public String getName() {
        return name;
    }

    public String getListenAddr() {
        return listenAddr;
    }

    /**
     * Bind host; empty means all interfaces.
     */
    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /**
     * Database clients must name; empty accepts any database.
     */
    public String getDb() {
        return db;
    }

    public String getZone() {
        return zone;
    }

    /**
     * Statistics reporting interval in seconds.
     */
    public int getInterval() {
        return interval;
    }

    /**
     * Seconds an idle client connection is kept open.
     */
    public int getIdleTimeout() {
        return idleTimeout;
    }

    public boolean isWriteTracing() {
        return writeTracing;
    }

    public boolean isQueryTracing() {
        return queryTracing;
    }

    /**
     * Backends that receive every point written through this node.
     */
    public List<String> getNexts() {
        return nexts;
    }

    public boolean acceptsDatabase(String database) {
        return db.isEmpty() || db.equals(database);
    }

    /**
     * Whether the node listens on all interfaces.
     */
    public boolean isWildcardHost() {
        return host.isEmpty() || "0.0.0.0".equals(host) || "::".equals(host) || "[::]".equals(host);
    }

    /**
     * Whether both nodes would bind the same socket: the same port, and the same host
     * or either of them on all interfaces.
     */
    public boolean sharesListenAddress(NodeConfig other) {
        return port == other.port && (isWildcardHost() || other.isWildcardHost() || sameHost(host, other.host));
    }

    /**
     * Whether a connection accepted on the given local address and port reached this node's listener.
     */
    public boolean listensOn(String localAddress, int localPort) {
        if (port != localPort) {
            return false;
        }
        return isWildcardHost() || localAddress == null || sameHost(host, localAddress);
    }

    private static boolean sameHost(String a, String b) {
        if (a.equalsIgnoreCase(b)) {
            return true;
        }
        try {
            return InetAddress.getByName(a).equals(InetAddress.getByName(b));
        } catch (UnknownHostException e) {
            return false;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        NodeConfig that = (NodeConfig) o;
        return interval == that.interval &&
               idleTimeout == that.idleTimeout &&
               writeTracing == that.writeTracing &&
               queryTracing == that.queryTracing &&
               name.equals(that.name) &&
               listenAddr.equals(that.listenAddr) &&
               db.equals(that.db) &&
               zone.equals(that.zone) &&
               nexts.equals(that.nexts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, listenAddr, db, zone, interval, idleTimeout, writeTracing, queryTracing, nexts);
    }

    @Override
    public String toString() {
        return String.format("NodeConfig{name='%s', listenAddr='%s', db='%s', zone='%s', interval=%d, idleTimeout=%d, " +
                             "nexts=%s}",
                name, listenAddr, db, zone, interval, idleTimeout, nexts);
    }
}
