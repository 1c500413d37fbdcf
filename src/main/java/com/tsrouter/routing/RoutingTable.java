package com.tsrouter.routing;

import com.tsrouter.exception.NoRouteException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable measurement to backend-names mapping that governs write fan-out
 * and the candidate set for queries. Lookups are exact matches only.
 */
public final class RoutingTable {

    private static final RoutingTable EMPTY = new RoutingTable(Collections.emptyMap());

    private final Map<String, List<String>> routes;

    public RoutingTable(Map<String, List<String>> routes) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : routes.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                throw new IllegalArgumentException("Measurement " + entry.getKey() + " maps to no backend");
            }
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.routes = Collections.unmodifiableMap(copy);
    }

    public static RoutingTable empty() {
        return EMPTY;
    }

    /**
     * Backend names that receive writes for the measurement, in configured order.
     *
     * @throws NoRouteException if the measurement is not mapped
     */
    public List<String> resolve(String measurement) {
        List<String> backends = routes.get(measurement);
        if (backends == null) {
            throw new NoRouteException(measurement);
        }
        return backends;
    }

    public boolean contains(String measurement) {
        return routes.containsKey(measurement);
    }

    public Set<String> getMeasurements() {
        return routes.keySet();
    }

    public Map<String, List<String>> asMap() {
        return routes;
    }

    public int size() {
        return routes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return routes.equals(((RoutingTable) o).routes);
    }

    @Override
    public int hashCode() {
        return routes.hashCode();
    }

    @Override
    public String toString() {
        return "RoutingTable" + routes;
    }
}
