package com.tsrouter.query;

import com.tsrouter.backend.BackendRuntime;
import com.tsrouter.backend.QueryResult;
import com.tsrouter.exception.QueryTimeoutException;
import com.tsrouter.exception.UnavailableException;
import com.tsrouter.registry.RegistrySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Sends each query to one backend mapped for its measurement, preferring
 * backends in the zone of the node that received it.
 */
public class QueryRouter {

    private static final Logger logger = LoggerFactory.getLogger(QueryRouter.class);

    private final QueryValidator validator;

    public QueryRouter(QueryValidator validator) {
        this.validator = validator;
    }

    /**
     * Validates and forwards a query.
     *
     * @param parameters client parameters; {@code q} holds the query text
     * @throws com.tsrouter.exception.MalformedQueryException if the query is rejected
     * @throws com.tsrouter.exception.NoRouteException       if its measurement is not mapped
     * @throws UnavailableException                          if no mapped backend can serve it
     * @throws QueryTimeoutException                         if the chosen backend did not answer in time
     */
    public QueryResult route(RegistrySnapshot snapshot, String zone, Map<String, String> parameters) {
        String query = parameters.get("q");
        validator.validate(query);
        String measurement = InfluxQLScanner.extractMeasurement(query);
        List<String> names = snapshot.getRoutingTable().resolve(measurement);
        BackendRuntime target = selectCandidate(snapshot.runtimesFor(names), zone);

        logger.debug("Routing query on {} to backend {}", measurement, target.getName());
        try {
            return target.getClient().query(parameters);
        } catch (QueryTimeoutException e) {
            logger.warn("Query to backend {} timed out after {}ms", target.getName(), e.getTimeoutMs());
            throw e;
        } catch (UnavailableException e) {
            target.getState().markDown(e.getMessage());
            throw e;
        }
    }

    /**
     * First UP backend of the node's zone, else the first UP backend of any zone.
     * Write-only backends are never chosen.
     *
     * @throws UnavailableException if no backend qualifies
     */
    public BackendRuntime selectCandidate(List<BackendRuntime> backends, String zone) {
        BackendRuntime fallback = null;
        for (BackendRuntime backend : backends) {
            if (backend.getConfig().isWriteOnly() || !backend.getState().isUp()) {
                continue;
            }
            if (backend.getConfig().getZone().equals(zone)) {
                return backend;
            }
            if (fallback == null) {
                fallback = backend;
            }
        }
        if (fallback == null) {
            throw new UnavailableException("no healthy backend for query");
        }
        return fallback;
    }
}
