package com.tsrouter.service;

import com.tsrouter.config.NodeConfig;
import com.tsrouter.exception.NoRouteException;
import com.tsrouter.exception.RouterException;
import com.tsrouter.model.FieldValue;
import com.tsrouter.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Writes the router's own request counters as a point every node interval,
 * routed like any client point. Nothing is stored unless the statistics
 * measurement is mapped.
 */
@Component
public class StatisticsReporter {

    private static final Logger logger = LoggerFactory.getLogger(StatisticsReporter.class);

    static final String MEASUREMENT = "influxdb.cluster";

    @Autowired
    private RouterService routerService;

    @Autowired
    private RouterStatistics statistics;

    @Autowired
    private Clock clock;

    private ScheduledExecutorService reportExecutor;

    @PostConstruct
    public void initialize() {
        int interval = routerService.getSnapshot().getFallbackNode().getInterval();
        reportExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stats-reporter");
            t.setDaemon(true);
            return t;
        });
        reportExecutor.scheduleAtFixedRate(this::report, interval, interval, TimeUnit.SECONDS);
        logger.info("Reporting statistics every {}s", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (reportExecutor != null) {
            reportExecutor.shutdownNow();
        }
    }

    /**
     * Closes the current statistics interval and writes its counters.
     */
    public void report() {
        RouterStatistics.Counters counters = statistics.rollover();
        try {
            routerService.writeInternal(toPoint(routerService.getSnapshot().getFallbackNode(), counters));
        } catch (NoRouteException e) {
            logger.debug("Statistics not written: {}", e.getMessage());
        } catch (RouterException e) {
            logger.warn("Statistics not written: {}", e.getMessage());
        }
    }

    Point toPoint(NodeConfig node, RouterStatistics.Counters counters) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("addr", node.getListenAddr());
        tags.put("host", hostname());

        Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put("statQueryRequest", FieldValue.of(counters.getQueryRequests()));
        fields.put("statQueryRequestFail", FieldValue.of(counters.getFailedQueryRequests()));
        fields.put("statWriteRequest", FieldValue.of(counters.getWriteRequests()));
        fields.put("statWriteRequestFail", FieldValue.of(counters.getFailedWriteRequests()));
        fields.put("statPingRequest", FieldValue.of(counters.getPingRequests()));
        fields.put("statPingRequestFail", FieldValue.of(counters.getFailedPingRequests()));
        fields.put("statPointsWritten", FieldValue.of(counters.getPointsWritten()));
        fields.put("statPointsWrittenFail", FieldValue.of(counters.getFailedPoints()));
        fields.put("statQueryRequestDuration", FieldValue.of(counters.getQueryDurationMs()));
        fields.put("statWriteRequestDuration", FieldValue.of(counters.getWriteDurationMs()));

        long nanos = TimeUnit.MILLISECONDS.toNanos(clock.millis());
        return new Point(MEASUREMENT, tags, fields, nanos);
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }
}
