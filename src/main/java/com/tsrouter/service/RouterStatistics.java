package com.tsrouter.service;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Request counters of the router. Kept twice: since startup, and for the
 * current reporting interval, which {@link #rollover()} closes.
 */
@Component
public class RouterStatistics {

    private final Counters total = new Counters();
    private final AtomicReference<Counters> interval = new AtomicReference<>(new Counters());
    private final AtomicLong reloads = new AtomicLong(0);
    private final AtomicLong failedReloads = new AtomicLong(0);

    public void recordWrite(WriteResult result, long durationMs) {
        total.recordWrite(result, durationMs);
        interval.get().recordWrite(result, durationMs);
    }

    public void recordQuery(boolean success, long durationMs) {
        total.recordQuery(success, durationMs);
        interval.get().recordQuery(success, durationMs);
    }

    public void recordPing() {
        total.pingRequests.incrementAndGet();
        interval.get().pingRequests.incrementAndGet();
    }

    public void recordReload(boolean success) {
        if (success) {
            reloads.incrementAndGet();
        } else {
            failedReloads.incrementAndGet();
        }
    }

    /**
     * Closes the current interval and starts a new one.
     *
     * @return counters of the interval just closed
     */
    public Counters rollover() {
        return interval.getAndSet(new Counters());
    }

    public Counters getTotal() {
        return total;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = total.toMap();
        map.put("reloads", reloads.get());
        map.put("failedReloads", failedReloads.get());
        return map;
    }

    /**
     * One set of request counters.
     */
    public static class Counters {
        private final AtomicLong writeRequests = new AtomicLong(0);
        private final AtomicLong failedWriteRequests = new AtomicLong(0);
        private final AtomicLong pointsWritten = new AtomicLong(0);
        private final AtomicLong failedPoints = new AtomicLong(0);
        private final AtomicLong writeDurationMs = new AtomicLong(0);
        private final AtomicLong queryRequests = new AtomicLong(0);
        private final AtomicLong failedQueryRequests = new AtomicLong(0);
        private final AtomicLong queryDurationMs = new AtomicLong(0);
        private final AtomicLong pingRequests = new AtomicLong(0);
        // the ping endpoint answers locally and never fails; reported for a stable field set
        private final AtomicLong failedPingRequests = new AtomicLong(0);

        void recordWrite(WriteResult result, long durationMs) {
            writeRequests.incrementAndGet();
            if (!result.isComplete()) {
                failedWriteRequests.incrementAndGet();
            }
            pointsWritten.addAndGet(result.getAccepted());
            failedPoints.addAndGet(result.getRejected());
            writeDurationMs.addAndGet(durationMs);
        }

        void recordQuery(boolean success, long durationMs) {
            queryRequests.incrementAndGet();
            if (!success) {
                failedQueryRequests.incrementAndGet();
            }
            queryDurationMs.addAndGet(durationMs);
        }

        public long getWriteRequests() { return writeRequests.get(); }
        public long getFailedWriteRequests() { return failedWriteRequests.get(); }
        public long getPointsWritten() { return pointsWritten.get(); }
        public long getFailedPoints() { return failedPoints.get(); }
        public long getWriteDurationMs() { return writeDurationMs.get(); }
        public long getQueryRequests() { return queryRequests.get(); }
        public long getFailedQueryRequests() { return failedQueryRequests.get(); }
        public long getQueryDurationMs() { return queryDurationMs.get(); }
        public long getPingRequests() { return pingRequests.get(); }
        public long getFailedPingRequests() { return failedPingRequests.get(); }

        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("writeRequests", getWriteRequests());
            map.put("failedWriteRequests", getFailedWriteRequests());
            map.put("pointsWritten", getPointsWritten());
            map.put("failedPoints", getFailedPoints());
            map.put("writeDurationMs", getWriteDurationMs());
            map.put("queryRequests", getQueryRequests());
            map.put("failedQueryRequests", getFailedQueryRequests());
            map.put("queryDurationMs", getQueryDurationMs());
            map.put("pingRequests", getPingRequests());
            map.put("failedPingRequests", getFailedPingRequests());
            return map;
        }
    }
}
