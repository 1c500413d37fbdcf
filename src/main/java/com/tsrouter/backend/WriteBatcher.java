package com.tsrouter.backend;

import com.tsrouter.config.BackendConfig;
import com.tsrouter.config.RouterProperties;
import com.tsrouter.exception.BackendTimeoutException;
import com.tsrouter.exception.BackendWriteException;
import com.tsrouter.exception.RouterException;
import com.tsrouter.exception.UnavailableException;
import com.tsrouter.model.LineProtocol;
import com.tsrouter.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.zip.GZIPOutputStream;

/**
 * Buffers points for one backend and sends them in batches.
 *
 * A batch is cut when {@code maxrowlimit} points are buffered or when the
 * oldest buffered point is {@code interval} ms old. Batches are sent by a
 * single flush thread in the order they were cut, each bounded by the
 * backend's write timeout. At most {@code maxPendingBatches} cut batches wait
 * for the flush thread; while that many are waiting new points are refused.
 */
public class WriteBatcher {

    private static final Logger logger = LoggerFactory.getLogger(WriteBatcher.class);

    private final BackendConfig config;
    private final BackendState state;
    private final BackendClient client;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final RouterProperties.FailurePolicy failurePolicy;
    private final boolean gzip;
    private final int maxPendingBatches;
    private final RewriteBuffer rewriteBuffer;
    private final ExecutorService flushExecutor;

    private final Object lock = new Object();
    private List<Point> buffer = new ArrayList<>();
    private long oldestPointTime = -1;
    private ScheduledFuture<?> timer;
    private ScheduledFuture<?> rewriteTask;
    private boolean closed;
    private final AtomicInteger pendingBatches = new AtomicInteger(0);

    private final AtomicLong queuedPoints = new AtomicLong(0);
    private final AtomicLong flushedPoints = new AtomicLong(0);
    private final AtomicLong flushedBatches = new AtomicLong(0);
    private final AtomicLong droppedPoints = new AtomicLong(0);
    private final AtomicLong failedFlushes = new AtomicLong(0);
    private final AtomicLong rewrittenBatches = new AtomicLong(0);
    private final AtomicLong rejectedPoints = new AtomicLong(0);

    public WriteBatcher(BackendConfig config, BackendState state, BackendClient client,
                        ScheduledExecutorService scheduler, Clock clock, RouterProperties.Write settings) {
        this.config = config;
        this.state = state;
        this.client = client;
        this.scheduler = scheduler;
        this.clock = clock;
        this.failurePolicy = settings.getFailurePolicy();
        this.gzip = settings.isGzip();
        this.maxPendingBatches = Math.max(1, settings.getMaxPendingBatches());
        this.rewriteBuffer = new RewriteBuffer(settings.getRewriteBufferMaxBytes());
        this.flushExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "flush-" + config.getName());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the rewrite loop when failed batches are kept for resending.
     */
    public void start() {
        if (failurePolicy == RouterProperties.FailurePolicy.REWRITE) {
            synchronized (lock) {
                rewriteTask = scheduler.scheduleWithFixedDelay(
                    () -> flushExecutor.execute(this::rewrite),
                    config.getRewriteInterval(),
                    config.getRewriteInterval(),
                    TimeUnit.MILLISECONDS
                );
            }
        }
    }

    /**
     * Queues a point; cuts a batch if the row threshold is reached.
     *
     * @throws UnavailableException if the batcher has been closed or too many batches wait to be sent
     */
    public void submit(Point point) {
        synchronized (lock) {
            if (closed) {
                throw new UnavailableException("backend " + config.getName() + " is shutting down");
            }
            int pending = pendingBatches.get();
            if (pending >= maxPendingBatches) {
                rejectedPoints.incrementAndGet();
                throw new UnavailableException("backend " + config.getName() + " is behind: " +
                                               pending + " batches waiting to be sent");
            }
            buffer.add(point);
            queuedPoints.incrementAndGet();
            if (buffer.size() == 1) {
                oldestPointTime = clock.millis();
                scheduleTimer(config.getInterval());
            }
            if (buffer.size() >= config.getMaxRowLimit()) {
                dispatch();
            }
        }
    }

    /**
     * Cuts a batch if the oldest buffered point has reached the flush interval.
     * Otherwise re-arms the timer for the remaining time.
     *
     * @return true if a batch was cut
     */
    public boolean flushIfDue() {
        synchronized (lock) {
            if (buffer.isEmpty()) {
                return false;
            }
            long age = clock.millis() - oldestPointTime;
            if (age >= config.getInterval()) {
                dispatch();
                return true;
            }
            scheduleTimer(config.getInterval() - age);
            return false;
        }
    }

    /**
     * Cuts a batch of everything buffered.
     *
     * @return completes once this batch and every batch cut before it have been sent or given up
     */
    public Future<?> flushNow() {
        synchronized (lock) {
            if (closed) {
                return CompletableFuture.completedFuture(null);
            }
            return dispatch();
        }
    }

    /**
     * Flushes what is buffered, waits for the flush thread and stops accepting points.
     * Batches still waiting in the rewrite buffer are dropped.
     */
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            dispatch();
            if (rewriteTask != null) {
                rewriteTask.cancel(false);
            }
        }
        flushExecutor.shutdown();
        try {
            if (!flushExecutor.awaitTermination(config.getTimeout() + 1000L, TimeUnit.MILLISECONDS)) {
                logger.warn("Flush thread of backend {} did not finish in time", config.getName());
                flushExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            flushExecutor.shutdownNow();
        }
        int discarded = rewriteBuffer.clear();
        if (discarded > 0) {
            droppedPoints.addAndGet(discarded);
            logger.warn("Dropped {} points waiting for rewrite on backend {}", discarded, config.getName());
        }
        logger.info("Closed write batcher for backend {}: {}", config.getName(), getStats());
    }

    // caller holds the lock, so batches reach the flush thread in the order they were cut
    private Future<?> dispatch() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
        if (buffer.isEmpty()) {
            return flushExecutor.submit(() -> { });
        }
        List<Point> batch = buffer;
        buffer = new ArrayList<>();
        oldestPointTime = -1;
        pendingBatches.incrementAndGet();
        return flushExecutor.submit(() -> {
            try {
                send(batch);
            } finally {
                pendingBatches.decrementAndGet();
            }
        });
    }

    private void scheduleTimer(long delayMs) {
        if (timer != null) {
            timer.cancel(false);
        }
        timer = scheduler.schedule(this::onTimer, delayMs, TimeUnit.MILLISECONDS);
    }

    private void onTimer() {
        flushIfDue();
    }

    private void send(List<Point> batch) {
        byte[] body = encode(batch);
        try {
            deliver(body);
            flushedPoints.addAndGet(batch.size());
            flushedBatches.incrementAndGet();
            logger.debug("Flushed {} points to backend {}", batch.size(), config.getName());
        } catch (RouterException e) {
            failedFlushes.incrementAndGet();
            markDownOnTransportFailure(e);
            if (failurePolicy == RouterProperties.FailurePolicy.REWRITE && isRetryable(e)) {
                int evicted = rewriteBuffer.add(new RewriteBuffer.Batch(body, batch.size()));
                droppedPoints.addAndGet(evicted);
                logger.warn("Flush of {} points to backend {} failed, kept for rewrite: {}",
                           batch.size(), config.getName(), e.getMessage());
            } else {
                droppedPoints.addAndGet(batch.size());
                logger.warn("Flush of {} points to backend {} failed, batch dropped: {}",
                           batch.size(), config.getName(), e.getMessage());
            }
        }
    }

    /**
     * Resends buffered failed batches, oldest first, while the backend is not DOWN.
     * Runs on the flush thread.
     */
    void rewrite() {
        RewriteBuffer.Batch batch;
        while (!state.isDown() && (batch = rewriteBuffer.poll()) != null) {
            try {
                deliver(batch.getBody());
                rewrittenBatches.incrementAndGet();
                flushedPoints.addAndGet(batch.getPoints());
                flushedBatches.incrementAndGet();
                logger.info("Rewrote {} points to backend {}", batch.getPoints(), config.getName());
            } catch (RouterException e) {
                failedFlushes.incrementAndGet();
                markDownOnTransportFailure(e);
                if (isRetryable(e)) {
                    droppedPoints.addAndGet(rewriteBuffer.requeue(batch));
                    logger.warn("Rewrite to backend {} failed, will retry: {}", config.getName(), e.getMessage());
                    return;
                }
                droppedPoints.addAndGet(batch.getPoints());
                logger.warn("Rewrite to backend {} refused, batch dropped: {}", config.getName(), e.getMessage());
            }
        }
    }

    // the client bounds the call by the write timeout and aborts the request when it passes
    private void deliver(byte[] body) {
        try {
            client.write(body, gzip);
        } catch (RouterException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackendWriteException(config.getName(), String.valueOf(e), e);
        }
    }

    private void markDownOnTransportFailure(RouterException e) {
        if (e instanceof BackendTimeoutException ||
            (e instanceof BackendWriteException && ((BackendWriteException) e).isTransportFailure())) {
            state.markDown(e.getMessage());
        }
    }

    private static boolean isRetryable(RouterException e) {
        if (e instanceof BackendTimeoutException) {
            return true;
        }
        return e instanceof BackendWriteException && ((BackendWriteException) e).isRetryable();
    }

    private byte[] encode(List<Point> batch) {
        byte[] lines = LineProtocol.format(batch).getBytes(StandardCharsets.UTF_8);
        if (!gzip) {
            return lines;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(lines.length / 4 + 64);
        try (GZIPOutputStream zip = new GZIPOutputStream(out)) {
            zip.write(lines);
        } catch (IOException e) {
            throw new UncheckedIOException("gzip of batch failed", e);
        }
        return out.toByteArray();
    }

    public int getBufferedCount() {
        synchronized (lock) {
            return buffer.size();
        }
    }

    /**
     * Batches cut but not yet sent, the one being sent included.
     */
    public int getPendingBatches() {
        return pendingBatches.get();
    }

    public RewriteBuffer getRewriteBuffer() {
        return rewriteBuffer;
    }

    public BatcherStats getStats() {
        return new BatcherStats(
            config.getName(),
            queuedPoints.get(),
            flushedPoints.get(),
            flushedBatches.get(),
            droppedPoints.get(),
            failedFlushes.get(),
            rewrittenBatches.get(),
            rejectedPoints.get(),
            getBufferedCount(),
            pendingBatches.get(),
            rewriteBuffer.getBatchCount()
        );
    }

    /**
     * Counters of one batcher.
     */
    public static class BatcherStats {
        private final String backend;
        private final long queuedPoints;
        private final long flushedPoints;
        private final long flushedBatches;
        private final long droppedPoints;
        private final long failedFlushes;
        private final long rewrittenBatches;
        private final long rejectedPoints;
        private final int bufferedPoints;
        private final int pendingBatches;
        private final int pendingRewrites;

        public BatcherStats(String backend, long queuedPoints, long flushedPoints, long flushedBatches,
                            long droppedPoints, long failedFlushes, long rewrittenBatches, long rejectedPoints,
                            int bufferedPoints, int pendingBatches, int pendingRewrites) {
            this.backend = backend;
            this.queuedPoints = queuedPoints;
            this.flushedPoints = flushedPoints;
            this.flushedBatches = flushedBatches;
            this.droppedPoints = droppedPoints;
            this.failedFlushes = failedFlushes;
            this.rewrittenBatches = rewrittenBatches;
            this.rejectedPoints = rejectedPoints;
            this.bufferedPoints = bufferedPoints;
            this.pendingBatches = pendingBatches;
            this.pendingRewrites = pendingRewrites;
        }

        public String getBackend() { return backend; }
        public long getQueuedPoints() { return queuedPoints; }
        public long getFlushedPoints() { return flushedPoints; }
        public long getFlushedBatches() { return flushedBatches; }
        public long getDroppedPoints() { return droppedPoints; }
        public long getFailedFlushes() { return failedFlushes; }
        public long getRewrittenBatches() { return rewrittenBatches; }
        public long getRejectedPoints() { return rejectedPoints; }
        public int getBufferedPoints() { return bufferedPoints; }
        public int getPendingBatches() { return pendingBatches; }
        public int getPendingRewrites() { return pendingRewrites; }

        @Override
        public String toString() {
            return String.format("BatcherStats{queued=%d, flushed=%d, batches=%d, dropped=%d, failedFlushes=%d, " +
                               "rewritten=%d, rejected=%d, buffered=%d, pendingBatches=%d, pendingRewrites=%d}",
                    queuedPoints, flushedPoints, flushedBatches, droppedPoints, failedFlushes,
                    rewrittenBatches, rejectedPoints, bufferedPoints, pendingBatches, pendingRewrites);
        }
    }
}
