package com.tsrouter.backend;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Failed batches waiting to be resent, bounded by total body size.
 * When a new batch does not fit, the oldest batches are evicted.
 */
public class RewriteBuffer {

    private final long maxBytes;
    private final Deque<Batch> batches = new ArrayDeque<>();
    private long bytes;

    public RewriteBuffer(long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("Rewrite buffer size must be positive");
        }
        this.maxBytes = maxBytes;
    }

    /**
     * Appends a batch, evicting the oldest ones until it fits.
     *
     * @return number of points evicted, including the batch itself if it can never fit
     */
    public synchronized int add(Batch batch) {
        if (batch.size() > maxBytes) {
            return batch.getPoints();
        }
        int evicted = 0;
        while (bytes + batch.size() > maxBytes) {
            Batch oldest = batches.pollFirst();
            bytes -= oldest.size();
            evicted += oldest.getPoints();
        }
        batches.addLast(batch);
        bytes += batch.size();
        return evicted;
    }

    /**
     * Puts a batch whose resend failed back at the head. It was removed by
     * {@link #poll()} just before, so it still fits unless newer batches took its room.
     *
     * @return number of points evicted to make room
     */
    public synchronized int requeue(Batch batch) {
        int evicted = 0;
        while (bytes + batch.size() > maxBytes && !batches.isEmpty()) {
            Batch newest = batches.pollLast();
            bytes -= newest.size();
            evicted += newest.getPoints();
        }
        batches.addFirst(batch);
        bytes += batch.size();
        return evicted;
    }

    public synchronized Batch poll() {
        Batch batch = batches.pollFirst();
        if (batch != null) {
            bytes -= batch.size();
        }
        return batch;
    }

    /**
     * Empties the buffer.
     *
     * @return number of points discarded
     */
    public synchronized int clear() {
        int points = 0;
        for (Batch batch : batches) {
            points += batch.getPoints();
        }
        batches.clear();
        bytes = 0;
        return points;
    }

    public synchronized int getBatchCount() {
        return batches.size();
    }

    public synchronized long getBytes() {
        return bytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    /**
     * An encoded batch body and the number of points it carries.
     */
    public static class Batch {
        private final byte[] body;
        private final int points;

        public Batch(byte[] body, int points) {
            this.body = body;
            this.points = points;
        }

        public byte[] getBody() {
            return body;
        }

        public int getPoints() {
            return points;
        }

        public int size() {
            return body.length;
        }
    }
}
