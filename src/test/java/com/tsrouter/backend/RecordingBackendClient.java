package com.tsrouter.backend;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.zip.GZIPInputStream;

/**
 * Backend client that records every write body and fails on demand.
 */
public class RecordingBackendClient implements BackendClient {

    private final List<String> writes = Collections.synchronizedList(new ArrayList<>());
    private final Deque<RuntimeException> failures = new ConcurrentLinkedDeque<>();
    private volatile CountDownLatch gate;

    /**
     * Makes the next write throw the given exception.
     */
    public void failNext(RuntimeException failure) {
        failures.add(failure);
    }

    /**
     * Blocks every write until {@link #releaseWrites()}.
     */
    public void holdWrites() {
        gate = new CountDownLatch(1);
    }

    public void releaseWrites() {
        CountDownLatch held = gate;
        gate = null;
        if (held != null) {
            held.countDown();
        }
    }

    @Override
    public void write(byte[] body, boolean gzipped) {
        CountDownLatch held = gate;
        if (held != null) {
            try {
                held.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("write interrupted", e);
            }
        }
        RuntimeException failure = failures.poll();
        if (failure != null) {
            throw failure;
        }
        writes.add(gzipped ? gunzip(body) : new String(body, StandardCharsets.UTF_8));
    }

    @Override
    public QueryResult query(Map<String, String> parameters) {
        throw new UnsupportedOperationException();
    }

    @Override
    public void ping() {
    }

    public List<String> getWrites() {
        synchronized (writes) {
            return new ArrayList<>(writes);
        }
    }

    private static String gunzip(byte[] body) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
