package com.tsrouter.registry;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps a snapshot from being retired while a request is using it.
 */
public final class SnapshotLease implements AutoCloseable {

    private final RegistrySnapshot snapshot;
    private final AtomicBoolean released = new AtomicBoolean(false);

    SnapshotLease(RegistrySnapshot snapshot) {
        this.snapshot = snapshot;
    }

    public RegistrySnapshot snapshot() {
        return snapshot;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            snapshot.readers.decrementAndGet();
        }
    }
}
