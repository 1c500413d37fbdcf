package com.tsrouter.registry;

import com.tsrouter.config.BackendConfig;
import com.tsrouter.config.NodeConfig;
import com.tsrouter.exception.BackendNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link RegistrySnapshot}. Readers take the snapshot
 * without locking; a reload publishes a whole new snapshot in one atomic swap,
 * so no reader ever sees a half-applied reload.
 */
@Component
public class BackendRegistry {

    private static final Logger logger = LoggerFactory.getLogger(BackendRegistry.class);

    private final AtomicReference<RegistrySnapshot> current = new AtomicReference<>(RegistrySnapshot.empty());

    /**
     * Publishes a new snapshot and returns the one it replaces.
     */
    public RegistrySnapshot load(RegistrySnapshot snapshot) {
        RegistrySnapshot previous = current.getAndSet(snapshot);
        logger.info("Published registry snapshot {} (replacing version {})", snapshot, previous.getVersion());
        return previous;
    }

    public RegistrySnapshot current() {
        return current.get();
    }

    /**
     * Pins the current snapshot until the lease is closed.
     */
    public SnapshotLease acquire() {
        while (true) {
            RegistrySnapshot snapshot = current.get();
            snapshot.readers.incrementAndGet();
            if (current.get() == snapshot) {
                return new SnapshotLease(snapshot);
            }
            // swapped between read and pin, retry on the new one
            snapshot.readers.decrementAndGet();
        }
    }

    /**
     * Waits until no lease holds the given snapshot.
     *
     * @return false if readers remained when the timeout expired
     */
    public boolean awaitQuiescence(RegistrySnapshot snapshot, long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (snapshot.readers.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    /**
     * @throws BackendNotFoundException if no backend has that name
     */
    public BackendConfig lookup(String name) {
        BackendConfig config = current.get().getBackends().get(name);
        if (config == null) {
            throw new BackendNotFoundException(name);
        }
        return config;
    }

    public NodeConfig nodeFor(String localAddress, int localPort) {
        return current.get().nodeFor(localAddress, localPort);
    }
}
