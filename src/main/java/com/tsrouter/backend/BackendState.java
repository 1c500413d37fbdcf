package com.tsrouter.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable health record of one backend. Written by its probe loop and by
 * requests that hit a transport failure, read by the write and query paths.
 */
public class BackendState {

    private static final Logger logger = LoggerFactory.getLogger(BackendState.class);

    private final String name;
    private final AtomicReference<HealthState> health;
    private final AtomicLong lastTransitionTime;
    private final AtomicLong probes;
    private final AtomicLong failedProbes;

    public BackendState(String name) {
        this.name = name;
        this.health = new AtomicReference<>(HealthState.UNKNOWN);
        this.lastTransitionTime = new AtomicLong(0);
        this.probes = new AtomicLong(0);
        this.failedProbes = new AtomicLong(0);
    }

    public String getName() {
        return name;
    }

    public HealthState getHealth() {
        return health.get();
    }

    public boolean isUp() {
        return health.get() == HealthState.UP;
    }

    public boolean isDown() {
        return health.get() == HealthState.DOWN;
    }

    /**
     * @return true if the backend was not UP before
     */
    public boolean markUp() {
        HealthState old = health.getAndSet(HealthState.UP);
        if (old != HealthState.UP) {
            lastTransitionTime.set(System.currentTimeMillis());
            logger.info("Backend {} health changed: {} -> UP", name, old);
            return true;
        }
        return false;
    }

    /**
     * @return true if the backend was not DOWN before
     */
    public boolean markDown(String reason) {
        HealthState old = health.getAndSet(HealthState.DOWN);
        if (old != HealthState.DOWN) {
            lastTransitionTime.set(System.currentTimeMillis());
            logger.warn("Backend {} health changed: {} -> DOWN ({})", name, old, reason);
            return true;
        }
        return false;
    }

    void recordProbe(boolean success) {
        probes.incrementAndGet();
        if (!success) {
            failedProbes.incrementAndGet();
        }
    }

    public long getLastTransitionTime() {
        return lastTransitionTime.get();
    }

    public long getProbes() {
        return probes.get();
    }

    public long getFailedProbes() {
        return failedProbes.get();
    }

    @Override
    public String toString() {
        return String.format("BackendState{name='%s', health=%s, probes=%d, failedProbes=%d}",
                name, health.get(), probes.get(), failedProbes.get());
    }
}
