package com.tsrouter.backend;

/**
 * Health of a backend as last observed by its probe loop.
 */
public enum HealthState {
    /**
     * Not probed yet. Treated as not serving.
     */
    UNKNOWN,
    UP,
    DOWN
}
