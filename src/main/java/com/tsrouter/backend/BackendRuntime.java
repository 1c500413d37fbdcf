package com.tsrouter.backend;

import com.tsrouter.config.BackendConfig;

import java.util.concurrent.ScheduledFuture;

/**
 * Live objects of one backend: its health record, HTTP client, write batcher
 * and probe loop. Survives reloads that leave the backend's definition unchanged.
 */
public class BackendRuntime {

    private final BackendConfig config;
    private final BackendState state;
    private final BackendClient client;
    private final WriteBatcher batcher;
    private volatile ScheduledFuture<?> probeTask;

    public BackendRuntime(BackendConfig config, BackendState state, BackendClient client, WriteBatcher batcher) {
        this.config = config;
        this.state = state;
        this.client = client;
        this.batcher = batcher;
    }

    public String getName() {
        return config.getName();
    }

    public BackendConfig getConfig() {
        return config;
    }

    public BackendState getState() {
        return state;
    }

    public BackendClient getClient() {
        return client;
    }

    public WriteBatcher getBatcher() {
        return batcher;
    }

    void setProbeTask(ScheduledFuture<?> probeTask) {
        this.probeTask = probeTask;
    }

    ScheduledFuture<?> getProbeTask() {
        return probeTask;
    }

    /**
     * Stops probing, flushes queued points, stops the batcher and closes the client.
     */
    public void close() {
        ScheduledFuture<?> task = probeTask;
        if (task != null) {
            task.cancel(false);
        }
        batcher.close();
        client.close();
    }

    @Override
    public String toString() {
        return String.format("BackendRuntime{name='%s', health=%s}", config.getName(), state.getHealth());
    }
}
