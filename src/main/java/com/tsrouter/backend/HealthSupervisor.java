package com.tsrouter.backend;

import com.tsrouter.config.RouterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Probes every backend's ping endpoint at its check interval and keeps its
 * health record current. A single failed probe marks a backend DOWN; the next
 * successful one marks it UP again.
 */
@Component
public class HealthSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(HealthSupervisor.class);

    @Autowired
    private RouterProperties properties;

    private ScheduledExecutorService probeExecutor;

    @PostConstruct
    public void initialize() {
        this.probeExecutor = Executors.newScheduledThreadPool(properties.getHealthCheckThreads(), r -> {
            Thread t = new Thread(r, "health-probe");
            t.setDaemon(true);
            return t;
        });
        logger.info("HealthSupervisor initialized with {} probe threads", properties.getHealthCheckThreads());
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Shutting down HealthSupervisor");
        probeExecutor.shutdown();
        try {
            if (!probeExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                probeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            probeExecutor.shutdownNow();
        }
    }

    /**
     * Starts the probe loop of a backend. The first probe runs immediately.
     */
    public void start(BackendRuntime runtime) {
        ScheduledFuture<?> task = probeExecutor.scheduleWithFixedDelay(
            () -> probe(runtime),
            0,
            runtime.getConfig().getCheckInterval(),
            TimeUnit.MILLISECONDS
        );
        runtime.setProbeTask(task);
        logger.debug("Started probing backend {} every {}ms", runtime.getName(),
                     runtime.getConfig().getCheckInterval());
    }

    public void stop(BackendRuntime runtime) {
        ScheduledFuture<?> task = runtime.getProbeTask();
        if (task != null) {
            task.cancel(false);
            logger.debug("Stopped probing backend {}", runtime.getName());
        }
    }

    /**
     * Runs one probe and applies its outcome to the backend's health.
     *
     * @return true if the backend answered
     */
    public boolean probe(BackendRuntime runtime) {
        BackendState state = runtime.getState();
        try {
            runtime.getClient().ping();
            state.recordProbe(true);
            state.markUp();
            return true;
        } catch (RuntimeException e) {
            state.recordProbe(false);
            state.markDown("probe failed: " + e.getMessage());
            return false;
        }
    }
}
