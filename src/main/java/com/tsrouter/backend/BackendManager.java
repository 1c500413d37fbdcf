package com.tsrouter.backend;

import com.tsrouter.config.BackendConfig;
import com.tsrouter.config.RouterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Creates and retires backend runtimes as definitions come and go.
 * Owns the executors shared by all backends: HTTP exchanges run on the IO pool, batch timers on the scheduler.
 */
@Component
public class BackendManager {

    private static final Logger logger = LoggerFactory.getLogger(BackendManager.class);

    @Autowired
    private RouterProperties properties;

    @Autowired
    private HealthSupervisor healthSupervisor;

    @Autowired
    private RestTemplateBuilder restTemplateBuilder;

    @Autowired
    private Clock clock;

    private final ExecutorService ioExecutor;
    private final ScheduledExecutorService batchScheduler;

    public BackendManager() {
        this.ioExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "backend-io");
            t.setDaemon(true);
            return t;
        });
        this.batchScheduler = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "batch-timer");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Shutting down BackendManager");
        batchScheduler.shutdown();
        ioExecutor.shutdown();
        try {
            if (!batchScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                batchScheduler.shutdownNow();
            }
            if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            batchScheduler.shutdownNow();
            ioExecutor.shutdownNow();
        }
    }

    /**
     * Binds every definition to a runtime. A previous runtime is reused when its
     * definition is unchanged; new and changed backends get a fresh runtime whose
     * probe loop is started.
     */
    public Map<String, BackendRuntime> materialize(Map<String, BackendConfig> configs,
                                                   Map<String, BackendRuntime> previous) {
        Map<String, BackendRuntime> runtimes = new LinkedHashMap<>();
        for (BackendConfig config : configs.values()) {
            BackendRuntime existing = previous.get(config.getName());
            if (existing != null && existing.getConfig().equals(config)) {
                runtimes.put(config.getName(), existing);
                continue;
            }
            BackendRuntime runtime = create(config);
            healthSupervisor.start(runtime);
            runtimes.put(config.getName(), runtime);
            logger.info("{} backend {}", existing != null ? "Rebuilt" : "Created", config);
        }
        return runtimes;
    }

    /**
     * Runtimes of {@code previous} that {@code next} no longer uses.
     */
    public static List<BackendRuntime> obsolete(Map<String, BackendRuntime> previous,
                                                Map<String, BackendRuntime> next) {
        List<BackendRuntime> obsolete = new ArrayList<>();
        for (BackendRuntime runtime : previous.values()) {
            if (next.get(runtime.getName()) != runtime) {
                obsolete.add(runtime);
            }
        }
        return obsolete;
    }

    /**
     * Stops the probe loops and flushes then closes the batchers of the given runtimes.
     */
    public void retire(Collection<BackendRuntime> runtimes) {
        for (BackendRuntime runtime : runtimes) {
            healthSupervisor.stop(runtime);
            runtime.close();
            logger.info("Retired backend {}", runtime.getName());
        }
    }

    protected BackendRuntime create(BackendConfig config) {
        BackendState state = new BackendState(config.getName());
        BackendClient client = HttpBackendClient.create(config, restTemplateBuilder, ioExecutor);
        WriteBatcher batcher = new WriteBatcher(config, state, client, batchScheduler, clock,
                                                properties.getWrite());
        batcher.start();
        return new BackendRuntime(config, state, client, batcher);
    }
}
