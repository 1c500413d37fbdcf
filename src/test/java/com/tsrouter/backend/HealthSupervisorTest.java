package com.tsrouter.backend;

import com.tsrouter.config.BackendConfig;
import com.tsrouter.config.RouterProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.client.ResourceAccessException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class HealthSupervisorTest {

    @Mock
    private BackendClient client;

    @Mock
    private WriteBatcher batcher;

    private HealthSupervisor supervisor;
    private BackendRuntime runtime;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        supervisor = new HealthSupervisor();
        ReflectionTestUtils.setField(supervisor, "properties", new RouterProperties());
        supervisor.initialize();

        BackendConfig config = new BackendConfig("local", "http://localhost:8086", "test", "local",
                1000, 1000, 1000, 100, 20, 1000, false);
        runtime = new BackendRuntime(config, new BackendState("local"), client, batcher);
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    @Test
    public void testUnknownUntilFirstProbe() {
        assertEquals(HealthState.UNKNOWN, runtime.getState().getHealth());
        assertFalse(runtime.getState().isUp());
        assertFalse(runtime.getState().isDown());
    }

    @Test
    public void testSingleFailureMarksDown() {
        assertTrue(supervisor.probe(runtime));
        assertEquals(HealthState.UP, runtime.getState().getHealth());

        doThrow(new ResourceAccessException("connection refused")).when(client).ping();
        assertFalse(supervisor.probe(runtime));
        assertEquals(HealthState.DOWN, runtime.getState().getHealth());

        doNothing().when(client).ping();
        assertTrue(supervisor.probe(runtime));
        assertEquals(HealthState.UP, runtime.getState().getHealth());

        assertEquals(3, runtime.getState().getProbes());
        assertEquals(1, runtime.getState().getFailedProbes());
    }

    @Test
    public void testFirstProbeFailureGoesFromUnknownToDown() {
        doThrow(new IllegalStateException("500")).when(client).ping();
        supervisor.probe(runtime);
        assertTrue(runtime.getState().isDown());
    }

    @Test
    public void testProbeLoopRunsAtCheckInterval() throws Exception {
        supervisor.start(runtime);

        long deadline = System.currentTimeMillis() + 5000;
        while (runtime.getState().getProbes() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(runtime.getState().getProbes() >= 3);
        assertTrue(runtime.getState().isUp());

        supervisor.stop(runtime);
        assertTrue(runtime.getProbeTask().isCancelled());
    }
}
