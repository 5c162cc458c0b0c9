package com.pantheon.dispatch.monitor.runtime;

import com.pantheon.dispatch.api.SystemState;
import com.pantheon.dispatch.monitor.config.DispatchRuntimeConfig;
import com.pantheon.dispatch.monitor.tagdb.InMemoryTagDatabase;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.*;

class DispatchProductionRuntimeSmokeTest {

    @Test
    void fullStackLifecycle() throws InterruptedException {
        DispatchRuntimeConfig config = DispatchRuntimeConfig.builder()
            .withReaderBindAddress(new InetSocketAddress("127.0.0.1", 0)) // ephemeral
            .build();

        DispatchProductionRuntime runtime = DispatchProductionRuntime.builder()
            .withConfig(config)
            .withTagDatabase(new InMemoryTagDatabase())
            .build();

        assertNotNull(runtime);
        runtime.start();
        assertTrue(runtime.isRunning());
        Thread.sleep(200);
        assertEquals(SystemState.IDLE, runtime.getStatus().state());
        runtime.stop();
        assertFalse(runtime.isRunning());
    }

    @Test
    void buildRequiresTagDatabase() {
        assertThrows(NullPointerException.class, () -> DispatchProductionRuntime.builder().build());
    }
}
