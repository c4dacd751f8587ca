package com.powerguard.core.metrics;

import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PowerGuardMetricsTest {

    private SimpleMeterRegistry registry;
    private PowerGuardMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PowerGuardMetrics(registry);
    }

    @Test
    @DisplayName("recordActionableExecution records by type and status tags")
    void recordActionableExecution() {
        metrics.recordActionableExecution("kill_app", ExecutionStatus.SUCCESS, 40);
        metrics.recordActionableExecution("kill_app", ExecutionStatus.SUCCESS, 60);
        metrics.recordActionableExecution("kill_app", ExecutionStatus.FAILED, 10);

        var success = registry.find("powerguard.actionable.duration")
                .tag("type", "kill_app").tag("status", "SUCCESS").timer();
        assertNotNull(success);
        assertEquals(2, success.count());
    }

    @Test
    @DisplayName("recordBatch records size and duration")
    void recordBatch() {
        metrics.recordBatch(3, 250);

        var size = registry.find("powerguard.batch.size").summary();
        assertNotNull(size);
        assertEquals(3.0, size.totalAmount());
        assertNotNull(registry.find("powerguard.batch.duration").timer());
    }

    @Test
    @DisplayName("recordProbe counts verdicts per domain and tier")
    void recordProbe() {
        metrics.recordProbe(CapabilityDomain.WAKE_SOURCE, CapabilityTier.FALLBACK);

        var counter = registry.find("powerguard.capability.probes")
                .tag("domain", "WAKE_SOURCE").tag("tier", "FALLBACK").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordRejection and recordTimeout increment counters")
    void rejectionsAndTimeouts() {
        metrics.recordRejection("UNKNOWN_TYPE");
        metrics.recordRejection("UNKNOWN_TYPE");
        metrics.recordTimeout("throttle_cpu_usage");

        assertEquals(2.0, registry.find("powerguard.actionable.rejections").tag("reason", "UNKNOWN_TYPE").counter().count());
        assertEquals(1.0, registry.find("powerguard.actionable.timeouts").tag("type", "throttle_cpu_usage").counter().count());
    }
}
