package com.powerguard.core.metrics;

import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for actionable execution.
 */
@Service
public class PowerGuardMetrics {

    private final MeterRegistry registry;

    public PowerGuardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordActionableExecution(String type, ExecutionStatus status, long ms) {
        Timer.builder("powerguard.actionable.duration")
                .tag("type", type)
                .tag("status", status.name())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordBatch(int size, long ms) {
        DistributionSummary.builder("powerguard.batch.size")
                .description("Actionables per batch")
                .register(registry)
                .record(size);
        Timer.builder("powerguard.batch.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a probe verdict. Only called when the prober actually ran probe commands,
     * so cache hits do not count.
     */
    public void recordProbe(CapabilityDomain domain, CapabilityTier tier) {
        Counter.builder("powerguard.capability.probes")
                .tag("domain", domain.name())
                .tag("tier", tier.name())
                .register(registry)
                .increment();
    }

    public void recordRejection(String reason) {
        Counter.builder("powerguard.actionable.rejections")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordTimeout(String type) {
        Counter.builder("powerguard.actionable.timeouts")
                .tag("type", type)
                .register(registry)
                .increment();
    }
}
