package com.powerguard.core.capability;

import com.powerguard.core.metrics.PowerGuardMetrics;
import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.device.DeviceUnreachableException;
import com.powerguard.device.ScriptedDeviceShell;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityProberTest {

    private static final String SENTINEL = "com.powerguard.probe.sentinel";

    private ScriptedDeviceShell shell;
    private SimpleMeterRegistry meterRegistry;
    private CapabilityProber prober;

    @BeforeEach
    void setUp() {
        shell = new ScriptedDeviceShell();
        meterRegistry = new SimpleMeterRegistry();
        prober = new CapabilityProber(shell, SENTINEL, new PowerGuardMetrics(meterRegistry));
    }

    @Nested
    @DisplayName("tier selection")
    class TierSelection {

        @Test
        @DisplayName("a usable primary tier is chosen without trying the fallback")
        void primaryUsable() {
            assertEquals(CapabilityTier.PRIMARY, prober.probe(CapabilityDomain.IDLE_STATE));

            assertEquals(List.of("am get-standby-bucket " + SENTINEL), shell.commands());
        }

        @Test
        @DisplayName("a denied primary falls through to the fallback")
        void primaryDenied() {
            shell.deny("am get-standby-bucket");

            assertEquals(CapabilityTier.FALLBACK, prober.probe(CapabilityDomain.IDLE_STATE));
            assertEquals(List.of("am get-standby-bucket " + SENTINEL, "am get-inactive " + SENTINEL), shell.commands());
        }

        @Test
        @DisplayName("a missing primary mechanism falls through to the fallback")
        void primaryMissing() {
            shell.missing("cmd appops get");

            assertEquals(CapabilityTier.FALLBACK, prober.probe(CapabilityDomain.WAKE_SOURCE));
        }

        @Test
        @DisplayName("both tiers unusable is UNAVAILABLE")
        void noneUsable() {
            shell.deny("renice").respond(": > /dev/cpuset", 1,
                    "/system/bin/sh: can't create /dev/cpuset/background/tasks: Permission denied");

            assertEquals(CapabilityTier.UNAVAILABLE, prober.probe(CapabilityDomain.CPU_PRIORITY));
        }

        @Test
        @DisplayName("an error answer after the permission check still proves the tier")
        void serviceAnsweredWithError() {
            shell.respond("cmd appops get", 255, "Error: No UID for " + SENTINEL + " in user 0");

            assertEquals(CapabilityTier.PRIMARY, prober.probe(CapabilityDomain.WAKE_SOURCE));
        }

        @Test
        @DisplayName("alerts need no device access and run no command")
        void usageAlertAlwaysPrimary() {
            assertEquals(CapabilityTier.PRIMARY, prober.probe(CapabilityDomain.USAGE_ALERT));
            assertTrue(shell.commands().isEmpty());
        }
    }

    @Nested
    @DisplayName("caching")
    class Caching {

        @Test
        @DisplayName("the verdict is cached until invalidated")
        void cachedUntilInvalidated() {
            shell.deny("am force-stop");

            prober.probe(CapabilityDomain.PROCESS_TERMINATION);
            prober.probe(CapabilityDomain.PROCESS_TERMINATION);
            assertEquals(2, shell.commands().size());

            shell.respond("am force-stop", 0, "");
            prober.invalidate(CapabilityDomain.PROCESS_TERMINATION);

            assertEquals(CapabilityTier.PRIMARY, prober.probe(CapabilityDomain.PROCESS_TERMINATION));
            assertEquals(3, shell.commands().size());
        }

        @Test
        @DisplayName("UNAVAILABLE is cached as well")
        void unavailableCached() {
            shell.deny("cmd netpolicy").deny("cmd appops get");

            assertEquals(CapabilityTier.UNAVAILABLE, prober.probe(CapabilityDomain.BACKGROUND_TRANSFER));
            assertEquals(CapabilityTier.UNAVAILABLE, prober.probe(CapabilityDomain.BACKGROUND_TRANSFER));
            assertEquals(2, shell.commands().size());
        }

        @Test
        @DisplayName("an unreachable device reports UNAVAILABLE without caching it")
        void unreachableNotCached() {
            shell.unreachable("am get-standby-bucket");

            assertEquals(CapabilityTier.UNAVAILABLE, prober.probe(CapabilityDomain.IDLE_STATE));
            assertFalse(prober.snapshot().containsKey(CapabilityDomain.IDLE_STATE));

            shell.respond("am get-standby-bucket", 0, "50");
            assertEquals(CapabilityTier.PRIMARY, prober.probe(CapabilityDomain.IDLE_STATE));
        }

        @Test
        @DisplayName("resolveTier rethrows an unreachable device and caches nothing")
        void resolveTierRethrowsUnreachable() {
            shell.unreachable("am get-standby-bucket");

            var e = assertThrows(DeviceUnreachableException.class, () -> prober.resolveTier(CapabilityDomain.IDLE_STATE));
            assertEquals("error: device offline", e.getMessage());
            assertTrue(prober.snapshot().isEmpty());
        }

        @Test
        @DisplayName("invalidateAll clears every domain")
        void invalidateAll() {
            prober.probe(CapabilityDomain.IDLE_STATE);
            prober.probe(CapabilityDomain.PROCESS_TERMINATION);
            assertEquals(2, prober.snapshot().size());

            prober.invalidateAll();

            assertTrue(prober.snapshot().isEmpty());
        }

        @Test
        @DisplayName("concurrent first probes run the probe commands once")
        void concurrentFirstProbe() throws Exception {
            shell.delay("am get-standby-bucket", Duration.ofMillis(100));
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<CapabilityTier>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return prober.probe(CapabilityDomain.IDLE_STATE);
                    }));
                }
                start.countDown();
                for (Future<CapabilityTier> future : futures) {
                    assertEquals(CapabilityTier.PRIMARY, future.get(5, TimeUnit.SECONDS));
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, shell.count("am get-standby-bucket"));
        }
    }

    @Test
    @DisplayName("metrics count actual probes, not cache hits")
    void metricsCountProbes() {
        prober.probe(CapabilityDomain.IDLE_STATE);
        prober.probe(CapabilityDomain.IDLE_STATE);

        assertEquals(1.0, meterRegistry.get("powerguard.capability.probes")
                .tag("domain", "IDLE_STATE").tag("tier", "PRIMARY").counter().count());
    }
}
