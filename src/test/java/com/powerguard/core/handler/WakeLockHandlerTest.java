package com.powerguard.core.handler;

import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.ActionableType;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.core.model.ExecutionStatus;
import com.powerguard.device.DeviceProperties;
import com.powerguard.device.PackageResolver;
import com.powerguard.device.ScriptedDeviceShell;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WakeLockHandlerTest {

    private static final String POWER_DUMP = """
            POWER MANAGER (dumpsys power)
            Power Manager State:
              mWakefulness=Awake

            Wake Locks: size=3
              PARTIAL_WAKE_LOCK 'SyncLoopWakeLock' ACQ=-1m2s (uid=1000 pid=1234)
              PARTIAL_WAKE_LOCK '*job*/com.example.app/.SyncJob' ACQ=-12s (uid=10123 pid=4321)
              PARTIAL_WAKE_LOCK 'LocationUpdates' ACQ=-3s (uid=10123 pid=4321)

            Suspend Blockers: size=4
              PowerManagerService.WakeLocks: ref count=1
            """;

    private ScriptedDeviceShell shell;
    private WakeLockHandler handler;

    @BeforeEach
    void setUp() {
        shell = new ScriptedDeviceShell()
                .respond("cmd package list packages -U com.example.app", 0, "package:com.example.app uid:10123")
                .respond("dumpsys power", 0, POWER_DUMP);
        handler = new WakeLockHandler(shell, new PackageResolver(shell), new DeviceProperties());
    }

    private static ActionableRecord wakeLocks(String target, String mode) {
        return new ActionableRecord("wl-1", ActionableType.MANAGE_WAKE_LOCKS, target, mode, "partial wake locks");
    }

    @Nested
    @DisplayName("policy changes")
    class PolicyChanges {

        @Test
        @DisplayName("primary denies through cmd appops by default")
        void primaryDeny() {
            ExecutionResult result = handler.handle(wakeLocks("com.example.app", null), CapabilityTier.PRIMARY);

            assertEquals(ExecutionStatus.SUCCESS, result.status());
            assertEquals(List.of("cmd appops set com.example.app WAKE_LOCK ignore"), shell.commands());
        }

        @Test
        @DisplayName("fallback uses the standalone appops binary")
        void fallbackAllow() {
            handler.handle(wakeLocks("com.example.app", "allow"), CapabilityTier.FALLBACK);

            assertEquals(List.of("appops set com.example.app WAKE_LOCK allow"), shell.commands());
        }

        @Test
        @DisplayName("a denied write is reported as no permission")
        void denied() {
            shell.deny("cmd appops set");

            ExecutionResult result = handler.handle(wakeLocks("com.example.app", "deny"), CapabilityTier.PRIMARY);

            assertEquals(ExecutionStatus.FAILED, result.status());
            assertTrue(result.detail().startsWith("no permission"));
        }
    }

    @Nested
    @DisplayName("inspect")
    class Inspect {

        @Test
        @DisplayName("reports only the wake locks held by the app's uid")
        void heldByUid() {
            ExecutionResult result = handler.handle(wakeLocks("com.example.app", "inspect"), CapabilityTier.PRIMARY);

            assertEquals(ExecutionStatus.SUCCESS, result.status());
            assertTrue(result.detail().startsWith("com.example.app holds 2 wake lock(s)"), result.detail());
            assertEquals(0, shell.count("cmd appops set"));
        }

        @Test
        @DisplayName("stops at the end of the wake lock section")
        void sectionBoundary() {
            List<String> held = handler.heldWakeLocks("com.example.app");

            assertEquals(2, held.size());
            assertTrue(held.stream().noneMatch(line -> line.contains("ref count")));
        }

        @Test
        @DisplayName("uids and package names match as whole tokens only")
        void wholeTokenMatching() {
            shell.respond("cmd package list packages -U com.example.a", 0, "package:com.example.a uid:1001")
                    .respond("dumpsys power", 0, """
                            Wake Locks: size=4
                              PARTIAL_WAKE_LOCK 'Sync' ACQ=-1s (uid=10012 pid=77)
                              PARTIAL_WAKE_LOCK '*job*/com.example.abc/.Job' ACQ=-2s (uid=10400 pid=78)
                              PARTIAL_WAKE_LOCK 'Own' ACQ=-3s (uid=1001 pid=79)
                              PARTIAL_WAKE_LOCK '*alarm*/com.example.a/.Tick' ACQ=-4s (uid=10500 pid=80)

                            Suspend Blockers: size=0
                            """);

            List<String> held = handler.heldWakeLocks("com.example.a");

            assertEquals(2, held.size(), held.toString());
            assertTrue(held.get(0).contains("'Own'"));
            assertTrue(held.get(1).contains("com.example.a/.Tick"));
        }

        @Test
        @DisplayName("an app holding nothing reports zero")
        void nothingHeld() {
            shell.respond("cmd package list packages -U com.example.quiet", 0, "package:com.example.quiet uid:10500");

            ExecutionResult result = handler.handle(wakeLocks("com.example.quiet", "list"), CapabilityTier.FALLBACK);

            assertEquals("com.example.quiet holds 0 wake lock(s)", result.detail());
        }
    }

    @Test
    @DisplayName("a blank target fails without any shell command")
    void blankTarget() {
        ExecutionResult result = handler.handle(wakeLocks("", "deny"), CapabilityTier.PRIMARY);

        assertEquals(AbstractActionableHandler.BLANK_TARGET, result.detail());
        assertTrue(shell.commands().isEmpty());
    }
}
