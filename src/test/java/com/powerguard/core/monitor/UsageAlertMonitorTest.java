package com.powerguard.core.monitor;

import com.powerguard.core.events.EventBus;
import com.powerguard.core.events.PowerGuardEvent;
import com.powerguard.core.handler.UsageAlertHandler;
import com.powerguard.core.handler.UsageAlertStore;
import com.powerguard.core.handler.UsageAlertStore.AlertKind;
import com.powerguard.core.handler.UsageAlertStore.UsageAlert;
import com.powerguard.device.DeviceUsageReader;
import com.powerguard.device.PackageResolver;
import com.powerguard.device.ScriptedDeviceShell;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class UsageAlertMonitorTest {

    private ScriptedDeviceShell shell;
    private UsageAlertStore store;
    private List<PowerGuardEvent> events;
    private UsageAlertMonitor monitor;

    @BeforeEach
    void setUp() {
        shell = new ScriptedDeviceShell();
        store = new UsageAlertStore();
        events = new CopyOnWriteArrayList<>();
        EventBus eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        var properties = new AlertMonitorProperties();
        properties.setEnabled(false);
        monitor = new UsageAlertMonitor(store, new DeviceUsageReader(shell, new PackageResolver(shell)), eventBus, properties);
    }

    private void battery(int level) {
        shell.respond("dumpsys battery", 0, "Current Battery Service state:\n  level: " + level + "\n  scale: 100\n");
    }

    private static UsageAlert alert(AlertKind kind, String scope, int threshold, Instant armedAt) {
        return new UsageAlert(kind, scope, threshold, "test", "alert-" + kind.name().toLowerCase(), armedAt);
    }

    private List<PowerGuardEvent> triggered() {
        return events.stream().filter(e -> e.eventType().equals(UsageAlertMonitor.ALERT_TRIGGERED)).toList();
    }

    @Test
    @DisplayName("nothing armed means no device reads")
    void nothingArmed() {
        assertTrue(monitor.checkNow().isEmpty());
        assertTrue(shell.commands().isEmpty());
    }

    @Nested
    @DisplayName("battery alerts")
    class BatteryAlerts {

        @BeforeEach
        void arm() {
            store.arm(alert(AlertKind.BATTERY, UsageAlertHandler.DEVICE_SCOPE, 20, Instant.now()));
        }

        @Test
        @DisplayName("a level above the threshold does not trigger")
        void above() {
            battery(55);

            List<AlertReading> readings = monitor.checkNow();

            assertEquals(1, readings.size());
            assertEquals(55L, readings.get(0).reading());
            assertFalse(readings.get(0).triggered());
            assertTrue(triggered().isEmpty());
        }

        @Test
        @DisplayName("reaching the threshold publishes alert.triggered once")
        void triggersOnce() {
            battery(20);
            monitor.checkNow();
            battery(12);
            monitor.checkNow();

            assertEquals(1, triggered().size());
            PowerGuardEvent event = triggered().get(0);
            assertEquals("alert-battery", event.actionableId());
            assertEquals("BATTERY", event.payload().get("kind"));
            assertEquals(20L, ((Number) event.payload().get("reading")).longValue());
            assertEquals(20, event.payload().get("threshold"));
        }

        @Test
        @DisplayName("recovering above the threshold re-enables the alert")
        void retriggersAfterRecovery() {
            battery(15);
            monitor.checkNow();
            battery(80);
            monitor.checkNow();
            battery(10);
            monitor.checkNow();

            assertEquals(2, triggered().size());
        }

        @Test
        @DisplayName("an unreachable device skips the cycle and keeps the last readings")
        void unreachable() {
            battery(50);
            monitor.checkNow();
            shell.unreachable("dumpsys battery");

            List<AlertReading> readings = monitor.checkNow();

            assertEquals(50L, readings.get(0).reading());
            assertTrue(triggered().isEmpty());
        }

        @Test
        @DisplayName("a denied dump skips the cycle")
        void denied() {
            shell.deny("dumpsys battery");

            List<AlertReading> readings = monitor.checkNow();

            assertEquals(1, readings.size());
            assertNull(readings.get(0).reading());
            assertTrue(triggered().isEmpty());
        }
    }

    @Nested
    @DisplayName("data alerts")
    class DataAlerts {

        @Test
        @DisplayName("a package over its megabyte threshold triggers")
        void packageOverThreshold() {
            store.arm(alert(AlertKind.DATA, "com.example.app", 3, Instant.now()));
            shell.respond("cmd package list packages -U com.example.app", 0, "package:com.example.app uid:10123")
                    .respond("dumpsys netstats", 0, """
                            UID stats:
                              ident=[{type=MOBILE}] uid=10123 set=DEFAULT tag=0x0
                                NetworkStatsHistory: bucketDuration=7200
                                  st=1700000000 rb=2097152 rp=10 tb=1048576 tp=5 op=0
                            """);

            List<AlertReading> readings = monitor.checkNow();

            assertEquals(3L, readings.get(0).reading());
            assertTrue(readings.get(0).triggered());
            assertEquals("com.example.app", triggered().get(0).payload().get("scope"));
        }

        @Test
        @DisplayName("an uninstalled package is listed without a reading")
        void uninstalled() {
            store.arm(alert(AlertKind.DATA, "com.example.gone", 1, Instant.now()));

            List<AlertReading> readings = monitor.checkNow();

            assertNull(readings.get(0).reading());
            assertFalse(readings.get(0).triggered());
        }
    }

    @Test
    @DisplayName("one check reads the battery once for all battery alerts")
    void sharedBatteryRead() {
        Instant now = Instant.now();
        store.arm(alert(AlertKind.BATTERY, UsageAlertHandler.DEVICE_SCOPE, 20, now));
        store.arm(alert(AlertKind.BATTERY, "com.example.app", 30, now.plusSeconds(1)));
        battery(25);

        List<AlertReading> readings = monitor.checkNow();

        assertEquals(1, shell.count("dumpsys battery"));
        assertFalse(readings.get(0).triggered());
        assertTrue(readings.get(1).triggered());
    }

    @Test
    @DisplayName("re-arming starts the alert afresh")
    void rearm() {
        store.arm(alert(AlertKind.BATTERY, UsageAlertHandler.DEVICE_SCOPE, 20, Instant.now()));
        battery(10);
        monitor.checkNow();

        store.arm(alert(AlertKind.BATTERY, UsageAlertHandler.DEVICE_SCOPE, 15, Instant.now().plusSeconds(5)));
        monitor.checkNow();

        assertEquals(2, triggered().size());
        assertEquals(15, monitor.readings().get(0).alert().threshold());
    }

    @Test
    @DisplayName("readings lists armed alerts without touching the device")
    void readingsOnly() {
        store.arm(alert(AlertKind.DATA, UsageAlertHandler.DEVICE_SCOPE, 500, Instant.now()));

        List<AlertReading> readings = monitor.readings();

        assertEquals(1, readings.size());
        assertNull(readings.get(0).readAt());
        assertTrue(shell.commands().isEmpty());
    }
}
