package com.powerguard.core.monitor;

import com.powerguard.core.events.EventBus;
import com.powerguard.core.events.PowerGuardEvent;
import com.powerguard.core.handler.UsageAlertHandler;
import com.powerguard.core.handler.UsageAlertStore;
import com.powerguard.core.handler.UsageAlertStore.AlertKind;
import com.powerguard.core.handler.UsageAlertStore.UsageAlert;
import com.powerguard.device.DeviceUnreachableException;
import com.powerguard.device.DeviceUsageReader;
import com.powerguard.device.ShellCommandException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically measures battery and data usage for every armed alert and publishes
 * {@code alert.triggered} when a reading crosses its threshold.
 * <p>
 * A battery alert triggers at or below its percentage, a data alert at or above its
 * megabytes. An alert triggers once per crossing: it has to recover before it can
 * trigger again. Re-arming an alert starts it afresh.
 */
@Service
public class UsageAlertMonitor {

    private static final Logger log = LoggerFactory.getLogger(UsageAlertMonitor.class);

    public static final String ALERT_TRIGGERED = "alert.triggered";

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final UsageAlertStore store;
    private final DeviceUsageReader reader;
    private final EventBus eventBus;
    private final AlertMonitorProperties properties;

    private final Map<UsageAlert, AlertReading> lastReadings = new ConcurrentHashMap<>();
    private final Set<UsageAlert> triggered = ConcurrentHashMap.newKeySet();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "usage-alert-monitor");
        t.setDaemon(true);
        return t;
    });

    public UsageAlertMonitor(UsageAlertStore store, DeviceUsageReader reader, EventBus eventBus,
                             AlertMonitorProperties properties) {
        this.store = store;
        this.reader = reader;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @PostConstruct
    void start() {
        if (!properties.isEnabled()) {
            log.info("Usage alert monitor disabled");
            return;
        }
        long intervalMs = properties.getCheckInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::scheduledCheck, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Usage alert monitor started (interval={})", properties.getCheckInterval());
    }

    @PreDestroy
    void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Usage alert monitor stopped");
    }

    private void scheduledCheck() {
        // An exception escaping here would cancel every later run
        try {
            checkNow();
        } catch (RuntimeException e) {
            log.error("Usage alert check failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Measures every armed alert now. When the device cannot be read the cycle is
     * skipped and the previous readings are returned.
     */
    public synchronized List<AlertReading> checkNow() {
        List<UsageAlert> active = store.activeAlerts();
        lastReadings.keySet().retainAll(active);
        triggered.retainAll(active);
        if (active.isEmpty()) {
            return List.of();
        }

        var cycle = new Cycle();
        var measured = new LinkedHashMap<UsageAlert, OptionalLong>();
        try {
            for (UsageAlert alert : active) {
                measured.put(alert, cycle.read(alert));
            }
        } catch (DeviceUnreachableException | ShellCommandException e) {
            log.warn("Skipping usage alert check, device usage unreadable: {}", e.getMessage());
            return readings();
        }

        Instant now = Instant.now();
        var results = new ArrayList<AlertReading>();
        measured.forEach((alert, value) -> {
            if (value.isEmpty()) {
                log.debug("No usage reading for {} alert on {}", alert.kind(), alert.scope());
                AlertReading reading = AlertReading.unread(alert);
                lastReadings.put(alert, reading);
                results.add(reading);
                return;
            }
            long usage = value.getAsLong();
            boolean breached = breached(alert, usage);
            if (!breached) {
                triggered.remove(alert);
            } else if (triggered.add(alert)) {
                announce(alert, usage);
            }
            AlertReading reading = new AlertReading(alert, usage, breached, now);
            lastReadings.put(alert, reading);
            results.add(reading);
        });
        return results;
    }

    /**
     * Armed alerts in arming order with their latest readings, without touching the device.
     */
    public List<AlertReading> readings() {
        return store.activeAlerts().stream()
                .map(alert -> lastReadings.getOrDefault(alert, AlertReading.unread(alert)))
                .toList();
    }

    static boolean breached(UsageAlert alert, long usage) {
        return alert.kind() == AlertKind.BATTERY
                ? usage <= alert.threshold()
                : usage >= alert.threshold();
    }

    private void announce(UsageAlert alert, long usage) {
        log.info("Usage alert triggered: {} on {} at {}{} (threshold {}{})", alert.kind(), alert.scope(),
                usage, alert.kind().unit(), alert.threshold(), alert.kind().unit());
        eventBus.publish(PowerGuardEvent.of(ALERT_TRIGGERED, null, alert.actionableId(), Map.of(
                "kind", alert.kind().name(),
                "scope", alert.scope(),
                "threshold", alert.threshold(),
                "reading", usage,
                "unit", alert.kind().unit())));
    }

    /**
     * One check's device reads. The battery level is device-wide and read once;
     * data usage is read once per scope.
     */
    private final class Cycle {

        private Integer batteryPercent;
        private final Map<String, OptionalLong> dataMegabytes = new HashMap<>();

        OptionalLong read(UsageAlert alert) {
            if (alert.kind() == AlertKind.BATTERY) {
                if (batteryPercent == null) {
                    batteryPercent = reader.batteryPercent();
                }
                return OptionalLong.of(batteryPercent);
            }
            OptionalLong cached = dataMegabytes.get(alert.scope());
            if (cached == null) {
                String packageName = UsageAlertHandler.DEVICE_SCOPE.equals(alert.scope()) ? null : alert.scope();
                OptionalLong bytes = reader.dataBytes(packageName);
                cached = bytes.isPresent() ? OptionalLong.of(bytes.getAsLong() / BYTES_PER_MB) : OptionalLong.empty();
                dataMegabytes.put(alert.scope(), cached);
            }
            return cached;
        }
    }
}
