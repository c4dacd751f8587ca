package com.powerguard.core.handler;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Armed usage alerts, one per kind and scope. Re-arming replaces the previous threshold.
 */
@Component
public class UsageAlertStore {

    public enum AlertKind {
        BATTERY("threshold", "%", 20, 1, 100),
        DATA("threshold_mb", "MB", 1000, 1, Integer.MAX_VALUE);

        private final String parameter;
        private final String unit;
        private final int defaultThreshold;
        private final int min;
        private final int max;

        AlertKind(String parameter, String unit, int defaultThreshold, int min, int max) {
            this.parameter = parameter;
            this.unit = unit;
            this.defaultThreshold = defaultThreshold;
            this.min = min;
            this.max = max;
        }

        public String parameter() { return parameter; }
        public String unit() { return unit; }
        public int defaultThreshold() { return defaultThreshold; }

        public boolean accepts(long threshold) {
            return threshold >= min && threshold <= max;
        }
    }

    /**
     * @param scope package name, or {@link UsageAlertHandler#DEVICE_SCOPE} for device-wide alerts
     */
    public record UsageAlert(AlertKind kind, String scope, int threshold, String reason,
                             String actionableId, Instant armedAt) {}

    private record Key(AlertKind kind, String scope) {}

    private final ConcurrentHashMap<Key, UsageAlert> alerts = new ConcurrentHashMap<>();

    public void arm(UsageAlert alert) {
        alerts.put(new Key(alert.kind(), alert.scope()), alert);
    }

    public Optional<UsageAlert> cancel(AlertKind kind, String scope) {
        return Optional.ofNullable(alerts.remove(new Key(kind, scope)));
    }

    public Optional<UsageAlert> find(AlertKind kind, String scope) {
        return Optional.ofNullable(alerts.get(new Key(kind, scope)));
    }

    public List<UsageAlert> activeAlerts() {
        return alerts.values().stream()
                .sorted(Comparator.comparing(UsageAlert::armedAt))
                .toList();
    }
}
