package com.powerguard.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of optimization instructions this engine understands.
 * Wire keys are matched case-insensitively; nothing outside this set is ever
 * guessed or mapped to a nearby type.
 */
public enum ActionableType {

    SET_STANDBY_BUCKET("set_standby_bucket", CapabilityDomain.IDLE_STATE, "Move an app to an app-standby bucket"),
    RESTRICT_BACKGROUND_DATA("restrict_background_data", CapabilityDomain.BACKGROUND_TRANSFER, "Restrict background network use"),
    KILL_APP("kill_app", CapabilityDomain.PROCESS_TERMINATION, "Stop an app's processes"),
    MANAGE_WAKE_LOCKS("manage_wake_locks", CapabilityDomain.WAKE_SOURCE, "Control an app's ability to hold wake locks"),
    THROTTLE_CPU_USAGE("throttle_cpu_usage", CapabilityDomain.CPU_PRIORITY, "Lower the scheduling priority of an app's processes"),
    ENABLE_BATTERY_SAVER("enable_battery_saver", CapabilityDomain.BATTERY_SAVER, "Switch the system battery saver on or off"),
    ENABLE_DATA_SAVER("enable_data_saver", CapabilityDomain.DATA_SAVER, "Switch Data Saver on or off"),
    SET_BATTERY_ALERT("set_battery_alert", CapabilityDomain.USAGE_ALERT, "Alert when battery falls below a threshold"),
    SET_DATA_ALERT("set_data_alert", CapabilityDomain.USAGE_ALERT, "Alert when data usage exceeds a threshold");

    private final String key;
    private final CapabilityDomain domain;
    private final String description;

    ActionableType(String key, CapabilityDomain domain, String description) {
        this.key = key;
        this.domain = domain;
        this.description = description;
    }

    public String key() { return key; }
    public CapabilityDomain domain() { return domain; }
    public String description() { return description; }

    public static Optional<ActionableType> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (ActionableType type : values()) {
            if (type.key.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
