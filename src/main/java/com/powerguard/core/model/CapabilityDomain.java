package com.powerguard.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A family of OS controls that share one access mechanism.
 * <p>
 * Each domain declares its access tiers in the order they are tried, with one
 * read-only probe command per tier. {@code %s} in a probe command is replaced by
 * the configured probe package, a package name that is never installed.
 * A domain without probe commands needs no OS access and is always {@link CapabilityTier#PRIMARY}.
 */
public enum CapabilityDomain {

    IDLE_STATE(
            "am get-standby-bucket %s",
            "am get-inactive %s"),
    BACKGROUND_TRANSFER(
            "cmd netpolicy list restrict-background-blacklist",
            "cmd appops get %s RUN_ANY_IN_BACKGROUND"),
    PROCESS_TERMINATION(
            "am force-stop %s",
            "cmd activity force-stop %s"),
    WAKE_SOURCE(
            "cmd appops get %s WAKE_LOCK",
            "appops get %s WAKE_LOCK"),
    CPU_PRIORITY(
            "renice -n 0 -p 1",
            ": > /dev/cpuset/background/tasks"),
    BATTERY_SAVER(
            "cmd power help",
            "settings get global low_power"),
    DATA_SAVER(
            "cmd netpolicy get restrict-background",
            "settings get global restrict_background"),
    USAGE_ALERT(null, null);

    private final String primaryProbe;
    private final String fallbackProbe;

    CapabilityDomain(String primaryProbe, String fallbackProbe) {
        this.primaryProbe = primaryProbe;
        this.fallbackProbe = fallbackProbe;
    }

    public boolean requiresDeviceAccess() {
        return primaryProbe != null;
    }

    /**
     * Access tiers in probing order, each with its probe command resolved against
     * {@code probePackage}. Empty for domains that need no device access.
     */
    public List<AccessTier> accessTiers(String probePackage) {
        List<AccessTier> tiers = new ArrayList<>(2);
        if (primaryProbe != null) {
            tiers.add(new AccessTier(CapabilityTier.PRIMARY, primaryProbe.formatted(probePackage)));
        }
        if (fallbackProbe != null) {
            tiers.add(new AccessTier(CapabilityTier.FALLBACK, fallbackProbe.formatted(probePackage)));
        }
        return tiers;
    }

    /**
     * Case-insensitive lookup by constant name; accepts {@code idle-state} as well as {@code IDLE_STATE}.
     *
     * @throws IllegalArgumentException if no domain matches
     */
    public static CapabilityDomain fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Capability domain must not be blank");
        }
        String normalized = name.trim().replace('-', '_').toUpperCase();
        for (CapabilityDomain domain : values()) {
            if (domain.name().equals(normalized)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown capability domain: " + name);
    }

    /**
     * One named access tier of a domain together with the command that proves it usable.
     */
    public record AccessTier(CapabilityTier tier, String probeCommand) {}
}
