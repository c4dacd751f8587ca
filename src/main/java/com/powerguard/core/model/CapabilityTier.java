package com.powerguard.core.model;

/**
 * Which OS-access mechanism can be used for a capability domain on this device.
 */
public enum CapabilityTier {
    PRIMARY,
    FALLBACK,
    UNAVAILABLE
}
