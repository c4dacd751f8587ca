package com.powerguard.core.capability;

import com.powerguard.core.metrics.PowerGuardMetrics;
import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityDomain.AccessTier;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.device.DeviceProperties;
import com.powerguard.device.DeviceShell;
import com.powerguard.device.DeviceUnreachableException;
import com.powerguard.device.MechanismUnavailableException;
import com.powerguard.device.PermissionDeniedException;
import com.powerguard.device.ShellCommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Determines, once per capability domain, which access tier works on this device.
 * <p>
 * Each tier of a domain is tried in order with its read-only probe command. A tier is
 * unusable when its probe fails with a permission-class error or because the mechanism
 * does not exist; any other answer means the command reached the service and passed its
 * permission check. The first usable tier is cached; when none is usable,
 * {@link CapabilityTier#UNAVAILABLE} is cached and nothing is probed again until
 * {@link #invalidate}.
 * <p>
 * A transport failure is not a verdict about the device and nothing is cached:
 * {@link #probe} reports {@code UNAVAILABLE} for that call, {@link #resolveTier}
 * rethrows the {@link DeviceUnreachableException} so the caller can say why.
 * <p>
 * Reads go straight to a concurrent map. Probing and invalidation share one writer lock,
 * so concurrent first probes of a domain run its commands once.
 */
@Service
public class CapabilityProber {

    private static final Logger log = LoggerFactory.getLogger(CapabilityProber.class);

    private final DeviceShell shell;
    private final String probePackage;
    private final PowerGuardMetrics metrics;
    private final ConcurrentHashMap<CapabilityDomain, CapabilityTier> cache = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    @Autowired
    public CapabilityProber(DeviceShell shell, DeviceProperties properties,
                            @Autowired(required = false) PowerGuardMetrics metrics) {
        this(shell, properties.getProbePackage(), metrics);
    }

    public CapabilityProber(DeviceShell shell, String probePackage, PowerGuardMetrics metrics) {
        this.shell = shell;
        this.probePackage = probePackage;
        this.metrics = metrics;
    }

    public CapabilityTier probe(CapabilityDomain domain) {
        try {
            return resolveTier(domain);
        } catch (DeviceUnreachableException e) {
            return CapabilityTier.UNAVAILABLE;
        }
    }

    /**
     * Like {@link #probe}, but a device that cannot be reached is reported as such.
     *
     * @throws DeviceUnreachableException when a probe command could not be delivered; nothing is cached
     */
    public CapabilityTier resolveTier(CapabilityDomain domain) {
        CapabilityTier cached = cache.get(domain);
        if (cached != null) {
            return cached;
        }
        synchronized (writeLock) {
            cached = cache.get(domain);
            if (cached != null) {
                return cached;
            }
            try {
                CapabilityTier tier = runProbes(domain);
                cache.put(domain, tier);
                log.info("Capability {} resolved to {}", domain, tier);
                if (metrics != null) {
                    metrics.recordProbe(domain, tier);
                }
                return tier;
            } catch (DeviceUnreachableException e) {
                log.warn("Could not probe {}: {}; not caching", domain, e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Forgets the cached tier of one domain so the next {@link #probe} runs the probe
     * commands again. Called after the user grants or revokes a permission.
     */
    public void invalidate(CapabilityDomain domain) {
        synchronized (writeLock) {
            CapabilityTier previous = cache.remove(domain);
            log.info("Invalidated capability {} (was {})", domain, previous);
        }
    }

    public void invalidateAll() {
        synchronized (writeLock) {
            cache.clear();
            log.info("Invalidated all capability tiers");
        }
    }

    /**
     * Cached tiers, in domain order. Domains not probed yet are absent.
     */
    public Map<CapabilityDomain, CapabilityTier> snapshot() {
        var copy = new EnumMap<CapabilityDomain, CapabilityTier>(CapabilityDomain.class);
        copy.putAll(cache);
        return Collections.unmodifiableMap(copy);
    }

    private CapabilityTier runProbes(CapabilityDomain domain) {
        if (!domain.requiresDeviceAccess()) {
            return CapabilityTier.PRIMARY;
        }
        for (AccessTier accessTier : domain.accessTiers(probePackage)) {
            if (isUsable(domain, accessTier)) {
                return accessTier.tier();
            }
        }
        return CapabilityTier.UNAVAILABLE;
    }

    private boolean isUsable(CapabilityDomain domain, AccessTier accessTier) {
        try {
            shell.exec(accessTier.probeCommand());
            return true;
        } catch (PermissionDeniedException e) {
            log.info("{} {} tier denied: {}", domain, accessTier.tier(), e.getMessage());
            return false;
        } catch (MechanismUnavailableException e) {
            log.info("{} {} tier missing: {}", domain, accessTier.tier(), e.getMessage());
            return false;
        } catch (ShellCommandException e) {
            // The service answered (e.g. "unknown package" for the sentinel) after its permission check
            log.debug("{} {} probe answered with error, treating as usable: {}", domain, accessTier.tier(), e.getMessage());
            return true;
        }
    }
}
