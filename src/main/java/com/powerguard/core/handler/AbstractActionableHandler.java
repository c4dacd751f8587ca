package com.powerguard.core.handler;

import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.device.DeviceProperties;
import com.powerguard.device.DeviceUnreachableException;
import com.powerguard.device.PackageResolver;
import com.powerguard.device.PermissionDeniedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Common checks every handler runs before touching the device.
 * <p>
 * Order: target checks (blank, malformed, this engine's own package), then the tier,
 * then {@link #apply}. The first two steps never issue a shell command; the target checks
 * are also offered as {@link #precheck} so they can run before any probing. Exceptions
 * escaping {@code apply} become {@code FAILED} results, so {@link #handle} never throws.
 */
public abstract class AbstractActionableHandler implements ActionableHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractActionableHandler.class);

    public static final String BLANK_TARGET = "blank target";
    public static final String CAPABILITY_UNAVAILABLE = "capability unavailable";
    public static final String OWN_PACKAGE = "refusing to target own package";
    public static final String DEVICE_UNREACHABLE = "device unreachable: ";

    private final String selfPackage;

    protected AbstractActionableHandler(DeviceProperties properties) {
        this.selfPackage = properties.getSelfPackage();
    }

    @Override
    public final Optional<ExecutionResult> precheck(ActionableRecord record) {
        if (!requiresTarget()) {
            return Optional.empty();
        }
        String problem = checkTarget(record.target());
        return problem == null ? Optional.empty() : Optional.of(ExecutionResult.failed(record.id(), problem));
    }

    @Override
    public final ExecutionResult handle(ActionableRecord record, CapabilityTier tier) {
        String id = record.id();
        try {
            Optional<ExecutionResult> rejected = precheck(record);
            if (rejected.isPresent()) {
                return rejected.get();
            }
            if (tier == null || tier == CapabilityTier.UNAVAILABLE) {
                return ExecutionResult.failed(id, CAPABILITY_UNAVAILABLE);
            }
            return apply(record, tier);
        } catch (PermissionDeniedException e) {
            log.warn("Permission denied applying {}: {}", id, e.getMessage());
            return ExecutionResult.failed(id, "no permission: " + e.getMessage());
        } catch (DeviceUnreachableException e) {
            log.warn("Device unreachable applying {}: {}", id, e.getMessage());
            return ExecutionResult.failed(id, DEVICE_UNREACHABLE + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed applying {}: {}", id, e.getMessage());
            return ExecutionResult.failed(id, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Applies the actionable at {@code tier}, which is never {@code UNAVAILABLE} here.
     * Only the entry point of the given tier may be used.
     */
    protected abstract ExecutionResult apply(ActionableRecord record, CapabilityTier tier);

    /** Whether the instruction acts on one app. Device-global handlers return false. */
    protected boolean requiresTarget() {
        return true;
    }

    /**
     * @return a failure detail, or {@code null} when the target may be acted on
     */
    protected String checkTarget(String target) {
        if (target == null || target.isBlank()) {
            return BLANK_TARGET;
        }
        if (!PackageResolver.isValidPackageName(target)) {
            return "invalid target: " + target;
        }
        if (target.equals(selfPackage)) {
            return OWN_PACKAGE;
        }
        return null;
    }
}
