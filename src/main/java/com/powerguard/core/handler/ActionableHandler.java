package com.powerguard.core.handler;

import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;

import java.util.Optional;

/**
 * Applies one actionable of its capability domain to the device.
 * <p>
 * Implementations never throw: every failure, including an unusable tier, is returned
 * as a {@link com.powerguard.core.model.ExecutionStatus#FAILED} result with a short detail.
 */
public interface ActionableHandler {

    CapabilityDomain domain();

    /**
     * Checks that need no device access, run before the domain is probed.
     *
     * @return the failure to report, or empty when the record may go on to probing
     */
    default Optional<ExecutionResult> precheck(ActionableRecord record) {
        return Optional.empty();
    }

    /**
     * @param record the validated actionable
     * @param tier   the access tier probed for {@link #domain()}; only that tier's entry point is used
     */
    ExecutionResult handle(ActionableRecord record, CapabilityTier tier);
}
