package com.powerguard.core.model;

import java.util.Map;
import java.util.Optional;

/**
 * One optimization instruction as received from the recommendation service.
 *
 * @param id            unique id within the batch; normalized to {@code ""} when absent
 * @param type          the wire type key exactly as received
 * @param target        package-style app identifier, {@code null} for device-global instructions
 * @param requestedMode free-text mode, may be {@code null}
 * @param reason        human-readable justification
 * @param parameters    flat, immutable parameter map
 * @param defect        why the batch entry could not be read, {@code null} for a well-formed record
 */
public record ActionableRecord(
        String id,
        String type,
        String target,
        String requestedMode,
        String reason,
        Map<String, String> parameters,
        String defect
) {
    public ActionableRecord {
        id = id == null ? "" : id;
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public ActionableRecord(String id, String type, String target, String requestedMode, String reason,
                            Map<String, String> parameters) {
        this(id, type, target, requestedMode, reason, parameters, null);
    }

    public ActionableRecord(String id, ActionableType type, String target, String requestedMode, String reason) {
        this(id, type.key(), target, requestedMode, reason, Map.of());
    }

    /**
     * Placeholder for a batch entry that could not be read, so it still gets a result in its position.
     */
    public static ActionableRecord malformed(String id, String defect) {
        return new ActionableRecord(id, null, null, null, null, Map.of(), defect);
    }

    public boolean isMalformed() {
        return defect != null;
    }

    public Optional<ActionableType> resolvedType() {
        return ActionableType.fromKey(type);
    }

    public Optional<String> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }
}
