package com.powerguard.core.registry;

import com.powerguard.core.handler.ActionableHandler;
import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.ActionableType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed mapping from {@link ActionableType} to its handler and required fields.
 * <p>
 * Registrations happen while the application context is built; {@link #seal()} then
 * freezes the registry and every later {@link #register} fails. After sealing the
 * registry is read-only and safe to share between threads.
 * <p>
 * Required field names: {@code id}, {@code target}, {@code requestedMode}, {@code reason},
 * or {@code parameters.<name>} for an entry of the parameter map.
 */
public class ActionableRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionableRegistry.class);

    public static final String FIELD_ID = "id";
    public static final String FIELD_TARGET = "target";
    public static final String FIELD_MODE = "requestedMode";
    public static final String FIELD_REASON = "reason";
    public static final String PARAMETER_PREFIX = "parameters.";

    private static final Set<String> KNOWN_FIELDS = Set.of(FIELD_ID, FIELD_TARGET, FIELD_MODE, FIELD_REASON);

    private final Map<ActionableType, Registration> registrations = new EnumMap<>(ActionableType.class);
    private volatile boolean sealed;

    public synchronized void register(ActionableType type, ActionableHandler handler, List<String> requiredFields) {
        if (sealed) {
            throw new IllegalStateException("Registry is sealed; cannot register " + type.key());
        }
        if (handler.domain() != type.domain()) {
            throw new IllegalArgumentException("Handler for %s serves %s, expected %s"
                    .formatted(type.key(), handler.domain(), type.domain()));
        }
        if (registrations.containsKey(type)) {
            throw new IllegalStateException("Type already registered: " + type.key());
        }
        for (String field : requiredFields) {
            if (!field.startsWith(PARAMETER_PREFIX) && !KNOWN_FIELDS.contains(field)) {
                throw new IllegalArgumentException("Unknown required field name: " + field);
            }
        }
        registrations.put(type, new Registration(handler, List.copyOf(requiredFields)));
        log.debug("Registered {} -> {} (required: {})", type.key(), handler.getClass().getSimpleName(), requiredFields);
    }

    public synchronized void seal() {
        sealed = true;
        log.info("Actionable registry sealed with {} types", registrations.size());
    }

    public boolean isSealed() {
        return sealed;
    }

    public Optional<ActionableHandler> resolve(ActionableType type) {
        Registration registration = registrations.get(type);
        return registration == null ? Optional.empty() : Optional.of(registration.handler());
    }

    public Optional<ActionableHandler> resolve(String typeKey) {
        return ActionableType.fromKey(typeKey).flatMap(this::resolve);
    }

    public List<String> requiredFields(ActionableType type) {
        Registration registration = registrations.get(type);
        return registration == null ? List.of() : registration.requiredFields();
    }

    public Set<ActionableType> registeredTypes() {
        return Collections.unmodifiableSet(registrations.keySet());
    }

    /**
     * Checks the record's type against the closed set and its required fields for presence.
     * A present but blank {@code target} passes; rejecting it is the handler's job.
     */
    public ValidationResult validate(ActionableRecord record) {
        Optional<ActionableType> type = record.resolvedType();
        if (type.isEmpty() || !registrations.containsKey(type.get())) {
            return ValidationResult.unknownType(record.type());
        }
        for (String field : registrations.get(type.get()).requiredFields()) {
            if (!isPresent(record, field)) {
                return ValidationResult.missingField(field);
            }
        }
        return ValidationResult.ok();
    }

    private static boolean isPresent(ActionableRecord record, String field) {
        if (field.startsWith(PARAMETER_PREFIX)) {
            return record.parameters().containsKey(field.substring(PARAMETER_PREFIX.length()));
        }
        return switch (field) {
            case FIELD_ID -> !record.id().isBlank();
            case FIELD_TARGET -> record.target() != null;
            case FIELD_MODE -> record.requestedMode() != null;
            case FIELD_REASON -> record.reason() != null;
            default -> throw new IllegalStateException("Unknown required field name: " + field);
        };
    }

    private record Registration(ActionableHandler handler, List<String> requiredFields) {}
}
