package com.powerguard.core.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An engine event delivered through the {@link EventBus}.
 *
 * @param eventType    e.g. {@code batch.started}, {@code actionable.completed}, {@code alert.armed}
 * @param batchId      batch the event belongs to
 * @param actionableId actionable the event concerns, {@code null} for batch-level events
 * @param payload      event-specific data
 * @param timestamp    when the event was created
 */
public record PowerGuardEvent(
        String eventType,
        String batchId,
        String actionableId,
        Map<String, Object> payload,
        Instant timestamp
) {
    public PowerGuardEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static PowerGuardEvent of(String eventType, String batchId, String actionableId, Map<String, Object> payload) {
        return new PowerGuardEvent(eventType, batchId, actionableId, payload, Instant.now());
    }
}
