package com.powerguard.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.powerguard.core.handler.UsageAlertStore.UsageAlert;
import com.powerguard.core.monitor.AlertReading;

import java.time.Instant;

/**
 * One armed usage alert as returned by GET /api/v1/alerts.
 */
public record AlertResponse(
        String kind,
        String scope,
        int threshold,
        String unit,
        String reason,
        @JsonProperty("actionable_id") String actionableId,
        @JsonProperty("armed_at") Instant armedAt,
        Long reading,
        boolean triggered,
        @JsonProperty("read_at") Instant readAt
) {
    public static AlertResponse from(AlertReading reading) {
        UsageAlert alert = reading.alert();
        return new AlertResponse(alert.kind().name(), alert.scope(), alert.threshold(), alert.kind().unit(),
                alert.reason(), alert.actionableId(), alert.armedAt(),
                reading.reading(), reading.triggered(), reading.readAt());
    }
}
