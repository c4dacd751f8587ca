package com.powerguard.dispatch.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.powerguard.core.model.ActionableRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One actionable as sent by the recommendation service.
 * <p>
 * Accepts the field names of older payloads as aliases ({@code package_name},
 * {@code new_mode}, {@code description}) and folds their top-level {@code enabled}
 * and {@code throttle_level} fields into the parameter map.
 *
 * @param parameters flat map; non-string values are stringified, nulls dropped
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionableRequest(
        String id,
        String type,
        @JsonAlias({"package_name", "packageName", "app"}) String target,
        @JsonAlias({"new_mode", "newMode", "requested_mode"}) String requestedMode,
        String reason,
        String description,
        Map<String, Object> parameters,
        Boolean enabled,
        @JsonProperty("throttle_level") @JsonAlias("throttleLevel") Integer throttleLevel
) {

    public ActionableRecord toRecord() {
        var params = new LinkedHashMap<String, String>();
        if (parameters != null) {
            parameters.forEach((key, value) -> {
                if (key != null && value != null) {
                    params.put(key, String.valueOf(value));
                }
            });
        }
        if (enabled != null) {
            params.putIfAbsent("enabled", String.valueOf(enabled));
        }
        if (throttleLevel != null) {
            params.putIfAbsent("throttle_level", String.valueOf(throttleLevel));
        }
        return new ActionableRecord(id, type, target, requestedMode,
                reason != null ? reason : description, params);
    }
}
