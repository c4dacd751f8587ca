package com.powerguard.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome of one actionable. Exactly one is produced per input record.
 */
public record ExecutionResult(
        @JsonProperty("actionable_id") String actionableId,
        ExecutionStatus status,
        String detail,
        @JsonProperty("completed_at") Instant completedAt
) {
    public static ExecutionResult success(String actionableId, String detail) {
        return new ExecutionResult(actionableId, ExecutionStatus.SUCCESS, detail, Instant.now());
    }

    public static ExecutionResult failed(String actionableId, String detail) {
        return new ExecutionResult(actionableId, ExecutionStatus.FAILED, detail, Instant.now());
    }

    public static ExecutionResult unsupported(String actionableId, String detail) {
        return new ExecutionResult(actionableId, ExecutionStatus.UNSUPPORTED, detail, Instant.now());
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
