package com.powerguard.core.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.powerguard.core.model.ExecutionResult;

import java.time.Instant;

/**
 * One immutable line of the outcome log.
 *
 * @param sequence   increases with every append
 * @param batchId    batch the result belongs to, {@code null} when recorded outside a batch
 * @param result     the recorded outcome
 * @param recordedAt when the entry was appended
 */
public record OutcomeEntry(
        long sequence,
        @JsonProperty("batch_id") String batchId,
        ExecutionResult result,
        @JsonProperty("recorded_at") Instant recordedAt
) {}
