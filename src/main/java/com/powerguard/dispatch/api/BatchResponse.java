package com.powerguard.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.powerguard.core.model.ExecutionResult;

import java.util.List;

/**
 * Response body for POST /api/v1/batches. {@code results} is in request order.
 */
public record BatchResponse(
        @JsonProperty("batch_id") String batchId,
        int total,
        int succeeded,
        List<ExecutionResult> results
) {
    public static BatchResponse of(String batchId, List<ExecutionResult> results) {
        int succeeded = (int) results.stream().filter(ExecutionResult::isSuccess).count();
        return new BatchResponse(batchId, results.size(), succeeded, results);
    }
}
