package com.powerguard.core.history;

import com.powerguard.core.model.ExecutionResult;

import java.util.List;

/**
 * Append-only log of execution outcomes. Entries are never updated or removed.
 */
public interface OutcomeRecorder {

    /**
     * Appends a timestamped entry for {@code result}.
     *
     * @throws OutcomeRecordingException if the entry could not be stored
     */
    OutcomeEntry record(String batchId, ExecutionResult result);

    default OutcomeEntry record(ExecutionResult result) {
        return record(null, result);
    }

    /**
     * Most recent entries first, at most {@code limit} of them.
     */
    List<OutcomeEntry> recent(int limit);
}
