package com.powerguard.core.history;

import com.powerguard.core.model.ExecutionResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Process-local outcome log. Lost on restart; used when no database is configured and in tests.
 */
public class InMemoryOutcomeRecorder implements OutcomeRecorder {

    static final Comparator<OutcomeEntry> NEWEST_FIRST =
            Comparator.comparing(OutcomeEntry::recordedAt).thenComparingLong(OutcomeEntry::sequence).reversed();

    private final List<OutcomeEntry> entries = new ArrayList<>();
    private final Clock clock;
    private long nextSequence = 1;

    public InMemoryOutcomeRecorder() {
        this(Clock.systemUTC());
    }

    public InMemoryOutcomeRecorder(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized OutcomeEntry record(String batchId, ExecutionResult result) {
        var entry = new OutcomeEntry(nextSequence++, batchId, result, clock.instant());
        entries.add(entry);
        return entry;
    }

    @Override
    public synchronized List<OutcomeEntry> recent(int limit) {
        return entries.stream()
                .sorted(NEWEST_FIRST)
                .limit(Math.max(0, limit))
                .toList();
    }
}
