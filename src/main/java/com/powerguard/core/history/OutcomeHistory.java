package com.powerguard.core.history;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Groups outcome entries into day or hour buckets for history views.
 * Bucket order and entry order inside a bucket follow the input list, which is
 * newest-first when it comes from {@link OutcomeRecorder#recent}.
 */
public final class OutcomeHistory {

    private OutcomeHistory() {}

    public static Map<LocalDate, List<OutcomeEntry>> groupByDay(List<OutcomeEntry> entries, ZoneId zone) {
        return group(entries, e -> LocalDate.ofInstant(e.recordedAt(), zone));
    }

    /**
     * Keys are local date-times truncated to the hour.
     */
    public static Map<LocalDateTime, List<OutcomeEntry>> groupByHour(List<OutcomeEntry> entries, ZoneId zone) {
        return group(entries, e -> LocalDateTime.ofInstant(e.recordedAt(), zone).truncatedTo(ChronoUnit.HOURS));
    }

    private static <K> Map<K, List<OutcomeEntry>> group(List<OutcomeEntry> entries, Function<OutcomeEntry, K> key) {
        var groups = new LinkedHashMap<K, List<OutcomeEntry>>();
        for (OutcomeEntry entry : entries) {
            groups.computeIfAbsent(key.apply(entry), k -> new ArrayList<>()).add(entry);
        }
        return groups;
    }
}
