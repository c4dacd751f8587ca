package com.powerguard.dispatch.api;

import com.powerguard.core.history.HistoryProperties;
import com.powerguard.core.history.OutcomeEntry;
import com.powerguard.core.history.OutcomeHistory;
import com.powerguard.core.history.OutcomeRecorder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only access to the outcome log.
 */
@RestController
@RequestMapping("/api/v1/history")
public class HistoryController {

    private static final int MAX_LIMIT = 1000;

    private final OutcomeRecorder recorder;
    private final HistoryProperties properties;

    public HistoryController(OutcomeRecorder recorder, HistoryProperties properties) {
        this.recorder = recorder;
        this.properties = properties;
    }

    /**
     * GET /api/v1/history: Most recent outcomes first, optionally grouped by {@code day} or {@code hour}.
     */
    @GetMapping
    public ResponseEntity<?> history(@RequestParam(defaultValue = "50") int limit,
                                     @RequestParam(defaultValue = "none") String group) {
        if (limit < 1 || limit > MAX_LIMIT) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be between 1 and " + MAX_LIMIT));
        }
        List<OutcomeEntry> entries = recorder.recent(limit);

        switch (group.toLowerCase(Locale.ROOT)) {
            case "none":
                return ResponseEntity.ok(entries);
            case "day": {
                var grouped = new LinkedHashMap<String, List<OutcomeEntry>>();
                OutcomeHistory.groupByDay(entries, properties.zoneId())
                        .forEach((day, list) -> grouped.put(day.toString(), list));
                return ResponseEntity.ok(grouped);
            }
            case "hour": {
                var grouped = new LinkedHashMap<String, List<OutcomeEntry>>();
                OutcomeHistory.groupByHour(entries, properties.zoneId())
                        .forEach((hour, list) -> grouped.put(hour.toString(), list));
                return ResponseEntity.ok(grouped);
            }
            default:
                return ResponseEntity.badRequest().body(Map.of("error", "group must be one of none, day, hour"));
        }
    }
}
