package com.powerguard.dispatch.cli;

import com.powerguard.core.history.HistoryProperties;
import com.powerguard.core.history.OutcomeEntry;
import com.powerguard.core.history.OutcomeHistory;
import com.powerguard.core.history.OutcomeRecorder;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * CLI command: powerguard history
 * <p>
 * Shows recorded outcomes, newest first, optionally grouped by day or hour.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "Show recorded actionable outcomes")
@Component
public class HistoryCommand implements Runnable {

    public enum Grouping { NONE, DAY, HOUR }

    @Option(names = {"--limit", "-n"}, description = "Number of entries", defaultValue = "20")
    private int limit;

    @Option(names = {"--group", "-g"}, description = "Grouping: ${COMPLETION-CANDIDATES}", defaultValue = "NONE")
    private Grouping group;

    private final OutcomeRecorder recorder;
    private final HistoryProperties properties;

    public HistoryCommand(OutcomeRecorder recorder, HistoryProperties properties) {
        this.recorder = recorder;
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<OutcomeEntry> entries = recorder.recent(limit);
        if (entries.isEmpty()) {
            ConsoleOutput.info("No outcomes recorded.");
            return;
        }

        ZoneId zone = properties.zoneId();
        ConsoleOutput.info("Outcomes (" + entries.size() + ", newest first):");
        switch (group) {
            case DAY -> print(OutcomeHistory.groupByDay(entries, zone), zone);
            case HOUR -> print(OutcomeHistory.groupByHour(entries, zone), zone);
            default -> entries.forEach(e -> ConsoleOutput.historyEntry(e, zone));
        }
    }

    private static void print(Map<?, List<OutcomeEntry>> groups, ZoneId zone) {
        groups.forEach((bucket, bucketEntries) -> {
            System.out.println();
            System.out.println(bucket + " (" + bucketEntries.size() + ")");
            bucketEntries.forEach(e -> ConsoleOutput.historyEntry(e, zone));
        });
    }
}
