package com.powerguard.dispatch.cli;

import com.powerguard.core.handler.UsageAlertStore.UsageAlert;
import com.powerguard.core.history.OutcomeEntry;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.core.monitor.AlertReading;
import picocli.CommandLine;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * ANSI-colored terminal output utilities for the PowerGuard CLI.
 */
public class ConsoleOutput {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(green) POWERGUARD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [POWERGUARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void result(ExecutionResult result) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + statusTag(result) + " " + result.actionableId() + ": " + result.detail()));
    }

    public static void historyEntry(OutcomeEntry entry, ZoneId zone) {
        ExecutionResult result = entry.result();
        String when = TIME_FORMAT.format(entry.recordedAt().atZone(zone));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + when + " " + statusTag(result) + " " + result.actionableId()
                        + " @|faint (" + (entry.batchId() != null ? entry.batchId() : "-") + ")|@ " + result.detail()));
    }

    public static void tier(String domain, CapabilityTier tier) {
        String color = switch (tier) {
            case PRIMARY -> "fg(green)";
            case FALLBACK -> "fg(yellow)";
            case UNAVAILABLE -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("  %-22s @|%s %s|@", domain, color, tier.name())));
    }

    public static void alert(AlertReading reading) {
        UsageAlert alert = reading.alert();
        String unit = alert.kind().unit();
        String current = reading.reading() == null
                ? "@|faint no reading|@"
                : reading.triggered()
                        ? "@|fg(red) " + reading.reading() + unit + " TRIGGERED|@"
                        : "@|fg(green) " + reading.reading() + unit + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("  %-8s %-28s threshold %d%s  %s", alert.kind().name(), alert.scope(),
                        alert.threshold(), unit, current)));
    }

    public static void summary(int total, int succeeded) {
        int failed = total - succeeded;
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Batch|@ " + total + " actionable" + (total != 1 ? "s" : "") + ": "
                        + "@|fg(green) " + succeeded + " succeeded|@"
                        + (failed > 0 ? ", @|fg(red) " + failed + " not applied|@" : "")));
    }

    private static String statusTag(ExecutionResult result) {
        return switch (result.status()) {
            case SUCCESS -> "@|fg(green) SUCCESS|@    ";
            case FAILED -> "@|fg(red) FAILED|@     ";
            case UNSUPPORTED -> "@|fg(yellow) UNSUPPORTED|@";
        };
    }
}
