package com.powerguard.device;

import java.util.List;
import java.util.Locale;

/**
 * Exit code and combined stdout/stderr of one device shell command.
 * <p>
 * Several platform tools ({@code am}, {@code cmd}) print a {@code SecurityException}
 * and still exit with 0, so failure classification looks at the output first.
 */
public record ShellResult(String command, int exitCode, String output) {

    private static final List<String> PERMISSION_MARKERS = List.of(
            "securityexception",
            "permission denial",
            "permission denied",
            "operation not permitted",
            "not allowed to",
            "requires android.permission"
    );

    private static final List<String> MISSING_MARKERS = List.of(
            "unknown command",
            "can't find service",
            "no shell command implementation",
            "inaccessible or not found",
            "no such file or directory"
    );

    public ShellResult {
        output = output == null ? "" : output.strip();
    }

    public boolean isPermissionDenied() {
        return containsAny(PERMISSION_MARKERS);
    }

    public boolean isMechanismMissing() {
        return exitCode == 127 || containsAny(MISSING_MARKERS);
    }

    public boolean isSuccess() {
        String head = firstLine().toLowerCase(Locale.ROOT);
        return exitCode == 0 && !isPermissionDenied() && !isMechanismMissing()
                && !head.startsWith("error") && !head.contains("exception");
    }

    /**
     * Returns this result when the command succeeded, otherwise throws the matching
     * {@link ShellCommandException} subtype.
     */
    public ShellResult requireSuccess() {
        if (isPermissionDenied()) {
            throw new PermissionDeniedException(
                    "permission denied for '%s': %s".formatted(command, firstLine()), command, exitCode, output);
        }
        if (isMechanismMissing()) {
            throw new MechanismUnavailableException(
                    "mechanism unavailable for '%s': %s".formatted(command, firstLine()), command, exitCode, output);
        }
        if (!isSuccess()) {
            throw new ShellCommandException(
                    "'%s' failed (exit %d): %s".formatted(command, exitCode, firstLine()), command, exitCode, output);
        }
        return this;
    }

    public List<String> lines() {
        return output.isEmpty() ? List.of() : output.lines().toList();
    }

    public String firstLine() {
        List<String> lines = lines();
        return lines.isEmpty() ? "" : lines.get(0);
    }

    private boolean containsAny(List<String> markers) {
        String lower = output.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
