package com.powerguard.device;

import org.springframework.stereotype.Component;

import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads battery level and cumulative network traffic from {@code dumpsys}.
 */
@Component
public class DeviceUsageReader {

    static final String BATTERY_COMMAND = "dumpsys battery";
    static final String NETSTATS_COMMAND = "dumpsys netstats --full --uid";

    private static final Pattern UID = Pattern.compile("\\buid=(-?\\d+)");
    private static final Pattern TAG = Pattern.compile("\\btag=(0x[0-9a-fA-F]+)");
    private static final Pattern BYTES = Pattern.compile("\\b(rb|tb)=(\\d+)");

    private final DeviceShell shell;
    private final PackageResolver packageResolver;

    public DeviceUsageReader(DeviceShell shell, PackageResolver packageResolver) {
        this.shell = shell;
        this.packageResolver = packageResolver;
    }

    /**
     * Battery charge in percent, from the {@code level:} and {@code scale:} lines.
     *
     * @throws ShellCommandException when the dump has no usable level
     */
    public int batteryPercent() {
        ShellResult result = shell.exec(BATTERY_COMMAND);
        Integer level = null;
        int scale = 100;
        for (String line : result.lines()) {
            String trimmed = line.trim();
            if (trimmed.startsWith("level:")) {
                level = parseInt(trimmed.substring(6), result);
            } else if (trimmed.startsWith("scale:")) {
                scale = parseInt(trimmed.substring(6), result);
            }
        }
        if (level == null || scale <= 0) {
            throw new ShellCommandException("no battery level in dumpsys output",
                    result.command(), result.exitCode(), result.output());
        }
        return (int) Math.round(level * 100.0 / scale);
    }

    /**
     * Bytes received plus transmitted, summed over the untagged per-uid buckets of
     * {@code dumpsys netstats}. A package name limits the sum to that package's uid;
     * {@code null} sums every uid.
     *
     * @return the byte count, or empty when the package is not installed
     */
    public OptionalLong dataBytes(String packageName) {
        OptionalInt uid = OptionalInt.empty();
        if (packageName != null) {
            uid = packageResolver.uidOf(packageName);
            if (uid.isEmpty()) {
                return OptionalLong.empty();
            }
        }

        ShellResult result = shell.exec(NETSTATS_COMMAND);
        long total = 0;
        boolean inUidSection = false;
        boolean counting = false;
        for (String line : result.lines()) {
            String trimmed = line.trim();
            if (trimmed.endsWith("stats:")) {
                inUidSection = trimmed.equals("UID stats:");
                counting = false;
            } else if (trimmed.startsWith("ident=")) {
                counting = inUidSection && owns(trimmed, uid);
            } else if (counting && trimmed.startsWith("st=")) {
                Matcher bytes = BYTES.matcher(trimmed);
                while (bytes.find()) {
                    total += Long.parseLong(bytes.group(2));
                }
            }
        }
        return OptionalLong.of(total);
    }

    private static boolean owns(String identLine, OptionalInt uid) {
        Matcher uidMatch = UID.matcher(identLine);
        if (!uidMatch.find()) {
            return false;
        }
        // Tagged buckets repeat traffic already counted under tag 0x0
        Matcher tag = TAG.matcher(identLine);
        if (tag.find() && !"0x0".equals(tag.group(1))) {
            return false;
        }
        return uid.isEmpty() || Integer.parseInt(uidMatch.group(1)) == uid.getAsInt();
    }

    private static int parseInt(String value, ShellResult result) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ShellCommandException("unparsable battery value '%s'".formatted(value.trim()),
                    result.command(), result.exitCode(), result.output());
        }
    }
}
