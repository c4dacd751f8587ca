package com.powerguard.device;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Looks up the uid and running pids of an installed package.
 */
@Component
public class PackageResolver {

    private static final Pattern PACKAGE_NAME =
            Pattern.compile("[A-Za-z][A-Za-z0-9_]*(\\.[A-Za-z0-9_]+)+");

    private final DeviceShell shell;

    public PackageResolver(DeviceShell shell) {
        this.shell = shell;
    }

    /**
     * True when {@code name} looks like an Android application id. Only such names are
     * ever interpolated into a shell command.
     */
    public static boolean isValidPackageName(String name) {
        return name != null && PACKAGE_NAME.matcher(name).matches();
    }

    /**
     * Resolves the uid from {@code cmd package list packages -U}, which prints
     * {@code package:<name> uid:<uid>} for every package whose name contains the filter.
     */
    public OptionalInt uidOf(String packageName) {
        ShellResult result = shell.exec("cmd package list packages -U " + packageName);
        String prefix = "package:" + packageName + " ";
        for (String line : result.lines()) {
            String trimmed = line.trim();
            if (!trimmed.startsWith(prefix)) {
                continue;
            }
            int idx = trimmed.indexOf("uid:");
            if (idx < 0) {
                continue;
            }
            String uid = trimmed.substring(idx + 4).split("[\\s,]")[0];
            try {
                return OptionalInt.of(Integer.parseInt(uid));
            } catch (NumberFormatException e) {
                throw new ShellCommandException("unparsable uid '%s' for %s".formatted(uid, packageName),
                        result.command(), result.exitCode(), result.output());
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Pids of the package's running processes; empty when it is not running.
     * {@code pidof} exits non-zero with no output when nothing matches.
     */
    public List<Integer> pidsOf(String packageName) {
        ShellResult result = shell.run("pidof " + packageName);
        if (result.isPermissionDenied() || result.isMechanismMissing()) {
            result.requireSuccess();
        }
        var pids = new ArrayList<Integer>();
        for (String token : result.output().split("\\s+")) {
            if (token.matches("\\d+")) {
                pids.add(Integer.parseInt(token));
            }
        }
        return pids;
    }
}
