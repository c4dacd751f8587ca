package com.powerguard.core.handler;

import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.device.DeviceProperties;
import com.powerguard.device.DeviceShell;
import com.powerguard.device.PackageResolver;
import com.powerguard.device.ShellResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Controls whether an app may hold wake locks, through the {@code WAKE_LOCK} app op.
 * Primary uses the {@code cmd appops} service, fallback the legacy standalone
 * {@code appops} binary. {@code inspect} only reports the wake locks the app holds.
 */
@Component
public class WakeLockHandler extends AbstractActionableHandler {

    private static final Logger log = LoggerFactory.getLogger(WakeLockHandler.class);

    public enum WakeLockPolicy {
        DENY("ignore"),
        ALLOW("allow"),
        INSPECT(null);

        private final String opMode;

        WakeLockPolicy(String opMode) {
            this.opMode = opMode;
        }

        public String opMode() { return opMode; }
    }

    public static final WakeLockPolicy DEFAULT_POLICY = WakeLockPolicy.DENY;

    private static final Map<String, WakeLockPolicy> MODES = Map.of(
            "deny", WakeLockPolicy.DENY,
            "restrict", WakeLockPolicy.DENY,
            "restricted", WakeLockPolicy.DENY,
            "ignore", WakeLockPolicy.DENY,
            "allow", WakeLockPolicy.ALLOW,
            "allowed", WakeLockPolicy.ALLOW,
            "inspect", WakeLockPolicy.INSPECT,
            "list", WakeLockPolicy.INSPECT
    );

    private final DeviceShell shell;
    private final PackageResolver packageResolver;

    public WakeLockHandler(DeviceShell shell, PackageResolver packageResolver, DeviceProperties properties) {
        super(properties);
        this.shell = shell;
        this.packageResolver = packageResolver;
    }

    @Override
    public CapabilityDomain domain() {
        return CapabilityDomain.WAKE_SOURCE;
    }

    @Override
    protected ExecutionResult apply(ActionableRecord record, CapabilityTier tier) {
        WakeLockPolicy fallbackPolicy = record.parameter("enabled").filter("false"::equalsIgnoreCase).isPresent()
                ? WakeLockPolicy.ALLOW
                : DEFAULT_POLICY;
        var resolved = RequestedModes.resolve(record.requestedMode(), MODES, fallbackPolicy);
        WakeLockPolicy policy = resolved.mode();
        String pkg = record.target();

        if (policy == WakeLockPolicy.INSPECT) {
            List<String> held = heldWakeLocks(pkg);
            return ExecutionResult.success(record.id(),
                    "%s holds %d wake lock(s)%s".formatted(pkg, held.size(), held.isEmpty() ? "" : ": " + String.join("; ", held)));
        }

        String entryPoint = tier == CapabilityTier.PRIMARY ? "cmd appops" : "appops";
        shell.exec("%s set %s WAKE_LOCK %s".formatted(entryPoint, pkg, policy.opMode()));
        log.info("WAKE_LOCK for {} set to {} via {}", pkg, policy.opMode(), entryPoint);
        return ExecutionResult.success(record.id(),
                "wake locks %s for %s via %s%s".formatted(
                        policy == WakeLockPolicy.DENY ? "denied" : "allowed", pkg, entryPoint, resolved.note()));
    }

    /**
     * Entries of the {@code Wake Locks:} section of {@code dumpsys power} owned by the package's uid.
     */
    List<String> heldWakeLocks(String pkg) {
        OptionalInt uid = packageResolver.uidOf(pkg);
        ShellResult dump = shell.run("dumpsys power");
        if (dump.isPermissionDenied() || dump.isMechanismMissing() || dump.exitCode() != 0) {
            dump.requireSuccess();
        }

        // Whole tokens only: uid 1001 must not match uid=10012, com.a must not match com.abc
        Pattern uidMarker = uid.isPresent() ? Pattern.compile("\\buid=" + uid.getAsInt() + "(?!\\d)") : null;
        Pattern pkgMarker = Pattern.compile("(?<![\\w.])" + Pattern.quote(pkg) + "(?![\\w.])");
        var held = new ArrayList<String>();
        boolean inSection = false;
        for (String line : dump.lines()) {
            String trimmed = line.trim();
            if (trimmed.startsWith("Wake Locks:")) {
                inSection = true;
                continue;
            }
            if (!inSection) {
                continue;
            }
            if (trimmed.isEmpty() || !Character.isWhitespace(line.charAt(0))) {
                break;
            }
            if ((uidMarker != null && uidMarker.matcher(trimmed).find()) || pkgMarker.matcher(trimmed).find()) {
                held.add(trimmed);
            }
        }
        return held;
    }
}
