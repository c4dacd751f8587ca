package com.powerguard.core.handler;

import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.device.DeviceProperties;
import com.powerguard.device.DeviceShell;
import com.powerguard.device.PackageResolver;
import com.powerguard.device.ShellCommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lowers the CPU priority of an app's running processes.
 * <p>
 * Primary renices the processes. Fallback moves them into the background cpuset,
 * which caps them to the little cores.
 */
@Component
public class CpuThrottleHandler extends AbstractActionableHandler {

    private static final Logger log = LoggerFactory.getLogger(CpuThrottleHandler.class);

    public enum ThrottleLevel {
        NONE(0),
        LIGHT(5),
        MODERATE(10),
        HEAVY(15),
        MAXIMUM(19);

        private final int niceValue;

        ThrottleLevel(int niceValue) {
            this.niceValue = niceValue;
        }

        public int niceValue() { return niceValue; }
    }

    public static final ThrottleLevel DEFAULT_LEVEL = ThrottleLevel.MODERATE;

    static final String BACKGROUND_CPUSET = "/dev/cpuset/background/tasks";

    private static final Map<String, ThrottleLevel> MODES = buildModes();

    private final DeviceShell shell;
    private final PackageResolver packageResolver;

    public CpuThrottleHandler(DeviceShell shell, PackageResolver packageResolver, DeviceProperties properties) {
        super(properties);
        this.shell = shell;
        this.packageResolver = packageResolver;
    }

    @Override
    public CapabilityDomain domain() {
        return CapabilityDomain.CPU_PRIORITY;
    }

    @Override
    protected ExecutionResult apply(ActionableRecord record, CapabilityTier tier) {
        String requested = record.requestedMode() != null && !record.requestedMode().isBlank()
                ? record.requestedMode()
                : record.parameter("throttle_level").orElse(null);
        var resolved = RequestedModes.resolve(requested, MODES, DEFAULT_LEVEL);
        ThrottleLevel level = resolved.mode();
        String pkg = record.target();

        List<Integer> pids = packageResolver.pidsOf(pkg);
        if (pids.isEmpty()) {
            return ExecutionResult.failed(record.id(), "no running processes for " + pkg);
        }

        if (tier == CapabilityTier.PRIMARY) {
            String pidList = pids.stream().map(String::valueOf).collect(Collectors.joining(" "));
            shell.exec("renice -n %d -p %s".formatted(level.niceValue(), pidList));
            log.info("Reniced {} process(es) of {} to {}", pids.size(), pkg, level.niceValue());
            return ExecutionResult.success(record.id(),
                    "%d process(es) of %s reniced to %d (%s)%s".formatted(
                            pids.size(), pkg, level.niceValue(), level.name().toLowerCase(), resolved.note()));
        }

        int moved = 0;
        String lastError = null;
        for (int pid : pids) {
            try {
                shell.exec("echo %d > %s".formatted(pid, BACKGROUND_CPUSET));
                moved++;
            } catch (ShellCommandException e) {
                // Processes can exit between pidof and the write
                lastError = e.getMessage();
                log.debug("Could not move pid {} of {}: {}", pid, pkg, e.getMessage());
            }
        }
        if (moved == 0) {
            return ExecutionResult.failed(record.id(), "could not move any process of %s to background cpuset: %s"
                    .formatted(pkg, lastError));
        }
        log.info("Moved {}/{} process(es) of {} to background cpuset", moved, pids.size(), pkg);
        return ExecutionResult.success(record.id(),
                "moved %d of %d process(es) of %s to background cpuset (cpuset fallback)%s".formatted(
                        moved, pids.size(), pkg, resolved.note()));
    }

    /**
     * Named levels plus the numeric 1-10 scale of older recommendation payloads.
     */
    private static Map<String, ThrottleLevel> buildModes() {
        var modes = new HashMap<String, ThrottleLevel>();
        modes.put("none", ThrottleLevel.NONE);
        modes.put("off", ThrottleLevel.NONE);
        modes.put("foreground", ThrottleLevel.NONE);
        modes.put("light", ThrottleLevel.LIGHT);
        modes.put("low", ThrottleLevel.LIGHT);
        modes.put("moderate", ThrottleLevel.MODERATE);
        modes.put("medium", ThrottleLevel.MODERATE);
        modes.put("background", ThrottleLevel.MODERATE);
        modes.put("heavy", ThrottleLevel.HEAVY);
        modes.put("high", ThrottleLevel.HEAVY);
        modes.put("maximum", ThrottleLevel.MAXIMUM);
        modes.put("max", ThrottleLevel.MAXIMUM);
        ThrottleLevel[] scale = {
                ThrottleLevel.NONE, ThrottleLevel.NONE,
                ThrottleLevel.LIGHT, ThrottleLevel.LIGHT,
                ThrottleLevel.MODERATE, ThrottleLevel.MODERATE,
                ThrottleLevel.HEAVY, ThrottleLevel.HEAVY,
                ThrottleLevel.MAXIMUM, ThrottleLevel.MAXIMUM
        };
        for (int i = 0; i < scale.length; i++) {
            modes.put(String.valueOf(i + 1), scale[i]);
        }
        return Map.copyOf(modes);
    }
}
