package com.powerguard.core.handler;

import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.device.DeviceProperties;
import com.powerguard.device.DeviceShell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Stops an app. Primary goes through {@code am}, fallback through the activity
 * manager's {@code cmd} service; both reach the same system call.
 */
@Component
public class KillAppHandler extends AbstractActionableHandler {

    private static final Logger log = LoggerFactory.getLogger(KillAppHandler.class);

    public enum TerminationMode {
        FORCE_STOP("force-stop"),
        KILL_BACKGROUND("kill");

        private final String verb;

        TerminationMode(String verb) {
            this.verb = verb;
        }

        public String verb() { return verb; }
    }

    public static final TerminationMode DEFAULT_MODE = TerminationMode.FORCE_STOP;

    private static final Map<String, TerminationMode> MODES = Map.of(
            "force_stop", TerminationMode.FORCE_STOP,
            "stop", TerminationMode.FORCE_STOP,
            "force", TerminationMode.FORCE_STOP,
            "kill_background", TerminationMode.KILL_BACKGROUND,
            "background", TerminationMode.KILL_BACKGROUND,
            "kill", TerminationMode.KILL_BACKGROUND,
            "soft", TerminationMode.KILL_BACKGROUND
    );

    private final DeviceShell shell;

    public KillAppHandler(DeviceShell shell, DeviceProperties properties) {
        super(properties);
        this.shell = shell;
    }

    @Override
    public CapabilityDomain domain() {
        return CapabilityDomain.PROCESS_TERMINATION;
    }

    @Override
    protected ExecutionResult apply(ActionableRecord record, CapabilityTier tier) {
        var resolved = RequestedModes.resolve(record.requestedMode(), MODES, DEFAULT_MODE);
        TerminationMode mode = resolved.mode();
        String pkg = record.target();

        String entryPoint = tier == CapabilityTier.PRIMARY ? "am" : "cmd activity";
        shell.exec("%s %s %s".formatted(entryPoint, mode.verb(), pkg));
        log.info("Ran {} {} on {}", entryPoint, mode.verb(), pkg);

        String what = mode == TerminationMode.FORCE_STOP ? "force-stopped" : "background processes killed for";
        return ExecutionResult.success(record.id(),
                "%s %s via %s%s".formatted(what, pkg, entryPoint, resolved.note()));
    }
}
