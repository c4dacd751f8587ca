package com.powerguard.core.handler;

import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.device.DeviceProperties;
import com.powerguard.device.DeviceShell;
import com.powerguard.device.ShellResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Base for device-wide saver switches. Resolves enable or disable, skips the write when
 * the switch is already in that state, and otherwise runs the tier's write command.
 */
public abstract class PowerSaverHandler extends AbstractActionableHandler {

    private static final Logger log = LoggerFactory.getLogger(PowerSaverHandler.class);

    public enum SaverState {
        ENABLE,
        DISABLE
    }

    public static final SaverState DEFAULT_STATE = SaverState.ENABLE;

    private static final Map<String, SaverState> MODES = Map.of(
            "enable", SaverState.ENABLE,
            "enabled", SaverState.ENABLE,
            "on", SaverState.ENABLE,
            "true", SaverState.ENABLE,
            "disable", SaverState.DISABLE,
            "disabled", SaverState.DISABLE,
            "off", SaverState.DISABLE,
            "false", SaverState.DISABLE
    );

    protected final DeviceShell shell;

    protected PowerSaverHandler(DeviceShell shell, DeviceProperties properties) {
        super(properties);
        this.shell = shell;
    }

    /** Human name used in result details, e.g. {@code battery saver}. */
    protected abstract String label();

    /** Command reading the current state at {@code tier}. */
    protected abstract String stateCommand(CapabilityTier tier);

    /**
     * @return whether the saver is on, or empty when the output does not say
     */
    protected abstract Optional<Boolean> parseState(ShellResult result, CapabilityTier tier);

    /** Command switching the saver at {@code tier}. */
    protected abstract String writeCommand(CapabilityTier tier, boolean enable);

    @Override
    protected boolean requiresTarget() {
        return false;
    }

    @Override
    protected ExecutionResult apply(ActionableRecord record, CapabilityTier tier) {
        var resolved = RequestedModes.resolve(record.requestedMode(), MODES, defaultFor(record));
        boolean enable = resolved.mode() == SaverState.ENABLE;
        String state = enable ? "enabled" : "disabled";
        String via = tier == CapabilityTier.PRIMARY ? "" : " (settings fallback)";

        if (currentState(tier).filter(on -> on == enable).isPresent()) {
            log.info("{} already {}", label(), state);
            return ExecutionResult.success(record.id(), "%s already %s%s".formatted(label(), state, resolved.note()));
        }

        shell.exec(writeCommand(tier, enable));
        log.info("{} {}{}", label(), state, via);
        return ExecutionResult.success(record.id(), "%s %s%s%s".formatted(label(), state, via, resolved.note()));
    }

    private Optional<Boolean> currentState(CapabilityTier tier) {
        ShellResult result = shell.run(stateCommand(tier));
        if (!result.isSuccess()) {
            // Unknown state; the write below reports any real failure
            log.debug("Could not read {} state: {}", label(), result.firstLine());
            return Optional.empty();
        }
        return parseState(result, tier);
    }

    /**
     * Recommendation payloads carry {@code enabled=false} instead of a mode to switch the saver off.
     */
    private static SaverState defaultFor(ActionableRecord record) {
        return record.parameter("enabled").filter("false"::equalsIgnoreCase).isPresent()
                ? SaverState.DISABLE
                : DEFAULT_STATE;
    }
}
