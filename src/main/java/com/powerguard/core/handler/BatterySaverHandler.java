package com.powerguard.core.handler;

import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.device.DeviceProperties;
import com.powerguard.device.DeviceShell;
import com.powerguard.device.ShellResult;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Switches the system battery saver.
 * <p>
 * Primary: the power manager's {@code set-mode}. Fallback: the {@code low_power} global setting.
 * Both tiers read the current state from {@code low_power}.
 */
@Component
public class BatterySaverHandler extends PowerSaverHandler {

    public BatterySaverHandler(DeviceShell shell, DeviceProperties properties) {
        super(shell, properties);
    }

    @Override
    public CapabilityDomain domain() {
        return CapabilityDomain.BATTERY_SAVER;
    }

    @Override
    protected String label() {
        return "battery saver";
    }

    @Override
    protected String stateCommand(CapabilityTier tier) {
        return "settings get global low_power";
    }

    @Override
    protected Optional<Boolean> parseState(ShellResult result, CapabilityTier tier) {
        return switch (result.firstLine().trim()) {
            case "1" -> Optional.of(true);
            case "0" -> Optional.of(false);
            default -> Optional.empty();
        };
    }

    @Override
    protected String writeCommand(CapabilityTier tier, boolean enable) {
        return tier == CapabilityTier.PRIMARY
                ? "cmd power set-mode " + (enable ? 1 : 0)
                : "settings put global low_power " + (enable ? 1 : 0);
    }
}
