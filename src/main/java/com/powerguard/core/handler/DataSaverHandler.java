package com.powerguard.core.handler;

import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.device.DeviceProperties;
import com.powerguard.device.DeviceShell;
import com.powerguard.device.ShellResult;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Switches Data Saver, the device-wide restriction on background data over metered networks.
 * <p>
 * Primary: the network policy service. Fallback: the {@code restrict_background} global setting.
 */
@Component
public class DataSaverHandler extends PowerSaverHandler {

    public DataSaverHandler(DeviceShell shell, DeviceProperties properties) {
        super(shell, properties);
    }

    @Override
    public CapabilityDomain domain() {
        return CapabilityDomain.DATA_SAVER;
    }

    @Override
    protected String label() {
        return "data saver";
    }

    @Override
    protected String stateCommand(CapabilityTier tier) {
        return tier == CapabilityTier.PRIMARY
                ? "cmd netpolicy get restrict-background"
                : "settings get global restrict_background";
    }

    @Override
    protected Optional<Boolean> parseState(ShellResult result, CapabilityTier tier) {
        String line = result.firstLine().trim().toLowerCase(Locale.ROOT);
        if (tier == CapabilityTier.PRIMARY) {
            // "Restrict background status: enabled"
            if (line.endsWith("disabled")) {
                return Optional.of(false);
            }
            return line.endsWith("enabled") ? Optional.of(true) : Optional.empty();
        }
        return switch (line) {
            case "1" -> Optional.of(true);
            case "0" -> Optional.of(false);
            default -> Optional.empty();
        };
    }

    @Override
    protected String writeCommand(CapabilityTier tier, boolean enable) {
        return tier == CapabilityTier.PRIMARY
                ? "cmd netpolicy set restrict-background " + enable
                : "settings put global restrict_background " + (enable ? 1 : 0);
    }
}
