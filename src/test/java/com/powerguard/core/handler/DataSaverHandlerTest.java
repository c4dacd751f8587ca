package com.powerguard.core.handler;

import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.core.model.ExecutionStatus;
import com.powerguard.device.DeviceProperties;
import com.powerguard.device.ScriptedDeviceShell;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DataSaverHandlerTest {

    private ScriptedDeviceShell shell;
    private DataSaverHandler handler;

    @BeforeEach
    void setUp() {
        shell = new ScriptedDeviceShell()
                .respond("cmd netpolicy get restrict-background", 0, "Restrict background status: disabled")
                .respond("settings get global restrict_background", 0, "0");
        handler = new DataSaverHandler(shell, new DeviceProperties());
    }

    private static ActionableRecord saver(String mode, Map<String, String> parameters) {
        return new ActionableRecord("ds-1", "enable_data_saver", null, mode, "metered network", parameters);
    }

    @Test
    @DisplayName("primary turns on background restriction through netpolicy")
    void primaryEnables() {
        ExecutionResult result = handler.handle(saver(null, Map.of()), CapabilityTier.PRIMARY);

        assertEquals(ExecutionStatus.SUCCESS, result.status());
        assertEquals("data saver enabled", result.detail());
        assertEquals(1, shell.count("cmd netpolicy set restrict-background true"));
    }

    @Test
    @DisplayName("fallback writes the restrict_background setting")
    void fallbackEnables() {
        handler.handle(saver(null, Map.of()), CapabilityTier.FALLBACK);

        assertEquals(1, shell.count("settings put global restrict_background 1"));
        assertEquals(0, shell.count("cmd netpolicy"));
    }

    @Test
    @DisplayName("disable switches Data Saver off")
    void disable() {
        shell.respond("cmd netpolicy get restrict-background", 0, "Restrict background status: enabled");

        handler.handle(saver("disable", Map.of()), CapabilityTier.PRIMARY);

        assertEquals(1, shell.count("cmd netpolicy set restrict-background false"));
    }

    @Test
    @DisplayName("an already enabled Data Saver is left alone")
    void alreadyOn() {
        shell.respond("cmd netpolicy get restrict-background", 0, "Restrict background status: enabled");

        ExecutionResult result = handler.handle(saver("on", Map.of()), CapabilityTier.PRIMARY);

        assertEquals("data saver already enabled", result.detail());
        assertEquals(0, shell.count("cmd netpolicy set"));
    }

    @Test
    @DisplayName("a failed switch is FAILED")
    void failedWrite() {
        shell.respond("cmd netpolicy set restrict-background", 1, "Error: unknown state");

        ExecutionResult result = handler.handle(saver(null, Map.of()), CapabilityTier.PRIMARY);

        assertEquals(ExecutionStatus.FAILED, result.status());
    }

    @Test
    @DisplayName("an unavailable tier issues no command")
    void unavailable() {
        ExecutionResult result = handler.handle(saver(null, Map.of()), CapabilityTier.UNAVAILABLE);

        assertEquals(ExecutionStatus.FAILED, result.status());
        assertEquals(AbstractActionableHandler.CAPABILITY_UNAVAILABLE, result.detail());
        assertTrue(shell.commands().isEmpty());
    }
}
