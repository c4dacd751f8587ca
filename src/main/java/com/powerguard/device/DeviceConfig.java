package com.powerguard.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DeviceConfig {

    private static final Logger log = LoggerFactory.getLogger(DeviceConfig.class);

    @Bean
    @ConditionalOnProperty(name = "powerguard.device.shell", havingValue = "adb", matchIfMissing = true)
    public DeviceShell adbDeviceShell(DeviceProperties properties) {
        var shell = ProcessDeviceShell.adb(properties.getAdbPath(), properties.getSerial(), properties.getCommandTimeout());
        log.info("Using adb device shell: {}", shell.describe());
        return shell;
    }

    /**
     * Runs commands through the local {@code sh}, for deployments on a privileged device image.
     */
    @Bean
    @ConditionalOnProperty(name = "powerguard.device.shell", havingValue = "local")
    public DeviceShell localDeviceShell(DeviceProperties properties) {
        log.info("Using local device shell");
        return ProcessDeviceShell.local(properties.getCommandTimeout());
    }
}
