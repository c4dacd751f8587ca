package com.powerguard.dispatch.cli;

import com.powerguard.core.monitor.AlertReading;
import com.powerguard.core.monitor.UsageAlertMonitor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: powerguard alerts
 * <p>
 * Lists armed usage alerts with a fresh reading of the device.
 */
@Command(name = "alerts", mixinStandardHelpOptions = true, description = "Show armed usage alerts and current readings")
@Component
public class AlertsCommand implements Runnable {

    @Option(names = {"--cached", "-c"}, description = "List the last readings without reading the device")
    private boolean cached;

    private final UsageAlertMonitor monitor;

    public AlertsCommand(UsageAlertMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<AlertReading> readings = cached ? monitor.readings() : monitor.checkNow();
        if (readings.isEmpty()) {
            ConsoleOutput.info("No usage alerts armed.");
            return;
        }
        ConsoleOutput.info("Usage alerts (" + readings.size() + "):");
        readings.forEach(ConsoleOutput::alert);
    }
}
