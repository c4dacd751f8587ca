package com.powerguard.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * {@link DeviceShell} that runs each command as a child process via {@link ProcessBuilder}.
 * <p>
 * The launcher prefix decides the transport: {@code [adb, -s, SERIAL, shell]} reaches a
 * device from a host, {@code [sh, -c]} runs on the device itself. Each command is bounded
 * by a timeout after which the child process is destroyed.
 */
public class ProcessDeviceShell implements DeviceShell {

    private static final Logger log = LoggerFactory.getLogger(ProcessDeviceShell.class);

    private final List<String> launcher;
    private final Duration timeout;

    public ProcessDeviceShell(List<String> launcher, Duration timeout) {
        if (launcher == null || launcher.isEmpty()) {
            throw new IllegalArgumentException("Launcher must not be empty");
        }
        this.launcher = List.copyOf(launcher);
        this.timeout = timeout;
    }

    public static ProcessDeviceShell adb(String adbPath, String serial, Duration timeout) {
        var launcher = new ArrayList<String>();
        launcher.add(adbPath);
        if (serial != null && !serial.isBlank()) {
            launcher.add("-s");
            launcher.add(serial);
        }
        launcher.add("shell");
        return new ProcessDeviceShell(launcher, timeout);
    }

    public static ProcessDeviceShell local(Duration timeout) {
        return new ProcessDeviceShell(List.of("sh", "-c"), timeout);
    }

    @Override
    public ShellResult run(String command) {
        var argv = new ArrayList<>(launcher);
        argv.add(command);
        log.debug("Running: {}", command);

        Process process;
        try {
            process = new ProcessBuilder(argv)
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new DeviceUnreachableException("Could not start '%s': %s".formatted(launcher.get(0), e.getMessage()), e);
        }

        // Drain output off-thread so a chatty command cannot block on a full pipe
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new DeviceUnreachableException(
                        "Command timed out after %ds: %s".formatted(timeout.toSeconds(), command));
            }
            int exitCode = process.exitValue();
            var result = new ShellResult(command, exitCode, output.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
            log.debug("Exit {} for: {}", exitCode, command);
            return result;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new DeviceUnreachableException("Interrupted while running: " + command, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new DeviceUnreachableException("Could not read output of: " + command, e);
        }
    }

    @Override
    public String describe() {
        return String.join(" ", launcher);
    }

    List<String> launcher() {
        return launcher;
    }

    private static String readAll(Process process) {
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new DeviceUnreachableException("Failed reading command output", e);
        }
    }
}
