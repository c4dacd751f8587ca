package com.powerguard.device;

/**
 * Runs platform shell commands ({@code am}, {@code cmd}, {@code appops}, {@code dumpsys} ...)
 * on the managed device.
 */
public interface DeviceShell {

    /**
     * Runs one command and returns its result whatever the exit code.
     *
     * @throws DeviceUnreachableException if the command could not be delivered or timed out
     */
    ShellResult run(String command);

    /**
     * Runs one command and requires it to succeed.
     *
     * @throws PermissionDeniedException     on a permission-class failure
     * @throws MechanismUnavailableException when the command does not exist on this device
     * @throws ShellCommandException         on any other failure
     */
    default ShellResult exec(String command) {
        return run(command).requireSuccess();
    }

    /** Short human-readable description of the transport, for logs and health output. */
    String describe();
}
