package com.powerguard.device;

/**
 * The command, service or kernel interface does not exist on this platform revision.
 */
public class MechanismUnavailableException extends ShellCommandException {

    public MechanismUnavailableException(String message, String command, int exitCode, String output) {
        super(message, command, exitCode, output);
    }
}
