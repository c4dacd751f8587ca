package com.powerguard.device;

/**
 * The OS refused the command because the caller lacks a permission or privilege.
 */
public class PermissionDeniedException extends ShellCommandException {

    public PermissionDeniedException(String message, String command, int exitCode, String output) {
        super(message, command, exitCode, output);
    }
}
