package com.powerguard.device;

/**
 * The command could not be delivered to the device or did not finish in time.
 * Says nothing about whether the device supports the command.
 */
public class DeviceUnreachableException extends RuntimeException {

    public DeviceUnreachableException(String message) {
        super(message);
    }

    public DeviceUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
