package com.powerguard.device;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "powerguard.device")
public class DeviceProperties {

    /** {@code adb} to reach a device from a host, {@code local} when running on the device. */
    private String shell = "adb";
    private String adbPath = "adb";
    /** Device serial passed as {@code adb -s}; empty selects the only attached device. */
    private String serial = "";
    private Duration commandTimeout = Duration.ofSeconds(15);
    /** Package of this engine's own app. Instructions targeting it are refused. */
    private String selfPackage = "com.powerguard";
    /** A package name that is never installed, used by read-only capability probes. */
    private String probePackage = "com.powerguard.probe.sentinel";

    public String getShell() { return shell; }
    public void setShell(String shell) { this.shell = shell; }
    public String getAdbPath() { return adbPath; }
    public void setAdbPath(String adbPath) { this.adbPath = adbPath; }
    public String getSerial() { return serial; }
    public void setSerial(String serial) { this.serial = serial; }
    public Duration getCommandTimeout() { return commandTimeout; }
    public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
    public String getSelfPackage() { return selfPackage; }
    public void setSelfPackage(String selfPackage) { this.selfPackage = selfPackage; }
    public String getProbePackage() { return probePackage; }
    public void setProbePackage(String probePackage) { this.probePackage = probePackage; }
}
