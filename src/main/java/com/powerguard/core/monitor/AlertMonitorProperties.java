package com.powerguard.core.monitor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "powerguard.alerts")
public class AlertMonitorProperties {

    /** Whether armed alerts are checked in the background. */
    private boolean enabled = true;
    /** Time between two background checks of the armed alerts. */
    private Duration checkInterval = Duration.ofMinutes(15);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Duration getCheckInterval() { return checkInterval; }
    public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }
}
