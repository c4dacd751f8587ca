package com.powerguard.core.history;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

@Component
@ConfigurationProperties(prefix = "powerguard.history")
public class HistoryProperties {

    /** {@code jdbc} (default, needs a DataSource) or {@code memory}. */
    private String store = "jdbc";
    /** Zone used for day and hour grouping; empty means the system zone. */
    private String zone = "";

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }
    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }

    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
    }
}
