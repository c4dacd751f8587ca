package com.powerguard.core.monitor;

import com.powerguard.core.handler.UsageAlertStore.UsageAlert;

import java.time.Instant;

/**
 * Last measured usage for one armed alert.
 *
 * @param alert     the armed alert
 * @param reading   battery percent or data megabytes, {@code null} until a check has measured it
 * @param triggered whether the reading is past the alert's threshold
 * @param readAt    when the reading was taken, {@code null} if never
 */
public record AlertReading(UsageAlert alert, Long reading, boolean triggered, Instant readAt) {

    public static AlertReading unread(UsageAlert alert) {
        return new AlertReading(alert, null, false, null);
    }
}
