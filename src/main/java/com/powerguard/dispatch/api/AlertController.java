package com.powerguard.dispatch.api;

import com.powerguard.core.monitor.AlertReading;
import com.powerguard.core.monitor.UsageAlertMonitor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Armed usage alerts and their latest readings.
 */
@RestController
@RequestMapping("/api/v1/alerts")
public class AlertController {

    private final UsageAlertMonitor monitor;

    public AlertController(UsageAlertMonitor monitor) {
        this.monitor = monitor;
    }

    /**
     * GET /api/v1/alerts: Armed alerts in arming order; with {@code check=true} the device is read first.
     */
    @GetMapping
    public ResponseEntity<List<AlertResponse>> alerts(@RequestParam(defaultValue = "false") boolean check) {
        List<AlertReading> readings = check ? monitor.checkNow() : monitor.readings();
        return ResponseEntity.ok(readings.stream().map(AlertResponse::from).toList());
    }
}
