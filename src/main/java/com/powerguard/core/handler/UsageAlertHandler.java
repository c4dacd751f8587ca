package com.powerguard.core.handler;

import com.powerguard.core.events.EventBus;
import com.powerguard.core.events.PowerGuardEvent;
import com.powerguard.core.handler.UsageAlertStore.AlertKind;
import com.powerguard.core.handler.UsageAlertStore.UsageAlert;
import com.powerguard.core.logging.MdcContext;
import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.ActionableType;
import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.device.DeviceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Arms or cancels battery and data usage alerts. Has no OS effect: the alert is stored
 * and announced on the {@link EventBus} for the notification layer.
 */
@Component
public class UsageAlertHandler extends AbstractActionableHandler {

    private static final Logger log = LoggerFactory.getLogger(UsageAlertHandler.class);

    public static final String DEVICE_SCOPE = "system";

    public enum AlertAction {
        ARM,
        CANCEL
    }

    public static final AlertAction DEFAULT_ACTION = AlertAction.ARM;

    private static final Map<String, AlertAction> MODES = Map.of(
            "arm", AlertAction.ARM,
            "set", AlertAction.ARM,
            "enable", AlertAction.ARM,
            "on", AlertAction.ARM,
            "cancel", AlertAction.CANCEL,
            "disarm", AlertAction.CANCEL,
            "disable", AlertAction.CANCEL,
            "off", AlertAction.CANCEL
    );

    private final UsageAlertStore store;
    private final EventBus eventBus;

    public UsageAlertHandler(UsageAlertStore store, EventBus eventBus, DeviceProperties properties) {
        super(properties);
        this.store = store;
        this.eventBus = eventBus;
    }

    @Override
    public CapabilityDomain domain() {
        return CapabilityDomain.USAGE_ALERT;
    }

    @Override
    protected boolean requiresTarget() {
        return false;
    }

    @Override
    protected ExecutionResult apply(ActionableRecord record, CapabilityTier tier) {
        String scope = DEVICE_SCOPE;
        String target = record.target();
        if (target != null && !target.isBlank() && !DEVICE_SCOPE.equalsIgnoreCase(target.trim())) {
            String problem = checkTarget(target);
            if (problem != null) {
                return ExecutionResult.failed(record.id(), problem);
            }
            scope = target;
        }

        AlertKind kind = record.resolvedType().orElse(null) == ActionableType.SET_DATA_ALERT
                ? AlertKind.DATA
                : AlertKind.BATTERY;
        var resolved = RequestedModes.resolve(record.requestedMode(), MODES, DEFAULT_ACTION);

        if (resolved.mode() == AlertAction.CANCEL) {
            var removed = store.cancel(kind, scope);
            publish(record, "alert.cancelled", kind, scope, removed.map(UsageAlert::threshold).orElse(0));
            return ExecutionResult.success(record.id(), removed.isPresent()
                    ? "%s alert for %s cancelled".formatted(label(kind), scope)
                    : "no %s alert armed for %s".formatted(label(kind), scope));
        }

        String rawThreshold = record.parameter(kind.parameter()).orElse(null);
        int threshold;
        if (rawThreshold == null || rawThreshold.isBlank()) {
            threshold = kind.defaultThreshold();
        } else {
            long rounded;
            try {
                rounded = Math.round(Double.parseDouble(rawThreshold.trim()));
            } catch (NumberFormatException e) {
                return ExecutionResult.failed(record.id(), "invalid threshold: " + rawThreshold);
            }
            // Range check on the long; NaN rounds to 0 and infinities saturate, both out of range
            if (!kind.accepts(rounded)) {
                return ExecutionResult.failed(record.id(), "invalid threshold: " + rawThreshold);
            }
            threshold = (int) rounded;
        }

        store.arm(new UsageAlert(kind, scope, threshold, record.reason(), record.id(), Instant.now()));
        publish(record, "alert.armed", kind, scope, threshold);
        log.info("Armed {} alert for {} at {}{}", label(kind), scope, threshold, kind.unit());
        return ExecutionResult.success(record.id(),
                "%s alert armed for %s at %d%s%s".formatted(label(kind), scope, threshold, kind.unit(), resolved.note()));
    }

    private void publish(ActionableRecord record, String eventType, AlertKind kind, String scope, int threshold) {
        eventBus.publish(PowerGuardEvent.of(eventType, MDC.get(MdcContext.BATCH_ID), record.id(), Map.of(
                "kind", kind.name(),
                "scope", scope,
                "threshold", threshold,
                "unit", kind.unit())));
    }

    private static String label(AlertKind kind) {
        return kind == AlertKind.DATA ? "data" : "battery";
    }
}
