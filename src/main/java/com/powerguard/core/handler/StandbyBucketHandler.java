package com.powerguard.core.handler;

import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.device.DeviceProperties;
import com.powerguard.device.DeviceShell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Moves an app between app-standby buckets.
 * <p>
 * Primary: {@code am set-standby-bucket}. Fallback, for platforms without buckets:
 * {@code am set-inactive}, which only distinguishes active from idle.
 * An unrecognized mode selects {@link StandbyBucket#RESTRICTED}.
 */
@Component
public class StandbyBucketHandler extends AbstractActionableHandler {

    private static final Logger log = LoggerFactory.getLogger(StandbyBucketHandler.class);

    public enum StandbyBucket {
        ACTIVE("active", 10, false),
        WORKING_SET("working_set", 20, false),
        FREQUENT("frequent", 30, true),
        RARE("rare", 40, true),
        RESTRICTED("restricted", 50, true);

        private final String key;
        private final int level;
        private final boolean inactive;

        StandbyBucket(String key, int level, boolean inactive) {
            this.key = key;
            this.level = level;
            this.inactive = inactive;
        }

        public String key() { return key; }
        public int level() { return level; }
        public boolean inactive() { return inactive; }
    }

    public static final StandbyBucket DEFAULT_BUCKET = StandbyBucket.RESTRICTED;

    private static final Map<String, StandbyBucket> MODES = Map.ofEntries(
            Map.entry("active", StandbyBucket.ACTIVE),
            Map.entry("10", StandbyBucket.ACTIVE),
            Map.entry("working_set", StandbyBucket.WORKING_SET),
            Map.entry("working", StandbyBucket.WORKING_SET),
            Map.entry("20", StandbyBucket.WORKING_SET),
            Map.entry("frequent", StandbyBucket.FREQUENT),
            Map.entry("30", StandbyBucket.FREQUENT),
            Map.entry("rare", StandbyBucket.RARE),
            Map.entry("40", StandbyBucket.RARE),
            Map.entry("restricted", StandbyBucket.RESTRICTED),
            Map.entry("45", StandbyBucket.RESTRICTED),
            Map.entry("50", StandbyBucket.RESTRICTED)
    );

    private final DeviceShell shell;

    public StandbyBucketHandler(DeviceShell shell, DeviceProperties properties) {
        super(properties);
        this.shell = shell;
    }

    @Override
    public CapabilityDomain domain() {
        return CapabilityDomain.IDLE_STATE;
    }

    @Override
    protected ExecutionResult apply(ActionableRecord record, CapabilityTier tier) {
        var resolved = RequestedModes.resolve(record.requestedMode(), MODES, DEFAULT_BUCKET);
        StandbyBucket bucket = resolved.mode();
        String pkg = record.target();

        if (tier == CapabilityTier.PRIMARY) {
            shell.exec("am set-standby-bucket %s %s".formatted(pkg, bucket.key()));
            log.info("Set standby bucket of {} to {}", pkg, bucket.key());
            return ExecutionResult.success(record.id(),
                    "standby bucket of %s set to %s%s".formatted(pkg, bucket.key(), resolved.note()));
        }

        shell.exec("am set-inactive %s %s".formatted(pkg, bucket.inactive()));
        log.info("Marked {} {} via app-inactive", pkg, bucket.inactive() ? "inactive" : "active");
        return ExecutionResult.success(record.id(),
                "%s marked %s (app-inactive fallback for %s)%s".formatted(
                        pkg, bucket.inactive() ? "inactive" : "active", bucket.key(), resolved.note()));
    }
}
