package com.powerguard.core.handler;

import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.device.DeviceProperties;
import com.powerguard.device.DeviceShell;
import com.powerguard.device.PackageResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Restricts or allows an app's background network use.
 * <p>
 * Primary: the network policy's per-uid background restriction list. Fallback: the
 * {@code RUN_ANY_IN_BACKGROUND} app op, which stops the background work that would
 * use the network.
 */
@Component
public class BackgroundDataHandler extends AbstractActionableHandler {

    private static final Logger log = LoggerFactory.getLogger(BackgroundDataHandler.class);

    public enum BackgroundDataPolicy {
        RESTRICT,
        ALLOW
    }

    public static final BackgroundDataPolicy DEFAULT_POLICY = BackgroundDataPolicy.RESTRICT;

    private static final Map<String, BackgroundDataPolicy> MODES = Map.ofEntries(
            Map.entry("restrict", BackgroundDataPolicy.RESTRICT),
            Map.entry("restricted", BackgroundDataPolicy.RESTRICT),
            Map.entry("deny", BackgroundDataPolicy.RESTRICT),
            Map.entry("on", BackgroundDataPolicy.RESTRICT),
            Map.entry("enable", BackgroundDataPolicy.RESTRICT),
            Map.entry("allow", BackgroundDataPolicy.ALLOW),
            Map.entry("allowed", BackgroundDataPolicy.ALLOW),
            Map.entry("unrestricted", BackgroundDataPolicy.ALLOW),
            Map.entry("off", BackgroundDataPolicy.ALLOW),
            Map.entry("disable", BackgroundDataPolicy.ALLOW)
    );

    private final DeviceShell shell;
    private final PackageResolver packageResolver;

    public BackgroundDataHandler(DeviceShell shell, PackageResolver packageResolver, DeviceProperties properties) {
        super(properties);
        this.shell = shell;
        this.packageResolver = packageResolver;
    }

    @Override
    public CapabilityDomain domain() {
        return CapabilityDomain.BACKGROUND_TRANSFER;
    }

    @Override
    protected ExecutionResult apply(ActionableRecord record, CapabilityTier tier) {
        var resolved = RequestedModes.resolve(record.requestedMode(), MODES, defaultFor(record));
        BackgroundDataPolicy policy = resolved.mode();
        String pkg = record.target();

        if (tier == CapabilityTier.PRIMARY) {
            OptionalInt uid = packageResolver.uidOf(pkg);
            if (uid.isEmpty()) {
                return ExecutionResult.failed(record.id(), "package not installed: " + pkg);
            }
            String verb = policy == BackgroundDataPolicy.RESTRICT ? "add" : "remove";
            shell.exec("cmd netpolicy %s restrict-background-blacklist %d".formatted(verb, uid.getAsInt()));
            log.info("Background data for {} (uid {}) set to {}", pkg, uid.getAsInt(), policy);
            return ExecutionResult.success(record.id(),
                    "background data %s for %s (uid %d)%s".formatted(describe(policy), pkg, uid.getAsInt(), resolved.note()));
        }

        String opMode = policy == BackgroundDataPolicy.RESTRICT ? "ignore" : "allow";
        shell.exec("cmd appops set %s RUN_ANY_IN_BACKGROUND %s".formatted(pkg, opMode));
        log.info("Background running for {} set to {} via app ops", pkg, opMode);
        return ExecutionResult.success(record.id(),
                "background activity %s for %s (app-op fallback)%s".formatted(describe(policy), pkg, resolved.note()));
    }

    /**
     * Older recommendation payloads carry {@code enabled=false} instead of a mode to lift the restriction.
     */
    private static BackgroundDataPolicy defaultFor(ActionableRecord record) {
        return record.parameter("enabled").filter("false"::equalsIgnoreCase).isPresent()
                ? BackgroundDataPolicy.ALLOW
                : DEFAULT_POLICY;
    }

    private static String describe(BackgroundDataPolicy policy) {
        return policy == BackgroundDataPolicy.RESTRICT ? "restricted" : "allowed";
    }
}
