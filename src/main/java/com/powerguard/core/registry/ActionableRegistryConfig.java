package com.powerguard.core.registry;

import com.powerguard.core.handler.BackgroundDataHandler;
import com.powerguard.core.handler.BatterySaverHandler;
import com.powerguard.core.handler.CpuThrottleHandler;
import com.powerguard.core.handler.DataSaverHandler;
import com.powerguard.core.handler.KillAppHandler;
import com.powerguard.core.handler.StandbyBucketHandler;
import com.powerguard.core.handler.UsageAlertHandler;
import com.powerguard.core.handler.WakeLockHandler;
import com.powerguard.core.model.ActionableType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static com.powerguard.core.registry.ActionableRegistry.FIELD_ID;
import static com.powerguard.core.registry.ActionableRegistry.FIELD_TARGET;

/**
 * Binds every supported {@link ActionableType} to its handler and seals the registry.
 * Adding a type means adding its enum constant, a handler and a line here.
 */
@Configuration
public class ActionableRegistryConfig {

    @Bean
    public ActionableRegistry actionableRegistry(StandbyBucketHandler standbyBucketHandler,
                                                 BackgroundDataHandler backgroundDataHandler,
                                                 KillAppHandler killAppHandler,
                                                 WakeLockHandler wakeLockHandler,
                                                 CpuThrottleHandler cpuThrottleHandler,
                                                 BatterySaverHandler batterySaverHandler,
                                                 DataSaverHandler dataSaverHandler,
                                                 UsageAlertHandler usageAlertHandler) {
        var registry = new ActionableRegistry();
        List<String> appScoped = List.of(FIELD_ID, FIELD_TARGET);
        List<String> deviceScoped = List.of(FIELD_ID);

        registry.register(ActionableType.SET_STANDBY_BUCKET, standbyBucketHandler, appScoped);
        registry.register(ActionableType.RESTRICT_BACKGROUND_DATA, backgroundDataHandler, appScoped);
        registry.register(ActionableType.KILL_APP, killAppHandler, appScoped);
        registry.register(ActionableType.MANAGE_WAKE_LOCKS, wakeLockHandler, appScoped);
        registry.register(ActionableType.THROTTLE_CPU_USAGE, cpuThrottleHandler, appScoped);
        registry.register(ActionableType.ENABLE_BATTERY_SAVER, batterySaverHandler, deviceScoped);
        registry.register(ActionableType.ENABLE_DATA_SAVER, dataSaverHandler, deviceScoped);
        registry.register(ActionableType.SET_BATTERY_ALERT, usageAlertHandler, deviceScoped);
        registry.register(ActionableType.SET_DATA_ALERT, usageAlertHandler, deviceScoped);
        registry.seal();
        return registry;
    }
}
