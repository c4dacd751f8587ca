package com.powerguard.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "powerguard.engine")
public class EngineProperties {

    /** Upper bound for one handler call; a slower call yields a FAILED "timeout" result. */
    private Duration handlerTimeout = Duration.ofSeconds(30);

    public Duration getHandlerTimeout() { return handlerTimeout; }
    public void setHandlerTimeout(Duration handlerTimeout) { this.handlerTimeout = handlerTimeout; }
}
