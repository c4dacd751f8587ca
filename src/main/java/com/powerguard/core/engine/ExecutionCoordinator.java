package com.powerguard.core.engine;

import com.powerguard.core.capability.CapabilityProber;
import com.powerguard.core.events.EventBus;
import com.powerguard.core.events.PowerGuardEvent;
import com.powerguard.core.handler.AbstractActionableHandler;
import com.powerguard.core.handler.ActionableHandler;
import com.powerguard.core.history.OutcomeRecorder;
import com.powerguard.core.logging.MdcContext;
import com.powerguard.core.metrics.PowerGuardMetrics;
import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.ActionableType;
import com.powerguard.core.model.CapabilityTier;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.core.registry.ActionableRegistry;
import com.powerguard.core.registry.ValidationResult;
import com.powerguard.device.DeviceUnreachableException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a batch of actionables and produces exactly one {@link ExecutionResult} per record,
 * in input order.
 * <p>
 * Records run one after another. Each is validated against the {@link ActionableRegistry}
 * and its handler's {@link ActionableHandler#precheck}; only then does the tier for its
 * capability domain come from the {@link CapabilityProber}, and the bound handler is called
 * on a worker thread bounded by the handler timeout. A record that fails
 * for any reason never stops the records after it. Every result is handed to the
 * {@link OutcomeRecorder} as soon as it exists, so an interrupted batch leaves a prefix
 * of its outcomes in history.
 * <p>
 * Only one batch executes at a time.
 */
@Service
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    public static final String TIMEOUT = "timeout";
    private static final String MALFORMED = "MALFORMED";

    private static final DateTimeFormatter BATCH_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ActionableRegistry registry;
    private final CapabilityProber prober;
    private final OutcomeRecorder recorder;
    private final EventBus eventBus;
    private final PowerGuardMetrics metrics;
    private final Duration handlerTimeout;
    private final ExecutorService handlerExecutor;

    @Autowired
    public ExecutionCoordinator(ActionableRegistry registry,
                                CapabilityProber prober,
                                OutcomeRecorder recorder,
                                EventBus eventBus,
                                EngineProperties properties,
                                @Autowired(required = false) PowerGuardMetrics metrics) {
        this(registry, prober, recorder, eventBus, properties.getHandlerTimeout(), metrics);
    }

    public ExecutionCoordinator(ActionableRegistry registry,
                                CapabilityProber prober,
                                OutcomeRecorder recorder,
                                EventBus eventBus,
                                Duration handlerTimeout,
                                PowerGuardMetrics metrics) {
        this.registry = registry;
        this.prober = prober;
        this.recorder = recorder;
        this.eventBus = eventBus;
        this.handlerTimeout = handlerTimeout;
        this.metrics = metrics;
        this.handlerExecutor = Executors.newCachedThreadPool(workerThreadFactory());
    }

    public String generateBatchId() {
        return "PG-" + LocalDateTime.now().format(BATCH_ID_FORMAT) + "-"
                + UUID.randomUUID().toString().substring(0, 4).toUpperCase();
    }

    public List<ExecutionResult> executeBatch(List<ActionableRecord> records) {
        return executeBatch(generateBatchId(), records);
    }

    public synchronized List<ExecutionResult> executeBatch(String batchId, List<ActionableRecord> records) {
        long start = System.currentTimeMillis();
        MdcContext.setBatch(batchId);
        try {
            log.info("Executing batch {} with {} actionable(s)", batchId, records.size());
            eventBus.publish(PowerGuardEvent.of("batch.started", batchId, null, Map.of("size", records.size())));

            List<ExecutionResult> results = new ArrayList<>(records.size());
            for (ActionableRecord record : records) {
                ExecutionResult result = executeOne(batchId, record);
                results.add(result);
                persist(batchId, result);
                eventBus.publish(PowerGuardEvent.of("actionable.completed", batchId, record.id(), Map.of(
                        "type", String.valueOf(record.type()),
                        "status", result.status().name(),
                        "detail", Objects.toString(result.detail(), ""))));
            }

            long elapsed = System.currentTimeMillis() - start;
            long succeeded = results.stream().filter(ExecutionResult::isSuccess).count();
            log.info("Batch {} finished in {}ms: {}/{} succeeded", batchId, elapsed, succeeded, results.size());
            eventBus.publish(PowerGuardEvent.of("batch.completed", batchId, null, Map.of(
                    "size", results.size(),
                    "succeeded", succeeded)));
            if (metrics != null) {
                metrics.recordBatch(results.size(), elapsed);
            }
            return Collections.unmodifiableList(results);
        } finally {
            MdcContext.clear();
        }
    }

    private ExecutionResult executeOne(String batchId, ActionableRecord record) {
        long start = System.currentTimeMillis();
        MdcContext.setActionable(batchId, record.id(), String.valueOf(record.type()));
        try {
            if (record.isMalformed()) {
                log.warn("Rejected '{}': malformed actionable: {}", record.id(), record.defect());
                if (metrics != null) {
                    metrics.recordRejection(MALFORMED);
                }
                return ExecutionResult.failed(record.id(), "malformed actionable: " + record.defect());
            }

            ValidationResult validation = registry.validate(record);
            if (!validation.isValid()) {
                return reject(record, validation);
            }

            ActionableType type = record.resolvedType().orElseThrow();
            ActionableHandler handler = registry.resolve(type).orElseThrow();
            Optional<ExecutionResult> rejected = handler.precheck(record);
            if (rejected.isPresent()) {
                log.warn("{} '{}' rejected before probing: {}", type.key(), record.id(), rejected.get().detail());
                if (metrics != null) {
                    metrics.recordActionableExecution(type.key(), rejected.get().status(), System.currentTimeMillis() - start);
                }
                return conform(record, rejected.get());
            }

            CapabilityTier tier;
            try {
                tier = prober.resolveTier(type.domain());
            } catch (DeviceUnreachableException e) {
                log.warn("Device unreachable probing {} for '{}': {}", type.domain(), record.id(), e.getMessage());
                return ExecutionResult.failed(record.id(), AbstractActionableHandler.DEVICE_UNREACHABLE + e.getMessage());
            } catch (RuntimeException e) {
                log.error("Probing {} failed for '{}'", type.domain(), record.id(), e);
                return ExecutionResult.failed(record.id(), "capability probe failed: " + e.getMessage());
            }
            log.debug("Applying {} '{}' at tier {}", type.key(), record.id(), tier);

            ExecutionResult result = invokeWithTimeout(handler, record, tier);
            if (metrics != null) {
                metrics.recordActionableExecution(type.key(), result.status(), System.currentTimeMillis() - start);
            }
            if (result.isSuccess()) {
                log.info("{} '{}' succeeded: {}", type.key(), record.id(), result.detail());
            } else {
                log.warn("{} '{}' {}: {}", type.key(), record.id(), result.status(), result.detail());
            }
            return result;
        } finally {
            MdcContext.clearActionable();
        }
    }

    private ExecutionResult reject(ActionableRecord record, ValidationResult validation) {
        if (metrics != null) {
            metrics.recordRejection(validation.kind().name());
        }
        if (validation.kind() == ValidationResult.Kind.UNKNOWN_TYPE) {
            log.warn("Rejected '{}': unsupported type '{}'", record.id(), validation.detail());
            return ExecutionResult.unsupported(record.id(), "unsupported actionable type: " + validation.detail());
        }
        log.warn("Rejected '{}': missing {}", record.id(), validation.detail());
        return ExecutionResult.failed(record.id(), "missing required field: " + validation.detail());
    }

    private ExecutionResult invokeWithTimeout(ActionableHandler handler, ActionableRecord record, CapabilityTier tier) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<ExecutionResult> future = handlerExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return handler.handle(record, tier);
            } finally {
                MDC.clear();
            }
        });

        try {
            ExecutionResult result = future.get(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return conform(record, result);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (metrics != null) {
                metrics.recordTimeout(String.valueOf(record.type()));
            }
            return ExecutionResult.failed(record.id(), TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Handler {} threw for '{}'", handler.getClass().getSimpleName(), record.id(), cause);
            return ExecutionResult.failed(record.id(),
                    cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ExecutionResult.failed(record.id(), "interrupted");
        }
    }

    /**
     * Keeps the one-result-per-record pairing intact even if a handler misbehaves.
     */
    private static ExecutionResult conform(ActionableRecord record, ExecutionResult result) {
        if (result == null) {
            return ExecutionResult.failed(record.id(), "handler returned no result");
        }
        if (!Objects.equals(result.actionableId(), record.id())) {
            return new ExecutionResult(record.id(), result.status(), result.detail(), result.completedAt());
        }
        return result;
    }

    private void persist(String batchId, ExecutionResult result) {
        try {
            recorder.record(batchId, result);
        } catch (RuntimeException e) {
            log.error("Could not record outcome of '{}' ({}): {}", result.actionableId(), result.status(), e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        handlerExecutor.shutdownNow();
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "actionable-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
