package com.powerguard.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.powerguard.core.engine.ExecutionCoordinator;
import com.powerguard.core.model.ActionableRecord;
import com.powerguard.core.model.ActionableType;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.core.registry.ActionableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the recommendation service: submits actionable batches and lists
 * the supported actionable types.
 */
@RestController
@RequestMapping("/api/v1")
public class BatchController {

    private static final Logger log = LoggerFactory.getLogger(BatchController.class);

    private final ExecutionCoordinator coordinator;
    private final ActionableBatchReader batchReader;
    private final ActionableRegistry registry;

    public BatchController(ExecutionCoordinator coordinator,
                           ActionableBatchReader batchReader,
                           ActionableRegistry registry) {
        this.coordinator = coordinator;
        this.batchReader = batchReader;
        this.registry = registry;
    }

    /**
     * POST /api/v1/batches: Execute a batch synchronously and return one result per actionable.
     */
    @PostMapping("/batches")
    public ResponseEntity<?> executeBatch(@RequestBody JsonNode body) {
        List<ActionableRecord> records;
        try {
            records = batchReader.read(body);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected malformed batch: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        String batchId = coordinator.generateBatchId();
        List<ExecutionResult> results = coordinator.executeBatch(batchId, records);
        return ResponseEntity.ok(BatchResponse.of(batchId, results));
    }

    /**
     * GET /api/v1/actionables/types: The registered actionable taxonomy.
     */
    @GetMapping("/actionables/types")
    public ResponseEntity<List<Map<String, Object>>> listTypes() {
        var types = new ArrayList<Map<String, Object>>();
        for (ActionableType type : registry.registeredTypes()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("key", type.key());
            entry.put("domain", type.domain().name());
            entry.put("description", type.description());
            entry.put("required_fields", registry.requiredFields(type));
            types.add(entry);
        }
        return ResponseEntity.ok(types);
    }
}
