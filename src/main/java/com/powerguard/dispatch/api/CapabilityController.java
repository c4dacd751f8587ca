package com.powerguard.dispatch.api;

import com.powerguard.core.capability.CapabilityProber;
import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Capability tiers as seen by the engine. The permission flow calls the invalidate
 * endpoints after the user grants or revokes access.
 */
@RestController
@RequestMapping("/api/v1/capabilities")
public class CapabilityController {

    private static final Logger log = LoggerFactory.getLogger(CapabilityController.class);

    private final CapabilityProber prober;

    public CapabilityController(CapabilityProber prober) {
        this.prober = prober;
    }

    /**
     * GET /api/v1/capabilities: Cached tiers; with {@code probe=true} every domain is probed first.
     */
    @GetMapping
    public ResponseEntity<Map<String, String>> capabilities(@RequestParam(defaultValue = "false") boolean probe) {
        var tiers = new LinkedHashMap<String, String>();
        if (probe) {
            for (CapabilityDomain domain : CapabilityDomain.values()) {
                tiers.put(domain.name(), prober.probe(domain).name());
            }
        } else {
            for (Map.Entry<CapabilityDomain, CapabilityTier> entry : prober.snapshot().entrySet()) {
                tiers.put(entry.getKey().name(), entry.getValue().name());
            }
        }
        return ResponseEntity.ok(tiers);
    }

    /**
     * POST /api/v1/capabilities/{domain}/invalidate: Forget one domain's tier.
     */
    @PostMapping("/{domain}/invalidate")
    public ResponseEntity<Map<String, String>> invalidate(@PathVariable String domain) {
        CapabilityDomain parsed;
        try {
            parsed = CapabilityDomain.fromName(domain);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        prober.invalidate(parsed);
        log.info("Capability {} invalidated via API", parsed);
        return ResponseEntity.ok(Map.of("domain", parsed.name(), "status", "invalidated"));
    }

    /**
     * POST /api/v1/capabilities/invalidate: Forget every cached tier.
     */
    @PostMapping("/invalidate")
    public ResponseEntity<Map<String, String>> invalidateAll() {
        prober.invalidateAll();
        return ResponseEntity.ok(Map.of("domain", "ALL", "status", "invalidated"));
    }
}
