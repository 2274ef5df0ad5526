package com.company.anomaly.controller;

import com.company.anomaly.domain.RuleTable;
import com.company.anomaly.service.RollupEngine;
import com.company.anomaly.service.RuleTableRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service liveness")
@RequiredArgsConstructor
public class HealthController {

    private final RuleTableRegistry ruleTableRegistry;
    private final RollupEngine rollupEngine;

    @GetMapping
    @Operation(summary = "Health check")
    public ResponseEntity<Map<String, Object>> health() {
        RuleTable rules = ruleTableRegistry.current();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", rules.size() > 0 ? "UP" : "DEGRADED");
        response.put("timestamp", Instant.now());
        response.put("service", "anomaly-correlation-service");
        response.put("ruleTableVersion", rules.getVersion());
        response.put("ruleTiers", rules.size());
        response.put("liveRollupBuckets", rollupEngine.liveBucketCount());

        return ResponseEntity.ok(response);
    }
}
