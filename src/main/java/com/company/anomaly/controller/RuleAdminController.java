package com.company.anomaly.controller;

import com.company.anomaly.domain.RuleTable;
import com.company.anomaly.dto.response.RuleTableResponse;
import com.company.anomaly.service.RuleTableRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rule Table", description = "Inspect and reload the active rule table")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class RuleAdminController {

    private final RuleTableRegistry ruleTableRegistry;

    @GetMapping
    @Operation(summary = "Active rule table")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<RuleTableResponse> current() {
        return ResponseEntity.ok(toResponse(ruleTableRegistry.current()));
    }

    @PostMapping("/reload")
    @Operation(summary = "Reload the rule table",
            description = "Swaps in the new table atomically; an invalid table is rejected and the active one kept")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<RuleTableResponse> reload(@RequestParam(required = false) String location) {
        log.info("Rule table reload requested (location: {})", location != null ? location : "configured");

        RuleTable table = location != null
                ? ruleTableRegistry.reload(location)
                : ruleTableRegistry.reload();

        return ResponseEntity.ok(toResponse(table));
    }

    private RuleTableResponse toResponse(RuleTable table) {
        return RuleTableResponse.builder()
                .version(table.getVersion())
                .loadedAt(table.getLoadedAt())
                .tierCount(table.size())
                .tiers(table.allTiers().stream()
                        .map(tier -> RuleTableResponse.TierInfo.builder()
                                .component(tier.getComponent().getWireName())
                                .metricName(tier.getMetricName())
                                .comparison(tier.getComparison().getSymbol())
                                .threshold(tier.getThreshold())
                                .severity(tier.getSeverity().name())
                                .reasonTemplate(tier.getReasonTemplate())
                                .durationEstimateMinutes(tier.getDurationEstimateMinutes())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }
}
