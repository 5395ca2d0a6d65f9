package com.agentgate.governance.controller;

import com.agentgate.governance.config.AerospikeConfig;
import com.agentgate.governance.config.GovernanceConfig;
import com.agentgate.governance.model.EnforcementMode;
import com.agentgate.governance.service.ApprovalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime governance configuration")
public class ConfigController {

    private final GovernanceConfig governanceConfig;
    private final AerospikeConfig aerospikeConfig;

    public ConfigController(GovernanceConfig governanceConfig, AerospikeConfig aerospikeConfig) {
        this.governanceConfig = governanceConfig;
        this.aerospikeConfig = aerospikeConfig;
    }

    // ── Governance ──

    @Operation(summary = "Get effective governance settings",
            description = "The HMAC secret is never returned, only whether one is configured.")
    @GetMapping("/governance")
    public ResponseEntity<Map<String, Object>> getGovernance() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("enforcementMode", governanceConfig.getEnforcementMode());
        settings.put("defaultApprovalTtlSeconds", governanceConfig.getDefaultApprovalTtlSeconds());
        settings.put("guardrailsEnabled", governanceConfig.isGuardrailsEnabled());
        settings.put("defaultEffect", governanceConfig.getDefaultEffect());
        settings.put("ruleRefreshSeconds", governanceConfig.getRuleRefreshSeconds());
        settings.put("hmacSecretConfigured", governanceConfig.hasHmacSecret());
        settings.put("requiredParams", governanceConfig.getRequiredParams());
        return ResponseEntity.ok(settings);
    }

    @Operation(summary = "Update governance settings",
            description = "Only enforcementMode, defaultApprovalTtlSeconds and guardrailsEnabled can change at runtime. "
                    + "Changes apply immediately but reset on restart.")
    @PutMapping("/governance")
    public ResponseEntity<?> updateGovernance(@RequestBody Map<String, Object> body) {
        EnforcementMode mode = governanceConfig.getEnforcementMode();
        if (body.containsKey("enforcementMode")) {
            try {
                mode = EnforcementMode.fromValue(String.valueOf(body.get("enforcementMode")));
            } catch (IllegalArgumentException e) {
                return badRequest(e.getMessage(), "enforcementMode");
            }
        }
        if (mode == EnforcementMode.STRICT && !governanceConfig.hasHmacSecret()) {
            return badRequest("strict mode requires governance.hmac-secret", "enforcementMode");
        }

        long ttl = toLong(body, "defaultApprovalTtlSeconds", governanceConfig.getDefaultApprovalTtlSeconds());
        if (ttl <= 0 || ttl > ApprovalService.MAX_TTL_SECONDS) {
            return badRequest("defaultApprovalTtlSeconds must be between 1 and " + ApprovalService.MAX_TTL_SECONDS,
                    "defaultApprovalTtlSeconds");
        }

        Object guardrails = body.get("guardrailsEnabled");
        if (guardrails != null && !(guardrails instanceof Boolean)) {
            return badRequest("guardrailsEnabled must be true or false", "guardrailsEnabled");
        }

        governanceConfig.setEnforcementMode(mode);
        governanceConfig.setDefaultApprovalTtlSeconds(ttl);
        if (guardrails != null) governanceConfig.setGuardrailsEnabled((Boolean) guardrails);

        return getGovernance();
    }

    // ── Aerospike (read-only) ──

    @Operation(summary = "Get Aerospike connection info (read-only)")
    @GetMapping("/aerospike")
    public ResponseEntity<Map<String, Object>> getAerospikeInfo() {
        return ResponseEntity.ok(Map.of(
                "host", aerospikeConfig.getHost(),
                "port", aerospikeConfig.getPort(),
                "namespace", aerospikeConfig.getNamespace()
        ));
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private long toLong(Map<String, Object> body, String key, long defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.longValue();
        try { return Long.parseLong(v.toString()); } catch (NumberFormatException e) { return -1; }
    }
}
