package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

@Schema(description = "A complete rule set, replacing the active one as a whole")
public record RuleSetRequest(
        @Schema(description = "Policy rules") List<PolicyRule> rules,
        @Schema(description = "Budgets keyed by 'agent:action'", example = "{\"inbox_triage:quarantine\": {\"maxCostCents\": 100}}")
        Map<String, Budget> budgets) {}
