package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Summary of one persisted rule set version")
public record RuleSetVersion(
        @Schema(description = "Snapshot version", example = "7") long version,
        @Schema(description = "Epoch millis when this version was installed", example = "1739886764000") long updatedAt,
        @Schema(description = "Number of rules", example = "20") int ruleCount,
        @Schema(description = "Number of budgets", example = "2") int budgetCount) {}
