package com.agentgate.governance.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A single lint finding")
public record LintIssue(
        @Schema(description = "Rule the finding refers to", example = "global-deny-delete", nullable = true) String ruleId,
        @Schema(description = "Severity", example = "warning", allowableValues = {"error", "warning", "info"}) String severity,
        @Schema(description = "What is wrong", example = "Duplicate rule ID 'r1' (first seen at index 0)") String message,
        @Schema(description = "Index of the rule in the submitted list", example = "3", nullable = true) Integer index,
        @Schema(description = "Suggested fix", nullable = true) String suggestion) {

    public static final String ERROR = "error";
    public static final String WARNING = "warning";
    public static final String INFO = "info";
}
