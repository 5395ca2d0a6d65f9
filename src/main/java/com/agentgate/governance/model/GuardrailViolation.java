package com.agentgate.governance.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A failed guardrail check")
public record GuardrailViolation(
        @Schema(description = "Violation kind", example = "missing_parameter") ViolationKind kind,
        @Schema(description = "Human-readable message", example = "Missing required parameter 'email_id' for action 'quarantine'") String message,
        @Schema(description = "Offending field, if any", example = "email_id", nullable = true) String field) {

    public static GuardrailViolation of(ViolationKind kind, String message) {
        return new GuardrailViolation(kind, message, null);
    }

    public static GuardrailViolation of(ViolationKind kind, String message, String field) {
        return new GuardrailViolation(kind, message, field);
    }
}
