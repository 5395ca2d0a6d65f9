package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * A handler-level failure, reported separately from guardrail violations.
 */
@Schema(description = "Error raised by the action handler")
public record ExecutionError(
        @Schema(description = "Exception type", example = "IllegalStateException") String type,
        @Schema(description = "Original error message", example = "mailbox unavailable") String message) {

    public static ExecutionError from(Throwable t) {
        return new ExecutionError(t.getClass().getSimpleName(), t.getMessage());
    }
}
