package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An action an agent wants executed")
public class ExecutionPlan {

    @Schema(description = "Agent proposing the action", example = "inbox_triage")
    private String agent;

    @Schema(description = "Action to execute", example = "quarantine")
    private String action;

    @Schema(description = "Context the policy is evaluated against", example = "{\"risk_score\": 50, \"email_id\": \"e1\"}")
    @Builder.Default
    private Map<String, Object> context = new HashMap<>();

    @Schema(description = "Action-specific parameters passed to the handler", example = "{\"label_name\": \"suspicious\"}")
    @Builder.Default
    private Map<String, Object> params = new HashMap<>();

    @Schema(description = "Approval to consume when the policy requires one", nullable = true)
    private String approvalId;

    /**
     * A field counts as supplied when present in either the context or the params.
     */
    public boolean hasField(String field) {
        return (context != null && context.containsKey(field))
                || (params != null && params.containsKey(field));
    }
}
