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
@Schema(description = "Request a human approval")
public class ApprovalCreateRequest {

    @Schema(description = "Agent", example = "inbox_triage")
    private String agent;

    @Schema(description = "Action", example = "quarantine")
    private String action;

    @Schema(description = "Context to store for audit")
    @Builder.Default
    private Map<String, Object> context = new HashMap<>();

    @Schema(description = "Why approval is needed", example = "Quarantine requires human approval")
    private String reason;

    @Schema(description = "Seconds until the request lapses; the configured default when omitted", example = "3600")
    private Long ttlSeconds;

    @Schema(description = "Requester identity", nullable = true, example = "inbox_triage")
    private String requestedBy;

    @Schema(description = "Rule that required the approval", nullable = true)
    private String policyRuleId;
}
