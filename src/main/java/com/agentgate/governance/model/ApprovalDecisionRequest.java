package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A reviewer's signed decision")
public class ApprovalDecisionRequest {

    @Schema(description = "approved or rejected", example = "approved")
    private ApprovalVerdict decision;

    @Schema(description = "Reviewer identity", example = "alice@example.com")
    private String approver;

    @Schema(description = "Hex HMAC-SHA256 of id:decision:approver:expiresAt")
    private String signature;

    @Schema(description = "Optional comment", nullable = true)
    private String comment;
}
