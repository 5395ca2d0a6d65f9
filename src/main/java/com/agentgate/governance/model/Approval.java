package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A signed, time-boxed human authorization for one agent/action")
public class Approval {

    @Schema(description = "Approval id", example = "apr_5f2c0b7e9d1a4c3b8e6f")
    private String id;

    @Schema(description = "Agent the approval is bound to", example = "inbox_triage")
    private String agent;

    @Schema(description = "Action the approval is bound to", example = "quarantine")
    private String action;

    @Schema(description = "Context at request time, stored verbatim for audit")
    @Builder.Default
    private Map<String, Object> context = new HashMap<>();

    @Schema(description = "Why approval was requested", example = "Quarantine requires human approval")
    private String reason;

    @Schema(description = "Who asked for the approval", example = "inbox_triage")
    private String requestedBy;

    @Schema(description = "Rule that demanded the approval, if known", example = "inbox-triage-quarantine-requires-approval")
    private String policyRuleId;

    @Schema(description = "Lifecycle status; expired is derived from expiresAt", example = "pending")
    private ApprovalStatus status;

    @Schema(description = "Creation time (UTC)", example = "2026-10-18T12:00:00Z")
    private Instant requestedAt;

    @Schema(description = "Expiry time (UTC), always after requestedAt", example = "2026-10-18T13:00:00Z")
    private Instant expiresAt;

    @Schema(description = "Reviewer decision, set once", example = "approved")
    private ApprovalVerdict decision;

    @Schema(description = "Reviewer identity", example = "alice@example.com")
    private String approver;

    @Schema(description = "Hex HMAC-SHA256 over the canonical message")
    private String signature;

    @Schema(description = "Optional reviewer comment", example = "Verified sender is phishing")
    private String comment;

    @Schema(description = "When the decision was recorded")
    private Instant decidedAt;

    @Schema(description = "When the approval was consumed by an execution")
    private Instant executedAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Status as seen at {@code now}: a pending or approved record past its expiry reads as expired.
     */
    public ApprovalStatus effectiveStatus(Instant now) {
        if (status != null && status.canExpire() && isExpiredAt(now)) {
            return ApprovalStatus.EXPIRED;
        }
        return status;
    }
}
