package com.agentgate.governance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Outcome of a policy evaluation")
public class Decision {

    public static final String DEFAULT_REASON = "default";

    @Schema(description = "Effect to apply", example = "deny")
    Effect effect;

    @Schema(description = "Id of the winning rule; null when the store default applied",
            example = "inbox-triage-deny-high-risk", nullable = true)
    String matchedRuleId;

    @Schema(description = "Why this effect was chosen", example = "high risk")
    String reason;

    @Schema(description = "False when a supplied estimate exceeded the agent/action budget", example = "true")
    boolean budgetOk;

    @JsonIgnore
    public boolean isDenied() {
        return effect == Effect.DENY;
    }

    @JsonIgnore
    public boolean requiresApproval() {
        return effect == Effect.NEEDS_APPROVAL;
    }
}
