package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "A prioritized policy rule gating one agent/action pair (or wildcards)")
public class PolicyRule {

    public static final String WILDCARD = "*";

    @Schema(description = "Unique rule identifier within a snapshot", example = "inbox-triage-deny-high-risk")
    String id;

    @Schema(description = "Agent name, or * for any agent", example = "inbox_triage")
    String agent;

    @Schema(description = "Action name, or * for any action", example = "quarantine")
    String action;

    @Schema(description = "Conditions ANDed together. Numeric thresholds match when context[field] >= threshold, "
            + "anything else matches on equality. A field missing from the context never matches.",
            example = "{\"risk_score\": 70}")
    @Builder.Default
    Map<String, Object> conditions = Map.of();

    @Schema(description = "Effect applied when this rule wins", example = "deny")
    Effect effect;

    @Schema(description = "Priority 0-1000, higher wins", example = "100")
    int priority;

    @Schema(description = "Human-readable reason, required", example = "High-risk quarantine needs a human")
    String reason;

    /**
     * Copy whose conditions map is detached from the caller's and unmodifiable.
     */
    public PolicyRule frozen() {
        Map<String, Object> copy = conditions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
        return toBuilder().conditions(copy).build();
    }

    public boolean appliesTo(String candidateAgent, String candidateAction) {
        return (WILDCARD.equals(agent) || agent.equals(candidateAgent))
                && (WILDCARD.equals(action) || action.equals(candidateAction));
    }

    /**
     * Number of exact (non-wildcard) target fields, 0 to 2.
     */
    public int specificity() {
        int score = 0;
        if (!WILDCARD.equals(agent)) score++;
        if (!WILDCARD.equals(action)) score++;
        return score;
    }
}
