package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Immutable rule set. Replaced as a whole, never edited in place.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "The complete rule set and budgets in force")
public class RuleSetSnapshot {

    @Schema(description = "Monotonic version, assigned by the store on replacement", example = "7")
    long version;

    @Schema(description = "Policy rules")
    @Builder.Default
    List<PolicyRule> rules = List.of();

    @Schema(description = "Budgets keyed by agent:action", example = "{\"inbox_triage:quarantine\": {\"maxCostCents\": 100}}")
    @Builder.Default
    Map<String, Budget> budgets = Map.of();

    @Schema(description = "Epoch millis of the last replacement", example = "1739886764000")
    long updatedAt;

    public static RuleSetSnapshot empty() {
        return RuleSetSnapshot.builder().build();
    }

    /**
     * Copy with unmodifiable rule, condition and budget collections.
     */
    public RuleSetSnapshot frozen() {
        return toBuilder()
                .rules(rules == null ? List.of() : rules.stream().map(PolicyRule::frozen).toList())
                .budgets(budgets == null ? Map.of() : Map.copyOf(budgets))
                .build();
    }

    public Budget budgetFor(String agent, String action) {
        return budgets.get(Budget.key(agent, action));
    }
}
