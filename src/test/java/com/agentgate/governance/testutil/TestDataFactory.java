package com.agentgate.governance.testutil;

import com.agentgate.governance.model.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");
    public static final String SECRET = "test-secret";

    private TestDataFactory() {}

    public static PolicyRule rule(String id, String agent, String action, Effect effect, int priority) {
        return PolicyRule.builder()
                .id(id)
                .agent(agent)
                .action(action)
                .effect(effect)
                .priority(priority)
                .reason("Test rule " + id)
                .build();
    }

    public static PolicyRule rule(String id, String agent, String action, Effect effect, int priority,
                                  Map<String, Object> conditions) {
        return rule(id, agent, action, effect, priority).toBuilder()
                .conditions(conditions)
                .build();
    }

    public static RuleSetSnapshot snapshot(List<PolicyRule> rules) {
        return snapshot(rules, Map.of());
    }

    public static RuleSetSnapshot snapshot(List<PolicyRule> rules, Map<String, Budget> budgets) {
        return RuleSetSnapshot.builder()
                .version(1)
                .rules(rules)
                .budgets(budgets)
                .updatedAt(NOW.toEpochMilli())
                .build()
                .frozen();
    }

    public static Decision decision(Effect effect, String ruleId) {
        return Decision.builder()
                .effect(effect)
                .matchedRuleId(ruleId)
                .reason(ruleId == null ? Decision.DEFAULT_REASON : "Test rule " + ruleId)
                .budgetOk(true)
                .build();
    }

    public static Approval approval(String id, ApprovalStatus status, Instant requestedAt, long ttlSeconds) {
        return Approval.builder()
                .id(id)
                .agent("inbox_triage")
                .action("quarantine")
                .context(new HashMap<>(Map.of("email_id", "e1")))
                .reason("Quarantine requires human approval")
                .status(status)
                .requestedAt(requestedAt)
                .expiresAt(requestedAt.plusSeconds(ttlSeconds))
                .build();
    }

    public static ExecutionPlan plan(String agent, String action, Map<String, Object> context) {
        return ExecutionPlan.builder()
                .agent(agent)
                .action(action)
                .context(new HashMap<>(context))
                .build();
    }

    public static ApprovalCreateRequest approvalRequest(Long ttlSeconds) {
        return ApprovalCreateRequest.builder()
                .agent("inbox_triage")
                .action("quarantine")
                .context(new HashMap<>(Map.of("email_id", "e1", "risk_score", 75)))
                .reason("Quarantine requires human approval")
                .ttlSeconds(ttlSeconds)
                .requestedBy("inbox_triage")
                .build();
    }
}
