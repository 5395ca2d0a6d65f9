package com.agentgate.governance.engine;

import com.agentgate.governance.model.Budget;
import com.agentgate.governance.model.Effect;
import com.agentgate.governance.model.LintIssue;
import com.agentgate.governance.model.LintReport;
import com.agentgate.governance.model.PolicyRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static checks over a rule set before it is installed.
 * Errors block installation; warnings and info are returned to the author.
 */
@Component
public class RuleSetLinter {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 1000;
    static final int MIN_REASON_LENGTH = 10;
    static final String THRESHOLD_PREFIX = "min_";

    public LintReport lint(List<PolicyRule> rules, Map<String, Budget> budgets) {
        LintReport report = new LintReport();
        List<PolicyRule> ruleList = rules != null ? rules : List.of();

        checkRequiredFields(ruleList, report);
        checkDuplicateIds(ruleList, report);
        checkReasons(ruleList, report);
        checkConditions(ruleList, report);
        checkConflicts(ruleList, report);
        checkUnreachable(ruleList, report);
        checkBudgets(budgets != null ? budgets : Map.of(), report);

        return report;
    }

    private void checkRequiredFields(List<PolicyRule> rules, LintReport report) {
        for (int idx = 0; idx < rules.size(); idx++) {
            PolicyRule rule = rules.get(idx);
            if (rule == null) {
                report.add(new LintIssue(null, LintIssue.ERROR, "Rule at index " + idx + " is null", idx, null));
                continue;
            }
            String id = rule.getId();
            if (isBlank(id)) {
                report.add(new LintIssue(null, LintIssue.ERROR,
                        "Rule at index " + idx + " is missing an 'id' field", idx, null));
            }
            if (isBlank(rule.getAgent())) {
                report.add(new LintIssue(id, LintIssue.ERROR,
                        "Rule '" + label(rule, idx) + "' is missing an 'agent' field", idx,
                        "Use an agent name or '*'"));
            }
            if (isBlank(rule.getAction())) {
                report.add(new LintIssue(id, LintIssue.ERROR,
                        "Rule '" + label(rule, idx) + "' is missing an 'action' field", idx,
                        "Use an action name or '*'"));
            }
            if (rule.getEffect() == null) {
                report.add(new LintIssue(id, LintIssue.ERROR,
                        "Rule '" + label(rule, idx) + "' is missing an 'effect' field", idx,
                        "Use allow, deny or needs_approval"));
            }
            if (rule.getPriority() < MIN_PRIORITY || rule.getPriority() > MAX_PRIORITY) {
                report.add(new LintIssue(id, LintIssue.ERROR,
                        "Rule '" + label(rule, idx) + "' has priority " + rule.getPriority()
                                + " outside " + MIN_PRIORITY + ".." + MAX_PRIORITY, idx, null));
            }
        }
    }

    private void checkDuplicateIds(List<PolicyRule> rules, LintReport report) {
        Map<String, Integer> seen = new HashMap<>();
        for (int idx = 0; idx < rules.size(); idx++) {
            if (rules.get(idx) == null) continue;
            String id = rules.get(idx).getId();
            if (isBlank(id)) continue;

            Integer first = seen.putIfAbsent(id, idx);
            if (first != null) {
                report.add(new LintIssue(id, LintIssue.ERROR,
                        "Duplicate rule ID '" + id + "' (first seen at index " + first + ")", idx,
                        "Use a unique ID like '" + id + "_v2'"));
            }
        }
    }

    private void checkReasons(List<PolicyRule> rules, LintReport report) {
        for (int idx = 0; idx < rules.size(); idx++) {
            PolicyRule rule = rules.get(idx);
            if (rule == null) continue;
            String reason = rule.getReason();
            if (isBlank(reason)) {
                report.add(new LintIssue(rule.getId(), LintIssue.ERROR,
                        "Rule '" + label(rule, idx) + "' is missing a 'reason' field", idx,
                        "Add a clear explanation for audit and debugging"));
            } else if (reason.trim().length() < MIN_REASON_LENGTH) {
                report.add(new LintIssue(rule.getId(), LintIssue.WARNING,
                        "Rule '" + label(rule, idx) + "' has a very short reason (< " + MIN_REASON_LENGTH + " chars)",
                        idx, "Provide a more detailed explanation"));
            }
        }
    }

    private void checkConditions(List<PolicyRule> rules, LintReport report) {
        for (int idx = 0; idx < rules.size(); idx++) {
            PolicyRule rule = rules.get(idx);
            if (rule == null || rule.getConditions() == null) continue;

            for (Map.Entry<String, Object> condition : rule.getConditions().entrySet()) {
                String field = condition.getKey();
                if (!field.isEmpty() && "<>=!".indexOf(field.charAt(0)) >= 0) {
                    report.add(new LintIssue(rule.getId(), LintIssue.WARNING,
                            "Rule '" + label(rule, idx) + "' has suspicious condition key: '" + field + "'",
                            idx, "Condition keys are context field names; numeric values already mean '>='"));
                } else if (PolicyEngine.toDecimal(condition.getValue()) != null
                        && !field.startsWith(THRESHOLD_PREFIX)) {
                    report.add(new LintIssue(rule.getId(), LintIssue.INFO,
                            "Rule '" + label(rule, idx) + "' condition '" + field + "' matches values >= "
                                    + condition.getValue(),
                            idx, "Consider naming the context field '" + THRESHOLD_PREFIX + field
                                    + "' so the threshold reads as a minimum"));
                }
            }
        }
    }

    private void checkConflicts(List<PolicyRule> rules, LintReport report) {
        for (Map.Entry<String, List<Integer>> group : groupByTarget(rules).entrySet()) {
            List<Integer> indexes = group.getValue();
            if (indexes.size() < 2) continue;

            List<String> allowIds = new ArrayList<>();
            List<String> denyIds = new ArrayList<>();
            for (int idx : indexes) {
                PolicyRule rule = rules.get(idx);
                if (rule.getEffect() == Effect.ALLOW) allowIds.add(rule.getId());
                if (rule.getEffect() == Effect.DENY) denyIds.add(rule.getId());
            }
            if (!allowIds.isEmpty() && !denyIds.isEmpty()) {
                int top = byPriority(rules, indexes).get(0);
                report.add(new LintIssue(rules.get(top).getId(), LintIssue.WARNING,
                        "Conflicting allow/deny rules for " + group.getKey() + ": allow=" + allowIds
                                + ", deny=" + denyIds,
                        top, "Ensure conditions are mutually exclusive or use priority to order correctly"));
            }
        }
    }

    /**
     * A rule is unreachable when an unconditional rule for the same agent/action has a
     * strictly higher priority.
     */
    private void checkUnreachable(List<PolicyRule> rules, LintReport report) {
        for (List<Integer> indexes : groupByTarget(rules).values()) {
            if (indexes.size() < 2) continue;

            PolicyRule shadow = null;
            for (int idx : byPriority(rules, indexes)) {
                PolicyRule rule = rules.get(idx);
                if (shadow != null && rule.getPriority() < shadow.getPriority()) {
                    report.add(new LintIssue(rule.getId(), LintIssue.WARNING,
                            "Rule '" + label(rule, idx) + "' is unreachable (shadowed by '" + shadow.getId()
                                    + "' with higher priority and no conditions)",
                            idx, "Add conditions to '" + shadow.getId() + "' or raise the priority of '"
                                    + label(rule, idx) + "'"));
                } else if (shadow == null && (rule.getConditions() == null || rule.getConditions().isEmpty())) {
                    shadow = rule;
                }
            }
        }
    }

    private void checkBudgets(Map<String, Budget> budgets, LintReport report) {
        for (Map.Entry<String, Budget> entry : budgets.entrySet()) {
            String key = entry.getKey();
            String[] parts = key == null ? new String[0] : key.split(":", -1);
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                report.add(new LintIssue(null, LintIssue.ERROR,
                        "Budget key '" + key + "' must have the form 'agent:action'", null, null));
            }
            Budget budget = entry.getValue();
            if (budget == null) {
                report.add(new LintIssue(null, LintIssue.ERROR, "Budget '" + key + "' is empty", null, null));
                continue;
            }
            checkNonNegative(key, "maxDurationMs", budget.getMaxDurationMs(), report);
            checkNonNegative(key, "maxOps", budget.getMaxOps(), report);
            checkNonNegative(key, "maxCostCents", budget.getMaxCostCents(), report);
        }
    }

    private void checkNonNegative(String key, String field, Long value, LintReport report) {
        if (value != null && value < 0) {
            report.add(new LintIssue(null, LintIssue.ERROR,
                    "Budget '" + key + "' has negative " + field + ": " + value, null, null));
        }
    }

    private static Map<String, List<Integer>> groupByTarget(List<PolicyRule> rules) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int idx = 0; idx < rules.size(); idx++) {
            PolicyRule rule = rules.get(idx);
            if (rule == null || isBlank(rule.getAgent()) || isBlank(rule.getAction())) continue;
            groups.computeIfAbsent(rule.getAgent() + ":" + rule.getAction(), k -> new ArrayList<>()).add(idx);
        }
        return groups;
    }

    private static List<Integer> byPriority(List<PolicyRule> rules, List<Integer> indexes) {
        List<Integer> sorted = new ArrayList<>(indexes);
        sorted.sort(Comparator.comparingInt((Integer idx) -> rules.get(idx).getPriority()).reversed());
        return sorted;
    }

    private static String label(PolicyRule rule, int idx) {
        return isBlank(rule.getId()) ? "rule_" + idx : rule.getId();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
