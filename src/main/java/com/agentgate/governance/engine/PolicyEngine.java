package com.agentgate.governance.engine;

import com.agentgate.governance.config.MetricsConfig;
import com.agentgate.governance.model.Budget;
import com.agentgate.governance.model.Decision;
import com.agentgate.governance.model.Effect;
import com.agentgate.governance.model.PolicyRule;
import com.agentgate.governance.model.RuleSetSnapshot;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides allow / deny / needs_approval for an agent action.
 *
 * <p>Rule selection: candidates are rules whose agent and action equal the call's or are
 * the wildcard, and whose conditions all hold. The winner is the highest priority; ties go
 * to the more specific rule, then deny over allow over needs_approval, then the smaller id.
 * A budget ceiling overrides whatever the rules decided.
 *
 * <p>{@link #evaluate} is the pure form, used directly by simulations against rule sets
 * that are not installed.
 */
@Component
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    public static final String ESTIMATED_OPS = "estimated_ops";
    public static final String ESTIMATED_COST_CENTS = "estimated_cost_cents";
    public static final String ESTIMATED_DURATION_MS = "estimated_duration_ms";

    static final Comparator<PolicyRule> PRECEDENCE =
            Comparator.comparingInt(PolicyRule::getPriority).reversed()
                    .thenComparing(Comparator.comparingInt(PolicyRule::specificity).reversed())
                    .thenComparingInt(rule -> rule.getEffect().tieBreakRank())
                    .thenComparing(PolicyRule::getId);

    private final RuleStore ruleStore;
    private final MetricsConfig metricsConfig;

    public PolicyEngine(RuleStore ruleStore, MetricsConfig metricsConfig) {
        this.ruleStore = ruleStore;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Decide against the currently installed snapshot.
     */
    @Observed(name = "policy.decide", contextualName = "policy-decide")
    public Decision decide(String agent, String action, Map<String, Object> context) {
        Decision decision = evaluate(ruleStore.current(), ruleStore.getDefaultEffect(), agent, action, context);
        metricsConfig.recordDecision(decision.getEffect(), decision.getMatchedRuleId() != null);

        if (log.isDebugEnabled()) {
            log.debug("Decision for {}:{} -> {} (rule={}, budgetOk={})",
                    agent, action, decision.getEffect().getValue(),
                    decision.getMatchedRuleId(), decision.isBudgetOk());
        }
        return decision;
    }

    public static Decision evaluate(RuleSetSnapshot snapshot, Effect defaultEffect,
                                    String agent, String action, Map<String, Object> context) {
        Map<String, Object> ctx = context != null ? context : Map.of();

        Optional<PolicyRule> winner = snapshot.getRules().stream()
                .filter(rule -> rule.appliesTo(agent, action))
                .filter(rule -> conditionsMatch(rule.getConditions(), ctx))
                .min(PRECEDENCE);

        Decision.DecisionBuilder decision = winner
                .map(rule -> Decision.builder()
                        .effect(rule.getEffect())
                        .matchedRuleId(rule.getId())
                        .reason(rule.getReason()))
                .orElseGet(() -> Decision.builder()
                        .effect(defaultEffect)
                        .reason(Decision.DEFAULT_REASON));

        String budgetViolation = checkBudget(snapshot.budgetFor(agent, action), ctx);
        if (budgetViolation != null) {
            return decision.effect(Effect.DENY)
                    .reason(budgetViolation)
                    .budgetOk(false)
                    .build();
        }
        return decision.budgetOk(true).build();
    }

    /**
     * All conditions must hold. A numeric context value matches when it is at least the
     * threshold; anything else matches on equality. A missing field never matches.
     */
    static boolean conditionsMatch(Map<String, Object> conditions, Map<String, Object> context) {
        if (conditions == null || conditions.isEmpty()) return true;

        for (Map.Entry<String, Object> condition : conditions.entrySet()) {
            if (!context.containsKey(condition.getKey())) return false;
            if (!conditionMatches(context.get(condition.getKey()), condition.getValue())) return false;
        }
        return true;
    }

    private static boolean conditionMatches(Object actual, Object threshold) {
        BigDecimal actualNumber = toDecimal(actual);
        BigDecimal thresholdNumber = toDecimal(threshold);
        if (actualNumber != null && thresholdNumber != null) {
            return actualNumber.compareTo(thresholdNumber) >= 0;
        }
        return Objects.equals(actual, threshold);
    }

    /**
     * @return a reason string if any estimate exceeds the budget, null otherwise
     */
    static String checkBudget(Budget budget, Map<String, Object> context) {
        if (budget == null) return null;

        String exceeded = exceeds(ESTIMATED_OPS, context, budget.getMaxOps());
        if (exceeded == null) exceeded = exceeds(ESTIMATED_COST_CENTS, context, budget.getMaxCostCents());
        if (exceeded == null) exceeded = exceeds(ESTIMATED_DURATION_MS, context, budget.getMaxDurationMs());
        return exceeded;
    }

    private static String exceeds(String field, Map<String, Object> context, Long limit) {
        if (limit == null) return null;
        BigDecimal estimate = toDecimal(context.get(field));
        if (estimate == null) return null;
        if (estimate.compareTo(BigDecimal.valueOf(limit)) > 0) {
            return "Budget exceeded: " + field + " " + estimate.toPlainString() + " > " + limit;
        }
        return null;
    }

    /**
     * Numbers only; booleans and numeric-looking strings are not numbers here.
     */
    static BigDecimal toDecimal(Object value) {
        if (!(value instanceof Number number)) return null;
        if (number instanceof BigDecimal decimal) return decimal;
        if (number instanceof BigInteger integer) return new BigDecimal(integer);
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            return BigDecimal.valueOf(d);
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
