package com.agentgate.governance.service;

import com.agentgate.governance.config.GovernanceConfig;
import com.agentgate.governance.engine.PolicyEngine;
import com.agentgate.governance.engine.RuleSetLinter;
import com.agentgate.governance.engine.RuleStore;
import com.agentgate.governance.exception.InvalidRuleSetException;
import com.agentgate.governance.model.Budget;
import com.agentgate.governance.model.Decision;
import com.agentgate.governance.model.Effect;
import com.agentgate.governance.model.LintReport;
import com.agentgate.governance.model.PolicyRule;
import com.agentgate.governance.model.RuleSetSnapshot;
import com.agentgate.governance.model.RuleSetVersion;
import com.agentgate.governance.model.RuleSetUpdateResult;
import com.agentgate.governance.model.SimulationCase;
import com.agentgate.governance.model.SimulationReport;
import com.agentgate.governance.model.SimulationRequest;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Service layer for the rule set: read, replace, lint, and what-if simulation.
 * Starts the periodic snapshot reload on startup.
 */
@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final RuleStore ruleStore;
    private final RuleSetLinter linter;
    private final PolicyEngine policyEngine;
    private final GovernanceConfig config;

    public RuleService(RuleStore ruleStore, RuleSetLinter linter, PolicyEngine policyEngine,
                       GovernanceConfig config) {
        this.ruleStore = ruleStore;
        this.linter = linter;
        this.policyEngine = policyEngine;
        this.config = config;
    }

    @PostConstruct
    public void init() {
        ruleStore.startRefresh(config.getRuleRefreshSeconds());
    }

    public RuleSetSnapshot getSnapshot() {
        return ruleStore.current();
    }

    public RuleSetUpdateResult replaceSnapshot(List<PolicyRule> rules, Map<String, Budget> budgets) {
        return ruleStore.replace(rules, budgets);
    }

    public RuleSetSnapshot getSnapshotVersion(long version) {
        return ruleStore.snapshotAt(version);
    }

    public List<RuleSetVersion> listVersions() {
        return ruleStore.versions();
    }

    public RuleSetUpdateResult rollback(long version) {
        return ruleStore.rollback(version);
    }

    public LintReport lint(List<PolicyRule> rules, Map<String, Budget> budgets) {
        return linter.lint(rules, budgets);
    }

    public Decision decide(String agent, String action, Map<String, Object> context) {
        if (agent == null || agent.isBlank() || action == null || action.isBlank()) {
            throw new IllegalArgumentException("agent and action are required");
        }
        return policyEngine.decide(agent, action, context);
    }

    /**
     * Evaluate cases against a proposed rule set, or the active one when no rules are given.
     * Nothing is installed and no decision metrics are recorded.
     *
     * @throws InvalidRuleSetException if the proposed rules have lint errors
     */
    public SimulationReport simulate(SimulationRequest request) {
        RuleSetSnapshot snapshot = ruleStore.current();
        if (request.getRules() != null) {
            Map<String, Budget> budgets = request.getBudgets() != null ? request.getBudgets() : Map.of();
            LintReport report = linter.lint(request.getRules(), budgets);
            if (report.hasErrors()) {
                throw new InvalidRuleSetException(report);
            }
            snapshot = RuleSetSnapshot.builder()
                    .rules(request.getRules())
                    .budgets(budgets)
                    .build()
                    .frozen();
        } else if (request.getBudgets() != null) {
            snapshot = snapshot.toBuilder().budgets(request.getBudgets()).build().frozen();
        }

        Effect defaultEffect = ruleStore.getDefaultEffect();
        List<SimulationCase> cases = request.getCases() != null ? request.getCases() : List.of();
        List<SimulationReport.CaseResult> results = new ArrayList<>();
        List<String> mismatched = new ArrayList<>();
        int allow = 0, deny = 0, approval = 0, defaults = 0;

        for (int i = 0; i < cases.size(); i++) {
            SimulationCase simCase = cases.get(i);
            String caseId = simCase.getCaseId() != null ? simCase.getCaseId() : "case_" + i;
            Decision decision = PolicyEngine.evaluate(snapshot, defaultEffect,
                    simCase.getAgent(), simCase.getAction(), simCase.getContext());

            switch (decision.getEffect()) {
                case ALLOW -> allow++;
                case DENY -> deny++;
                case NEEDS_APPROVAL -> approval++;
            }
            if (decision.getMatchedRuleId() == null) defaults++;

            boolean matches = simCase.getExpectedEffect() == null || simCase.getExpectedEffect() == decision.getEffect();
            if (!matches) mismatched.add(caseId);
            results.add(new SimulationReport.CaseResult(caseId, decision, matches));
        }

        int total = cases.size();
        SimulationReport.Summary summary = new SimulationReport.Summary(total, allow, deny, approval, defaults,
                rate(allow, total), rate(deny, total), rate(approval, total), mismatched);
        log.info("Simulated {} case(s): allow={}, deny={}, needs_approval={}, mismatched={}",
                total, allow, deny, approval, mismatched.size());
        return new SimulationReport(summary, results);
    }

    private static double rate(int count, int total) {
        return total == 0 ? 0.0 : (double) count / total;
    }
}
