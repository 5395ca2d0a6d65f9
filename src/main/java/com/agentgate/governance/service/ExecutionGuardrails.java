package com.agentgate.governance.service;

import com.agentgate.governance.engine.PolicyEngine;
import com.agentgate.governance.engine.action.ActionRegistry;
import com.agentgate.governance.exception.ApprovalNotFoundException;
import com.agentgate.governance.exception.GuardrailViolationException;
import com.agentgate.governance.exception.UnknownActionException;
import com.agentgate.governance.model.Approval;
import com.agentgate.governance.model.ApprovalStatus;
import com.agentgate.governance.model.Decision;
import com.agentgate.governance.model.ExecutionPlan;
import com.agentgate.governance.model.GuardrailViolation;
import com.agentgate.governance.model.ViolationKind;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pre-execution checks block the handler call by throwing; post-execution checks only
 * report, since the action has already happened.
 */
@Component
public class ExecutionGuardrails {

    public static final String OPS_COUNT = "ops_count";
    public static final String COST_CENTS_USED = "cost_cents_used";

    private final PolicyEngine policyEngine;
    private final ApprovalService approvalService;
    private final ActionRegistry actionRegistry;

    public ExecutionGuardrails(PolicyEngine policyEngine, ApprovalService approvalService,
                               ActionRegistry actionRegistry) {
        this.policyEngine = policyEngine;
        this.approvalService = approvalService;
        this.actionRegistry = actionRegistry;
    }

    /**
     * Re-derive the decision, then run every pre-execution check.
     *
     * @throws GuardrailViolationException on the first failed check
     * @throws UnknownActionException      if no handler is registered for the action
     */
    public void validatePre(ExecutionPlan plan) {
        Decision decision = policyEngine.decide(plan.getAgent(), plan.getAction(), plan.getContext());
        checkPolicy(plan, decision);
        checkRequiredParams(plan);
    }

    /**
     * A deny is a violation; a needs_approval decision requires an approved, unexpired
     * approval bound to the same agent and action.
     */
    public void checkPolicy(ExecutionPlan plan, Decision decision) {
        if (decision.isDenied()) {
            throw violation(GuardrailViolation.of(ViolationKind.POLICY_DENIED,
                    "Policy denied " + plan.getAgent() + ":" + plan.getAction() + ": " + decision.getReason()));
        }
        if (decision.requiresApproval()) {
            checkApproval(plan);
        }
    }

    /**
     * Required fields in the registry's declared order; the first missing one is reported.
     */
    public void checkRequiredParams(ExecutionPlan plan) {
        for (String field : actionRegistry.requiredParams(plan.getAction())) {
            if (!plan.hasField(field)) {
                throw violation(GuardrailViolation.of(ViolationKind.MISSING_PARAMETER,
                        "Missing required parameter '" + field + "' for action '" + plan.getAction() + "'", field));
            }
        }
    }

    public List<GuardrailViolation> validatePost(Object result) {
        List<GuardrailViolation> violations = new ArrayList<>();
        if (!(result instanceof Map<?, ?> map)) {
            violations.add(GuardrailViolation.of(ViolationKind.RESULT_SHAPE,
                    "Result must be a key/value mapping, got "
                            + (result == null ? "null" : result.getClass().getSimpleName())));
            return violations;
        }

        for (String metric : List.of(OPS_COUNT, COST_CENTS_USED)) {
            if (map.containsKey(metric) && !isNonNegativeInteger(map.get(metric))) {
                violations.add(GuardrailViolation.of(ViolationKind.METRIC_INVALID,
                        "'" + metric + "' must be a non-negative integer, got " + map.get(metric), metric));
            }
        }
        return violations;
    }

    private void checkApproval(ExecutionPlan plan) {
        String approvalId = plan.getApprovalId();
        if (approvalId == null || approvalId.isBlank()) {
            throw violation(GuardrailViolation.of(ViolationKind.APPROVAL_REQUIRED,
                    "Action " + plan.getAgent() + ":" + plan.getAction() + " requires an approval", "approvalId"));
        }

        Approval approval;
        try {
            approval = approvalService.get(approvalId);
        } catch (ApprovalNotFoundException e) {
            throw violation(GuardrailViolation.of(ViolationKind.APPROVAL_INVALID,
                    "Approval not found: " + approvalId, "approvalId"));
        }

        if (!approval.getAgent().equals(plan.getAgent()) || !approval.getAction().equals(plan.getAction())) {
            throw violation(GuardrailViolation.of(ViolationKind.APPROVAL_INVALID,
                    "Approval " + approvalId + " is for " + approval.getAgent() + ":" + approval.getAction()
                            + ", not " + plan.getAgent() + ":" + plan.getAction(), "approvalId"));
        }
        if (approval.getStatus() != ApprovalStatus.APPROVED) {
            throw violation(GuardrailViolation.of(ViolationKind.APPROVAL_INVALID,
                    "Approval " + approvalId + " is " + approval.getStatus().getValue() + ", not approved",
                    "approvalId"));
        }
    }

    private static boolean isNonNegativeInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue() >= 0;
        }
        if (value instanceof BigInteger big) {
            return big.signum() >= 0;
        }
        return false;
    }

    private static GuardrailViolationException violation(GuardrailViolation violation) {
        return new GuardrailViolationException(violation);
    }
}
