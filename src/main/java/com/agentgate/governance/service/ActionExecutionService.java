package com.agentgate.governance.service;

import com.agentgate.governance.config.GovernanceConfig;
import com.agentgate.governance.config.MetricsConfig;
import com.agentgate.governance.engine.PolicyEngine;
import com.agentgate.governance.engine.action.ActionHandler;
import com.agentgate.governance.engine.action.ActionRegistry;
import com.agentgate.governance.exception.ApprovalException;
import com.agentgate.governance.exception.GuardrailViolationException;
import com.agentgate.governance.model.Decision;
import com.agentgate.governance.model.Effect;
import com.agentgate.governance.model.EnforcementMode;
import com.agentgate.governance.model.ExecutionError;
import com.agentgate.governance.model.ExecutionPlan;
import com.agentgate.governance.model.ExecutionResult;
import com.agentgate.governance.model.ExecutionStage;
import com.agentgate.governance.model.GuardrailViolation;
import com.agentgate.governance.model.ViolationKind;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one plan through the pipeline:
 * policy decision → pre-execution checks → approval consumption → handler → post-execution checks.
 *
 * <p>In strict mode a deny stops at {@code denied} and a pre-execution violation at
 * {@code blocked}; neither calls the handler. Permissive mode runs the same checks and
 * reports their failures as warnings. Disabled mode skips the policy engine.
 */
@Service
public class ActionExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutionService.class);

    static final String DISABLED_REASON = "enforcement disabled";

    private final PolicyEngine policyEngine;
    private final ExecutionGuardrails guardrails;
    private final ApprovalService approvalService;
    private final ActionRegistry actionRegistry;
    private final GovernanceConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    public ActionExecutionService(PolicyEngine policyEngine, ExecutionGuardrails guardrails,
                                  ApprovalService approvalService, ActionRegistry actionRegistry,
                                  GovernanceConfig config, MetricsConfig metricsConfig, Tracer tracer) {
        this.policyEngine = policyEngine;
        this.guardrails = guardrails;
        this.approvalService = approvalService;
        this.actionRegistry = actionRegistry;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    @Observed(name = "action.execute", contextualName = "execute-action")
    public ExecutionResult execute(ExecutionPlan plan) {
        if (plan.getAgent() == null || plan.getAgent().isBlank()
                || plan.getAction() == null || plan.getAction().isBlank()) {
            throw new IllegalArgumentException("agent and action are required");
        }

        EnforcementMode mode = config.getEnforcementMode();
        List<GuardrailViolation> violations = new ArrayList<>();

        Decision decision = mode == EnforcementMode.DISABLED
                ? Decision.builder().effect(Effect.ALLOW).reason(DISABLED_REASON).budgetOk(true).build()
                : policyEngine.decide(plan.getAgent(), plan.getAction(), plan.getContext());
        log.debug("{}:{} {} -> {}", plan.getAgent(), plan.getAction(),
                ExecutionStage.POLICY_CHECKED.getValue(), decision.getEffect().getValue());

        if (decision.isDenied()) {
            GuardrailViolation denied = GuardrailViolation.of(ViolationKind.POLICY_DENIED,
                    "Policy denied " + plan.getAgent() + ":" + plan.getAction() + ": " + decision.getReason());
            if (mode == EnforcementMode.STRICT) {
                log.warn("Denied {}:{} (rule={}, reason={})", plan.getAgent(), plan.getAction(),
                        decision.getMatchedRuleId(), decision.getReason());
                violations.add(denied);
                return finish(ExecutionStage.DENIED, decision, null, violations, null);
            }
            log.warn("Permissive mode: ignoring deny for {}:{} ({})", plan.getAgent(), plan.getAction(),
                    decision.getReason());
            violations.add(denied);
        }

        // A deny wins over an unknown action, so the lookup comes after the decision.
        ActionHandler handler = actionRegistry.handlerFor(plan.getAction());

        boolean approvalVerified = false;
        try {
            if (mode != EnforcementMode.DISABLED && !decision.isDenied()) {
                guardrails.checkPolicy(plan, decision);
                approvalVerified = decision.requiresApproval();
            }
        } catch (GuardrailViolationException e) {
            if (mode == EnforcementMode.STRICT) {
                return block(plan, decision, violations, e.getViolation());
            }
            warn(plan, violations, e.getViolation());
        }

        if (config.isGuardrailsEnabled()) {
            try {
                guardrails.checkRequiredParams(plan);
            } catch (GuardrailViolationException e) {
                // Disabled mode drops only the policy engine; parameter checks still block.
                if (mode != EnforcementMode.PERMISSIVE) {
                    return block(plan, decision, violations, e.getViolation());
                }
                warn(plan, violations, e.getViolation());
            }
        }
        log.debug("{}:{} {}", plan.getAgent(), plan.getAction(), ExecutionStage.PRE_GUARDRAILS_CHECKED.getValue());

        // Consume the approval before the handler runs, so it can never authorize two executions.
        if (approvalVerified) {
            try {
                approvalService.markExecuted(plan.getApprovalId());
            } catch (ApprovalException e) {
                GuardrailViolation invalid = GuardrailViolation.of(ViolationKind.APPROVAL_INVALID,
                        e.getMessage(), "approvalId");
                if (mode == EnforcementMode.STRICT) {
                    return block(plan, decision, violations, invalid);
                }
                warn(plan, violations, invalid);
            }
        }

        Object result;
        Span span = tracer.nextSpan()
                .name("action.handle")
                .tag("agent", plan.getAgent())
                .tag("action", plan.getAction())
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            result = handler.handle(plan);
        } catch (Exception e) {
            span.error(e);
            log.error("Handler for {}:{} failed: {}", plan.getAgent(), plan.getAction(), e.getMessage(), e);
            return finish(ExecutionStage.FAILED, decision, null, violations, ExecutionError.from(e));
        } finally {
            span.end();
        }
        log.debug("{}:{} {}", plan.getAgent(), plan.getAction(), ExecutionStage.HANDLER_INVOKED.getValue());

        if (config.isGuardrailsEnabled()) {
            List<GuardrailViolation> post = guardrails.validatePost(result);
            for (GuardrailViolation violation : post) {
                log.warn("Post-execution violation for {}:{}: {}", plan.getAgent(), plan.getAction(),
                        violation.message());
            }
            violations.addAll(post);
        }

        log.info("Executed {}:{} (effect={}, warnings={})", plan.getAgent(), plan.getAction(),
                decision.getEffect().getValue(), violations.size());
        return finish(ExecutionStage.DONE, decision, result, violations, null);
    }

    private ExecutionResult block(ExecutionPlan plan, Decision decision,
                                  List<GuardrailViolation> violations, GuardrailViolation violation) {
        log.warn("Blocked {}:{}: {}", plan.getAgent(), plan.getAction(), violation.message());
        violations.add(violation);
        return finish(ExecutionStage.BLOCKED, decision, null, violations, null);
    }

    private void warn(ExecutionPlan plan, List<GuardrailViolation> violations, GuardrailViolation violation) {
        log.warn("Permissive mode: continuing {}:{} despite {}", plan.getAgent(), plan.getAction(),
                violation.message());
        violations.add(violation);
    }

    private ExecutionResult finish(ExecutionStage stage, Decision decision, Object result,
                                   List<GuardrailViolation> violations, ExecutionError error) {
        metricsConfig.recordExecution(stage);
        violations.forEach(v -> metricsConfig.recordViolation(v.kind()));
        return ExecutionResult.builder()
                .stage(stage)
                .effect(decision.getEffect())
                .decision(decision)
                .result(result)
                .violations(violations)
                .error(error)
                .build();
    }
}
