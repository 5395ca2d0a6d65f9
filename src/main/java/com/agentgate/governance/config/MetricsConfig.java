package com.agentgate.governance.config;

import com.agentgate.governance.model.ApprovalStatus;
import com.agentgate.governance.model.Effect;
import com.agentgate.governance.model.ExecutionStage;
import com.agentgate.governance.model.ViolationKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeRuleCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeRuleCount = registry.gauge("policy.rules.active", new AtomicInteger(0));
    }

    public void recordDecision(Effect effect, boolean matchedRule) {
        Counter.builder("policy.decision.count")
                .tag("effect", effect.getValue())
                .tag("default", String.valueOf(!matchedRule))
                .register(registry)
                .increment();
    }

    public void recordApprovalTransition(ApprovalStatus status) {
        Counter.builder("approval.transition.count")
                .tag("status", status.getValue())
                .register(registry)
                .increment();
    }

    public void recordApprovalRaceLost(String operation) {
        Counter.builder("approval.race_lost.count")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordExecution(ExecutionStage stage) {
        Counter.builder("execution.count")
                .tag("stage", stage.getValue())
                .register(registry)
                .increment();
    }

    public void recordViolation(ViolationKind kind) {
        Counter.builder("guardrail.violation.count")
                .tag("kind", kind.getValue())
                .register(registry)
                .increment();
    }

    public void updateActiveRuleCount(int count) {
        activeRuleCount.set(count);
    }
}
