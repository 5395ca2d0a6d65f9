package com.agentgate.governance.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Executor states. The path is linear:
 * START → POLICY_CHECKED → PRE_GUARDRAILS_CHECKED → HANDLER_INVOKED → POST_GUARDRAILS_CHECKED → DONE.
 * DENIED and BLOCKED exit before the handler; FAILED is a handler error.
 */
public enum ExecutionStage {
    START("start"),
    POLICY_CHECKED("policy_checked"),
    PRE_GUARDRAILS_CHECKED("pre_guardrails_checked"),
    HANDLER_INVOKED("handler_invoked"),
    POST_GUARDRAILS_CHECKED("post_guardrails_checked"),
    DONE("done"),
    DENIED("denied"),
    BLOCKED("blocked"),
    FAILED("failed");

    private final String value;

    ExecutionStage(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == DONE || this == DENIED || this == BLOCKED || this == FAILED;
    }
}
