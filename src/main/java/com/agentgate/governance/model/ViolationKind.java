package com.agentgate.governance.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ViolationKind {
    POLICY_DENIED("policy_denied", true),
    APPROVAL_REQUIRED("approval_required", true),
    APPROVAL_INVALID("approval_invalid", true),
    MISSING_PARAMETER("missing_parameter", true),
    RESULT_SHAPE("result_shape", false),
    METRIC_INVALID("metric_invalid", false);

    private final String value;
    private final boolean preExecution;

    ViolationKind(String value, boolean preExecution) {
        this.value = value;
        this.preExecution = preExecution;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Pre-execution kinds block the handler call; the others are post-execution warnings.
     */
    public boolean isPreExecution() {
        return preExecution;
    }
}
