package com.agentgate.governance.exception;

import com.agentgate.governance.model.GuardrailViolation;

/**
 * A blocking pre-execution violation. No side effect has happened when this is thrown.
 */
public class GuardrailViolationException extends RuntimeException {

    private final GuardrailViolation violation;

    public GuardrailViolationException(GuardrailViolation violation) {
        super(violation.message());
        this.violation = violation;
    }

    public GuardrailViolation getViolation() {
        return violation;
    }
}
