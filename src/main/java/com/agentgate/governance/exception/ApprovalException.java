package com.agentgate.governance.exception;

/**
 * Base for approval lifecycle failures. Every subtype blocks execution; the caller
 * has to obtain a fresh, valid approval.
 */
public abstract class ApprovalException extends RuntimeException {

    private final String approvalId;

    protected ApprovalException(String approvalId, String message) {
        super(message);
        this.approvalId = approvalId;
    }

    public String getApprovalId() {
        return approvalId;
    }
}
