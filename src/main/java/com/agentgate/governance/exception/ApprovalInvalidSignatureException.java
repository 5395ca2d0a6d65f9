package com.agentgate.governance.exception;

public class ApprovalInvalidSignatureException extends ApprovalException {

    public ApprovalInvalidSignatureException(String approvalId) {
        super(approvalId, "Invalid signature for approval " + approvalId);
    }
}
