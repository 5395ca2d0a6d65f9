package com.agentgate.governance.exception;

public class ApprovalNotFoundException extends ApprovalException {

    public ApprovalNotFoundException(String approvalId) {
        super(approvalId, "Approval not found: " + approvalId);
    }
}
