package com.agentgate.governance.exception;

import com.agentgate.governance.model.ApprovalStatus;

public class ApprovalAlreadyDecidedException extends ApprovalException {

    public ApprovalAlreadyDecidedException(String approvalId, ApprovalStatus status) {
        super(approvalId, "Approval " + approvalId + " is already " + status.getValue());
    }
}
