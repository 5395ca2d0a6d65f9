package com.agentgate.governance.exception;

import com.agentgate.governance.model.ApprovalStatus;

/**
 * Raised by mark-executed on anything but an approved record, including one that was
 * already executed. A second consumption points at a double-execution bug upstream.
 */
public class ApprovalNotApprovedException extends ApprovalException {

    public ApprovalNotApprovedException(String approvalId, ApprovalStatus status) {
        super(approvalId, "Approval " + approvalId + " cannot be executed from status "
                + (status == null ? "unknown" : status.getValue()));
    }
}
