package com.agentgate.governance.exception;

import java.time.Instant;

public class ApprovalExpiredException extends ApprovalException {

    public ApprovalExpiredException(String approvalId, Instant expiresAt) {
        super(approvalId, "Approval " + approvalId + " expired at " + expiresAt);
    }
}
