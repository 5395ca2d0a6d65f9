package com.agentgate.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Approval lifecycle:
 *
 * <pre>
 * PENDING → APPROVED → EXECUTED
 *         ↘ REJECTED
 *         ↘ EXPIRED
 * </pre>
 *
 * Transitions only move forward. EXPIRED is usually never stored; it is derived from the
 * wall clock whenever a record is verified.
 */
public enum ApprovalStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected"),
    EXECUTED("executed"),
    EXPIRED("expired");

    private final String value;

    ApprovalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Statuses that still lapse when the wall clock passes the expiry.
     */
    public boolean canExpire() {
        return this == PENDING || this == APPROVED;
    }

    @JsonCreator
    public static ApprovalStatus fromValue(String value) {
        if (value == null) return null;
        for (ApprovalStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown approval status: " + value);
    }
}
