package com.agentgate.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A reviewer's decision. The lowercase value is the one that is signed.
 */
public enum ApprovalVerdict {
    APPROVED("approved"),
    REJECTED("rejected");

    private final String value;

    ApprovalVerdict(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public ApprovalStatus resultingStatus() {
        return this == APPROVED ? ApprovalStatus.APPROVED : ApprovalStatus.REJECTED;
    }

    @JsonCreator
    public static ApprovalVerdict fromValue(String value) {
        if (value == null) return null;
        for (ApprovalVerdict verdict : values()) {
            if (verdict.value.equalsIgnoreCase(value) || verdict.name().equalsIgnoreCase(value)) {
                return verdict;
            }
        }
        throw new IllegalArgumentException("Decision must be 'approved' or 'rejected', got: " + value);
    }
}
