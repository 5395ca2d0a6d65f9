package com.agentgate.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EnforcementMode {
    /** Every check runs and blocks. */
    STRICT("strict"),
    /** Every check runs; failures are logged and reported but never block. */
    PERMISSIVE("permissive"),
    /** The policy engine is bypassed. */
    DISABLED("disabled");

    private final String value;

    EnforcementMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EnforcementMode fromValue(String value) {
        if (value == null) return null;
        for (EnforcementMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Enforcement mode must be strict, permissive or disabled, got: " + value);
    }
}
