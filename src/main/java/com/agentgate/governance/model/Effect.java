package com.agentgate.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Three-valued outcome of a policy rule.
 */
public enum Effect {
    ALLOW("allow"),
    DENY("deny"),
    NEEDS_APPROVAL("needs_approval");

    private final String value;

    Effect(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Rank used when two matching rules tie on priority and specificity.
     * Lower wins: deny, then allow, then needs_approval.
     */
    public int tieBreakRank() {
        return switch (this) {
            case DENY -> 0;
            case ALLOW -> 1;
            case NEEDS_APPROVAL -> 2;
        };
    }

    @JsonCreator
    public static Effect fromValue(String value) {
        if (value == null) return null;
        for (Effect effect : values()) {
            if (effect.value.equalsIgnoreCase(value) || effect.name().equalsIgnoreCase(value)) {
                return effect;
            }
        }
        throw new IllegalArgumentException("Unknown effect: " + value);
    }
}
