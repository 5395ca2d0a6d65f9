package com.agentgate.governance.exception;

public class UnknownActionException extends RuntimeException {

    private final String action;

    public UnknownActionException(String action) {
        super("Unknown action: " + action);
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}
