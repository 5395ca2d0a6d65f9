package com.agentgate.governance.exception;

public class RuleSetVersionNotFoundException extends RuntimeException {

    private final long version;

    public RuleSetVersionNotFoundException(long version) {
        super("Rule set version not found: " + version);
        this.version = version;
    }

    public long getVersion() {
        return version;
    }
}
