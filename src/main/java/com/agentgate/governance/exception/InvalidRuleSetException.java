package com.agentgate.governance.exception;

import com.agentgate.governance.model.LintReport;

public class InvalidRuleSetException extends RuntimeException {

    private final LintReport report;

    public InvalidRuleSetException(LintReport report) {
        super("Rule set has " + report.getErrors().size() + " lint error(s)");
        this.report = report;
    }

    public LintReport getReport() {
        return report;
    }
}
