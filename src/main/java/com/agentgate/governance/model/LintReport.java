package com.agentgate.governance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Schema(description = "Static analysis of a rule set")
public class LintReport {

    private final List<LintIssue> errors = new ArrayList<>();
    private final List<LintIssue> warnings = new ArrayList<>();
    private final List<LintIssue> info = new ArrayList<>();

    public void add(LintIssue issue) {
        switch (issue.severity()) {
            case LintIssue.ERROR -> errors.add(issue);
            case LintIssue.WARNING -> warnings.add(issue);
            default -> info.add(issue);
        }
    }

    @JsonIgnore
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int getTotalIssues() {
        return errors.size() + warnings.size() + info.size();
    }
}
