package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Snapshot now in force plus the lint findings for it")
public record RuleSetUpdateResult(RuleSetSnapshot snapshot, LintReport lint) {}
