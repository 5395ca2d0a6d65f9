package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "Ask for a policy decision without executing anything")
public record DecideRequest(
        @Schema(example = "inbox_triage") String agent,
        @Schema(example = "quarantine") String action,
        @Schema(example = "{\"risk_score\": 85}") Map<String, Object> context) {}
