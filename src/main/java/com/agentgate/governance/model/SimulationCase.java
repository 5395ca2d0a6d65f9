package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A what-if case for policy simulation")
public class SimulationCase {

    @Schema(description = "Case identifier", example = "case-1")
    private String caseId;

    @Schema(description = "Agent", example = "inbox_triage")
    private String agent;

    @Schema(description = "Action", example = "quarantine")
    private String action;

    @Schema(description = "Context to evaluate")
    @Builder.Default
    private Map<String, Object> context = new HashMap<>();

    @Schema(description = "Effect the case is expected to produce", nullable = true, example = "deny")
    private Effect expectedEffect;
}
