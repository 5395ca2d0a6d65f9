package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Simulate a proposed rule set (or the active one when rules is null) against cases")
public class SimulationRequest {

    @Schema(description = "Proposed rules; null means the active snapshot", nullable = true)
    private List<PolicyRule> rules;

    @Schema(description = "Proposed budgets; with no rules given they replace the active budgets", nullable = true)
    private Map<String, Budget> budgets;

    @Schema(description = "Cases to evaluate")
    @Builder.Default
    private List<SimulationCase> cases = new ArrayList<>();
}
