package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Result of a policy simulation")
public record SimulationReport(Summary summary, List<CaseResult> results) {

    @Schema(description = "Per-case decision")
    public record CaseResult(String caseId, Decision decision, boolean matchesExpectation) {}

    @Schema(description = "Aggregate counts and rates")
    public record Summary(int totalCases,
                          int allowCount,
                          int denyCount,
                          int approvalCount,
                          int defaultCount,
                          double allowRate,
                          double denyRate,
                          double approvalRate,
                          List<String> mismatchedCaseIds) {}
}
