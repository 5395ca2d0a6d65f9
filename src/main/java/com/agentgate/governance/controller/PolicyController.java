package com.agentgate.governance.controller;

import com.agentgate.governance.exception.InvalidRuleSetException;
import com.agentgate.governance.exception.RuleSetVersionNotFoundException;
import com.agentgate.governance.model.DecideRequest;
import com.agentgate.governance.model.Decision;
import com.agentgate.governance.model.LintReport;
import com.agentgate.governance.model.RuleSetRequest;
import com.agentgate.governance.model.RuleSetSnapshot;
import com.agentgate.governance.model.RuleSetVersion;
import com.agentgate.governance.model.SimulationRequest;
import com.agentgate.governance.service.RuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/policy")
@Tag(name = "Policy", description = "Rule set management, dry-run decisions, lint and simulation")
public class PolicyController {

    private final RuleService ruleService;

    public PolicyController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @GetMapping("/snapshot")
    @Operation(summary = "Get the active rule set",
               description = "Returns rules, budgets keyed by agent:action, version and last update time")
    public ResponseEntity<RuleSetSnapshot> getSnapshot() {
        return ResponseEntity.ok(ruleService.getSnapshot());
    }

    @PutMapping("/snapshot")
    @Operation(summary = "Replace the active rule set",
               description = "Atomic whole-set replacement. Rejected with the lint report if lint finds errors; "
                       + "warnings are returned with the accepted snapshot.")
    public ResponseEntity<?> replaceSnapshot(@RequestBody RuleSetRequest request) {
        try {
            return ResponseEntity.ok(ruleService.replaceSnapshot(request.rules(), request.budgets()));
        } catch (InvalidRuleSetException e) {
            return lintFailure(e);
        }
    }

    @GetMapping("/snapshot/versions")
    @Operation(summary = "List persisted rule set versions", description = "Newest first")
    public ResponseEntity<List<RuleSetVersion>> listVersions() {
        return ResponseEntity.ok(ruleService.listVersions());
    }

    @GetMapping("/snapshot/versions/{version}")
    @Operation(summary = "Get a persisted rule set version")
    public ResponseEntity<?> getVersion(@PathVariable long version) {
        try {
            return ResponseEntity.ok(ruleService.getSnapshotVersion(version));
        } catch (RuleSetVersionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/snapshot/rollback/{version}")
    @Operation(summary = "Roll back to an earlier rule set version",
               description = "Re-installs that version's rules and budgets as a new version through the same "
                       + "atomic replacement. Earlier versions are kept.")
    public ResponseEntity<?> rollback(@PathVariable long version) {
        try {
            return ResponseEntity.ok(ruleService.rollback(version));
        } catch (RuleSetVersionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (InvalidRuleSetException e) {
            return lintFailure(e);
        }
    }

    @PostMapping("/lint")
    @Operation(summary = "Lint a rule set without installing it")
    public ResponseEntity<LintReport> lint(@RequestBody RuleSetRequest request) {
        return ResponseEntity.ok(ruleService.lint(request.rules(), request.budgets()));
    }

    @PostMapping("/decide")
    @Operation(summary = "Dry-run policy decision",
               description = "Evaluates the active rules and budgets for an agent action. Nothing is executed.")
    public ResponseEntity<?> decide(@RequestBody DecideRequest request) {
        try {
            Decision decision = ruleService.decide(request.agent(), request.action(), request.context());
            return ResponseEntity.ok(decision);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/simulate")
    @Operation(summary = "Simulate a rule set against test cases",
               description = "Uses the proposed rules, or the active ones when 'rules' is omitted. "
                       + "Returns per-case decisions, effect rates and cases that missed their expected effect.")
    public ResponseEntity<?> simulate(@RequestBody SimulationRequest request) {
        try {
            return ResponseEntity.ok(ruleService.simulate(request));
        } catch (InvalidRuleSetException e) {
            return lintFailure(e);
        }
    }

    private ResponseEntity<Map<String, Object>> lintFailure(InvalidRuleSetException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("lint", e.getReport());
        return ResponseEntity.badRequest().body(body);
    }
}
