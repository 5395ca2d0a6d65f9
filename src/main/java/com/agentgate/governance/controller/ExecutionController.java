package com.agentgate.governance.controller;

import com.agentgate.governance.exception.UnknownActionException;
import com.agentgate.governance.model.ExecutionPlan;
import com.agentgate.governance.model.ExecutionResult;
import com.agentgate.governance.service.ActionExecutionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/execute")
@Tag(name = "Execution", description = "Run an agent action through policy, guardrails and its handler")
public class ExecutionController {

    private final ActionExecutionService executionService;

    public ExecutionController(ActionExecutionService executionService) {
        this.executionService = executionService;
    }

    @PostMapping
    @Operation(summary = "Execute an agent action",
               description = "Always 200 once the plan is accepted; the outcome is in 'stage': "
                       + "denied, blocked (pre-execution violation), failed (handler error) or done. "
                       + "Post-execution violations are warnings on a done result.")
    public ResponseEntity<?> execute(@RequestBody ExecutionPlan plan) {
        try {
            ExecutionResult result = executionService.execute(plan);
            return ResponseEntity.ok(result);
        } catch (UnknownActionException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", "action"));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
