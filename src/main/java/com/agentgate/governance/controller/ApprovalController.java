package com.agentgate.governance.controller;

import com.agentgate.governance.exception.ApprovalAlreadyDecidedException;
import com.agentgate.governance.exception.ApprovalException;
import com.agentgate.governance.exception.ApprovalExpiredException;
import com.agentgate.governance.exception.ApprovalInvalidSignatureException;
import com.agentgate.governance.exception.ApprovalNotApprovedException;
import com.agentgate.governance.exception.ApprovalNotFoundException;
import com.agentgate.governance.model.Approval;
import com.agentgate.governance.model.ApprovalCreateRequest;
import com.agentgate.governance.model.ApprovalDecisionRequest;
import com.agentgate.governance.model.ApprovalList;
import com.agentgate.governance.model.ApprovalStatus;
import com.agentgate.governance.service.ApprovalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/approvals")
@Tag(name = "Approvals", description = "Signed, time-boxed human approvals for gated agent actions")
public class ApprovalController {

    private final ApprovalService approvalService;

    public ApprovalController(ApprovalService approvalService) {
        this.approvalService = approvalService;
    }

    @PostMapping
    @Operation(summary = "Request an approval",
               description = "Creates a pending approval that expires after ttlSeconds (default from configuration)")
    public ResponseEntity<?> create(@RequestBody ApprovalCreateRequest request) {
        try {
            Approval approval = approvalService.request(request);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("id", approval.getId());
            response.put("status", approval.getStatus());
            response.put("expiresAt", approval.getExpiresAt());
            return ResponseEntity.status(HttpStatus.CREATED).body(response);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/{id}/decide")
    @Operation(summary = "Approve or reject",
               description = "The signature is the hex HMAC-SHA256 of 'id:decision:approver:expiresAt' "
                       + "with expiresAt in ISO-8601 UTC")
    public ResponseEntity<?> decide(@PathVariable String id, @RequestBody ApprovalDecisionRequest request) {
        try {
            return ResponseEntity.ok(approvalService.decideApproval(id, request));
        } catch (ApprovalException e) {
            return approvalError(e);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping
    @Operation(summary = "List approvals",
               description = "Newest first, with per-status counts. Statuses are effective: lapsed approvals read as expired.")
    public ResponseEntity<?> list(
            @Parameter(description = "pending, approved, rejected, executed or expired")
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String agent,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        try {
            ApprovalList approvals = approvalService.list(ApprovalStatus.fromValue(status), agent, limit, offset);
            return ResponseEntity.ok(approvals);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get an approval")
    public ResponseEntity<?> get(@PathVariable String id) {
        try {
            return ResponseEntity.ok(approvalService.get(id));
        } catch (ApprovalNotFoundException e) {
            return approvalError(e);
        }
    }

    private ResponseEntity<Map<String, String>> approvalError(ApprovalException e) {
        HttpStatus status;
        if (e instanceof ApprovalNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof ApprovalExpiredException) {
            status = HttpStatus.GONE;
        } else if (e instanceof ApprovalInvalidSignatureException) {
            status = HttpStatus.FORBIDDEN;
        } else if (e instanceof ApprovalAlreadyDecidedException || e instanceof ApprovalNotApprovedException) {
            status = HttpStatus.CONFLICT;
        } else {
            status = HttpStatus.BAD_REQUEST;
        }
        return ResponseEntity.status(status).body(Map.of("error", e.getMessage(), "approvalId", e.getApprovalId()));
    }
}
