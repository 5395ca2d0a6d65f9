package com.agentgate.governance.controller;

import com.agentgate.governance.exception.ApprovalAlreadyDecidedException;
import com.agentgate.governance.exception.ApprovalExpiredException;
import com.agentgate.governance.exception.ApprovalInvalidSignatureException;
import com.agentgate.governance.exception.ApprovalNotFoundException;
import com.agentgate.governance.model.*;
import com.agentgate.governance.service.ApprovalService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static com.agentgate.governance.testutil.TestDataFactory.NOW;
import static com.agentgate.governance.testutil.TestDataFactory.approval;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ApprovalController.class)
class ApprovalControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ApprovalService approvalService;

    private String decisionBody() throws Exception {
        return objectMapper.writeValueAsString(Map.of(
                "decision", "approved",
                "approver", "alice@example.com",
                "signature", "ab12"));
    }

    // ── Create ──

    @Test
    void create_returns201() throws Exception {
        when(approvalService.request(any(ApprovalCreateRequest.class)))
                .thenReturn(approval("apr_1", ApprovalStatus.PENDING, NOW, 3600));

        mockMvc.perform(post("/api/v1/approvals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "agent", "inbox_triage",
                                "action", "quarantine",
                                "context", Map.of("email_id", "e1"),
                                "reason", "Quarantine requires human approval",
                                "ttlSeconds", 3600))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("apr_1"))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.expiresAt").value("2026-10-18T13:00:00Z"));
    }

    @Test
    void create_invalidTtl_returns400() throws Exception {
        when(approvalService.request(any(ApprovalCreateRequest.class)))
                .thenThrow(new IllegalArgumentException("ttlSeconds must be positive, got: 0"));

        mockMvc.perform(post("/api/v1/approvals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agent\": \"a\", \"action\": \"b\", \"reason\": \"c\", \"ttlSeconds\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ttlSeconds must be positive, got: 0"));
    }

    // ── Decide ──

    @Test
    void decide_success() throws Exception {
        Approval approved = approval("apr_1", ApprovalStatus.APPROVED, NOW, 3600).toBuilder()
                .decision(ApprovalVerdict.APPROVED)
                .approver("alice@example.com")
                .build();
        when(approvalService.decideApproval(eq("apr_1"), any(ApprovalDecisionRequest.class))).thenReturn(approved);

        mockMvc.perform(post("/api/v1/approvals/apr_1/decide")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(decisionBody()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("approved"))
                .andExpect(jsonPath("$.decision").value("approved"))
                .andExpect(jsonPath("$.approver").value("alice@example.com"));
    }

    @Test
    void decide_notFound_returns404() throws Exception {
        when(approvalService.decideApproval(eq("apr_x"), any())).thenThrow(new ApprovalNotFoundException("apr_x"));

        mockMvc.perform(post("/api/v1/approvals/apr_x/decide")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(decisionBody()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.approvalId").value("apr_x"));
    }

    @Test
    void decide_expired_returns410() throws Exception {
        when(approvalService.decideApproval(eq("apr_1"), any()))
                .thenThrow(new ApprovalExpiredException("apr_1", NOW));

        mockMvc.perform(post("/api/v1/approvals/apr_1/decide")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(decisionBody()))
                .andExpect(status().isGone());
    }

    @Test
    void decide_badSignature_returns403() throws Exception {
        when(approvalService.decideApproval(eq("apr_1"), any()))
                .thenThrow(new ApprovalInvalidSignatureException("apr_1"));

        mockMvc.perform(post("/api/v1/approvals/apr_1/decide")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(decisionBody()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Invalid signature for approval apr_1"));
    }

    @Test
    void decide_alreadyDecided_returns409() throws Exception {
        when(approvalService.decideApproval(eq("apr_1"), any()))
                .thenThrow(new ApprovalAlreadyDecidedException("apr_1", ApprovalStatus.REJECTED));

        mockMvc.perform(post("/api/v1/approvals/apr_1/decide")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(decisionBody()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Approval apr_1 is already rejected"));
    }

    @Test
    void decide_missingApprover_returns400() throws Exception {
        when(approvalService.decideApproval(eq("apr_1"), any()))
                .thenThrow(new IllegalArgumentException("approver is required"));

        mockMvc.perform(post("/api/v1/approvals/apr_1/decide")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\": \"approved\", \"signature\": \"ab12\"}"))
                .andExpect(status().isBadRequest());
    }

    // ── Read ──

    @Test
    void list_withFilters() throws Exception {
        when(approvalService.list(ApprovalStatus.PENDING, "inbox_triage", 10, 0))
                .thenReturn(new ApprovalList(
                        List.of(approval("apr_1", ApprovalStatus.PENDING, NOW, 3600)),
                        1,
                        Map.of("pending", 1, "approved", 0)));

        mockMvc.perform(get("/api/v1/approvals?status=pending&agent=inbox_triage&limit=10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.approvals[0].id").value("apr_1"))
                .andExpect(jsonPath("$.counts.pending").value(1));
    }

    @Test
    void list_defaultsLimitAndOffset() throws Exception {
        when(approvalService.list(isNull(), isNull(), eq(50), eq(0)))
                .thenReturn(new ApprovalList(List.of(), 0, Map.of()));

        mockMvc.perform(get("/api/v1/approvals"))
                .andExpect(status().isOk());

        verify(approvalService).list(null, null, 50, 0);
    }

    @Test
    void list_unknownStatus_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/approvals?status=lost"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void list_limitTooLarge_returns400() throws Exception {
        when(approvalService.list(any(), any(), eq(500), anyInt()))
                .thenThrow(new IllegalArgumentException("limit must be between 1 and 100"));

        mockMvc.perform(get("/api/v1/approvals?limit=500"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void get_found() throws Exception {
        when(approvalService.get("apr_1")).thenReturn(approval("apr_1", ApprovalStatus.EXPIRED, NOW, 5));

        mockMvc.perform(get("/api/v1/approvals/apr_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("expired"))
                .andExpect(jsonPath("$.context.email_id").value("e1"));
    }

    @Test
    void get_notFound_returns404() throws Exception {
        when(approvalService.get("missing")).thenThrow(new ApprovalNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/approvals/missing"))
                .andExpect(status().isNotFound());
    }
}
