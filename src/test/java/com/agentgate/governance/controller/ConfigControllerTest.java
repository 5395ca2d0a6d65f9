package com.agentgate.governance.controller;

import com.agentgate.governance.config.AerospikeConfig;
import com.agentgate.governance.config.GovernanceConfig;
import com.agentgate.governance.model.Effect;
import com.agentgate.governance.model.EnforcementMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private GovernanceConfig governanceConfig;

    @MockBean
    private AerospikeConfig aerospikeConfig;

    private void stubGovernance(EnforcementMode mode, boolean secretConfigured) {
        when(governanceConfig.getEnforcementMode()).thenReturn(mode);
        when(governanceConfig.getDefaultApprovalTtlSeconds()).thenReturn(3600L);
        when(governanceConfig.isGuardrailsEnabled()).thenReturn(true);
        when(governanceConfig.getDefaultEffect()).thenReturn(Effect.ALLOW);
        when(governanceConfig.getRuleRefreshSeconds()).thenReturn(30);
        when(governanceConfig.hasHmacSecret()).thenReturn(secretConfigured);
        when(governanceConfig.getRequiredParams()).thenReturn(Map.of("quarantine", List.of("email_id")));
    }

    // ── Governance ──

    @Test
    void getGovernance_hidesSecret() throws Exception {
        stubGovernance(EnforcementMode.STRICT, true);

        mockMvc.perform(get("/api/v1/config/governance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enforcementMode").value("strict"))
                .andExpect(jsonPath("$.defaultApprovalTtlSeconds").value(3600))
                .andExpect(jsonPath("$.defaultEffect").value("allow"))
                .andExpect(jsonPath("$.hmacSecretConfigured").value(true))
                .andExpect(jsonPath("$.requiredParams.quarantine[0]").value("email_id"))
                .andExpect(jsonPath("$.hmacSecret").doesNotExist());
    }

    @Test
    void updateGovernance_success() throws Exception {
        stubGovernance(EnforcementMode.STRICT, true);

        mockMvc.perform(put("/api/v1/config/governance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "enforcementMode", "permissive",
                                "defaultApprovalTtlSeconds", 600,
                                "guardrailsEnabled", false))))
                .andExpect(status().isOk());

        verify(governanceConfig).setEnforcementMode(EnforcementMode.PERMISSIVE);
        verify(governanceConfig).setDefaultApprovalTtlSeconds(600L);
        verify(governanceConfig).setGuardrailsEnabled(false);
    }

    @Test
    void updateGovernance_strictWithoutSecret_returns400() throws Exception {
        stubGovernance(EnforcementMode.PERMISSIVE, false);

        mockMvc.perform(put("/api/v1/config/governance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("enforcementMode", "strict"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("enforcementMode"));

        verify(governanceConfig, never()).setEnforcementMode(any());
    }

    @Test
    void updateGovernance_unknownMode_returns400() throws Exception {
        stubGovernance(EnforcementMode.STRICT, true);

        mockMvc.perform(put("/api/v1/config/governance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("enforcementMode", "lenient"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("enforcementMode"));
    }

    @Test
    void updateGovernance_nonPositiveTtl_returns400() throws Exception {
        stubGovernance(EnforcementMode.STRICT, true);

        mockMvc.perform(put("/api/v1/config/governance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("defaultApprovalTtlSeconds", 0))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("defaultApprovalTtlSeconds"));
    }

    @Test
    void updateGovernance_nonBooleanGuardrails_returns400() throws Exception {
        stubGovernance(EnforcementMode.STRICT, true);

        mockMvc.perform(put("/api/v1/config/governance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("guardrailsEnabled", "yes"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("guardrailsEnabled"));
    }

    // ── Aerospike (read-only) ──

    @Test
    void getAerospikeInfo_success() throws Exception {
        when(aerospikeConfig.getHost()).thenReturn("127.0.0.1");
        when(aerospikeConfig.getPort()).thenReturn(3000);
        when(aerospikeConfig.getNamespace()).thenReturn("governance");

        mockMvc.perform(get("/api/v1/config/aerospike"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.host").value("127.0.0.1"))
                .andExpect(jsonPath("$.port").value(3000))
                .andExpect(jsonPath("$.namespace").value("governance"));
    }
}
