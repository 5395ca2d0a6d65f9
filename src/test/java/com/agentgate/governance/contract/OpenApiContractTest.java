package com.agentgate.governance.contract;

import com.aerospike.client.AerospikeClient;
import com.agentgate.governance.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates the published OpenAPI document so agents and reviewer tooling
 * are protected from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @MockBean
    private AerospikeClient aerospikeClient;

    @Autowired
    private TestRestTemplate restTemplate;

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return JsonPath.parse(response.getBody());
    }

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        // Policy endpoints
        assertThat(paths).containsKey("/api/v1/policy/snapshot");
        assertThat(paths).containsKey("/api/v1/policy/snapshot/versions");
        assertThat(paths).containsKey("/api/v1/policy/snapshot/versions/{version}");
        assertThat(paths).containsKey("/api/v1/policy/snapshot/rollback/{version}");
        assertThat(paths).containsKey("/api/v1/policy/lint");
        assertThat(paths).containsKey("/api/v1/policy/decide");
        assertThat(paths).containsKey("/api/v1/policy/simulate");

        // Approval endpoints
        assertThat(paths).containsKey("/api/v1/approvals");
        assertThat(paths).containsKey("/api/v1/approvals/{id}");
        assertThat(paths).containsKey("/api/v1/approvals/{id}/decide");

        // Execution endpoint
        assertThat(paths).containsKey("/api/v1/execute");

        // Config endpoints
        assertThat(paths).containsKey("/api/v1/config/governance");
        assertThat(paths).containsKey("/api/v1/config/aerospike");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKey("PolicyRule");
        assertThat(schemas).containsKey("RuleSetSnapshot");
        assertThat(schemas).containsKey("Decision");
        assertThat(schemas).containsKey("Approval");
        assertThat(schemas).containsKey("ExecutionPlan");
        assertThat(schemas).containsKey("ExecutionResult");
        assertThat(schemas).containsKey("LintReport");
    }

    @Test
    void openApiSpec_decisionAndApprovalSchemas_haveRequiredFields() {
        DocumentContext json = apiDocs();

        Map<String, Object> decisionProps = json.read("$.components.schemas.Decision.properties");
        assertThat(decisionProps).containsKey("effect");
        assertThat(decisionProps).containsKey("matchedRuleId");
        assertThat(decisionProps).containsKey("reason");
        assertThat(decisionProps).containsKey("budgetOk");

        Map<String, Object> approvalProps = json.read("$.components.schemas.Approval.properties");
        assertThat(approvalProps).containsKey("id");
        assertThat(approvalProps).containsKey("status");
        assertThat(approvalProps).containsKey("expiresAt");
        assertThat(approvalProps).containsKey("signature");

        Map<String, Object> resultProps = json.read("$.components.schemas.ExecutionResult.properties");
        assertThat(resultProps).containsKey("stage");
        assertThat(resultProps).containsKey("violations");
        assertThat(resultProps).containsKey("error");
    }
}
