package com.agentgate.governance.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI agentGovernanceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Agent Governance API")
                        .version("1.0.0")
                        .description(
                                "Policy decisions, signed human approvals and execution guardrails for autonomous agents.\n\n" +
                                "**Execution Pipeline:**\n" +
                                "1. Submit a plan via `POST /api/v1/execute`\n" +
                                "2. Policy engine decides **allow**, **deny** or **needs_approval** from the highest-priority matching rule\n" +
                                "3. Budget ceilings override any rule to **deny**\n" +
                                "4. Pre-guardrails verify the approval (when required) and the action's required parameters\n" +
                                "5. The approval is consumed, then the action handler runs\n" +
                                "6. Post-guardrails attach result-shape and metric warnings; nothing is rolled back\n\n" +
                                "**Approvals:**\n" +
                                "- `POST /api/v1/approvals` creates a pending request with an expiry\n" +
                                "- Reviewers sign `id:decision:approver:expiresAt` with HMAC-SHA256 and post it to `/decide`\n" +
                                "- Each approval authorizes exactly one execution")
                        .contact(new Contact().name("Agent Platform Team")));
    }
}
