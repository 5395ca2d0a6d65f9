package com.agentgate.governance.config;

import com.agentgate.governance.model.Effect;
import com.agentgate.governance.model.EnforcementMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "governance")
public class GovernanceConfig {

    // strict: every check blocks. permissive: log and report, never block. disabled: no policy engine.
    private EnforcementMode enforcementMode = EnforcementMode.STRICT;

    // Approvals lapse after this many seconds unless the request says otherwise.
    private long defaultApprovalTtlSeconds = 3600;

    // Shared HMAC-SHA256 key for approval signatures.
    private String hmacSecret = "";

    // Required-parameter and post-execution checks. Policy and approval checks ignore this flag.
    private boolean guardrailsEnabled = true;

    // Effect when no rule matches. Fixed for the lifetime of the rule store.
    private Effect defaultEffect = Effect.ALLOW;

    // How often each node re-reads the persisted rule snapshot.
    private int ruleRefreshSeconds = 30;

    // action -> required fields, in the order they are checked. Extends handler declarations.
    private Map<String, List<String>> requiredParams = new LinkedHashMap<>();

    public boolean hasHmacSecret() {
        return hmacSecret != null && !hmacSecret.isBlank();
    }
}
