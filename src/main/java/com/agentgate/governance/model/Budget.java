package com.agentgate.governance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Hard resource ceiling for one agent/action pair. A null limit is unlimited.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Resource ceiling for an agent/action pair; null fields are unlimited")
public class Budget {

    @Schema(description = "Maximum estimated duration in milliseconds", example = "5000")
    Long maxDurationMs;

    @Schema(description = "Maximum estimated number of operations", example = "100")
    Long maxOps;

    @Schema(description = "Maximum estimated cost in cents", example = "250")
    Long maxCostCents;

    public static String key(String agent, String action) {
        return agent + ":" + action;
    }
}
