package com.agentgate.governance.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Outcome of one execute call")
public class ExecutionResult {

    @Schema(description = "Terminal executor stage", example = "done",
            allowableValues = {"denied", "blocked", "failed", "done"})
    private ExecutionStage stage;

    @Schema(description = "Policy effect that applied", example = "allow")
    private Effect effect;

    @Schema(description = "Full policy decision")
    private Decision decision;

    @Schema(description = "Handler result, returned unmodified")
    private Object result;

    @Schema(description = "Blocking violation (blocked) or post-execution warnings (done)")
    @Builder.Default
    private List<GuardrailViolation> violations = new ArrayList<>();

    @Schema(description = "Handler error (failed only)")
    private ExecutionError error;

    public boolean isHandlerInvoked() {
        return stage == ExecutionStage.DONE || stage == ExecutionStage.FAILED;
    }
}
