package com.agentgate.governance.engine.action;

import com.agentgate.governance.model.ExecutionPlan;

import java.util.List;

/**
 * Interface for the side-effecting implementation of one agent action.
 * Every Spring bean implementing it is registered under {@link #actionName()}.
 */
public interface ActionHandler {

    /**
     * The action this handler performs, e.g. "quarantine".
     */
    String actionName();

    /**
     * Fields that must be present in the plan's context or params, in the order they are checked.
     */
    default List<String> requiredParams() {
        return List.of();
    }

    /**
     * Perform the action. Only called after the policy decision and pre-execution checks passed.
     *
     * @param plan the plan as submitted by the caller
     * @return the handler result, normally a key/value map; {@code ops_count} and
     *         {@code cost_cents_used} are reported usage metrics
     * @throws Exception any failure, reported to the caller as an execution error
     */
    Object handle(ExecutionPlan plan) throws Exception;
}
