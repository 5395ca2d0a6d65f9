package com.agentgate.governance.engine.action;

import com.agentgate.governance.config.GovernanceConfig;
import com.agentgate.governance.exception.UnknownActionException;
import com.agentgate.governance.model.ExecutionPlan;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionRegistryTest {

    private static ActionHandler handler(String name, List<String> params) {
        return new ActionHandler() {
            @Override
            public String actionName() {
                return name;
            }

            @Override
            public List<String> requiredParams() {
                return params;
            }

            @Override
            public Object handle(ExecutionPlan plan) {
                return Map.of("handled", name);
            }
        };
    }

    @Test
    void handlerFor_registeredAction_returnsHandler() {
        ActionHandler quarantine = handler("quarantine", List.of("email_id"));
        ActionRegistry registry = new ActionRegistry(List.of(quarantine, handler("label", List.of())),
                new GovernanceConfig());

        assertThat(registry.handlerFor("quarantine")).isSameAs(quarantine);
        assertThat(registry.isRegistered("label")).isTrue();
        assertThat(registry.actions()).containsExactly("label", "quarantine");
    }

    @Test
    void handlerFor_unknownAction_throws() {
        ActionRegistry registry = new ActionRegistry(List.of(), new GovernanceConfig());

        assertThatThrownBy(() -> registry.handlerFor("deploy"))
                .isInstanceOf(UnknownActionException.class)
                .hasMessageContaining("deploy");
        assertThatThrownBy(() -> registry.requiredParams("deploy"))
                .isInstanceOf(UnknownActionException.class);
    }

    @Test
    void constructor_duplicateActionNames_rejected() {
        assertThatThrownBy(() -> new ActionRegistry(
                List.of(handler("quarantine", List.of()), handler("quarantine", List.of())),
                new GovernanceConfig()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("quarantine");
    }

    @Test
    void requiredParams_declaredByHandler() {
        ActionRegistry registry = new ActionRegistry(
                List.of(handler("quarantine", List.of("email_id"))), new GovernanceConfig());

        assertThat(registry.requiredParams("quarantine")).containsExactly("email_id");
    }

    @Test
    void requiredParams_configuredFirstThenDeclared_withoutDuplicates() {
        GovernanceConfig config = new GovernanceConfig();
        config.getRequiredParams().put("label", List.of("label", "email_id"));

        ActionRegistry registry = new ActionRegistry(
                List.of(handler("label", List.of("email_id", "mailbox"))), config);

        assertThat(registry.requiredParams("label")).containsExactly("label", "email_id", "mailbox");
    }
}
