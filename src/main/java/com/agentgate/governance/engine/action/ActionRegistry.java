package com.agentgate.governance.engine.action;

import com.agentgate.governance.config.GovernanceConfig;
import com.agentgate.governance.exception.UnknownActionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Closed registry of action name → handler and required parameters.
 * An action with no handler is an explicit error, never a silent no-op.
 */
@Component
public class ActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, ActionHandler> handlers = new LinkedHashMap<>();
    private final Map<String, List<String>> requiredParams = new LinkedHashMap<>();

    public ActionRegistry(List<ActionHandler> actionHandlers, GovernanceConfig config) {
        // Auto-register all handler implementations
        for (ActionHandler handler : actionHandlers) {
            ActionHandler existing = handlers.putIfAbsent(handler.actionName(), handler);
            if (existing != null) {
                throw new IllegalStateException("Duplicate handlers for action '" + handler.actionName() + "': "
                        + existing.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
            requiredParams.put(handler.actionName(), mergeParams(handler.requiredParams(),
                    config.getRequiredParams().get(handler.actionName())));
            log.info("Registered action handler: {} -> {} (required params {})",
                    handler.actionName(), handler.getClass().getSimpleName(),
                    requiredParams.get(handler.actionName()));
        }

        for (String action : config.getRequiredParams().keySet()) {
            if (!handlers.containsKey(action)) {
                log.warn("Required params configured for action '{}' which has no handler", action);
            }
        }
    }

    public ActionHandler handlerFor(String action) {
        ActionHandler handler = handlers.get(action);
        if (handler == null) {
            throw new UnknownActionException(action);
        }
        return handler;
    }

    /**
     * Required fields for an action: the configured list first, then any the handler
     * declares that the configuration did not repeat.
     */
    public List<String> requiredParams(String action) {
        handlerFor(action);
        return requiredParams.get(action);
    }

    public boolean isRegistered(String action) {
        return handlers.containsKey(action);
    }

    public Set<String> actions() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }

    private static List<String> mergeParams(List<String> declared, List<String> configured) {
        List<String> merged = new ArrayList<>();
        if (configured != null) {
            for (String field : configured) {
                if (!merged.contains(field)) merged.add(field);
            }
        }
        if (declared != null) {
            for (String field : declared) {
                if (!merged.contains(field)) merged.add(field);
            }
        }
        return List.copyOf(merged);
    }
}
