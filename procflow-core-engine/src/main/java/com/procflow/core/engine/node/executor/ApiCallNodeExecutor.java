package com.procflow.core.engine.node.executor;

import com.procflow.core.engine.node.ProcFlowCollaborators;
import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.enumerations.ProcFlowNodeKind;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Outbound HTTP call through the action provider. {@code url} is required, {@code method}
 * defaults to GET.
 */
public class ApiCallNodeExecutor extends AbstractActionNodeExecutor {

    public static final String CONFIG_URL = "url";
    public static final String CONFIG_METHOD = "method";

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD");

    public ApiCallNodeExecutor(ProcFlowCollaborators collaborators) {
        super(ProcFlowNodeKind.API_CALL, collaborators);
    }

    @Override
    protected Optional<String> validateConfig(Map<String, Object> actionConfig) {
        if (isBlank(actionConfig.get(CONFIG_URL))) {
            return Optional.of("'url' is required");
        }
        Object method = actionConfig.get(CONFIG_METHOD);
        if (method != null && !METHODS.contains(method.toString().toUpperCase(Locale.ROOT))) {
            return Optional.of("unsupported HTTP method " + method);
        }
        return Optional.empty();
    }

    @Override
    protected Map<String, Object> prepare(ExecutionContext context, Map<String, Object> actionConfig) {
        Object method = actionConfig.get(CONFIG_METHOD);
        actionConfig.put(CONFIG_METHOD, method == null ? "GET" : method.toString().toUpperCase(Locale.ROOT));
        return actionConfig;
    }
}
