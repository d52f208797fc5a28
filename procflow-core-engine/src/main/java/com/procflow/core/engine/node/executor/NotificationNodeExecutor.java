package com.procflow.core.engine.node.executor;

import com.procflow.core.engine.node.ProcFlowCollaborators;
import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.enumerations.ProcFlowNodeKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sends a notification through the action provider. {@code recipients} is required and may be
 * a list or a comma separated string; it reaches the provider as a list.
 */
public class NotificationNodeExecutor extends AbstractActionNodeExecutor {

    public static final String CONFIG_RECIPIENTS = "recipients";

    public NotificationNodeExecutor(ProcFlowCollaborators collaborators) {
        super(ProcFlowNodeKind.NOTIFICATION, collaborators);
    }

    @Override
    protected Optional<String> validateConfig(Map<String, Object> actionConfig) {
        return recipients(actionConfig.get(CONFIG_RECIPIENTS)).isEmpty()
                ? Optional.of("'recipients' is required")
                : Optional.empty();
    }

    @Override
    protected Map<String, Object> prepare(ExecutionContext context, Map<String, Object> actionConfig) {
        actionConfig.put(CONFIG_RECIPIENTS, recipients(actionConfig.get(CONFIG_RECIPIENTS)));
        return actionConfig;
    }

    static List<String> recipients(Object value) {
        List<String> recipients = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            items.stream().filter(item -> !isBlank(item)).forEach(item -> recipients.add(item.toString().trim()));
        } else if (!isBlank(value)) {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    recipients.add(part.trim());
                }
            }
        }
        return recipients;
    }
}
