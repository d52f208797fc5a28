package com.procflow.core.engine.node;

import com.procflow.core.exception.ProcFlowVariableConflictException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only writes into a run's variable scope.
 */
public final class RunVariables {

    public static final String SEPARATOR = ".";

    private RunVariables() {}

    public static String key(String nodeId, String field) {
        return nodeId + SEPARATOR + field;
    }

    /**
     * Binds every output under {@code nodeId.field}. Re-binding a key to an equal value is
     * accepted; a different value is rejected before anything is written.
     *
     * @throws ProcFlowVariableConflictException when a key is already bound to another value
     */
    public static void mergeNodeOutputs(String runId, Map<String, Object> variables, String nodeId,
                                        Map<String, Object> outputs) {
        if (outputs == null || outputs.isEmpty()) {
            return;
        }
        for (Map.Entry<String, Object> entry : outputs.entrySet()) {
            String key = key(nodeId, entry.getKey());
            if (variables.containsKey(key) && !Objects.equals(variables.get(key), entry.getValue())) {
                throw new ProcFlowVariableConflictException(runId, key);
            }
        }
        outputs.forEach((field, value) -> variables.put(key(nodeId, field), value));
    }

    /**
     * Seeds trigger fields under their bare names.
     */
    public static void seedTriggerInput(String runId, Map<String, Object> variables, Map<String, Object> triggerInput) {
        if (triggerInput == null) {
            return;
        }
        for (Map.Entry<String, Object> entry : triggerInput.entrySet()) {
            if (variables.containsKey(entry.getKey()) && !Objects.equals(variables.get(entry.getKey()), entry.getValue())) {
                throw new ProcFlowVariableConflictException(runId, entry.getKey());
            }
            variables.put(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Outputs of one node with the {@code nodeId.} prefix stripped.
     */
    public static Map<String, Object> outputsOf(Map<String, Object> variables, String nodeId) {
        String prefix = nodeId + SEPARATOR;
        Map<String, Object> outputs = new LinkedHashMap<>();
        variables.forEach((key, value) -> {
            if (key.startsWith(prefix)) {
                outputs.put(key.substring(prefix.length()), value);
            }
        });
        return outputs;
    }
}
