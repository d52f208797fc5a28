package com.procflow.integration.contract.executor;

import com.procflow.integration.contract.expression.IProcFlowExpressionEvaluator;
import com.procflow.integration.models.run.StepExecution;
import com.procflow.integration.models.workflow.EdgeDefinition;
import com.procflow.integration.models.workflow.NodeDefinition;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Everything an executor may read for one attempt. The variable scope is a read-only
 * snapshot taken before the attempt started.
 */
@Getter
@Builder
@ToString(of = {"runId", "attempt"})
public class ExecutionContext {

    private final String runId;

    private final int attempt;

    private final NodeDefinition node;

    private final WorkflowDefinition definition;

    @Builder.Default
    private final Map<String, Object> variables = Collections.emptyMap();

    @Builder.Default
    private final Map<String, Object> triggerInput = Collections.emptyMap();

    /**
     * Predecessors that have reached this node; only populated for joins.
     */
    @Builder.Default
    private final List<String> arrivals = Collections.emptyList();

    private final IProcFlowExpressionEvaluator evaluator;

    public String getNodeId() {
        return node.getNodeId();
    }

    /**
     * Deterministic token for this attempt, handed to collaborators so that retried
     * side effects can be de-duplicated.
     */
    public String getIdempotencyKey() {
        return StepExecution.stepId(runId, node.getNodeId(), attempt);
    }

    public List<EdgeDefinition> getOutgoingEdges() {
        return definition.outgoingEdges(node.getNodeId());
    }

    public Object evaluate(String expression) {
        return evaluator.evaluate(expression, variables);
    }

    public Object interpolate(Object value) {
        return evaluator.interpolateValue(value, variables);
    }
}
