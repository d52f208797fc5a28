package com.procflow.core.engine.node.executor;

import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.exception.ProcFlowExpressionException;
import com.procflow.integration.models.workflow.EdgeDefinition;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes to the first outgoing edge whose condition is truthy, falling back to the default edge.
 *
 * <h2>Default edge</h2>
 * An edge flagged {@code defaultEdge} wins over an edge without condition; among several
 * candidates the first declared one is taken.
 *
 * <h2>Expression failures</h2>
 * An unknown identifier whose namespace is a node of this definition means that node's outputs
 * are not bound yet, which can resolve itself on a later attempt. Every other expression
 * failure is fatal.
 */
@Slf4j
public class DecisionNodeExecutor extends AbstractProcFlowNodeExecutor {

    public DecisionNodeExecutor() {
        super(ProcFlowNodeKind.DECISION);
    }

    @Override
    protected Mono<ExecutorResult> doExecute(ExecutionContext context) {
        List<EdgeDefinition> edges = context.getOutgoingEdges();
        for (EdgeDefinition edge : edges) {
            if (edge.hasCondition() && context.getEvaluator().evaluateCondition(edge.getCondition(), context.getVariables())) {
                log.debug("Branch matched: runId={}, nodeId={}, target={}", context.getRunId(), context.getNodeId(), edge.getTarget());
                return Mono.just(branch(edge, false));
            }
        }

        Optional<EdgeDefinition> fallback = defaultEdge(edges);
        if (fallback.isEmpty()) {
            return Mono.just(ExecutorResult.fail(ProcFlowErrorKind.NO_MATCHING_BRANCH, false,
                    "No condition matched and decision node '" + context.getNodeId() + "' has no default edge"));
        }
        log.debug("Default branch taken: runId={}, nodeId={}, target={}", context.getRunId(), context.getNodeId(), fallback.get().getTarget());
        return Mono.just(branch(fallback.get(), true));
    }

    @Override
    protected ExecutorResult onExpressionError(ExecutionContext context, ProcFlowExpressionException e) {
        boolean retryable = e.getReason() == ProcFlowExpressionException.Reason.UNKNOWN_IDENTIFIER
                && e.getIdentifierRoot() != null
                && context.getDefinition().node(e.getIdentifierRoot()).isPresent();
        return ExecutorResult.fail(ProcFlowErrorKind.EXPRESSION, retryable, e.getMessage());
    }

    static Optional<EdgeDefinition> defaultEdge(List<EdgeDefinition> edges) {
        Optional<EdgeDefinition> flagged = edges.stream().filter(EdgeDefinition::isDefaultEdge).findFirst();
        if (flagged.isPresent()) {
            return flagged;
        }
        return edges.stream().filter(edge -> !edge.hasCondition()).findFirst();
    }

    private static ExecutorResult branch(EdgeDefinition edge, boolean isDefault) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("branch", edge.getTarget());
        outputs.put("defaultTaken", isDefault);
        if (edge.getLabel() != null) {
            outputs.put("label", edge.getLabel());
        }
        return ExecutorResult.proceed(outputs, List.of(edge.getTarget()));
    }
}
