package com.procflow.core.engine.node.executor;

import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.models.workflow.EdgeDefinition;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Fans out to every outgoing edge, conditions ignored.
 */
public class ForkNodeExecutor extends AbstractProcFlowNodeExecutor {

    public ForkNodeExecutor() {
        super(ProcFlowNodeKind.FORK);
    }

    @Override
    protected Mono<ExecutorResult> doExecute(ExecutionContext context) {
        List<String> targets = context.getOutgoingEdges().stream()
                .map(EdgeDefinition::getTarget)
                .distinct()
                .toList();
        return Mono.just(ExecutorResult.proceed(Map.of("branches", targets), targets));
    }
}
