package com.procflow.core.engine.node.executor;

import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import reactor.core.publisher.Mono;

/**
 * Publishes the trigger input as the start node's outputs.
 */
public class StartNodeExecutor extends AbstractProcFlowNodeExecutor {

    public StartNodeExecutor() {
        super(ProcFlowNodeKind.START);
    }

    @Override
    protected Mono<ExecutorResult> doExecute(ExecutionContext context) {
        return Mono.just(ExecutorResult.proceed(context.getTriggerInput()));
    }
}
