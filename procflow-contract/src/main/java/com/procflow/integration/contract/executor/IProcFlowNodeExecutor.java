package com.procflow.integration.contract.executor;

import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.ReviewDecision;
import reactor.core.publisher.Mono;

/**
 * Implementation behind one node kind.
 *
 * <p>Executors never touch the run or the store. They read the {@link ExecutionContext}
 * and describe what should happen through an {@link ExecutorResult}; the walker applies it.
 * Errors should be reported as {@link ExecutorResult.Fail} rather than as error signals,
 * although the walker maps stray errors to a retryable upstream failure.</p>
 */
public interface IProcFlowNodeExecutor {

    ProcFlowNodeKind getKind();

    Mono<ExecutorResult> execute(ExecutionContext context);

    /**
     * Feeds a reviewer decision into a previously suspended node.
     * Only kinds that suspend need to override this.
     */
    default Mono<ExecutorResult> resume(ExecutionContext context, PendingApproval approval, ReviewDecision decision) {
        return Mono.just(ExecutorResult.fail(ProcFlowErrorKind.VALIDATION, false,
                "Node kind " + getKind() + " does not support resumption"));
    }
}
