package com.procflow.core.engine.node.executor;

import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.contract.executor.IProcFlowNodeExecutor;
import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.exception.ProcFlowCollaboratorException;
import com.procflow.integration.exception.ProcFlowExpressionException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Base class for the built-in executors.
 *
 * <p>Subclasses implement {@link #doExecute(ExecutionContext)} and may throw
 * {@link ProcFlowExpressionException} freely; expression failures raised while the result is
 * assembled are converted into {@link ExecutorResult.Fail} by {@link #onExpressionError}.</p>
 */
@Slf4j
public abstract class AbstractProcFlowNodeExecutor implements IProcFlowNodeExecutor {

    private final ProcFlowNodeKind kind;

    protected AbstractProcFlowNodeExecutor(ProcFlowNodeKind kind) {
        this.kind = kind;
    }

    @Override
    public final ProcFlowNodeKind getKind() {
        return kind;
    }

    @Override
    public final Mono<ExecutorResult> execute(ExecutionContext context) {
        return Mono.defer(() -> doExecute(context))
                .onErrorResume(ProcFlowExpressionException.class, e -> {
                    log.debug("Expression failed: runId={}, nodeId={}, reason={}",
                            context.getRunId(), context.getNodeId(), e.getReason());
                    return Mono.just(onExpressionError(context, e));
                });
    }

    protected abstract Mono<ExecutorResult> doExecute(ExecutionContext context);

    /**
     * Expression failures are fatal unless a subclass knows better.
     */
    protected ExecutorResult onExpressionError(ExecutionContext context, ProcFlowExpressionException e) {
        return ExecutorResult.fail(ProcFlowErrorKind.EXPRESSION, false, e.getMessage());
    }

    protected static Mono<ExecutorResult> invalid(String message) {
        return Mono.just(ExecutorResult.fail(ProcFlowErrorKind.VALIDATION, false, message));
    }

    /**
     * Maps a collaborator failure: permanent ones are fatal, everything else may be retried.
     */
    protected static ExecutorResult upstreamFailure(Throwable error) {
        if (error instanceof ProcFlowCollaboratorException collaboratorError) {
            return ExecutorResult.fail(ProcFlowErrorKind.UPSTREAM, !collaboratorError.isPermanent(),
                    collaboratorError.getMessage());
        }
        if (error instanceof ProcFlowExpressionException expressionError) {
            return ExecutorResult.fail(ProcFlowErrorKind.EXPRESSION, false, expressionError.getMessage());
        }
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return ExecutorResult.fail(ProcFlowErrorKind.UPSTREAM, true, message);
    }
}
