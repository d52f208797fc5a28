package com.procflow.core.engine;

import com.procflow.core.engine.config.ProcFlowEngineConfig;
import com.procflow.core.engine.lock.IProcFlowRunLockService;
import com.procflow.core.engine.node.IProcFlowRunWalker;
import com.procflow.core.engine.node.ProcFlowNodeExecutorRegistry;
import com.procflow.core.engine.validation.ProcFlowDefinitionValidator;
import com.procflow.integration.contract.expression.IProcFlowExpressionEvaluator;
import com.procflow.integration.contract.store.IProcFlowExecutionStore;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.ReviewDecision;
import com.procflow.integration.models.run.WorkflowRunState;
import com.procflow.integration.models.workflow.DefinitionValidationResult;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Entry point for callers: starts, resumes, cancels and inspects runs.
 *
 * <p>Every run operation returns once the run has nothing runnable left, so the returned
 * state is COMPLETED, FAILED, CANCELLED or SUSPENDED.</p>
 */
public interface IProcFlowFacade {

    // ========================================================================
    // RUN OPERATIONS
    // ========================================================================

    /**
     * Starts a run under a generated id.
     */
    Mono<WorkflowRunState> startRun(WorkflowDefinition definition, Map<String, Object> triggerInput);

    /**
     * Starts a run under the caller's id. Starting an id that already exists returns the state
     * of the existing run and starts nothing.
     *
     * @throws com.procflow.integration.exception.ProcFlowValidationException (as error signal) for
     *         an invalid definition or trigger input; no run is created
     */
    Mono<WorkflowRunState> startRun(String runId, WorkflowDefinition definition, Map<String, Object> triggerInput);

    Mono<WorkflowRunState> resumeRun(String runId, String nodeId, ReviewDecision decision);

    /**
     * Cancels a run. When another walker keeps the run locked past the lock wait timeout, the
     * request stays registered, the walker honours it before its next round, and the returned
     * state has {@link WorkflowRunState#isCancelRequested()} set.
     */
    Mono<WorkflowRunState> cancelRun(String runId);

    /**
     * @throws com.procflow.core.exception.ProcFlowEngineException (as error signal) with
     *         {@code RUN_NOT_FOUND} for an unknown run
     */
    Mono<WorkflowRunState> getRunState(String runId);

    Mono<DefinitionValidationResult> validateDefinition(WorkflowDefinition definition);

    // ========================================================================
    // APPROVALS
    // ========================================================================

    /**
     * Open approvals across all runs that {@code assignee} may decide, including approvals
     * escalated to them.
     */
    Flux<PendingApproval> findOpenApprovals(String assignee);

    // ========================================================================
    // COMPONENTS
    // ========================================================================

    ProcFlowEngineConfig getConfig();

    IProcFlowExecutionStore getExecutionStore();

    ProcFlowNodeExecutorRegistry getExecutorRegistry();

    IProcFlowExpressionEvaluator getExpressionEvaluator();

    IProcFlowRunLockService getLockService();

    IProcFlowRunWalker getRunWalker();

    ProcFlowDefinitionValidator getDefinitionValidator();
}
