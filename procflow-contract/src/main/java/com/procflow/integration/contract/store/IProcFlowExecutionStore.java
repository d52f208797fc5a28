package com.procflow.integration.contract.store;

import com.procflow.integration.enumerations.ProcFlowRunStatus;
import com.procflow.integration.models.run.ExecutionCommit;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.StepExecution;
import com.procflow.integration.models.run.WorkflowRun;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable state for definitions, runs, step executions and pending approvals.
 *
 * <p>Design Pattern: Repository Pattern
 * - Abstracts data access for the engine
 * - Enables different storage backends (memory, file, database)
 * - Provides reactive API for non-blocking operations
 *
 * <h2>Storage Guarantees</h2>
 * <ul>
 *   <li>Atomicity: {@link #commit(ExecutionCommit)} applies the run and its step and approval
 *       changes together, so a crash never leaves a closed step without its frontier update</li>
 *   <li>Isolation: stores return copies; callers never share mutable state with the store</li>
 *   <li>Ordering: steps are returned in the order they were first saved</li>
 * </ul>
 *
 * <p>The store never changes a run on its own; only the engine writes runs.</p>
 */
public interface IProcFlowExecutionStore {

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    Mono<Void> initialize();

    Mono<Void> shutdown();

    Mono<Boolean> healthCheck();

    // ========================================================================
    // DEFINITIONS
    // ========================================================================

    /**
     * Stores a definition. Definitions are immutable: when the same id and version already
     * exist, the stored one is kept and returned.
     */
    Mono<WorkflowDefinition> saveDefinition(WorkflowDefinition definition);

    Mono<WorkflowDefinition> findDefinition(String definitionId, int version);

    // ========================================================================
    // RUNS
    // ========================================================================

    /**
     * Creates a new run.
     *
     * @return the stored run; an error if the run id already exists
     */
    Mono<WorkflowRun> createRun(WorkflowRun run);

    Mono<WorkflowRun> findRun(String runId);

    Flux<WorkflowRun> findRunsByStatus(ProcFlowRunStatus status);

    /**
     * Atomically replaces the run and upserts or removes the records in the commit.
     *
     * @return the stored run
     */
    Mono<WorkflowRun> commit(ExecutionCommit commit);

    // ========================================================================
    // STEPS & APPROVALS
    // ========================================================================

    /**
     * Upserts a single step by {@code stepId}; used for attempts that do not change the run.
     */
    Mono<StepExecution> saveStep(StepExecution step);

    Flux<StepExecution> findSteps(String runId);

    Mono<PendingApproval> findApproval(String runId, String nodeId);

    Flux<PendingApproval> findApprovals(String runId);

    /**
     * Open approvals of every run, in no particular order.
     */
    Flux<PendingApproval> findOpenApprovals();

    /**
     * Open approvals assigned to {@code assignee}, directly or through an escalation that has
     * already happened.
     */
    default Flux<PendingApproval> findOpenApprovals(String assignee) {
        return findOpenApprovals().filter(approval -> approval.isAssignedTo(assignee));
    }
}
