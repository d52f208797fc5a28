package com.procflow.core.engine.node.impl;

import com.procflow.core.engine.config.ProcFlowEngineConfig;
import com.procflow.core.engine.error.ProcFlowRetryFactory;
import com.procflow.core.engine.lock.IProcFlowRunLockService;
import com.procflow.core.engine.lock.RunLockedException;
import com.procflow.core.engine.node.IProcFlowRunWalker;
import com.procflow.core.engine.node.ProcFlowNodeExecutorRegistry;
import com.procflow.core.engine.node.ProcFlowRunCancellationRegistry;
import com.procflow.core.engine.node.RunVariables;
import com.procflow.core.engine.node.executor.JoinNodeExecutor;
import com.procflow.core.exception.ProcFlowEngineException;
import com.procflow.core.exception.ProcFlowVariableConflictException;
import com.procflow.integration.contract.event.IProcFlowRunEventListener;
import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.contract.executor.IProcFlowNodeExecutor;
import com.procflow.integration.contract.expression.IProcFlowExpressionEvaluator;
import com.procflow.integration.contract.store.IProcFlowExecutionStore;
import com.procflow.integration.enumerations.ProcFlowApprovalDecision;
import com.procflow.integration.enumerations.ProcFlowApprovalTimeoutAction;
import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.enumerations.ProcFlowRunEventType;
import com.procflow.integration.enumerations.ProcFlowRunStatus;
import com.procflow.integration.enumerations.ProcFlowStepStatus;
import com.procflow.integration.exception.ProcFlowCollaboratorException;
import com.procflow.integration.exception.ProcFlowExpressionException;
import com.procflow.integration.exception.ProcFlowValidationException;
import com.procflow.integration.models.event.RunEvent;
import com.procflow.integration.models.run.ExecutionCommit;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.ReviewDecision;
import com.procflow.integration.models.run.StepExecution;
import com.procflow.integration.models.run.WorkflowRun;
import com.procflow.integration.models.workflow.EdgeDefinition;
import com.procflow.integration.models.workflow.NodeDefinition;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Round-based run scheduler.
 *
 * <h2>Round</h2>
 * <pre>
 * frontier ─→ execute all nodes (concurrently, same variable snapshot)
 *          ─→ apply outcomes one by one in frontier order
 *          ─→ one ExecutionCommit ─→ extend lock ─→ next round
 * </pre>
 *
 * <h2>Per node</h2>
 * Open a step, invoke the executor with a timeout, and retry retryable failures with
 * exponential backoff. Each failed attempt is closed and saved before the next one starts.
 * An expression that reads outputs no node has bound yet is not retried in place: the node is
 * deferred to the next round, which sees a fresh snapshot, up to its max attempts.
 * Routing for {@code Continue} is computed while executing, so the apply phase is pure
 * bookkeeping.
 *
 * <h2>End of walk</h2>
 * Empty frontier: open approvals suspend the run, partially arrived joins fail it, otherwise
 * it completes.
 *
 * <p>Events are queued while a round is applied and delivered once its commit is stored.</p>
 */
@Slf4j
public class ProcFlowRunWalker implements IProcFlowRunWalker {

    /**
     * Reviewer id of approvals granted by {@code AUTO_APPROVE} once their deadline passed.
     */
    public static final String DEADLINE_REVIEWER = "procflow:deadline";

    private static final String INTERRUPTED = "attempt interrupted";

    private final IProcFlowExecutionStore store;
    private final ProcFlowNodeExecutorRegistry registry;
    private final IProcFlowExpressionEvaluator evaluator;
    private final IProcFlowRunLockService lockService;
    private final ProcFlowRunCancellationRegistry cancellations;
    private final IProcFlowRunEventListener listener;
    private final ProcFlowEngineConfig config;

    public ProcFlowRunWalker(IProcFlowExecutionStore store,
                             ProcFlowNodeExecutorRegistry registry,
                             IProcFlowExpressionEvaluator evaluator,
                             IProcFlowRunLockService lockService,
                             ProcFlowRunCancellationRegistry cancellations,
                             IProcFlowRunEventListener listener,
                             ProcFlowEngineConfig config) {
        this.store = store;
        this.registry = registry;
        this.evaluator = evaluator;
        this.lockService = lockService;
        this.cancellations = cancellations;
        this.listener = listener;
        this.config = config;
    }

    // ========================================================================
    // OPERATIONS
    // ========================================================================

    @Override
    public Mono<WorkflowRun> walk(String runId) {
        String ownerId = ownerId("walk");
        return lockService.executeWithLock(runId, ownerId, config.getLockDuration(),
                () -> openSession(runId, ownerId)
                        .flatMap(session -> closeInterruptedSteps(session).then(advance(session))));
    }

    @Override
    public Mono<WorkflowRun> resume(String runId, String nodeId, ReviewDecision decision) {
        String ownerId = ownerId("resume");
        return lockService.executeWithLockWaiting(runId, ownerId, config.getLockDuration(), config.getLockWaitTimeout(),
                () -> openSession(runId, ownerId).flatMap(session -> resumeInSession(session, nodeId, decision)));
    }

    @Override
    public Mono<WorkflowRun> cancel(String runId) {
        cancellations.request(runId);
        String ownerId = ownerId("cancel");
        return lockService.executeWithLockWaiting(runId, ownerId, config.getLockDuration(), config.getLockWaitTimeout(),
                        () -> openSession(runId, ownerId).flatMap(session -> {
                            if (session.getRun().getStatus().isTerminal()) {
                                log.info("Cancel ignored, run already terminal: runId={}, status={}",
                                        runId, session.getRun().getStatus());
                                cancellations.clear(runId);
                                return Mono.just(session.getRun());
                            }
                            return applyCancellation(session);
                        }))
                .doOnError(error -> {
                    // a walker still holding the lock honours the request at its next round
                    if (!(error instanceof RunLockedException)) {
                        cancellations.clear(runId);
                    }
                });
    }

    @Override
    public Mono<WorkflowRun> expire(String runId, String nodeId, Instant now) {
        String ownerId = ownerId("expire");
        return lockService.executeWithLock(runId, ownerId, config.getLockDuration(),
                () -> openSession(runId, ownerId).flatMap(session -> expireInSession(session, nodeId, now)));
    }

    @Override
    public Mono<WorkflowRun> escalate(String runId, String nodeId, Instant now) {
        String ownerId = ownerId("escalate");
        return lockService.executeWithLock(runId, ownerId, config.getLockDuration(),
                () -> openSession(runId, ownerId).flatMap(session -> escalateInSession(session, nodeId, now)));
    }

    // ========================================================================
    // SESSION
    // ========================================================================

    private Mono<WalkSession> openSession(String runId, String ownerId) {
        return store.findRun(runId)
                .switchIfEmpty(Mono.error(() -> ProcFlowEngineException.runNotFound(runId)))
                .flatMap(run -> store.findDefinition(run.getDefinitionId(), run.getDefinitionVersion())
                        .switchIfEmpty(Mono.error(() -> ProcFlowEngineException.definitionNotFound(
                                run.getDefinitionId(), run.getDefinitionVersion())))
                        .flatMap(definition -> Mono.zip(
                                        store.findSteps(runId).collectList(),
                                        store.findApprovals(runId).collectList())
                                .map(records -> new WalkSession(ownerId, definition, run, records.getT1(), records.getT2()))));
    }

    private Mono<Void> closeInterruptedSteps(WalkSession session) {
        return Flux.fromIterable(session.getInterruptedSteps())
                .concatMap(step -> {
                    log.warn("Closing interrupted attempt: runId={}, nodeId={}, attempt={}",
                            step.getRunId(), step.getNodeId(), step.getAttempt());
                    return store.saveStep(step.fail(ProcFlowErrorKind.INTERNAL, INTERRUPTED));
                })
                .then(Mono.fromRunnable(() -> session.getInterruptedSteps().clear()));
    }

    private Mono<WorkflowRun> resumeInSession(WalkSession session, String nodeId, ReviewDecision decision) {
        WorkflowRun run = session.getRun();
        if (run.getStatus().isTerminal()) {
            log.info("Resume ignored, run already terminal: runId={}, nodeId={}, status={}",
                    run.getRunId(), nodeId, run.getStatus());
            return Mono.just(run);
        }
        PendingApproval approval = session.getApprovals().get(nodeId);
        if (approval == null || !approval.isOpen()) {
            log.info("Resume ignored, no open approval: runId={}, nodeId={}", run.getRunId(), nodeId);
            return Mono.just(run);
        }
        if (cancellations.isRequested(run.getRunId())) {
            return applyCancellation(session);
        }
        if (decision != null && decision.getDecision() == ProcFlowApprovalDecision.APPROVED && approval.getMinApprovals() > 1) {
            PendingApproval recorded = approval.recordApproval(decision.getReviewerId());
            if (recorded.getRemainingApprovals() > 0) {
                return recordApproval(session, recorded);
            }
            return resolveApproval(session, recorded, decision);
        }
        return resolveApproval(session, approval, decision);
    }

    private Mono<WorkflowRun> resolveApproval(WalkSession session, PendingApproval approval, ReviewDecision decision) {
        WorkflowRun run = session.getRun();
        String nodeId = approval.getNodeId();
        log.info("Resuming run: runId={}, nodeId={}, decision={}", run.getRunId(), nodeId,
                decision == null ? null : decision.getDecision());
        return closeInterruptedSteps(session)
                .then(Mono.defer(() -> resumeNode(session, approval, decision)))
                .flatMap(outcome -> {
                    session.getRun().setStatus(ProcFlowRunStatus.RUNNING);
                    session.queue(RunEvent.of(ProcFlowRunEventType.RUN_RESUMED, run.getRunId(), nodeId,
                            decision == null ? Map.of() : Map.of("decision", String.valueOf(decision.getDecision()))));
                    return applyRound(session, List.of(nodeId), List.of(outcome), approval.getNodeId());
                })
                .then(advance(session));
    }

    // ========================================================================
    // APPROVAL LIFECYCLE
    // ========================================================================

    /**
     * Stores an approval that has not reached its quorum yet; the run stays suspended.
     */
    private Mono<WorkflowRun> recordApproval(WalkSession session, PendingApproval recorded) {
        WorkflowRun run = session.getRun();
        session.getApprovals().put(recorded.getNodeId(), recorded);
        ExecutionCommit commit = ExecutionCommit.of(run);
        commit.getApprovals().add(recorded);

        log.info("Approval recorded: runId={}, nodeId={}, approvedBy={}, remaining={}",
                run.getRunId(), recorded.getNodeId(), recorded.getApprovedBy(), recorded.getRemainingApprovals());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("approvedBy", List.copyOf(recorded.getApprovedBy()));
        data.put("remaining", recorded.getRemainingApprovals());
        session.queue(RunEvent.of(ProcFlowRunEventType.APPROVAL_RECORDED, run.getRunId(), recorded.getNodeId(), data));
        return persist(session, commit);
    }

    private Mono<WorkflowRun> expireInSession(WalkSession session, String nodeId, Instant now) {
        WorkflowRun run = session.getRun();
        PendingApproval approval = session.getApprovals().get(nodeId);
        if (run.getStatus().isTerminal() || approval == null || !approval.isExpired(now)) {
            log.debug("Expiry ignored: runId={}, nodeId={}, status={}", run.getRunId(), nodeId, run.getStatus());
            return Mono.just(run);
        }
        if (cancellations.isRequested(run.getRunId())) {
            return applyCancellation(session);
        }
        if (approval.getTimeoutAction() == ProcFlowApprovalTimeoutAction.AUTO_APPROVE) {
            log.info("Approval deadline passed, approving automatically: runId={}, nodeId={}, deadline={}",
                    run.getRunId(), nodeId, approval.getDeadline());
            return resolveApproval(session, approval, ReviewDecision.builder()
                    .decision(ProcFlowApprovalDecision.APPROVED)
                    .reviewerId(DEADLINE_REVIEWER)
                    .comment("Approved automatically after the deadline " + approval.getDeadline())
                    .build());
        }

        log.warn("Approval deadline passed: runId={}, nodeId={}, deadline={}", run.getRunId(), nodeId, approval.getDeadline());
        session.getApprovals().put(nodeId, approval.close(PendingApproval.CLOSED_EXPIRED));
        run.setStatus(ProcFlowRunStatus.RUNNING);
        return closeInterruptedSteps(session)
                .then(Mono.fromSupplier(() -> expiredOutcome(session, approval)))
                .flatMap(outcome -> applyRound(session, List.of(nodeId), List.of(outcome), nodeId))
                .then(advance(session));
    }

    private NodeOutcome expiredOutcome(WalkSession session, PendingApproval approval) {
        String nodeId = approval.getNodeId();
        Optional<NodeDefinition> definedNode = session.getDefinition().node(nodeId);
        if (definedNode.isEmpty()) {
            return NodeOutcome.failed(nodeId, null, ExecutorResult.fail(ProcFlowErrorKind.INTERNAL, false,
                    "Node '" + nodeId + "' is not part of definition " + session.getDefinition().getId()));
        }
        if (!session.reserveStep(config.getMaxNodeExecutions())) {
            return NodeOutcome.limitExceeded(nodeId);
        }
        Map<String, Object> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(session.getRun().getVariables()));
        StepExecution step = StepExecution.open(session.getRunId(), nodeId, session.nextAttempt(nodeId), snapshot);
        return terminalFailure(session, definedNode.get(), step, ExecutorResult.fail(ProcFlowErrorKind.TIMEOUT, false,
                "Approval deadline " + approval.getDeadline() + " passed without a decision"));
    }

    private Mono<WorkflowRun> escalateInSession(WalkSession session, String nodeId, Instant now) {
        WorkflowRun run = session.getRun();
        PendingApproval approval = session.getApprovals().get(nodeId);
        if (run.getStatus().isTerminal() || approval == null || !approval.isEscalationDue(now)) {
            log.debug("Escalation ignored: runId={}, nodeId={}, status={}", run.getRunId(), nodeId, run.getStatus());
            return Mono.just(run);
        }
        PendingApproval escalated = approval.escalate(now);
        session.getApprovals().put(nodeId, escalated);
        ExecutionCommit commit = ExecutionCommit.of(run);
        commit.getApprovals().add(escalated);

        log.info("Approval escalated: runId={}, nodeId={}, escalationAssignees={}",
                run.getRunId(), nodeId, escalated.getEscalationAssignees());
        session.queue(RunEvent.of(ProcFlowRunEventType.APPROVAL_ESCALATED, run.getRunId(), nodeId,
                Map.of("escalationAssignees", List.copyOf(escalated.getEscalationAssignees()))));
        return persist(session, commit);
    }

    // ========================================================================
    // ROUNDS
    // ========================================================================

    private Mono<WorkflowRun> advance(WalkSession session) {
        return Mono.defer(() -> runRound(session))
                .repeat()
                .takeUntil(more -> !more)
                .then(Mono.fromSupplier(session::getRun));
    }

    /**
     * @return whether another round should follow
     */
    private Mono<Boolean> runRound(WalkSession session) {
        WorkflowRun run = session.getRun();
        if (run.getStatus().isTerminal()) {
            return Mono.just(false);
        }
        if (cancellations.isRequested(run.getRunId())) {
            return applyCancellation(session).thenReturn(false);
        }
        if (run.getFrontier().isEmpty()) {
            return finishWalk(session).thenReturn(false);
        }
        if (session.getStepCount() >= config.getMaxNodeExecutions()) {
            ExecutionCommit commit = ExecutionCommit.of(run);
            failRun(session, commit, null, ProcFlowErrorKind.STEP_LIMIT_EXCEEDED, stepLimitMessage());
            return persist(session, commit).thenReturn(false);
        }
        if (run.getStatus() != ProcFlowRunStatus.RUNNING) {
            run.setStatus(ProcFlowRunStatus.RUNNING);
        }

        List<String> frontier = List.copyOf(run.getFrontier());
        Map<String, Object> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(run.getVariables()));
        log.debug("Executing round: runId={}, frontier={}", run.getRunId(), frontier);

        return Flux.fromIterable(frontier)
                .flatMapSequential(nodeId -> executeNode(session, nodeId, snapshot), Math.max(1, config.getBranchConcurrency()))
                .collectList()
                .flatMap(outcomes -> applyRound(session, frontier, outcomes, null))
                .flatMap(stored -> lockService.extend(stored.getRunId(), session.getOwnerId(), config.getLockDuration()))
                .thenReturn(true);
    }

    // ========================================================================
    // EXECUTE PHASE
    // ========================================================================

    private Mono<NodeOutcome> executeNode(WalkSession session, String nodeId, Map<String, Object> snapshot) {
        String runId = session.getRunId();
        Optional<NodeDefinition> definedNode = session.getDefinition().node(nodeId);
        if (definedNode.isEmpty()) {
            return Mono.just(NodeOutcome.failed(nodeId, null, ExecutorResult.fail(ProcFlowErrorKind.INTERNAL, false,
                    "Node '" + nodeId + "' is not part of definition " + session.getDefinition().getId())));
        }
        NodeDefinition node = definedNode.get();
        IProcFlowNodeExecutor executor = registry.getExecutor(node.getKind());
        Duration timeout = timeoutOf(node);
        int maxAttempts = node.getMaxAttempts() != null ? node.getMaxAttempts() : config.getMaxAttempts();

        Mono<NodeOutcome> attempt = Mono.defer(() -> {
            if (!session.reserveStep(config.getMaxNodeExecutions())) {
                return Mono.just(NodeOutcome.limitExceeded(nodeId));
            }
            StepExecution step = StepExecution.open(runId, nodeId, session.nextAttempt(nodeId), snapshot);
            if (!node.isEnabled()) {
                log.debug("Skipping disabled node: runId={}, nodeId={}", runId, nodeId);
                return Mono.just(NodeOutcome.skipped(step, null, "node disabled", skipTargets(session.getDefinition(), node)));
            }
            ExecutionContext context = contextFor(session, node, step.getAttempt(), snapshot);
            return store.saveStep(step)
                    .doOnNext(saved -> emit(RunEvent.of(ProcFlowRunEventType.STEP_STARTED, runId, nodeId,
                            Map.of("attempt", saved.getAttempt()))))
                    .then(invoke(() -> executor.execute(context), context, timeout))
                    .flatMap(result -> toOutcome(session, node, step, context, result, maxAttempts));
        });

        return attempt
                .retryWhen(ProcFlowRetryFactory.buildRetry(maxAttempts, config,
                        error -> error instanceof RetryableAttemptFailure && !cancellations.isRequested(runId)))
                .onErrorResume(RetryableAttemptFailure.class, failure -> {
                    if (cancellations.isRequested(runId)) {
                        log.info("Retry abandoned for cancellation: runId={}, nodeId={}", runId, nodeId);
                        return Mono.just(NodeOutcome.abandoned(nodeId));
                    }
                    log.warn("Retries exhausted: runId={}, nodeId={}, attempts={}, errorKind={}",
                            runId, nodeId, failure.getStep().getAttempt(), failure.getFail().errorKind());
                    return Mono.just(terminalFailure(session, node, failure.getStep(), failure.getFail().fatal()));
                });
    }

    private Mono<NodeOutcome> resumeNode(WalkSession session, PendingApproval approval, ReviewDecision decision) {
        String runId = session.getRunId();
        String nodeId = approval.getNodeId();
        Optional<NodeDefinition> definedNode = session.getDefinition().node(nodeId);
        if (definedNode.isEmpty()) {
            return Mono.just(NodeOutcome.failed(nodeId, null, ExecutorResult.fail(ProcFlowErrorKind.INTERNAL, false,
                    "Node '" + nodeId + "' is not part of definition " + session.getDefinition().getId())));
        }
        if (!session.reserveStep(config.getMaxNodeExecutions())) {
            return Mono.just(NodeOutcome.limitExceeded(nodeId));
        }
        NodeDefinition node = definedNode.get();
        IProcFlowNodeExecutor executor = registry.getExecutor(node.getKind());
        Map<String, Object> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(session.getRun().getVariables()));
        StepExecution step = StepExecution.open(runId, nodeId, session.nextAttempt(nodeId), snapshot);
        ExecutionContext context = contextFor(session, node, step.getAttempt(), snapshot);

        return store.saveStep(step)
                .doOnNext(saved -> emit(RunEvent.of(ProcFlowRunEventType.STEP_STARTED, runId, nodeId,
                        Map.of("attempt", saved.getAttempt()))))
                .then(invoke(() -> executor.resume(context, approval, decision), context, timeoutOf(node)))
                // a reviewer decision is final, so nothing here is retried
                .map(result -> result instanceof ExecutorResult.Fail fail ? fail.fatal() : result)
                .flatMap(result -> toOutcome(session, node, step, context, result, 1));
    }

    private Mono<ExecutorResult> invoke(Supplier<Mono<ExecutorResult>> call, ExecutionContext context, Duration timeout) {
        return Mono.defer(call)
                .timeout(timeout)
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("Step timed out: runId={}, nodeId={}, attempt={}, timeoutMs={}",
                            context.getRunId(), context.getNodeId(), context.getAttempt(), timeout.toMillis());
                    return Mono.just(ExecutorResult.fail(ProcFlowErrorKind.TIMEOUT, true,
                            "Step timed out after " + timeout.toMillis() + " ms"));
                })
                .onErrorResume(error -> Mono.just(strayFailure(context, error)))
                .switchIfEmpty(Mono.fromSupplier(() -> ExecutorResult.fail(ProcFlowErrorKind.INTERNAL, false,
                        "Executor for " + context.getNode().getKind() + " returned no result")));
    }

    private static ExecutorResult strayFailure(ExecutionContext context, Throwable error) {
        log.warn("Executor signalled an error: runId={}, nodeId={}, attempt={}, error={}",
                context.getRunId(), context.getNodeId(), context.getAttempt(), error.toString());
        if (error instanceof ProcFlowExpressionException) {
            return ExecutorResult.fail(ProcFlowErrorKind.EXPRESSION, false, error.getMessage());
        }
        if (error instanceof ProcFlowValidationException) {
            return ExecutorResult.fail(ProcFlowErrorKind.VALIDATION, false, error.getMessage());
        }
        if (error instanceof ProcFlowCollaboratorException collaboratorError) {
            return ExecutorResult.fail(ProcFlowErrorKind.UPSTREAM, !collaboratorError.isPermanent(), error.getMessage());
        }
        return ExecutorResult.fail(ProcFlowErrorKind.UPSTREAM, true,
                error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage());
    }

    private Mono<NodeOutcome> toOutcome(WalkSession session, NodeDefinition node, StepExecution step,
                                        ExecutionContext context, ExecutorResult result, int maxAttempts) {
        switch (result.getType()) {
            case CONTINUE:
                ExecutorResult.Continue proceed = (ExecutorResult.Continue) result;
                List<String> targets;
                try {
                    targets = route(session.getDefinition(), node, proceed, context);
                } catch (ProcFlowExpressionException e) {
                    return Mono.just(terminalFailure(session, node, step,
                            ExecutorResult.fail(ProcFlowErrorKind.EXPRESSION, false, e.getMessage())));
                }
                return Mono.just(NodeOutcome.continued(step, proceed.outputs(), targets));
            case SUSPEND:
                return Mono.just(NodeOutcome.suspended(step, ((ExecutorResult.Suspend) result).reviewPayload()));
            case FAIL:
                ExecutorResult.Fail fail = (ExecutorResult.Fail) result;
                if (fail.retryable() && fail.errorKind() == ProcFlowErrorKind.EXPRESSION) {
                    return deferAttempt(session, node, step, fail, maxAttempts);
                }
                if (fail.retryable()) {
                    return closeFailedAttempt(step, fail);
                }
                return Mono.just(terminalFailure(session, node, step, fail));
            default:
                return Mono.just(NodeOutcome.failed(node.getNodeId(), step, ExecutorResult.fail(
                        ProcFlowErrorKind.INTERNAL, false, "Unknown executor result " + result.getType())));
        }
    }

    /**
     * Persists the failed attempt and signals the retry loop.
     */
    private Mono<NodeOutcome> closeFailedAttempt(StepExecution step, ExecutorResult.Fail fail) {
        StepExecution closed = step.fail(fail.errorKind(), fail.message());
        log.warn("Attempt failed: runId={}, nodeId={}, attempt={}, errorKind={}, error={}",
                closed.getRunId(), closed.getNodeId(), closed.getAttempt(), fail.errorKind(), fail.message());
        return store.saveStep(closed)
                .doOnNext(saved -> emit(stepEvent(ProcFlowRunEventType.STEP_FAILED, saved)))
                .then(Mono.error(new RetryableAttemptFailure(closed, fail)));
    }

    /**
     * Closes an attempt whose expression read outputs of a node that has not bound them yet.
     * Retrying inside the round would see the same snapshot, so the node waits for the next one.
     */
    private Mono<NodeOutcome> deferAttempt(WalkSession session, NodeDefinition node, StepExecution step,
                                           ExecutorResult.Fail fail, int maxAttempts) {
        if (step.getAttempt() >= maxAttempts) {
            log.warn("Deferrals exhausted: runId={}, nodeId={}, attempts={}", step.getRunId(), step.getNodeId(), step.getAttempt());
            return Mono.just(terminalFailure(session, node, step, fail.fatal()));
        }
        StepExecution closed = step.fail(fail.errorKind(), fail.message());
        log.info("Deferring node to next round: runId={}, nodeId={}, attempt={}, error={}",
                closed.getRunId(), closed.getNodeId(), closed.getAttempt(), fail.message());
        return store.saveStep(closed)
                .doOnNext(saved -> emit(stepEvent(ProcFlowRunEventType.STEP_FAILED, saved)))
                .thenReturn(NodeOutcome.deferred(closed, fail));
    }

    private NodeOutcome terminalFailure(WalkSession session, NodeDefinition node, StepExecution step, ExecutorResult.Fail fail) {
        if (node.isSkipOnError()) {
            log.info("Failure skipped by node setting: runId={}, nodeId={}, errorKind={}",
                    session.getRunId(), node.getNodeId(), fail.errorKind());
            return NodeOutcome.skipped(step, fail.errorKind(), fail.message(), skipTargets(session.getDefinition(), node));
        }
        return NodeOutcome.failed(node.getNodeId(), step, fail);
    }

    private List<String> route(WorkflowDefinition definition, NodeDefinition node, ExecutorResult.Continue proceed,
                               ExecutionContext context) {
        if (proceed.hasNextOverride()) {
            List<String> targets = new ArrayList<>();
            for (String target : proceed.nextOverride()) {
                if (definition.node(target).isEmpty()) {
                    log.warn("Ignoring unknown routing target: runId={}, nodeId={}, target={}",
                            context.getRunId(), node.getNodeId(), target);
                } else if (!targets.contains(target)) {
                    targets.add(target);
                }
            }
            return targets;
        }

        // conditions on a node's edges may read that node's own outputs
        Map<String, Object> scope = new LinkedHashMap<>(context.getVariables());
        proceed.outputs().forEach((field, value) -> scope.putIfAbsent(RunVariables.key(node.getNodeId(), field), value));

        List<String> targets = new ArrayList<>();
        for (EdgeDefinition edge : definition.outgoingEdges(node.getNodeId())) {
            if ((!edge.hasCondition() || evaluator.evaluateCondition(edge.getCondition(), scope))
                    && !targets.contains(edge.getTarget())) {
                targets.add(edge.getTarget());
            }
        }
        return targets;
    }

    private static List<String> skipTargets(WorkflowDefinition definition, NodeDefinition node) {
        return definition.outgoingEdges(node.getNodeId()).stream()
                .filter(edge -> !edge.hasCondition() || edge.isDefaultEdge())
                .map(EdgeDefinition::getTarget)
                .distinct()
                .toList();
    }

    private ExecutionContext contextFor(WalkSession session, NodeDefinition node, int attempt, Map<String, Object> snapshot) {
        WorkflowRun run = session.getRun();
        return ExecutionContext.builder()
                .runId(run.getRunId())
                .attempt(attempt)
                .node(node)
                .definition(session.getDefinition())
                .variables(snapshot)
                .triggerInput(Collections.unmodifiableMap(new LinkedHashMap<>(run.getTriggerInput())))
                .arrivals(List.copyOf(run.getJoinArrivals().getOrDefault(node.getNodeId(), List.of())))
                .evaluator(evaluator)
                .build();
    }

    private Duration timeoutOf(NodeDefinition node) {
        return node.getTimeoutMs() != null ? Duration.ofMillis(node.getTimeoutMs()) : config.getStepTimeout();
    }

    // ========================================================================
    // APPLY PHASE
    // ========================================================================

    private Mono<WorkflowRun> applyRound(WalkSession session, Collection<String> processed, List<NodeOutcome> outcomes,
                                         String consumedApproval) {
        WorkflowRun run = session.getRun();
        ExecutionCommit commit = ExecutionCommit.of(run);
        session.setCurrentRound(processed);

        if (consumedApproval != null) {
            PendingApproval consumed = session.getApprovals().get(consumedApproval);
            run.getSuspendedNodes().remove(consumedApproval);
            if (consumed != null && !consumed.isOpen()) {
                // expired approvals stay on record
                commit.getApprovals().add(consumed);
            } else {
                session.getApprovals().remove(consumedApproval);
                commit.getRemovedApprovals().add(consumedApproval);
            }
        }

        List<String> nextFrontier = new ArrayList<>();
        for (String nodeId : run.getFrontier()) {
            if (!processed.contains(nodeId)) {
                nextFrontier.add(nodeId);
            }
        }

        boolean progressed = outcomes.stream().anyMatch(outcome -> outcome.getKind() != NodeOutcome.Kind.DEFERRED);
        for (NodeOutcome outcome : outcomes) {
            applyOutcome(session, commit, outcome, nextFrontier, progressed);
        }

        if (run.getStatus() == ProcFlowRunStatus.FAILED) {
            run.getFrontier().clear();
            closeOpenApprovals(session, commit);
        } else {
            run.setFrontier(nextFrontier);
        }
        session.setCurrentRound(List.of());
        return persist(session, commit);
    }

    private void applyOutcome(WalkSession session, ExecutionCommit commit, NodeOutcome outcome, List<String> nextFrontier,
                              boolean progressed) {
        WorkflowRun run = session.getRun();
        boolean runFailed = run.getStatus() == ProcFlowRunStatus.FAILED;
        String nodeId = outcome.getNodeId();

        switch (outcome.getKind()) {
            case CONTINUE:
                try {
                    RunVariables.mergeNodeOutputs(run.getRunId(), run.getVariables(), nodeId, outcome.getOutputs());
                } catch (ProcFlowVariableConflictException e) {
                    log.error("Variable conflict: runId={}, nodeId={}, key={}", run.getRunId(), nodeId, e.getKey());
                    StepExecution failed = outcome.getStep().fail(ProcFlowErrorKind.INTERNAL, e.getMessage());
                    commit.getSteps().add(failed);
                    session.queue(stepEvent(ProcFlowRunEventType.STEP_FAILED, failed));
                    if (!runFailed) {
                        failRun(session, commit, nodeId, ProcFlowErrorKind.INTERNAL, e.getMessage());
                    }
                    return;
                }
                StepExecution succeeded = outcome.getStep().succeed(new LinkedHashMap<>(outcome.getOutputs()));
                commit.getSteps().add(succeeded);
                session.markCompleted(nodeId);
                if (isEndNode(session, nodeId)) {
                    run.getOutput().putAll(outcome.getOutputs());
                }
                session.queue(stepEvent(ProcFlowRunEventType.STEP_SUCCEEDED, succeeded));
                if (!runFailed) {
                    enqueue(session, nodeId, outcome.getTargets(), nextFrontier);
                }
                return;

            case SUSPEND:
                StepExecution suspended = outcome.getStep().suspend();
                commit.getSteps().add(suspended);
                PendingApproval approval = PendingApproval.fromReviewPayload(
                        run.getRunId(), nodeId, outcome.getReviewPayload(), Instant.now());
                session.getApprovals().put(nodeId, approval);
                commit.getApprovals().add(approval);
                if (!run.getSuspendedNodes().contains(nodeId)) {
                    run.getSuspendedNodes().add(nodeId);
                }
                session.queue(stepEvent(ProcFlowRunEventType.STEP_SUSPENDED, suspended));
                return;

            case SKIP:
                StepExecution skipped = outcome.getStep().skip(outcome.getErrorKind(), outcome.getMessage());
                commit.getSteps().add(skipped);
                session.markCompleted(nodeId);
                session.queue(stepEvent(ProcFlowRunEventType.STEP_SKIPPED, skipped));
                if (!runFailed) {
                    enqueue(session, nodeId, outcome.getTargets(), nextFrontier);
                }
                return;

            case FAIL:
                StepExecution step = outcome.getStep();
                if (step != null) {
                    if (step.getStatus() == ProcFlowStepStatus.RUNNING) {
                        step = step.fail(outcome.getErrorKind(), outcome.getMessage());
                        session.queue(stepEvent(ProcFlowRunEventType.STEP_FAILED, step));
                    }
                    commit.getSteps().add(step);
                }
                if (!runFailed) {
                    failRun(session, commit, nodeId, outcome.getErrorKind(), outcome.getMessage());
                }
                return;

            case LIMIT_EXCEEDED:
                if (!runFailed) {
                    failRun(session, commit, nodeId, ProcFlowErrorKind.STEP_LIMIT_EXCEEDED, stepLimitMessage());
                }
                return;

            case DEFERRED:
                if (!progressed) {
                    // a round where every node deferred leaves the next snapshot unchanged
                    ExecutorResult.Fail fatal = ExecutorResult.fail(outcome.getErrorKind(), false, outcome.getMessage());
                    NodeOutcome terminal = session.getDefinition().node(nodeId)
                            .map(node -> terminalFailure(session, node, outcome.getStep(), fatal))
                            .orElseGet(() -> NodeOutcome.failed(nodeId, outcome.getStep(), fatal));
                    applyOutcome(session, commit, terminal, nextFrontier, true);
                    return;
                }
                if (!nextFrontier.contains(nodeId)) {
                    nextFrontier.add(nodeId);
                }
                return;

            case ABANDONED:
            default:
                if (!nextFrontier.contains(nodeId)) {
                    nextFrontier.add(nodeId);
                }
        }
    }

    /**
     * Schedules routing targets. A join only records the arrival and is scheduled once it is
     * satisfied; a node that already completed or is already scheduled is not scheduled again.
     */
    private void enqueue(WalkSession session, String sourceId, List<String> targets, List<String> nextFrontier) {
        WorkflowRun run = session.getRun();
        WorkflowDefinition definition = session.getDefinition();
        for (String target : targets) {
            Optional<NodeDefinition> targetNode = definition.node(target);
            if (targetNode.isEmpty()) {
                continue;
            }
            boolean scheduled = session.isCompleted(target)
                    || session.getCurrentRound().contains(target)
                    || nextFrontier.contains(target);

            if (targetNode.get().getKind() == ProcFlowNodeKind.JOIN) {
                List<String> arrivals = run.getJoinArrivals().computeIfAbsent(target, key -> new ArrayList<>());
                if (!arrivals.contains(sourceId)) {
                    arrivals.add(sourceId);
                }
                int incoming = incomingSources(definition, target);
                if (!scheduled && JoinNodeExecutor.isSatisfied(targetNode.get(), incoming, arrivals)) {
                    nextFrontier.add(target);
                } else {
                    log.debug("Join waiting: runId={}, joinId={}, arrivals={}, expected={}", run.getRunId(), target,
                            arrivals.size(), JoinNodeExecutor.expectedArrivals(targetNode.get(), incoming));
                }
            } else if (scheduled) {
                log.debug("Target already scheduled or completed: runId={}, source={}, target={}",
                        run.getRunId(), sourceId, target);
            } else {
                nextFrontier.add(target);
            }
        }
    }

    private static int incomingSources(WorkflowDefinition definition, String nodeId) {
        return (int) definition.incomingEdges(nodeId).stream().map(EdgeDefinition::getSource).distinct().count();
    }

    private static boolean isEndNode(WalkSession session, String nodeId) {
        return session.getDefinition().node(nodeId)
                .map(node -> node.getKind() == ProcFlowNodeKind.END)
                .orElse(false);
    }

    private void failRun(WalkSession session, ExecutionCommit commit, String nodeId, ProcFlowErrorKind errorKind, String message) {
        WorkflowRun run = session.getRun();
        run.setStatus(ProcFlowRunStatus.FAILED);
        run.setErrorKind(errorKind);
        run.setError(message);
        run.setFailedNodeId(nodeId);
        run.setCompletedAt(Instant.now());
        run.getFrontier().clear();
        closeOpenApprovals(session, commit);

        log.warn("Run failed: runId={}, nodeId={}, errorKind={}, error={}", run.getRunId(), nodeId, errorKind, message);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("errorKind", String.valueOf(errorKind));
        data.put("error", message);
        session.queue(RunEvent.of(ProcFlowRunEventType.RUN_FAILED, run.getRunId(), nodeId, data));
    }

    /**
     * Keeps sibling approvals for postmortem, closed so that they can no longer be resumed.
     */
    private static void closeOpenApprovals(WalkSession session, ExecutionCommit commit) {
        for (Map.Entry<String, PendingApproval> entry : session.getApprovals().entrySet()) {
            if (entry.getValue().isOpen()) {
                PendingApproval closed = entry.getValue().close(PendingApproval.CLOSED_RUN_FAILED);
                entry.setValue(closed);
                commit.getApprovals().removeIf(approval -> approval.getNodeId().equals(closed.getNodeId()));
                commit.getApprovals().add(closed);
            }
        }
        session.getRun().getSuspendedNodes().clear();
    }

    private Mono<WorkflowRun> finishWalk(WalkSession session) {
        WorkflowRun run = session.getRun();
        ExecutionCommit commit = ExecutionCommit.of(run);

        if (session.hasOpenApprovals()) {
            if (run.getStatus() == ProcFlowRunStatus.SUSPENDED) {
                return Mono.just(run);
            }
            run.setStatus(ProcFlowRunStatus.SUSPENDED);
            log.info("Run suspended: runId={}, awaiting={}", run.getRunId(), run.getSuspendedNodes());
            session.queue(RunEvent.of(ProcFlowRunEventType.RUN_SUSPENDED, run.getRunId(), null,
                    Map.of("suspendedNodes", List.copyOf(run.getSuspendedNodes()))));
            return persist(session, commit);
        }

        Optional<Map.Entry<String, List<String>>> partialJoin = run.getJoinArrivals().entrySet().stream()
                .filter(entry -> !entry.getValue().isEmpty() && !session.isCompleted(entry.getKey()))
                .findFirst();
        if (partialJoin.isPresent()) {
            String joinId = partialJoin.get().getKey();
            int expected = session.getDefinition().node(joinId)
                    .map(join -> JoinNodeExecutor.expectedArrivals(join, incomingSources(session.getDefinition(), joinId)))
                    .orElse(0);
            failRun(session, commit, joinId, ProcFlowErrorKind.JOIN_UNSATISFIED,
                    "Join '" + joinId + "' received " + partialJoin.get().getValue().size()
                            + " of " + expected + " expected arrivals");
            return persist(session, commit);
        }

        run.setStatus(ProcFlowRunStatus.COMPLETED);
        run.setCompletedAt(Instant.now());
        log.info("Run completed: runId={}, steps={}", run.getRunId(), session.getStepCount());
        session.queue(RunEvent.of(ProcFlowRunEventType.RUN_COMPLETED, run.getRunId(), null,
                Map.of("output", new LinkedHashMap<>(run.getOutput()))));
        return persist(session, commit);
    }

    private Mono<WorkflowRun> applyCancellation(WalkSession session) {
        WorkflowRun run = session.getRun();
        ExecutionCommit commit = ExecutionCommit.of(run);

        run.setStatus(ProcFlowRunStatus.CANCELLED);
        run.setErrorKind(ProcFlowErrorKind.CANCELLED);
        run.setError("Run cancelled");
        run.setCompletedAt(Instant.now());
        run.getFrontier().clear();
        run.getSuspendedNodes().clear();
        commit.getRemovedApprovals().addAll(session.getApprovals().keySet());
        session.getApprovals().clear();

        log.info("Run cancelled: runId={}", run.getRunId());
        session.queue(RunEvent.of(ProcFlowRunEventType.RUN_CANCELLED, run.getRunId()));
        return persist(session, commit)
                .doOnNext(stored -> cancellations.clear(stored.getRunId()));
    }

    private Mono<WorkflowRun> persist(WalkSession session, ExecutionCommit commit) {
        WorkflowRun run = session.getRun();
        run.setStepCount(session.getStepCount());
        run.setUpdatedAt(Instant.now());
        commit.setRun(run);
        return store.commit(commit)
                .doOnNext(stored -> {
                    session.setRun(stored);
                    session.drainEvents().forEach(this::emit);
                });
    }

    // ========================================================================
    // EVENTS
    // ========================================================================

    private static RunEvent stepEvent(ProcFlowRunEventType type, StepExecution step) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("attempt", step.getAttempt());
        data.put("status", String.valueOf(step.getStatus()));
        if (step.getErrorKind() != null) {
            data.put("errorKind", step.getErrorKind().name());
            data.put("error", step.getError());
        }
        return RunEvent.of(type, step.getRunId(), step.getNodeId(), data);
    }

    private void emit(RunEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Run event listener failed: runId={}, type={}, error={}", event.getRunId(), event.getType(), e.getMessage());
        }
    }

    private String stepLimitMessage() {
        return "Run exceeded the limit of " + config.getMaxNodeExecutions() + " node executions";
    }

    private static String ownerId(String operation) {
        return operation + ":" + UUID.randomUUID();
    }

    /**
     * Carries a closed retryable attempt through {@code retryWhen}.
     */
    static final class RetryableAttemptFailure extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final transient StepExecution step;
        private final transient ExecutorResult.Fail fail;

        RetryableAttemptFailure(StepExecution step, ExecutorResult.Fail fail) {
            super(fail.message(), null, false, false);
            this.step = step;
            this.fail = fail;
        }

        StepExecution getStep() {
            return step;
        }

        ExecutorResult.Fail getFail() {
            return fail;
        }
    }
}
