package com.procflow.core.engine;

import com.procflow.core.engine.config.ProcFlowEngineConfig;
import com.procflow.core.engine.event.impl.CompositeRunEventListener;
import com.procflow.core.engine.expression.ProcFlowExpressionEvaluator;
import com.procflow.core.engine.lock.IProcFlowRunLockService;
import com.procflow.core.engine.lock.RunLockedException;
import com.procflow.core.engine.lock.impl.InMemoryRunLockService;
import com.procflow.core.engine.node.IProcFlowRunWalker;
import com.procflow.core.engine.node.ProcFlowCollaborators;
import com.procflow.core.engine.node.ProcFlowNodeExecutorRegistry;
import com.procflow.core.engine.node.ProcFlowRunCancellationRegistry;
import com.procflow.core.engine.node.RunVariables;
import com.procflow.core.engine.node.impl.ProcFlowRunWalker;
import com.procflow.core.engine.state.ProcFlowExecutionStoreManager;
import com.procflow.core.engine.validation.ProcFlowDefinitionValidator;
import com.procflow.core.exception.ProcFlowEngineException;
import com.procflow.core.exception.codes.ProcFlowEngineErrorCodes;
import com.procflow.integration.contract.event.IProcFlowRunEventListener;
import com.procflow.integration.contract.expression.IProcFlowExpressionEvaluator;
import com.procflow.integration.contract.store.IProcFlowExecutionStore;
import com.procflow.integration.enumerations.ProcFlowRunEventType;
import com.procflow.integration.enumerations.ProcFlowRunStatus;
import com.procflow.integration.exception.ProcFlowValidationException;
import com.procflow.integration.models.event.RunEvent;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.ReviewDecision;
import com.procflow.integration.models.run.WorkflowRun;
import com.procflow.integration.models.run.WorkflowRunState;
import com.procflow.integration.models.workflow.DefinitionValidationResult;
import com.procflow.integration.models.workflow.NodeDefinition;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Default {@link IProcFlowFacade}.
 *
 * <p>{@link #getInstance()} wires the process-wide defaults: configuration from system
 * properties and environment, the configured execution store, the in-memory run lock and
 * executors without collaborators. Embedding applications and tests assemble their own
 * instance through {@link #builder()}; any component left unset falls back to its default.</p>
 */
@Slf4j
@Getter
public class ProcFlowFacade implements IProcFlowFacade {

    private final ProcFlowEngineConfig config;
    private final IProcFlowExecutionStore executionStore;
    private final ProcFlowNodeExecutorRegistry executorRegistry;
    private final IProcFlowExpressionEvaluator expressionEvaluator;
    private final IProcFlowRunLockService lockService;
    private final IProcFlowRunEventListener eventListener;
    private final ProcFlowRunCancellationRegistry cancellations;
    private final IProcFlowRunWalker runWalker;
    private final ProcFlowDefinitionValidator definitionValidator;

    @Builder
    private ProcFlowFacade(ProcFlowEngineConfig config,
                           IProcFlowExecutionStore executionStore,
                           ProcFlowNodeExecutorRegistry executorRegistry,
                           ProcFlowCollaborators collaborators,
                           IProcFlowExpressionEvaluator expressionEvaluator,
                           IProcFlowRunLockService lockService,
                           ProcFlowRunCancellationRegistry cancellations,
                           IProcFlowRunEventListener eventListener) {
        this.config = config != null ? config : ProcFlowEngineConfig.defaults();
        this.executionStore = executionStore != null ? executionStore : ProcFlowExecutionStoreManager.getInstance().getStore();
        this.executorRegistry = executorRegistry != null
                ? executorRegistry
                : ProcFlowNodeExecutorRegistry.defaults(collaborators != null ? collaborators : ProcFlowCollaborators.none());
        this.expressionEvaluator = expressionEvaluator != null
                ? expressionEvaluator
                : new ProcFlowExpressionEvaluator(this.config.getMaxExpressionDepth(), this.config.getMaxExpressionLength());
        this.lockService = lockService != null ? lockService : InMemoryRunLockService.getInstance();
        this.eventListener = eventListener != null ? eventListener : CompositeRunEventListener.withLogging();
        this.cancellations = cancellations != null ? cancellations : ProcFlowRunCancellationRegistry.getInstance();
        this.runWalker = new ProcFlowRunWalker(
                this.executionStore,
                this.executorRegistry,
                this.expressionEvaluator,
                this.lockService,
                this.cancellations,
                this.eventListener,
                this.config);
        this.definitionValidator = new ProcFlowDefinitionValidator(this.expressionEvaluator, this.executorRegistry);
    }

    private static final class SingletonHelper {
        private static final IProcFlowFacade INSTANCE = ProcFlowFacade.builder()
                .config(ProcFlowEngineConfig.fromSystem())
                .build();
    }

    public static IProcFlowFacade getInstance() {
        return SingletonHelper.INSTANCE;
    }

    // ========================================================================
    // RUN OPERATIONS
    // ========================================================================

    @Override
    public Mono<WorkflowRunState> startRun(WorkflowDefinition definition, Map<String, Object> triggerInput) {
        return startRun(UUID.randomUUID().toString(), definition, triggerInput);
    }

    @Override
    public Mono<WorkflowRunState> startRun(String runId, WorkflowDefinition definition, Map<String, Object> triggerInput) {
        Objects.requireNonNull(runId, "runId must not be null");
        return executionStore.findRun(runId)
                .flatMap(existing -> {
                    log.info("Run already exists, returning its state: runId={}, status={}", runId, existing.getStatus());
                    return getRunState(runId);
                })
                .switchIfEmpty(Mono.defer(() -> createAndWalk(runId, definition, triggerInput)));
    }

    @Override
    public Mono<WorkflowRunState> resumeRun(String runId, String nodeId, ReviewDecision decision) {
        log.info("Resuming run: runId={}, nodeId={}, decision={}",
                runId, nodeId, decision == null ? null : decision.getDecision());
        if (decision == null || decision.getDecision() == null) {
            return Mono.error(new ProcFlowValidationException("Review decision for run " + runId + " is invalid",
                    List.of("decision must not be null")));
        }
        return runWalker.resume(runId, nodeId, decision)
                .then(Mono.defer(() -> getRunState(runId)));
    }

    @Override
    public Mono<WorkflowRunState> cancelRun(String runId) {
        log.info("Cancelling run: runId={}", runId);
        return runWalker.cancel(runId)
                .then(Mono.defer(() -> getRunState(runId)))
                .onErrorResume(RunLockedException.class, e -> {
                    log.info("Run still walked elsewhere, cancel left pending: runId={}, owner={}", runId, e.getCurrentOwner());
                    return getRunState(runId);
                });
    }

    @Override
    public Mono<WorkflowRunState> getRunState(String runId) {
        return executionStore.findRun(runId)
                .switchIfEmpty(Mono.error(() -> ProcFlowEngineException.runNotFound(runId)))
                .flatMap(run -> Mono.zip(
                                executionStore.findSteps(runId).collectList(),
                                executionStore.findApprovals(runId).collectList())
                        .map(records -> WorkflowRunState.builder()
                                .run(run)
                                .steps(records.getT1())
                                .pendingApprovals(records.getT2())
                                .cancelRequested(!run.getStatus().isTerminal() && cancellations.isRequested(runId))
                                .build()));
    }

    @Override
    public Mono<DefinitionValidationResult> validateDefinition(WorkflowDefinition definition) {
        return Mono.fromCallable(() -> definitionValidator.validate(definition));
    }

    // ========================================================================
    // APPROVALS
    // ========================================================================

    @Override
    public Flux<PendingApproval> findOpenApprovals(String assignee) {
        Objects.requireNonNull(assignee, "assignee must not be null");
        return executionStore.findOpenApprovals(assignee);
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private Mono<WorkflowRunState> createAndWalk(String runId, WorkflowDefinition definition, Map<String, Object> triggerInput) {
        Map<String, Object> input = triggerInput == null ? new LinkedHashMap<>() : new LinkedHashMap<>(triggerInput);
        return Mono.fromCallable(() -> {
                    definitionValidator.requireValid(definition);
                    definitionValidator.validateTriggerInput(definition, input);
                    return definition;
                })
                .flatMap(executionStore::saveDefinition)
                .flatMap(stored -> executionStore.createRun(newRun(runId, stored, input)))
                .doOnNext(created -> {
                    log.info("Run started: runId={}, definitionId={}, version={}",
                            runId, created.getDefinitionId(), created.getDefinitionVersion());
                    emit(RunEvent.of(ProcFlowRunEventType.RUN_STARTED, runId));
                })
                .flatMap(created -> runWalker.walk(runId))
                .then(Mono.defer(() -> getRunState(runId)))
                .onErrorResume(ProcFlowFacade::isRunAlreadyExists, e -> {
                    log.info("Run created concurrently, returning its state: runId={}", runId);
                    return getRunState(runId);
                });
    }

    private static WorkflowRun newRun(String runId, WorkflowDefinition definition, Map<String, Object> input) {
        Map<String, Object> variables = new LinkedHashMap<>();
        RunVariables.seedTriggerInput(runId, variables, input);
        String startId = definition.startNode()
                .map(NodeDefinition::getNodeId)
                .orElseThrow(() -> new ProcFlowEngineException(ProcFlowEngineErrorCodes.INTERNAL_ERROR,
                        "definition " + definition.getId() + " has no start node"));
        Instant now = Instant.now();
        return WorkflowRun.builder()
                .runId(runId)
                .definitionId(definition.getId())
                .definitionVersion(definition.getVersion())
                .status(ProcFlowRunStatus.RUNNING)
                .triggerInput(new LinkedHashMap<>(input))
                .variables(variables)
                .frontier(new ArrayList<>(List.of(startId)))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private void emit(RunEvent event) {
        try {
            eventListener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Run event listener failed: runId={}, type={}, error={}", event.getRunId(), event.getType(), e.getMessage());
        }
    }

    private static boolean isRunAlreadyExists(Throwable error) {
        return error instanceof ProcFlowEngineException engineException
                && engineException.getErrorInfo() == ProcFlowEngineErrorCodes.RUN_ALREADY_EXISTS;
    }
}
