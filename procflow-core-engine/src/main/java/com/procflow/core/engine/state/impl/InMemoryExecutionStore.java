package com.procflow.core.engine.state.impl;

import com.procflow.core.exception.ProcFlowEngineException;
import com.procflow.core.exception.codes.ProcFlowEngineErrorCodes;
import com.procflow.integration.contract.store.IProcFlowExecutionStore;
import com.procflow.integration.enumerations.ProcFlowRunStatus;
import com.procflow.integration.models.run.ExecutionCommit;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.StepExecution;
import com.procflow.integration.models.run.WorkflowRun;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory execution store for tests and single-process use.
 *
 * <h2>Thread Safety</h2>
 * Each run's document is guarded by its own monitor, so commits to one run are atomic
 * with respect to readers of that run while other runs proceed independently.
 */
@Slf4j
public class InMemoryExecutionStore implements IProcFlowExecutionStore {

    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();
    private final Map<String, RunDocument> runs = new ConcurrentHashMap<>();

    private volatile boolean initialized = false;

    private InMemoryExecutionStore() {}

    public static InMemoryExecutionStore create() {
        InMemoryExecutionStore store = new InMemoryExecutionStore();
        store.initialized = true;
        return store;
    }

    private static final class SingletonHelper {
        private static final InMemoryExecutionStore INSTANCE = create();
    }

    public static InMemoryExecutionStore getInstance() {
        return SingletonHelper.INSTANCE;
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public Mono<Void> initialize() {
        return Mono.fromRunnable(() -> {
            log.info("Initializing in-memory execution store");
            initialized = true;
        });
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("Shutting down in-memory execution store");
            definitions.clear();
            runs.clear();
            initialized = false;
        });
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.fromCallable(() -> initialized);
    }

    // ========================================================================
    // DEFINITIONS
    // ========================================================================

    @Override
    public Mono<WorkflowDefinition> saveDefinition(WorkflowDefinition definition) {
        return Mono.fromCallable(() -> definitions.computeIfAbsent(
                definitionKey(definition.getId(), definition.getVersion()),
                key -> {
                    log.debug("Stored definition. definitionId={}, version={}", definition.getId(), definition.getVersion());
                    return definition;
                }));
    }

    @Override
    public Mono<WorkflowDefinition> findDefinition(String definitionId, int version) {
        return Mono.fromCallable(() -> definitions.get(definitionKey(definitionId, version)));
    }

    // ========================================================================
    // RUNS
    // ========================================================================

    @Override
    public Mono<WorkflowRun> createRun(WorkflowRun run) {
        return Mono.fromCallable(() -> {
            RunDocument created = RunDocument.of(run);
            if (runs.putIfAbsent(run.getRunId(), created) != null) {
                throw new ProcFlowEngineException(ProcFlowEngineErrorCodes.RUN_ALREADY_EXISTS, run.getRunId());
            }
            log.debug("Created run. runId={}", run.getRunId());
            return run.copy();
        });
    }

    @Override
    public Mono<WorkflowRun> findRun(String runId) {
        return Mono.fromCallable(() -> {
            RunDocument document = runs.get(runId);
            if (document == null) {
                return null;
            }
            synchronized (document) {
                return document.getRun().copy();
            }
        });
    }

    @Override
    public Flux<WorkflowRun> findRunsByStatus(ProcFlowRunStatus status) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(runs.values())))
                .map(document -> {
                    synchronized (document) {
                        return document.getRun().copy();
                    }
                })
                .filter(run -> run.getStatus() == status);
    }

    @Override
    public Mono<WorkflowRun> commit(ExecutionCommit commit) {
        return Mono.fromCallable(() -> {
            String runId = commit.getRun().getRunId();
            RunDocument document = runs.get(runId);
            if (document == null) {
                throw ProcFlowEngineException.runNotFound(runId);
            }
            synchronized (document) {
                document.apply(commit);
                log.debug("Committed run. runId={}, status={}, steps={}, approvals={}, removedApprovals={}",
                        runId, commit.getRun().getStatus(), commit.getSteps().size(),
                        commit.getApprovals().size(), commit.getRemovedApprovals().size());
                return document.getRun().copy();
            }
        });
    }

    // ========================================================================
    // STEPS & APPROVALS
    // ========================================================================

    @Override
    public Mono<StepExecution> saveStep(StepExecution step) {
        return Mono.fromCallable(() -> {
            RunDocument document = runs.get(step.getRunId());
            if (document == null) {
                throw ProcFlowEngineException.runNotFound(step.getRunId());
            }
            synchronized (document) {
                document.upsertStep(step);
            }
            return RunDocument.copyOf(step);
        });
    }

    @Override
    public Flux<StepExecution> findSteps(String runId) {
        return Flux.defer(() -> {
            RunDocument document = runs.get(runId);
            if (document == null) {
                return Flux.empty();
            }
            synchronized (document) {
                return Flux.fromIterable(document.snapshot().getSteps());
            }
        });
    }

    @Override
    public Mono<PendingApproval> findApproval(String runId, String nodeId) {
        return findApprovals(runId)
                .filter(approval -> nodeId.equals(approval.getNodeId()))
                .next();
    }

    @Override
    public Flux<PendingApproval> findApprovals(String runId) {
        return Flux.defer(() -> {
            RunDocument document = runs.get(runId);
            if (document == null) {
                return Flux.empty();
            }
            synchronized (document) {
                return Flux.fromIterable(document.snapshot().getApprovals());
            }
        });
    }

    @Override
    public Flux<PendingApproval> findOpenApprovals() {
        return Flux.defer(() -> {
            return Flux.fromIterable(List.copyOf(runs.values()));
        }).concatMapIterable(document -> {
            synchronized (document) {
                return document.snapshot().getApprovals();
            }
        }).filter(PendingApproval::isOpen);
    }

    static String definitionKey(String definitionId, int version) {
        return definitionId + "@" + version;
    }
}
