package com.procflow.core.engine.state.impl;

import com.procflow.core.engine.misc.ProcFlowObjectMapper;
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
import reactor.core.scheduler.Schedulers;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * File-based execution store. Each run is one JSON document holding the run, its trace and
 * its approvals, so a commit is a single atomic file replacement.
 *
 * <h2>Storage Structure</h2>
 * <pre>
 * {baseDir}/
 *   ├── runs/
 *   │   ├── {runId}.json
 *   │   └── ...
 *   └── definitions/
 *       ├── {definitionId}-v{version}.json
 *       └── ...
 * </pre>
 *
 * <h2>Characteristics</h2>
 * <ul>
 *   <li>Human-readable JSON documents written through Jackson</li>
 *   <li>Writes go to a temp file first and are moved into place atomically</li>
 *   <li>Documents are cached in memory and reloaded on {@link #initialize()}</li>
 * </ul>
 */
@Slf4j
public class FileBasedExecutionStore implements IProcFlowExecutionStore {

    private static final String RUNS_DIR = "runs";
    private static final String DEFINITIONS_DIR = "definitions";
    private static final String JSON_EXTENSION = ".json";

    private final Path baseDir;
    private final Path runsDir;
    private final Path definitionsDir;
    private final ObjectMapper objectMapper;

    private final Map<String, RunDocument> cache = new ConcurrentHashMap<>();
    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();

    private volatile boolean initialized = false;

    public FileBasedExecutionStore(Path baseDir) {
        this.baseDir = baseDir;
        this.runsDir = baseDir.resolve(RUNS_DIR);
        this.definitionsDir = baseDir.resolve(DEFINITIONS_DIR);
        this.objectMapper = ProcFlowObjectMapper.getInstance().getObjectMapper();
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public Mono<Void> initialize() {
        return Mono.fromCallable(() -> {
            log.info("Initializing file-based execution store. baseDir={}", baseDir);
            Files.createDirectories(runsDir);
            Files.createDirectories(definitionsDir);
            loadExisting(runsDir, RunDocument.class)
                    .forEach(document -> cache.put(document.getRun().getRunId(), document));
            loadExisting(definitionsDir, WorkflowDefinition.class)
                    .forEach(definition -> definitions.put(
                            InMemoryExecutionStore.definitionKey(definition.getId(), definition.getVersion()), definition));
            initialized = true;
            log.info("File-based execution store initialized. runs={}, definitions={}", cache.size(), definitions.size());
            return null;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("Shutting down file-based execution store");
            cache.clear();
            definitions.clear();
            initialized = false;
        });
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.fromCallable(() -> initialized && Files.isWritable(runsDir));
    }

    // ========================================================================
    // DEFINITIONS
    // ========================================================================

    @Override
    public Mono<WorkflowDefinition> saveDefinition(WorkflowDefinition definition) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            String key = InMemoryExecutionStore.definitionKey(definition.getId(), definition.getVersion());
            synchronized (definitions) {
                WorkflowDefinition existing = definitions.get(key);
                if (existing != null) {
                    return existing;
                }
                writeAtomically(definitionFile(definition.getId(), definition.getVersion()), definition);
                definitions.put(key, definition);
                log.debug("Stored definition. definitionId={}, version={}", definition.getId(), definition.getVersion());
                return definition;
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<WorkflowDefinition> findDefinition(String definitionId, int version) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            return definitions.get(InMemoryExecutionStore.definitionKey(definitionId, version));
        });
    }

    // ========================================================================
    // RUNS
    // ========================================================================

    @Override
    public Mono<WorkflowRun> createRun(WorkflowRun run) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            RunDocument created = RunDocument.of(run);
            if (cache.putIfAbsent(run.getRunId(), created) != null) {
                throw new ProcFlowEngineException(ProcFlowEngineErrorCodes.RUN_ALREADY_EXISTS, run.getRunId());
            }
            synchronized (created) {
                try {
                    persist(created);
                } catch (UncheckedIOException e) {
                    cache.remove(run.getRunId(), created);
                    throw e;
                }
            }
            log.debug("Created run. runId={}", run.getRunId());
            return run.copy();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<WorkflowRun> findRun(String runId) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            RunDocument document = cache.get(runId);
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
        return Flux.defer(() -> {
            ensureInitialized();
            return Flux.fromIterable(List.copyOf(cache.values()));
        }).map(document -> {
            synchronized (document) {
                return document.getRun().copy();
            }
        }).filter(run -> run.getStatus() == status);
    }

    @Override
    public Mono<WorkflowRun> commit(ExecutionCommit commit) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            String runId = commit.getRun().getRunId();
            RunDocument document = cache.get(runId);
            if (document == null) {
                throw ProcFlowEngineException.runNotFound(runId);
            }
            synchronized (document) {
                RunDocument updated = document.snapshot();
                updated.apply(commit);
                persist(updated);
                document.apply(commit);
                log.debug("Committed run. runId={}, status={}", runId, commit.getRun().getStatus());
                return document.getRun().copy();
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    // ========================================================================
    // STEPS & APPROVALS
    // ========================================================================

    @Override
    public Mono<StepExecution> saveStep(StepExecution step) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            RunDocument document = cache.get(step.getRunId());
            if (document == null) {
                throw ProcFlowEngineException.runNotFound(step.getRunId());
            }
            synchronized (document) {
                RunDocument updated = document.snapshot();
                updated.upsertStep(step);
                persist(updated);
                document.upsertStep(step);
            }
            return RunDocument.copyOf(step);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<StepExecution> findSteps(String runId) {
        return Flux.defer(() -> {
            ensureInitialized();
            RunDocument document = cache.get(runId);
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
            ensureInitialized();
            RunDocument document = cache.get(runId);
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
            ensureInitialized();
            return Flux.fromIterable(List.copyOf(cache.values()));
        }).concatMapIterable(document -> {
            synchronized (document) {
                return document.snapshot().getApprovals();
            }
        }).filter(PendingApproval::isOpen);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Execution store not initialized. Call initialize() first.");
        }
    }

    private void persist(RunDocument document) {
        writeAtomically(runsDir.resolve(document.getRun().getRunId() + JSON_EXTENSION), document);
    }

    private Path definitionFile(String definitionId, int version) {
        return definitionsDir.resolve(definitionId + "-v" + version + JSON_EXTENSION);
    }

    private void writeAtomically(Path target, Object value) {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.write(temp, objectMapper.writeValueAsBytes(value));
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported, falling back to replace. file={}", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + target, e);
        }
    }

    private <T> List<T> loadExisting(Path directory, Class<T> type) {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(path -> path.toString().endsWith(JSON_EXTENSION))
                    .sorted()
                    .map(path -> read(path, type))
                    .filter(value -> value != null)
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list " + directory, e);
        }
    }

    private <T> T read(Path file, Class<T> type) {
        try {
            return objectMapper.readValue(Files.readAllBytes(file), type);
        } catch (IOException | JacksonException e) {
            log.warn("Skipping unreadable document. file={}, error={}", file, e.getMessage());
            return null;
        }
    }
}
