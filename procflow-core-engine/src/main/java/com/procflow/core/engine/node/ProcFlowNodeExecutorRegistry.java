package com.procflow.core.engine.node;

import com.procflow.core.engine.node.executor.AiExtractionNodeExecutor;
import com.procflow.core.engine.node.executor.ApiCallNodeExecutor;
import com.procflow.core.engine.node.executor.ApprovalNodeExecutor;
import com.procflow.core.engine.node.executor.DecisionNodeExecutor;
import com.procflow.core.engine.node.executor.DocumentGenerationNodeExecutor;
import com.procflow.core.engine.node.executor.EndNodeExecutor;
import com.procflow.core.engine.node.executor.FileOperationNodeExecutor;
import com.procflow.core.engine.node.executor.ForkNodeExecutor;
import com.procflow.core.engine.node.executor.JoinNodeExecutor;
import com.procflow.core.engine.node.executor.NotificationNodeExecutor;
import com.procflow.core.engine.node.executor.StartNodeExecutor;
import com.procflow.core.exception.ProcFlowEngineException;
import com.procflow.core.exception.codes.ProcFlowEngineErrorCodes;
import com.procflow.integration.contract.executor.IProcFlowNodeExecutor;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exactly one executor per {@link ProcFlowNodeKind}. The registry is complete by construction:
 * a missing kind, a duplicate or an executor registered under another kind's key fails fast.
 */
@Slf4j
public class ProcFlowNodeExecutorRegistry {

    private final Map<ProcFlowNodeKind, IProcFlowNodeExecutor> executors;

    public ProcFlowNodeExecutorRegistry(Collection<? extends IProcFlowNodeExecutor> executors) {
        Map<ProcFlowNodeKind, IProcFlowNodeExecutor> byKind = new EnumMap<>(ProcFlowNodeKind.class);
        for (IProcFlowNodeExecutor executor : executors) {
            if (executor.getKind() == null) {
                throw invalid("executor " + executor.getClass().getName() + " declares no kind");
            }
            if (byKind.putIfAbsent(executor.getKind(), executor) != null) {
                throw invalid("more than one executor registered for " + executor.getKind());
            }
        }
        this.executors = verified(byKind);
    }

    /**
     * Registers explicit kind to executor pairs, rejecting pairs whose executor reports a
     * different kind.
     */
    public ProcFlowNodeExecutorRegistry(Map<ProcFlowNodeKind, ? extends IProcFlowNodeExecutor> executors) {
        Map<ProcFlowNodeKind, IProcFlowNodeExecutor> byKind = new EnumMap<>(ProcFlowNodeKind.class);
        executors.forEach((kind, executor) -> {
            if (executor.getKind() != kind) {
                throw invalid("executor for " + executor.getKind() + " registered under " + kind);
            }
            byKind.put(kind, executor);
        });
        this.executors = verified(byKind);
    }

    /**
     * The built-in executors wired to the given collaborators.
     */
    public static ProcFlowNodeExecutorRegistry defaults(ProcFlowCollaborators collaborators) {
        ProcFlowCollaborators wired = collaborators == null ? ProcFlowCollaborators.none() : collaborators;
        return new ProcFlowNodeExecutorRegistry(List.of(
                new StartNodeExecutor(),
                new EndNodeExecutor(),
                new DecisionNodeExecutor(),
                new ForkNodeExecutor(),
                new JoinNodeExecutor(),
                new AiExtractionNodeExecutor(wired.getExtractionAdapter()),
                new ApprovalNodeExecutor(),
                new FileOperationNodeExecutor(wired),
                new DocumentGenerationNodeExecutor(wired),
                new NotificationNodeExecutor(wired),
                new ApiCallNodeExecutor(wired)
        ));
    }

    /**
     * Same as {@link #defaults(ProcFlowCollaborators)} with some executors replaced.
     */
    public static ProcFlowNodeExecutorRegistry defaultsWith(ProcFlowCollaborators collaborators,
                                                            IProcFlowNodeExecutor... overrides) {
        Map<ProcFlowNodeKind, IProcFlowNodeExecutor> merged = new EnumMap<>(defaults(collaborators).executors);
        for (IProcFlowNodeExecutor override : overrides) {
            merged.put(override.getKind(), override);
        }
        return new ProcFlowNodeExecutorRegistry(merged);
    }

    public IProcFlowNodeExecutor getExecutor(ProcFlowNodeKind kind) {
        IProcFlowNodeExecutor executor = executors.get(kind);
        if (executor == null) {
            throw invalid("no executor registered for " + kind);
        }
        return executor;
    }

    public boolean isRegistered(ProcFlowNodeKind kind) {
        return kind != null && executors.containsKey(kind);
    }

    public Set<ProcFlowNodeKind> getRegisteredKinds() {
        return Collections.unmodifiableSet(executors.keySet());
    }

    private static Map<ProcFlowNodeKind, IProcFlowNodeExecutor> verified(Map<ProcFlowNodeKind, IProcFlowNodeExecutor> byKind) {
        List<ProcFlowNodeKind> missing = new ArrayList<>();
        for (ProcFlowNodeKind kind : ProcFlowNodeKind.values()) {
            if (!byKind.containsKey(kind)) {
                missing.add(kind);
            }
        }
        if (!missing.isEmpty()) {
            throw invalid("no executor registered for " + missing);
        }
        log.debug("Node executor registry ready: kinds={}", byKind.keySet());
        return Collections.unmodifiableMap(byKind);
    }

    private static ProcFlowEngineException invalid(String detail) {
        return new ProcFlowEngineException(ProcFlowEngineErrorCodes.EXECUTOR_REGISTRATION_INVALID, detail);
    }
}
