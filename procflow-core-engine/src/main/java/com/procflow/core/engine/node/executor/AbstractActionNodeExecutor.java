package com.procflow.core.engine.node.executor;

import com.procflow.core.engine.node.ProcFlowCollaborators;
import com.procflow.integration.contract.collaborator.IProcFlowActionProvider;
import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shared pipeline of the side-effecting node kinds.
 *
 * <pre>
 * interpolate config ─→ validateConfig ─→ prepare ─→ provider.invoke ─→ postProcess ─→ Continue
 * </pre>
 *
 * <p>Each invocation carries the attempt's idempotency key. Collaborator failures become
 * retryable upstream failures unless flagged permanent.</p>
 */
@Slf4j
public abstract class AbstractActionNodeExecutor extends AbstractProcFlowNodeExecutor {

    protected final ProcFlowCollaborators collaborators;

    protected AbstractActionNodeExecutor(ProcFlowNodeKind kind, ProcFlowCollaborators collaborators) {
        super(kind);
        if (!kind.isAction()) {
            throw new IllegalArgumentException(kind + " is not an action kind");
        }
        this.collaborators = collaborators == null ? ProcFlowCollaborators.none() : collaborators;
    }

    @Override
    protected final Mono<ExecutorResult> doExecute(ExecutionContext context) {
        Optional<IProcFlowActionProvider> provider = collaborators.actionProvider(getKind());
        if (provider.isEmpty()) {
            return invalid("No action provider is registered for " + getKind() + " (node '" + context.getNodeId() + "')");
        }

        Map<String, Object> actionConfig = interpolatedConfig(context);
        Optional<String> problem = validateConfig(actionConfig);
        if (problem.isPresent()) {
            return invalid("Node '" + context.getNodeId() + "': " + problem.get());
        }

        String idempotencyKey = context.getIdempotencyKey();
        log.debug("Invoking action provider: runId={}, nodeId={}, kind={}, idempotencyKey={}",
                context.getRunId(), context.getNodeId(), getKind(), idempotencyKey);

        return Mono.just(prepare(context, actionConfig))
                .flatMap(prepared -> provider.get().invoke(prepared, context.getVariables(), idempotencyKey))
                .defaultIfEmpty(Map.of())
                .flatMap(result -> postProcess(context, actionConfig, new LinkedHashMap<>(result)))
                .onErrorResume(error -> {
                    log.warn("Action failed: runId={}, nodeId={}, kind={}, attempt={}, error={}",
                            context.getRunId(), context.getNodeId(), getKind(), context.getAttempt(), error.getMessage());
                    return Mono.just(upstreamFailure(error));
                });
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> interpolatedConfig(ExecutionContext context) {
        Object interpolated = context.interpolate(context.getNode().getConfig());
        return interpolated instanceof Map<?, ?> map ? (Map<String, Object>) map : new LinkedHashMap<>();
    }

    /**
     * @return a description of what is wrong with the interpolated config, empty when it is usable
     */
    protected abstract Optional<String> validateConfig(Map<String, Object> actionConfig);

    /**
     * Last chance to reshape the config before the provider sees it.
     */
    protected Map<String, Object> prepare(ExecutionContext context, Map<String, Object> actionConfig) {
        return actionConfig;
    }

    protected Mono<ExecutorResult> postProcess(ExecutionContext context, Map<String, Object> actionConfig,
                                               Map<String, Object> result) {
        return Mono.just(ExecutorResult.proceed(result));
    }

    protected static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
