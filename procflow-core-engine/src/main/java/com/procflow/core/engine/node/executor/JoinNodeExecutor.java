package com.procflow.core.engine.node.executor;

import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.models.workflow.NodeDefinition;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Synchronization point. The walker decides when a join is enqueued; executing it only
 * publishes the arrivals.
 *
 * <p>Config: {@code mode} is {@code all} (default) or {@code any}; {@code expected}
 * overrides the number of arrivals needed in {@code all} mode.</p>
 */
public class JoinNodeExecutor extends AbstractProcFlowNodeExecutor {

    public static final String CONFIG_MODE = "mode";
    public static final String CONFIG_EXPECTED = "expected";
    public static final String MODE_ANY = "any";

    public JoinNodeExecutor() {
        super(ProcFlowNodeKind.JOIN);
    }

    @Override
    protected Mono<ExecutorResult> doExecute(ExecutionContext context) {
        List<String> arrivals = List.copyOf(context.getArrivals());
        return Mono.just(ExecutorResult.proceed(Map.of("arrivals", arrivals, "arrivalCount", arrivals.size())));
    }

    /**
     * Number of arrivals that releases the join.
     */
    public static int expectedArrivals(NodeDefinition join, int incomingEdges) {
        if (MODE_ANY.equalsIgnoreCase(join.configString(CONFIG_MODE, "all"))) {
            return 1;
        }
        Object expected = join.configValue(CONFIG_EXPECTED);
        if (expected instanceof Number count && count.longValue() > 0) {
            return (int) Math.min(count.longValue(), Integer.MAX_VALUE);
        }
        return Math.max(incomingEdges, 1);
    }

    public static boolean isSatisfied(NodeDefinition join, int incomingEdges, Collection<String> arrivals) {
        return arrivals.size() >= expectedArrivals(join, incomingEdges);
    }
}
