package com.procflow.core.engine.node.impl;

import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.models.run.StepExecution;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * What one frontier node produced in a round, ready to be applied to the run.
 * The step is still open unless the attempt was closed while retrying.
 */
@Getter
@ToString(of = {"kind", "nodeId", "errorKind"})
@AllArgsConstructor(access = AccessLevel.PRIVATE)
final class NodeOutcome {

    enum Kind {
        CONTINUE,
        SUSPEND,
        SKIP,
        FAIL,
        /**
         * Retrying stopped because the run is being cancelled; the node stays on the frontier.
         */
        ABANDONED,
        /**
         * The attempt read outputs that no node has bound yet; the closed step is kept and the
         * node runs again next round against a fresh snapshot.
         */
        DEFERRED,
        LIMIT_EXCEEDED
    }

    private final Kind kind;
    private final String nodeId;
    private final StepExecution step;
    private final Map<String, Object> outputs;
    private final List<String> targets;
    private final Map<String, Object> reviewPayload;
    private final ProcFlowErrorKind errorKind;
    private final String message;

    static NodeOutcome continued(StepExecution step, Map<String, Object> outputs, List<String> targets) {
        return new NodeOutcome(Kind.CONTINUE, step.getNodeId(), step, outputs, List.copyOf(targets), null, null, null);
    }

    static NodeOutcome suspended(StepExecution step, Map<String, Object> reviewPayload) {
        return new NodeOutcome(Kind.SUSPEND, step.getNodeId(), step, null, List.of(), reviewPayload, null, null);
    }

    static NodeOutcome skipped(StepExecution step, ProcFlowErrorKind errorKind, String message, List<String> targets) {
        return new NodeOutcome(Kind.SKIP, step.getNodeId(), step, null, List.copyOf(targets), null, errorKind, message);
    }

    static NodeOutcome failed(String nodeId, StepExecution step, ExecutorResult.Fail fail) {
        return new NodeOutcome(Kind.FAIL, nodeId, step, null, List.of(), null, fail.errorKind(), fail.message());
    }

    static NodeOutcome deferred(StepExecution step, ExecutorResult.Fail fail) {
        return new NodeOutcome(Kind.DEFERRED, step.getNodeId(), step, null, List.of(), null, fail.errorKind(), fail.message());
    }

    static NodeOutcome abandoned(String nodeId) {
        return new NodeOutcome(Kind.ABANDONED, nodeId, null, null, List.of(), null, ProcFlowErrorKind.CANCELLED, null);
    }

    static NodeOutcome limitExceeded(String nodeId) {
        return new NodeOutcome(Kind.LIMIT_EXCEEDED, nodeId, null, null, List.of(), null,
                ProcFlowErrorKind.STEP_LIMIT_EXCEEDED, null);
    }
}
