package com.procflow.integration.models.run;

import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowStepStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only trace entry for one attempt of one node.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StepExecution implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * {@code runId:nodeId:attempt}; doubles as the idempotency key handed to collaborators.
     */
    private String stepId;

    private String runId;

    private String nodeId;

    private int attempt;

    private ProcFlowStepStatus status;

    @Builder.Default
    private Map<String, Object> inputSnapshot = new LinkedHashMap<>();

    private Map<String, Object> output;

    private ProcFlowErrorKind errorKind;

    private String error;

    private Instant startedAt;

    private Instant endedAt;

    public static String stepId(String runId, String nodeId, int attempt) {
        return runId + ":" + nodeId + ":" + attempt;
    }

    public static StepExecution open(String runId, String nodeId, int attempt, Map<String, Object> inputSnapshot) {
        return StepExecution.builder()
                .stepId(stepId(runId, nodeId, attempt))
                .runId(runId)
                .nodeId(nodeId)
                .attempt(attempt)
                .status(ProcFlowStepStatus.RUNNING)
                .inputSnapshot(new LinkedHashMap<>(inputSnapshot))
                .startedAt(Instant.now())
                .build();
    }

    public StepExecution succeed(Map<String, Object> stepOutput) {
        return toBuilder()
                .status(ProcFlowStepStatus.SUCCEEDED)
                .output(stepOutput)
                .endedAt(Instant.now())
                .build();
    }

    public StepExecution suspend() {
        return toBuilder()
                .status(ProcFlowStepStatus.SUSPENDED)
                .endedAt(Instant.now())
                .build();
    }

    public StepExecution skip(ProcFlowErrorKind kind, String message) {
        return toBuilder()
                .status(ProcFlowStepStatus.SKIPPED)
                .errorKind(kind)
                .error(message)
                .endedAt(Instant.now())
                .build();
    }

    public StepExecution fail(ProcFlowErrorKind kind, String message) {
        return toBuilder()
                .status(ProcFlowStepStatus.FAILED)
                .errorKind(kind)
                .error(message)
                .endedAt(Instant.now())
                .build();
    }
}
