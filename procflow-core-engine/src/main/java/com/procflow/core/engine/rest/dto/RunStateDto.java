package com.procflow.core.engine.rest.dto;

import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowRunStatus;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.StepExecution;
import com.procflow.integration.models.run.WorkflowRun;
import com.procflow.integration.models.run.WorkflowRunState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Flattened run view for REST responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunStateDto {

    private String runId;
    private String definitionId;
    private int definitionVersion;
    private ProcFlowRunStatus status;
    private Map<String, Object> variables;
    private Map<String, Object> output;
    private List<String> frontier;
    private List<String> suspendedNodes;
    private int stepCount;
    private ProcFlowErrorKind errorKind;
    private String error;
    private String failedNodeId;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
    private List<StepExecution> steps;
    private List<PendingApproval> openApprovals;
    private boolean cancelRequested;

    public static RunStateDto fromState(WorkflowRunState state) {
        if (state == null) {
            return null;
        }
        WorkflowRun run = state.getRun();
        return RunStateDto.builder()
                .runId(run.getRunId())
                .definitionId(run.getDefinitionId())
                .definitionVersion(run.getDefinitionVersion())
                .status(run.getStatus())
                .variables(run.getVariables())
                .output(run.getOutput())
                .frontier(run.getFrontier())
                .suspendedNodes(run.getSuspendedNodes())
                .stepCount(run.getStepCount())
                .errorKind(run.getErrorKind())
                .error(run.getError())
                .failedNodeId(run.getFailedNodeId())
                .createdAt(run.getCreatedAt())
                .updatedAt(run.getUpdatedAt())
                .completedAt(run.getCompletedAt())
                .steps(state.getSteps())
                .openApprovals(state.openApprovals())
                .cancelRequested(state.isCancelRequested())
                .build();
    }
}
