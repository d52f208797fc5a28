package com.procflow.integration.models.run;

import com.procflow.integration.enumerations.ProcFlowStepStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a run together with its trace and approvals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRunState {

    private WorkflowRun run;

    @Builder.Default
    private List<StepExecution> steps = new ArrayList<>();

    @Builder.Default
    private List<PendingApproval> pendingApprovals = new ArrayList<>();

    /**
     * A cancel was accepted but the walker holding the run has not reached its next round yet.
     */
    private boolean cancelRequested;

    public List<StepExecution> stepsFor(String nodeId) {
        return steps.stream()
                .filter(step -> nodeId.equals(step.getNodeId()))
                .toList();
    }

    public List<PendingApproval> openApprovals() {
        return pendingApprovals.stream()
                .filter(PendingApproval::isOpen)
                .toList();
    }

    /**
     * The most recent failed attempt, which is what callers surface as the run error.
     */
    public Optional<StepExecution> latestFailure() {
        for (int i = steps.size() - 1; i >= 0; i--) {
            if (steps.get(i).getStatus() == ProcFlowStepStatus.FAILED) {
                return Optional.of(steps.get(i));
            }
        }
        return Optional.empty();
    }
}
