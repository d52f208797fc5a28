package com.procflow.integration.models.run;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Unit of atomic persistence: the updated run plus the step and approval records
 * that changed with it. Stores apply all of it or none of it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionCommit {

    private WorkflowRun run;

    /**
     * Upserted by {@code stepId}, appended when new.
     */
    @Builder.Default
    private List<StepExecution> steps = new ArrayList<>();

    /**
     * Upserted by {@code (runId, nodeId)}.
     */
    @Builder.Default
    private List<PendingApproval> approvals = new ArrayList<>();

    /**
     * Node ids whose approvals are deleted.
     */
    @Builder.Default
    private List<String> removedApprovals = new ArrayList<>();

    public static ExecutionCommit of(WorkflowRun run) {
        return ExecutionCommit.builder().run(run).build();
    }
}
