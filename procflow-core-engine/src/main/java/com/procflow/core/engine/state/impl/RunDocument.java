package com.procflow.core.engine.state.impl;

import com.procflow.integration.models.run.ExecutionCommit;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.StepExecution;
import com.procflow.integration.models.run.WorkflowRun;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Everything stored for one run: the run itself, its trace and its approvals.
 * The file store writes exactly one of these per run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunDocument {

    private WorkflowRun run;

    @Builder.Default
    private List<StepExecution> steps = new ArrayList<>();

    @Builder.Default
    private List<PendingApproval> approvals = new ArrayList<>();

    public static RunDocument of(WorkflowRun run) {
        return RunDocument.builder().run(run.copy()).build();
    }

    public void apply(ExecutionCommit commit) {
        this.run = commit.getRun().copy();
        commit.getSteps().forEach(this::upsertStep);
        commit.getRemovedApprovals().forEach(nodeId ->
                approvals.removeIf(approval -> nodeId.equals(approval.getNodeId())));
        commit.getApprovals().forEach(this::upsertApproval);
    }

    public void upsertStep(StepExecution step) {
        StepExecution copy = copyOf(step);
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).getStepId().equals(step.getStepId())) {
                steps.set(i, copy);
                return;
            }
        }
        steps.add(copy);
    }

    public void upsertApproval(PendingApproval approval) {
        PendingApproval copy = copyOf(approval);
        for (int i = 0; i < approvals.size(); i++) {
            if (approvals.get(i).getNodeId().equals(approval.getNodeId())) {
                approvals.set(i, copy);
                return;
            }
        }
        approvals.add(copy);
    }

    /**
     * Copy that shares no mutable collections with this document.
     */
    public RunDocument snapshot() {
        List<StepExecution> stepCopies = new ArrayList<>(steps.size());
        steps.forEach(step -> stepCopies.add(copyOf(step)));
        List<PendingApproval> approvalCopies = new ArrayList<>(approvals.size());
        approvals.forEach(approval -> approvalCopies.add(copyOf(approval)));
        return new RunDocument(run.copy(), stepCopies, approvalCopies);
    }

    static StepExecution copyOf(StepExecution step) {
        return step.toBuilder()
                .inputSnapshot(step.getInputSnapshot() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(step.getInputSnapshot()))
                .output(step.getOutput() == null ? null : new LinkedHashMap<>(step.getOutput()))
                .build();
    }

    static PendingApproval copyOf(PendingApproval approval) {
        return approval.toBuilder()
                .reviewPayload(approval.getReviewPayload() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(approval.getReviewPayload()))
                .editedValues(approval.getEditedValues() == null ? null : new LinkedHashMap<>(approval.getEditedValues()))
                .assignees(listOf(approval.getAssignees()))
                .approvedBy(listOf(approval.getApprovedBy()))
                .escalationAssignees(listOf(approval.getEscalationAssignees()))
                .build();
    }

    private static List<String> listOf(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
