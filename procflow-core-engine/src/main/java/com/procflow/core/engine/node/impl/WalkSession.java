package com.procflow.core.engine.node.impl;

import com.procflow.integration.enumerations.ProcFlowStepStatus;
import com.procflow.integration.models.event.RunEvent;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.StepExecution;
import com.procflow.integration.models.run.WorkflowRun;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Working state of one locked walk, resume or cancel.
 *
 * <p>Attempt and step counters are touched by concurrently executing branches; everything else
 * is only changed while outcomes are applied, which happens on a single thread.</p>
 */
@Getter
final class WalkSession {

    private final String ownerId;
    private final WorkflowDefinition definition;

    @Setter
    private WorkflowRun run;

    private final Map<String, PendingApproval> approvals = new LinkedHashMap<>();
    private final List<StepExecution> interruptedSteps = new ArrayList<>();

    private final Map<String, Integer> attempts = new ConcurrentHashMap<>();
    private final Set<String> completedNodes = ConcurrentHashMap.newKeySet();
    private final AtomicInteger stepCount;

    /**
     * Nodes of the round being applied; they must not be enqueued again.
     */
    @Setter
    private Collection<String> currentRound = List.of();

    private final List<RunEvent> pendingEvents = new ArrayList<>();

    WalkSession(String ownerId, WorkflowDefinition definition, WorkflowRun run,
                List<StepExecution> steps, List<PendingApproval> approvals) {
        this.ownerId = ownerId;
        this.definition = definition;
        this.run = run;
        for (StepExecution step : steps) {
            attempts.merge(step.getNodeId(), step.getAttempt(), Math::max);
            if (step.getStatus() != null && step.getStatus().isTerminal()) {
                completedNodes.add(step.getNodeId());
            } else if (step.getStatus() == ProcFlowStepStatus.RUNNING) {
                interruptedSteps.add(step);
            }
        }
        approvals.forEach(approval -> this.approvals.put(approval.getNodeId(), approval));
        this.stepCount = new AtomicInteger(Math.max(run.getStepCount(), steps.size()));
    }

    String getRunId() {
        return run.getRunId();
    }

    int nextAttempt(String nodeId) {
        return attempts.merge(nodeId, 1, Integer::sum);
    }

    /**
     * Counts one more step attempt unless the limit is already reached.
     */
    boolean reserveStep(int maxNodeExecutions) {
        while (true) {
            int current = stepCount.get();
            if (current >= maxNodeExecutions) {
                return false;
            }
            if (stepCount.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    int getStepCount() {
        return stepCount.get();
    }

    boolean isCompleted(String nodeId) {
        return completedNodes.contains(nodeId);
    }

    void markCompleted(String nodeId) {
        completedNodes.add(nodeId);
    }

    boolean hasOpenApprovals() {
        return approvals.values().stream().anyMatch(PendingApproval::isOpen);
    }

    void queue(RunEvent event) {
        pendingEvents.add(event);
    }

    List<RunEvent> drainEvents() {
        List<RunEvent> drained = new ArrayList<>(pendingEvents);
        pendingEvents.clear();
        return drained;
    }
}
