package com.procflow.core.engine.node;

import com.procflow.integration.models.run.ReviewDecision;
import com.procflow.integration.models.run.WorkflowRun;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Advances persisted runs. Every operation loads the run from the store, works under the
 * run-scoped lock and persists before it returns, so any process can pick a run up where
 * another one left it.
 */
public interface IProcFlowRunWalker {

    /**
     * Walks the run until it completes, fails or has nothing runnable left.
     *
     * @throws com.procflow.core.engine.lock.RunLockedException (as error signal) when the run is being walked elsewhere
     */
    Mono<WorkflowRun> walk(String runId);

    /**
     * Feeds a reviewer decision into a suspended approval node and keeps walking.
     * A terminal run or a missing or closed approval leaves the run untouched.
     */
    Mono<WorkflowRun> resume(String runId, String nodeId, ReviewDecision decision);

    /**
     * Cancels a RUNNING or SUSPENDED run. Calls already in flight finish first; a terminal run
     * is returned unchanged.
     */
    Mono<WorkflowRun> cancel(String runId);

    /**
     * Applies the timeout action of an approval whose deadline is at or before {@code now}:
     * {@code FAIL} closes the approval and fails the node with {@code TIMEOUT} (skipped when the
     * node skips on error), {@code AUTO_APPROVE} resumes it as approved. Anything else leaves the
     * run untouched.
     *
     * @throws com.procflow.core.engine.lock.RunLockedException (as error signal) when the run is locked
     */
    Mono<WorkflowRun> expire(String runId, String nodeId, Instant now);

    /**
     * Marks an open approval whose escalation is due as escalated, adding its escalation
     * assignees to the reviewers it is assigned to.
     *
     * @throws com.procflow.core.engine.lock.RunLockedException (as error signal) when the run is locked
     */
    Mono<WorkflowRun> escalate(String runId, String nodeId, Instant now);
}
