package com.procflow.core.engine.recovery;

import com.procflow.core.engine.config.ProcFlowEngineConfig;
import com.procflow.core.engine.lock.IProcFlowRunLockService;
import com.procflow.core.engine.lock.RunLockedException;
import com.procflow.core.engine.node.IProcFlowRunWalker;
import com.procflow.integration.contract.store.IProcFlowExecutionStore;
import com.procflow.integration.enumerations.ProcFlowRunStatus;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.WorkflowRun;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Picks up runs whose walker went away.
 *
 * <p>A run is stalled when it is RUNNING, still has frontier nodes, has not been written for
 * {@code recoveryStaleAfter} and nobody holds its lock. Such runs are walked again from their
 * persisted state. Attempts left RUNNING by the lost walker are closed by the walk itself.</p>
 *
 * <p>The same pass sweeps open approvals: those whose escalation is due are escalated, those
 * whose deadline has passed get their timeout action applied.</p>
 *
 * <p>Single-process scheduler on a daemon thread; call {@link #recoverStalledRuns()} and
 * {@link #sweepApprovals(Instant)} directly to drive recovery from elsewhere.</p>
 */
@Slf4j
public class ProcFlowRunRecoveryWorker {

    private final IProcFlowExecutionStore store;
    private final IProcFlowRunWalker walker;
    private final IProcFlowRunLockService lockService;
    private final ProcFlowEngineConfig config;
    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> task;

    public ProcFlowRunRecoveryWorker(IProcFlowExecutionStore store,
                                     IProcFlowRunWalker walker,
                                     IProcFlowRunLockService lockService,
                                     ProcFlowEngineConfig config) {
        this.store = store;
        this.walker = walker;
        this.lockService = lockService;
        this.config = config;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "procflow-run-recovery");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        long interval = config.getRecoveryInterval().toMillis();
        task = scheduler.scheduleWithFixedDelay(this::recoverOnce, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Run recovery worker started: interval={}, staleAfter={}",
                config.getRecoveryInterval(), config.getRecoveryStaleAfter());
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Run recovery worker stopped");
    }

    public boolean isRunning() {
        return task != null;
    }

    /**
     * Walks every stalled run once, one at a time.
     *
     * @return the runs as they were left by their recovery walk
     */
    public Flux<WorkflowRun> recoverStalledRuns() {
        return Flux.defer(() -> {
            Instant cutoff = Instant.now().minus(config.getRecoveryStaleAfter());
            return store.findRunsByStatus(ProcFlowRunStatus.RUNNING)
                    .filter(run -> run.getFrontier() != null && !run.getFrontier().isEmpty())
                    .filter(run -> run.getUpdatedAt() == null || !run.getUpdatedAt().isAfter(cutoff))
                    .filterWhen(run -> lockService.isLocked(run.getRunId()).map(locked -> !locked))
                    .concatMap(this::recover);
        });
    }

    private Mono<WorkflowRun> recover(WorkflowRun stalled) {
        log.info("Recovering stalled run: runId={}, updatedAt={}, frontier={}",
                stalled.getRunId(), stalled.getUpdatedAt(), stalled.getFrontier());
        return walker.walk(stalled.getRunId())
                .doOnNext(run -> log.info("Recovered run: runId={}, status={}", run.getRunId(), run.getStatus()))
                .onErrorResume(RunLockedException.class, e -> {
                    log.debug("Stalled run picked up elsewhere: runId={}", stalled.getRunId());
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    log.warn("Run recovery failed: runId={}, error={}", stalled.getRunId(), e.getMessage(), e);
                    return Mono.empty();
                });
    }

    /**
     * Escalates due approvals and applies the timeout action of expired ones, one run at a time.
     * Runs locked by another walker are left for the next sweep.
     *
     * @return the runs touched by the sweep, as each change left them
     */
    public Flux<WorkflowRun> sweepApprovals(Instant now) {
        return store.findOpenApprovals()
                .filter(approval -> approval.isExpired(now) || approval.isEscalationDue(now))
                .concatMap(approval -> sweep(approval, now));
    }

    private Mono<WorkflowRun> sweep(PendingApproval approval, Instant now) {
        Mono<WorkflowRun> change;
        if (approval.isExpired(now)) {
            log.info("Approval expired: runId={}, nodeId={}, deadline={}, action={}",
                    approval.getRunId(), approval.getNodeId(), approval.getDeadline(), approval.getTimeoutAction());
            change = walker.expire(approval.getRunId(), approval.getNodeId(), now);
        } else {
            change = walker.escalate(approval.getRunId(), approval.getNodeId(), now);
        }
        return change
                .onErrorResume(RunLockedException.class, e -> {
                    log.debug("Approval sweep skipped locked run: runId={}, nodeId={}", approval.getRunId(), approval.getNodeId());
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    log.warn("Approval sweep failed: runId={}, nodeId={}, error={}",
                            approval.getRunId(), approval.getNodeId(), e.getMessage(), e);
                    return Mono.empty();
                });
    }

    private void recoverOnce() {
        try {
            Long recovered = recoverStalledRuns().count().block();
            if (recovered != null && recovered > 0) {
                log.info("Recovery pass finished: recovered={}", recovered);
            }
            Long swept = sweepApprovals(Instant.now()).count().block();
            if (swept != null && swept > 0) {
                log.info("Approval sweep finished: changed={}", swept);
            }
        } catch (RuntimeException e) {
            // keep the schedule alive; the next pass retries
            log.error("Recovery pass failed", e);
        }
    }
}
