package com.procflow.core.engine.recovery;

import com.procflow.core.engine.ProcFlowFacade;
import com.procflow.core.engine.config.ProcFlowEngineConfig;
import com.procflow.core.engine.node.IProcFlowRunWalker;
import com.procflow.core.engine.node.ProcFlowCollaborators;
import com.procflow.core.engine.node.impl.ProcFlowRunWalker;
import com.procflow.core.engine.support.RecordingActionProvider;
import com.procflow.core.engine.support.TestDefinitions;
import com.procflow.core.engine.support.TestEngines;
import com.procflow.integration.contract.store.IProcFlowExecutionStore;
import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.enumerations.ProcFlowRunStatus;
import com.procflow.integration.enumerations.ProcFlowStepStatus;
import com.procflow.integration.models.run.ExecutionCommit;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.ReviewDecision;
import com.procflow.integration.models.run.StepExecution;
import com.procflow.integration.models.run.WorkflowRun;
import com.procflow.integration.models.run.WorkflowRunState;
import com.procflow.integration.models.workflow.EdgeDefinition;
import com.procflow.integration.models.workflow.NodeDefinition;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Run Recovery Worker Tests")
class ProcFlowRunRecoveryWorkerTest {

    private static final Instant LONG_AGO = Instant.now().minus(Duration.ofHours(1));

    private ProcFlowFacade facade;
    private IProcFlowExecutionStore store;
    private ProcFlowRunRecoveryWorker worker;
    private WorkflowDefinition definition;

    @BeforeEach
    void setUp() {
        facade = TestEngines.isolated()
                .config(TestEngines.fastConfig().toBuilder().recoveryStaleAfter(Duration.ofMinutes(5)).build())
                .collaborators(ProcFlowCollaborators.builder()
                        .actionProvider(ProcFlowNodeKind.NOTIFICATION, new RecordingActionProvider())
                        .build())
                .build();
        store = facade.getExecutionStore();
        worker = new ProcFlowRunRecoveryWorker(store, facade.getRunWalker(), facade.getLockService(), facade.getConfig());
        definition = store.saveDefinition(TestDefinitions.invoiceRouting()).block();
    }

    @AfterEach
    void tearDown() {
        worker.stop();
    }

    private WorkflowRun abandoned(String runId, Instant updatedAt) {
        Map<String, Object> input = new LinkedHashMap<>(Map.of("amount", 500));
        return store.createRun(WorkflowRun.builder()
                .runId(runId)
                .definitionId(definition.getId())
                .definitionVersion(definition.getVersion())
                .status(ProcFlowRunStatus.RUNNING)
                .triggerInput(input)
                .variables(new LinkedHashMap<>(input))
                .frontier(new ArrayList<>(List.of("start")))
                .createdAt(updatedAt)
                .updatedAt(updatedAt)
                .build()).block();
    }

    @Test
    @DisplayName("Should walk an abandoned run to completion and close its interrupted attempt")
    void shouldRecoverAbandonedRun() {
        // Given - the previous walker died after opening the start attempt
        WorkflowRun run = abandoned("run-stale", LONG_AGO);
        store.saveStep(StepExecution.open("run-stale", "start", 1, run.getVariables())).block();

        // When
        StepVerifier.create(worker.recoverStalledRuns())
                .assertNext(recovered -> {
                    assertThat(recovered.getRunId()).isEqualTo("run-stale");
                    assertThat(recovered.getStatus()).isEqualTo(ProcFlowRunStatus.COMPLETED);
                })
                .verifyComplete();

        // Then
        assertThat(store.findSteps("run-stale").collectList().block())
                .filteredOn(step -> step.getNodeId().equals("start"))
                .extracting(StepExecution::getAttempt, StepExecution::getStatus, StepExecution::getErrorKind)
                .containsExactly(
                        tuple(1, ProcFlowStepStatus.FAILED, ProcFlowErrorKind.INTERNAL),
                        tuple(2, ProcFlowStepStatus.SUCCEEDED, null));
    }

    @Test
    @DisplayName("Should leave fresh, locked, suspended and idle runs alone")
    void shouldSkipRunsThatAreNotStalled() {
        abandoned("run-fresh", Instant.now());
        abandoned("run-locked", LONG_AGO);
        facade.getLockService().tryAcquire("run-locked", "walk-elsewhere", Duration.ofMinutes(5)).block();
        WorkflowRun suspended = abandoned("run-suspended", LONG_AGO);
        store.commit(ExecutionCommit.of(suspended.toBuilder()
                .status(ProcFlowRunStatus.SUSPENDED)
                .frontier(new ArrayList<>())
                .build())).block();
        WorkflowRun idle = abandoned("run-idle", LONG_AGO);
        store.commit(ExecutionCommit.of(idle.toBuilder().frontier(new ArrayList<>()).build())).block();

        StepVerifier.create(worker.recoverStalledRuns()).verifyComplete();

        assertThat(store.findSteps("run-fresh").collectList().block()).isEmpty();
        assertThat(store.findRun("run-locked").block().getStatus()).isEqualTo(ProcFlowRunStatus.RUNNING);
    }

    @Test
    @DisplayName("Should keep going when one recovery walk fails")
    void shouldContinueAfterFailure() {
        abandoned("run-a", LONG_AGO);
        abandoned("run-b", LONG_AGO);
        IProcFlowRunWalker walker = facade.getRunWalker();
        IProcFlowRunWalker flaky = new IProcFlowRunWalker() {
            @Override
            public Mono<WorkflowRun> walk(String runId) {
                return runId.equals("run-a")
                        ? Mono.error(new IllegalStateException("store unavailable"))
                        : walker.walk(runId);
            }

            @Override
            public Mono<WorkflowRun> resume(String runId, String nodeId, ReviewDecision decision) {
                return walker.resume(runId, nodeId, decision);
            }

            @Override
            public Mono<WorkflowRun> cancel(String runId) {
                return walker.cancel(runId);
            }

            @Override
            public Mono<WorkflowRun> expire(String runId, String nodeId, Instant now) {
                return walker.expire(runId, nodeId, now);
            }

            @Override
            public Mono<WorkflowRun> escalate(String runId, String nodeId, Instant now) {
                return walker.escalate(runId, nodeId, now);
            }
        };
        ProcFlowRunRecoveryWorker flakyWorker = new ProcFlowRunRecoveryWorker(store, flaky, facade.getLockService(), facade.getConfig());

        try {
            assertThat(flakyWorker.recoverStalledRuns().map(WorkflowRun::getRunId).collectList().block())
                    .containsExactly("run-b");
        } finally {
            flakyWorker.stop();
        }
    }

    // ========================================================================
    // APPROVAL SWEEP
    // ========================================================================

    private String suspendedOnReview(NodeDefinition review) {
        WorkflowDefinition gated = WorkflowDefinition.builder()
                .id("deadline-review")
                .nodes(new ArrayList<>(List.of(
                        TestDefinitions.node("start", ProcFlowNodeKind.START),
                        review,
                        TestDefinitions.node("end", ProcFlowNodeKind.END))))
                .edges(new ArrayList<>(List.of(
                        EdgeDefinition.of("start", "review"),
                        EdgeDefinition.of("review", "end"))))
                .build();
        WorkflowRunState state = facade.startRun(gated, Map.of()).block();
        assertThat(state.getRun().getStatus()).isEqualTo(ProcFlowRunStatus.SUSPENDED);
        return state.getRun().getRunId();
    }

    private String suspendedOnReview(Map<String, Object> reviewConfig) {
        return suspendedOnReview(TestDefinitions.node("review", ProcFlowNodeKind.APPROVAL, reviewConfig));
    }

    @Test
    @DisplayName("Should fail the run once the approval deadline has passed")
    void shouldFailExpiredApproval() {
        // Given
        String runId = suspendedOnReview(Map.of("timeoutHours", 2));
        Instant now = Instant.now();

        // When - the deadline has not passed yet
        StepVerifier.create(worker.sweepApprovals(now.plus(Duration.ofHours(1)))).verifyComplete();

        // When - it has
        StepVerifier.create(worker.sweepApprovals(now.plus(Duration.ofHours(3))))
                .assertNext(run -> {
                    assertThat(run.getStatus()).isEqualTo(ProcFlowRunStatus.FAILED);
                    assertThat(run.getErrorKind()).isEqualTo(ProcFlowErrorKind.TIMEOUT);
                    assertThat(run.getFailedNodeId()).isEqualTo("review");
                })
                .verifyComplete();

        // Then
        WorkflowRunState state = facade.getRunState(runId).block();
        assertThat(state.getPendingApprovals()).singleElement().satisfies(approval -> {
            assertThat(approval.isOpen()).isFalse();
            assertThat(approval.getClosedReason()).isEqualTo(PendingApproval.CLOSED_EXPIRED);
        });
        assertThat(state.stepsFor("review"))
                .extracting(StepExecution::getStatus, StepExecution::getErrorKind)
                .containsExactly(
                        tuple(ProcFlowStepStatus.SUSPENDED, null),
                        tuple(ProcFlowStepStatus.FAILED, ProcFlowErrorKind.TIMEOUT));

        // And a late decision is ignored
        assertThat(facade.resumeRun(runId, "review", ReviewDecision.approved()).block().getRun().getStatus())
                .isEqualTo(ProcFlowRunStatus.FAILED);
    }

    @Test
    @DisplayName("Should approve an expired approval whose timeout action is auto-approve")
    void shouldAutoApproveExpiredApproval() {
        String runId = suspendedOnReview(Map.of("timeoutHours", 1, "timeoutAction", "auto_approve"));

        StepVerifier.create(worker.sweepApprovals(Instant.now().plus(Duration.ofHours(2))))
                .assertNext(run -> assertThat(run.getStatus()).isEqualTo(ProcFlowRunStatus.COMPLETED))
                .verifyComplete();

        WorkflowRunState state = facade.getRunState(runId).block();
        assertThat(state.getRun().getVariables())
                .containsEntry("review.decision", "APPROVED")
                .containsEntry("review.reviewerId", ProcFlowRunWalker.DEADLINE_REVIEWER);
        assertThat(state.getPendingApprovals()).isEmpty();
    }

    @Test
    @DisplayName("Should skip an expired approval node that skips on error")
    void shouldSkipExpiredApprovalWhenNodeSkipsOnError() {
        String runId = suspendedOnReview(TestDefinitions.node("review", ProcFlowNodeKind.APPROVAL, Map.of("timeoutHours", 1))
                .toBuilder().skipOnError(true).build());

        worker.sweepApprovals(Instant.now().plus(Duration.ofHours(2))).blockLast();

        WorkflowRunState state = facade.getRunState(runId).block();
        assertThat(state.getRun().getStatus()).isEqualTo(ProcFlowRunStatus.COMPLETED);
        assertThat(state.stepsFor("review"))
                .extracting(StepExecution::getStatus, StepExecution::getErrorKind)
                .containsExactly(
                        tuple(ProcFlowStepStatus.SUSPENDED, null),
                        tuple(ProcFlowStepStatus.SKIPPED, ProcFlowErrorKind.TIMEOUT));
    }

    @Test
    @DisplayName("Should escalate a due approval once and route it to the escalation assignees")
    void shouldEscalateDueApproval() {
        // Given
        String runId = suspendedOnReview(Map.of(
                "assignees", List.of("clerk"),
                "timeoutHours", 48,
                "escalationEnabled", true,
                "escalationAfterHours", 4,
                "escalationAssignees", List.of("supervisor")));
        Instant escalation = Instant.now().plus(Duration.ofHours(5));
        assertThat(store.findOpenApprovals("supervisor").collectList().block()).isEmpty();

        // When
        StepVerifier.create(worker.sweepApprovals(escalation))
                .assertNext(run -> assertThat(run.getStatus()).isEqualTo(ProcFlowRunStatus.SUSPENDED))
                .verifyComplete();

        // Then
        assertThat(store.findOpenApprovals("supervisor").collectList().block()).singleElement().satisfies(approval -> {
            assertThat(approval.getRunId()).isEqualTo(runId);
            assertThat(approval.isEscalated()).isTrue();
            assertThat(approval.getEscalatedAt()).isEqualTo(escalation);
        });
        assertThat(store.findOpenApprovals("clerk").collectList().block()).hasSize(1);

        // And a later sweep before the deadline changes nothing
        StepVerifier.create(worker.sweepApprovals(escalation.plus(Duration.ofHours(1)))).verifyComplete();
    }

    @Test
    @DisplayName("Should leave approvals of a locked run for the next sweep")
    void shouldSkipLockedRunDuringSweep() {
        String runId = suspendedOnReview(Map.of("timeoutHours", 1));
        facade.getLockService().tryAcquire(runId, "walk-elsewhere", Duration.ofMinutes(5)).block();

        StepVerifier.create(worker.sweepApprovals(Instant.now().plus(Duration.ofHours(2)))).verifyComplete();

        assertThat(store.findRun(runId).block().getStatus()).isEqualTo(ProcFlowRunStatus.SUSPENDED);
    }

    @Test
    @DisplayName("Should start once and stop cleanly")
    void shouldStartAndStop() {
        ProcFlowRunRecoveryWorker scheduled = new ProcFlowRunRecoveryWorker(store, facade.getRunWalker(), facade.getLockService(),
                ProcFlowEngineConfig.builder().recoveryInterval(Duration.ofHours(1)).build());

        scheduled.start();
        scheduled.start();
        assertThat(scheduled.isRunning()).isTrue();

        scheduled.stop();
        assertThat(scheduled.isRunning()).isFalse();
    }
}
