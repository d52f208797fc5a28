package com.procflow.core.engine.state.impl;

import com.procflow.core.engine.support.TestDefinitions;
import com.procflow.integration.contract.store.IProcFlowExecutionStore;
import com.procflow.integration.enumerations.ProcFlowApprovalTimeoutAction;
import com.procflow.integration.enumerations.ProcFlowRunStatus;
import com.procflow.integration.enumerations.ProcFlowStepStatus;
import com.procflow.integration.models.run.ExecutionCommit;
import com.procflow.integration.models.run.PendingApproval;
import com.procflow.integration.models.run.StepExecution;
import com.procflow.integration.models.run.WorkflowRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("File-Based Execution Store Tests")
class FileBasedExecutionStoreTest extends AbstractExecutionStoreTest {

    @TempDir
    Path baseDir;

    private FileBasedExecutionStore store;

    @BeforeEach
    void setUp() {
        store = new FileBasedExecutionStore(baseDir);
        store.initialize().block();
    }

    @Override
    protected IProcFlowExecutionStore store() {
        return store;
    }

    @Test
    @DisplayName("Should write one document per run and per definition version")
    void shouldWriteDocuments() {
        store.saveDefinition(TestDefinitions.invoiceRouting()).block();
        store.createRun(run("run-1")).block();

        assertThat(baseDir.resolve("runs").resolve("run-1.json")).exists();
        assertThat(baseDir.resolve("definitions").resolve("invoice-routing-v1.json")).exists();
        assertThat(baseDir.resolve("runs").resolve("run-1.json.tmp")).doesNotExist();
    }

    @Test
    @DisplayName("Should reload committed state after a restart")
    void shouldReloadAfterRestart() {
        store.saveDefinition(TestDefinitions.invoiceRouting()).block();
        WorkflowRun created = store.createRun(run("run-1")).block();
        store.commit(ExecutionCommit.builder()
                .run(suspended(created))
                .steps(List.of(step("run-1", "start", 1, ProcFlowStepStatus.SUCCEEDED)))
                .approvals(List.of(approval("run-1", "manager-approval")))
                .build()).block();
        store.shutdown().block();

        FileBasedExecutionStore restarted = new FileBasedExecutionStore(baseDir);
        restarted.initialize().block();

        WorkflowRun reloaded = restarted.findRun("run-1").block();
        assertThat(reloaded.getStatus()).isEqualTo(ProcFlowRunStatus.SUSPENDED);
        assertThat(reloaded.getSuspendedNodes()).containsExactly("manager-approval");
        assertThat(reloaded.getVariables()).containsEntry("amount", 1250);
        assertThat(reloaded.getCreatedAt()).isEqualTo(created.getCreatedAt());
        assertThat(restarted.findSteps("run-1").map(StepExecution::getStepId).collectList().block())
                .containsExactly("run-1:start:1");
        assertThat(restarted.findApproval("run-1", "manager-approval").block().isOpen()).isTrue();
        assertThat(restarted.findDefinition("invoice-routing", 1).block().getNodes()).hasSize(5);
    }

    @Test
    @DisplayName("Should keep approval deadlines, quorum and escalation across a restart")
    void shouldReloadApprovalLifecycle() {
        WorkflowRun created = store.createRun(run("run-1")).block();
        Instant deadline = Instant.parse("2026-03-02T09:00:00Z");
        store.commit(ExecutionCommit.builder()
                .run(suspended(created))
                .approvals(List.of(approval("run-1", "manager-approval").toBuilder()
                        .assignees(List.of("manager-1"))
                        .deadline(deadline)
                        .timeoutAction(ProcFlowApprovalTimeoutAction.AUTO_APPROVE)
                        .minApprovals(2)
                        .build()
                        .recordApproval("manager-1")
                        .escalate(Instant.parse("2026-03-01T13:00:00Z"))))
                .build()).block();
        store.shutdown().block();

        FileBasedExecutionStore restarted = new FileBasedExecutionStore(baseDir);
        restarted.initialize().block();

        PendingApproval reloaded = restarted.findApproval("run-1", "manager-approval").block();
        assertThat(reloaded.getDeadline()).isEqualTo(deadline);
        assertThat(reloaded.getTimeoutAction()).isEqualTo(ProcFlowApprovalTimeoutAction.AUTO_APPROVE);
        assertThat(reloaded.getApprovedBy()).containsExactly("manager-1");
        assertThat(reloaded.getRemainingApprovals()).isEqualTo(1);
        assertThat(reloaded.isEscalated()).isTrue();
        assertThat(reloaded.isExpired(deadline)).isTrue();
    }

    @Test
    @DisplayName("Should skip unreadable documents on startup")
    void shouldSkipUnreadableDocuments() throws IOException {
        store.createRun(run("run-1")).block();
        Files.writeString(baseDir.resolve("runs").resolve("broken.json"), "{ not json");

        FileBasedExecutionStore restarted = new FileBasedExecutionStore(baseDir);
        restarted.initialize().block();

        assertThat(restarted.findRunsByStatus(ProcFlowRunStatus.RUNNING).collectList().block()).hasSize(1);
    }

    @Test
    @DisplayName("Should refuse to work before initialization")
    void shouldRequireInitialization() {
        FileBasedExecutionStore fresh = new FileBasedExecutionStore(baseDir.resolve("fresh"));

        assertThatThrownBy(() -> fresh.findRun("run-1").block())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("initialize()");
        assertThat(fresh.healthCheck().block()).isFalse();
    }
}
