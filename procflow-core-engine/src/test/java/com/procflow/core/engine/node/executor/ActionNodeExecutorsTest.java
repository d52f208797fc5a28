package com.procflow.core.engine.node.executor;

import com.procflow.core.engine.node.ProcFlowCollaborators;
import com.procflow.core.engine.support.RecordingActionProvider;
import com.procflow.integration.contract.collaborator.IProcFlowFileStore;
import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.exception.ProcFlowCollaboratorException;
import com.procflow.integration.models.commons.FileReference;
import com.procflow.integration.models.workflow.EdgeDefinition;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.procflow.core.engine.support.TestContexts.RUN_ID;
import static com.procflow.core.engine.support.TestContexts.context;
import static com.procflow.core.engine.support.TestDefinitions.INVOICE_PDF;
import static com.procflow.core.engine.support.TestDefinitions.node;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests of the side-effecting executors: notification, API call, file operation and document
 * generation.
 */
@DisplayName("Action Node Executor Tests")
class ActionNodeExecutorsTest {

    private static ExecutionContext actionContext(ProcFlowNodeKind kind, Map<String, Object> config,
                                                  Map<String, Object> variables, int attempt) {
        WorkflowDefinition definition = WorkflowDefinition.builder()
                .id("actions")
                .nodes(new ArrayList<>(List.of(
                        node("start", ProcFlowNodeKind.START),
                        node("act", kind, config),
                        node("end", ProcFlowNodeKind.END))))
                .edges(new ArrayList<>(List.of(EdgeDefinition.of("start", "act"), EdgeDefinition.of("act", "end"))))
                .build();
        return context(definition, "act", variables, attempt);
    }

    private static ProcFlowCollaborators with(ProcFlowNodeKind kind, RecordingActionProvider provider) {
        return ProcFlowCollaborators.builder().actionProvider(kind, provider).build();
    }

    // ========================================================================
    // SHARED PIPELINE
    // ========================================================================

    @Nested
    @DisplayName("Shared Pipeline")
    class SharedPipelineTests {

        @Test
        @DisplayName("Should interpolate the config and pass the attempt's idempotency key")
        void shouldInterpolateAndPassIdempotencyKey() {
            RecordingActionProvider provider = new RecordingActionProvider(Map.of("status", 200));
            ApiCallNodeExecutor executor = new ApiCallNodeExecutor(with(ProcFlowNodeKind.API_CALL, provider));
            ExecutionContext context = actionContext(ProcFlowNodeKind.API_CALL,
                    Map.of("url", "https://erp.example.com/vendors/{{vendorId}}", "method", "post"),
                    Map.of("vendorId", 42), 2);

            StepVerifier.create(executor.execute(context))
                    .assertNext(result -> assertThat(((ExecutorResult.Continue) result).outputs()).containsEntry("status", 200))
                    .verifyComplete();

            RecordingActionProvider.Call call = provider.lastCall();
            assertThat(call.actionConfig())
                    .containsEntry("url", "https://erp.example.com/vendors/42")
                    .containsEntry("method", "POST");
            assertThat(call.idempotencyKey()).isEqualTo(RUN_ID + ":act:2");
            assertThat(call.variables()).containsEntry("vendorId", 42);
        }

        @Test
        @DisplayName("Should fail validation when no provider is registered")
        void shouldRequireProvider() {
            ApiCallNodeExecutor executor = new ApiCallNodeExecutor(ProcFlowCollaborators.none());

            StepVerifier.create(executor.execute(actionContext(ProcFlowNodeKind.API_CALL, Map.of("url", "https://x"), Map.of(), 1)))
                    .assertNext(result -> {
                        ExecutorResult.Fail fail = (ExecutorResult.Fail) result;
                        assertThat(fail.errorKind()).isEqualTo(ProcFlowErrorKind.VALIDATION);
                        assertThat(fail.retryable()).isFalse();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should separate permanent from transient collaborator failures")
        void shouldClassifyCollaboratorFailures() {
            ProcFlowCollaborators permanent = ProcFlowCollaborators.builder()
                    .actionProvider(ProcFlowNodeKind.API_CALL, (config, variables, key) ->
                            Mono.error(ProcFlowCollaboratorException.permanent("HTTP 422")))
                    .build();
            ProcFlowCollaborators transientOnly = ProcFlowCollaborators.builder()
                    .actionProvider(ProcFlowNodeKind.API_CALL, (config, variables, key) ->
                            Mono.error(ProcFlowCollaboratorException.transientFailure("HTTP 503")))
                    .build();
            ProcFlowCollaborators unexpected = ProcFlowCollaborators.builder()
                    .actionProvider(ProcFlowNodeKind.API_CALL, (config, variables, key) ->
                            Mono.error(new IllegalStateException("socket closed")))
                    .build();
            ExecutionContext context = actionContext(ProcFlowNodeKind.API_CALL, Map.of("url", "https://x"), Map.of(), 1);

            assertThat(((ExecutorResult.Fail) new ApiCallNodeExecutor(permanent).execute(context).block()).retryable()).isFalse();
            assertThat(((ExecutorResult.Fail) new ApiCallNodeExecutor(transientOnly).execute(context).block()).retryable()).isTrue();
            ExecutorResult.Fail failure = (ExecutorResult.Fail) new ApiCallNodeExecutor(unexpected).execute(context).block();
            assertThat(failure.errorKind()).isEqualTo(ProcFlowErrorKind.UPSTREAM);
            assertThat(failure.retryable()).isTrue();
            assertThat(failure.message()).isEqualTo("socket closed");
        }

        @Test
        @DisplayName("Should reject a kind that is not an action")
        void shouldRejectNonActionKind() {
            assertThatThrownBy(() -> new AbstractActionNodeExecutor(ProcFlowNodeKind.DECISION, ProcFlowCollaborators.none()) {
                @Override
                protected java.util.Optional<String> validateConfig(Map<String, Object> actionConfig) {
                    return java.util.Optional.empty();
                }
            }).isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ========================================================================
    // KIND SPECIFIC CONFIG
    // ========================================================================

    @Nested
    @DisplayName("Kind Specific Config")
    class KindSpecificTests {

        @Test
        @DisplayName("Should split comma separated recipients")
        void shouldSplitRecipients() {
            RecordingActionProvider provider = new RecordingActionProvider();
            NotificationNodeExecutor executor = new NotificationNodeExecutor(with(ProcFlowNodeKind.NOTIFICATION, provider));

            executor.execute(actionContext(ProcFlowNodeKind.NOTIFICATION,
                    Map.of("recipients", "ap@example.com, {{owner}} ,"), Map.of("owner", "cfo@example.com"), 1)).block();

            assertThat(provider.lastCall().actionConfig().get("recipients"))
                    .isEqualTo(List.of("ap@example.com", "cfo@example.com"));
        }

        @Test
        @DisplayName("Should require recipients, url, operation and template")
        void shouldRequireKindSpecificFields() {
            RecordingActionProvider provider = new RecordingActionProvider();
            ProcFlowCollaborators collaborators = ProcFlowCollaborators.builder()
                    .actionProvider(ProcFlowNodeKind.NOTIFICATION, provider)
                    .actionProvider(ProcFlowNodeKind.API_CALL, provider)
                    .actionProvider(ProcFlowNodeKind.FILE_OPERATION, provider)
                    .actionProvider(ProcFlowNodeKind.DOCUMENT_GENERATION, provider)
                    .build();

            List<ExecutorResult> results = List.of(
                    new NotificationNodeExecutor(collaborators).execute(actionContext(ProcFlowNodeKind.NOTIFICATION, Map.of("recipients", " "), Map.of(), 1)).block(),
                    new ApiCallNodeExecutor(collaborators).execute(actionContext(ProcFlowNodeKind.API_CALL, Map.of("method", "GET"), Map.of(), 1)).block(),
                    new ApiCallNodeExecutor(collaborators).execute(actionContext(ProcFlowNodeKind.API_CALL, Map.of("url", "https://x", "method", "BREW"), Map.of(), 1)).block(),
                    new FileOperationNodeExecutor(collaborators).execute(actionContext(ProcFlowNodeKind.FILE_OPERATION, Map.of(), Map.of(), 1)).block(),
                    new DocumentGenerationNodeExecutor(collaborators).execute(actionContext(ProcFlowNodeKind.DOCUMENT_GENERATION, Map.of(), Map.of(), 1)).block());

            assertThat(results).allSatisfy(result -> assertThat(((ExecutorResult.Fail) result).errorKind())
                    .isEqualTo(ProcFlowErrorKind.VALIDATION));
            assertThat(provider.getCalls()).isEmpty();
        }

        @Test
        @DisplayName("Should resolve file references for file operations")
        void shouldResolveFileReferences() {
            RecordingActionProvider provider = new RecordingActionProvider(Map.of("moved", true));
            FileOperationNodeExecutor executor = new FileOperationNodeExecutor(with(ProcFlowNodeKind.FILE_OPERATION, provider));
            Map<String, Object> fileMap = Map.of("id", "f-9", "name", "scan.png", "contentType", "image/png");

            StepVerifier.create(executor.execute(actionContext(ProcFlowNodeKind.FILE_OPERATION,
                            Map.of("operation", "archive", "file", "{{invoice}}", "files", List.of("{{invoice}}", fileMap)),
                            Map.of("invoice", INVOICE_PDF), 1)))
                    .assertNext(result -> assertThat(result).isInstanceOf(ExecutorResult.Continue.class))
                    .verifyComplete();

            Map<String, Object> sent = provider.lastCall().actionConfig();
            assertThat(sent.get("file")).isEqualTo(INVOICE_PDF);
            assertThat((List<Object>) sent.get("files")).containsExactly(
                    INVOICE_PDF, new FileReference("f-9", "scan.png", 0L, "image/png"));
        }

        @Test
        @DisplayName("Should reject a file value that is not a file reference")
        void shouldRejectInvalidFile() {
            RecordingActionProvider provider = new RecordingActionProvider();
            FileOperationNodeExecutor executor = new FileOperationNodeExecutor(with(ProcFlowNodeKind.FILE_OPERATION, provider));

            ExecutorResult result = executor.execute(actionContext(ProcFlowNodeKind.FILE_OPERATION,
                    Map.of("operation", "archive", "file", "scan.pdf"), Map.of(), 1)).block();

            assertThat(((ExecutorResult.Fail) result).message()).contains("'file' does not resolve to a file reference");
        }

        @Test
        @DisplayName("Should upload generated content and output the stored document")
        void shouldUploadGeneratedDocument() {
            RecordingActionProvider provider = new RecordingActionProvider(Map.of("content", "Dear Acme", "pages", 1));
            List<String> uploads = new ArrayList<>();
            IProcFlowFileStore fileStore = new IProcFlowFileStore() {
                @Override
                public Mono<FileReference> upload(byte[] bytes, String name, String contentType) {
                    uploads.add(new String(bytes, StandardCharsets.UTF_8) + "|" + name + "|" + contentType);
                    return Mono.just(new FileReference("doc-1", name, bytes.length, contentType));
                }

                @Override
                public Mono<byte[]> read(FileReference reference) {
                    return Mono.empty();
                }
            };
            DocumentGenerationNodeExecutor executor = new DocumentGenerationNodeExecutor(ProcFlowCollaborators.builder()
                    .actionProvider(ProcFlowNodeKind.DOCUMENT_GENERATION, provider)
                    .fileStore(fileStore)
                    .build());

            StepVerifier.create(executor.execute(actionContext(ProcFlowNodeKind.DOCUMENT_GENERATION,
                            Map.of("template", "reminder", "fileName", "reminder.txt", "contentType", "text/plain"), Map.of(), 1)))
                    .assertNext(result -> assertThat(((ExecutorResult.Continue) result).outputs())
                            .containsEntry("pages", 1)
                            .containsEntry("document", new FileReference("doc-1", "reminder.txt", 9L, "text/plain"))
                            .doesNotContainKey("content"))
                    .verifyComplete();
            assertThat(uploads).containsExactly("Dear Acme|reminder.txt|text/plain");
        }

        @Test
        @DisplayName("Should fail validation when content is produced without a file store")
        void shouldRequireFileStoreForContent() {
            RecordingActionProvider provider = new RecordingActionProvider(Map.of("content", "Dear Acme"));
            DocumentGenerationNodeExecutor executor = new DocumentGenerationNodeExecutor(with(ProcFlowNodeKind.DOCUMENT_GENERATION, provider));

            ExecutorResult result = executor.execute(actionContext(ProcFlowNodeKind.DOCUMENT_GENERATION,
                    Map.of("template", "reminder"), Map.of(), 1)).block();

            assertThat(((ExecutorResult.Fail) result).errorKind()).isEqualTo(ProcFlowErrorKind.VALIDATION);
        }
    }
}
