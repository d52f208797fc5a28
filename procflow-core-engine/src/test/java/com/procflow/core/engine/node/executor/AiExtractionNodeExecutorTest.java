package com.procflow.core.engine.node.executor;

import com.procflow.integration.contract.collaborator.IProcFlowExtractionAdapter;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowFieldType;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.exception.ProcFlowCollaboratorException;
import com.procflow.integration.models.workflow.EdgeDefinition;
import com.procflow.integration.models.workflow.FieldDefinition;
import com.procflow.integration.models.workflow.NodeDefinition;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.procflow.core.engine.support.TestContexts.context;
import static com.procflow.core.engine.support.TestDefinitions.INVOICE_PDF;
import static com.procflow.core.engine.support.TestDefinitions.field;
import static com.procflow.core.engine.support.TestDefinitions.node;
import static org.assertj.core.api.Assertions.*;

@DisplayName("AI Extraction Node Executor Tests")
class AiExtractionNodeExecutorTest {

    private static final List<FieldDefinition> INVOICE_FIELDS = List.of(
            FieldDefinition.builder().name("total").type(ProcFlowFieldType.CURRENCY).required(true).min(0.0).build(),
            field("paid", ProcFlowFieldType.BOOLEAN, false),
            field("vendor", ProcFlowFieldType.TEXT, true));

    private final AtomicReference<String> seenPrompt = new AtomicReference<>();
    private final AtomicReference<Map<String, Object>> seenSchema = new AtomicReference<>();
    private final AtomicReference<Map<String, Object>> seenContext = new AtomicReference<>();

    private IProcFlowExtractionAdapter answering(Mono<Map<String, Object>> answer) {
        return (prompt, schema, context) -> {
            seenPrompt.set(prompt);
            seenSchema.set(schema);
            seenContext.set(context);
            return answer;
        };
    }

    private static WorkflowDefinition definition(NodeDefinition extract) {
        return WorkflowDefinition.builder()
                .id("extraction")
                .nodes(new ArrayList<>(List.of(node("start", ProcFlowNodeKind.START), extract, node("end", ProcFlowNodeKind.END))))
                .edges(new ArrayList<>(List.of(EdgeDefinition.of("start", "extract"), EdgeDefinition.of("extract", "end"))))
                .build();
    }

    private static NodeDefinition extractNode(Map<String, Object> config, List<FieldDefinition> outputFields) {
        return node("extract", ProcFlowNodeKind.AI_EXTRACTION, config).toBuilder().outputFields(outputFields).build();
    }

    @Test
    @DisplayName("Should coerce extracted values and report anomalies")
    @SuppressWarnings("unchecked")
    void shouldCoerceAndCheckExtractedValues() {
        AiExtractionNodeExecutor executor = new AiExtractionNodeExecutor(answering(
                Mono.just(Map.of("total", "-$12.00", "paid", "yes", "notes", "handwritten"))));
        WorkflowDefinition definition = definition(extractNode(Map.of("prompt", "Read {{invoice.name}}"), INVOICE_FIELDS));

        StepVerifier.create(executor.execute(context(definition, "extract", Map.of("invoice", INVOICE_PDF))))
                .assertNext(result -> {
                    Map<String, Object> outputs = ((ExecutorResult.Continue) result).outputs();
                    assertThat(outputs)
                            .containsEntry("total", -12.0)
                            .containsEntry("paid", true)
                            .containsEntry("notes", "handwritten")
                            .containsEntry("sourceFiles", List.of(INVOICE_PDF));
                    assertThat((List<Map<String, Object>>) outputs.get("anomalies"))
                            .extracting(finding -> finding.get("field") + ":" + finding.get("rule"))
                            .containsExactly("total:BELOW_MIN", "vendor:REQUIRED_MISSING");
                })
                .verifyComplete();

        assertThat(seenPrompt.get()).isEqualTo("Read invoice-0042.pdf");
        assertThat(seenSchema.get()).containsExactly(
                entry("total", "CURRENCY"), entry("paid", "BOOLEAN"), entry("vendor", "TEXT"));
    }

    @Test
    @DisplayName("Should prefer a configured schema and hand over only the context fields")
    void shouldUseConfiguredSchemaAndContextFields() {
        AiExtractionNodeExecutor executor = new AiExtractionNodeExecutor(answering(Mono.just(Map.of("po", "PO-1"))));
        WorkflowDefinition definition = definition(extractNode(Map.of(
                "schema", Map.of("po", "TEXT"),
                "contextFields", List.of("email")), List.of()));

        StepVerifier.create(executor.execute(context(definition, "extract", Map.of("email", "Order PO-1", "secret", "x"))))
                .assertNext(result -> assertThat(((ExecutorResult.Continue) result).outputs()).containsEntry("po", "PO-1"))
                .verifyComplete();

        assertThat(seenSchema.get()).containsOnlyKeys("po");
        assertThat(seenContext.get()).containsOnlyKeys("email");
    }

    @Test
    @DisplayName("Should map a transient adapter failure to a retryable upstream failure")
    void shouldRetryTransientFailure() {
        AiExtractionNodeExecutor executor = new AiExtractionNodeExecutor(answering(
                Mono.error(ProcFlowCollaboratorException.transientFailure("model overloaded"))));

        StepVerifier.create(executor.execute(context(definition(extractNode(Map.of(), INVOICE_FIELDS)), "extract", Map.of())))
                .assertNext(result -> {
                    ExecutorResult.Fail fail = (ExecutorResult.Fail) result;
                    assertThat(fail.errorKind()).isEqualTo(ProcFlowErrorKind.UPSTREAM);
                    assertThat(fail.retryable()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should treat an empty adapter answer as retryable")
    void shouldRetryEmptyAnswer() {
        AiExtractionNodeExecutor executor = new AiExtractionNodeExecutor(answering(Mono.empty()));

        StepVerifier.create(executor.execute(context(definition(extractNode(Map.of(), INVOICE_FIELDS)), "extract", Map.of())))
                .assertNext(result -> assertThat(((ExecutorResult.Fail) result).retryable()).isTrue())
                .verifyComplete();
    }

    @Test
    @DisplayName("Should fail validation without an adapter or without fields to extract")
    void shouldFailValidationWhenMisconfigured() {
        WorkflowDefinition withFields = definition(extractNode(Map.of(), INVOICE_FIELDS));
        WorkflowDefinition withoutFields = definition(extractNode(Map.of(), List.of()));

        StepVerifier.create(new AiExtractionNodeExecutor(null).execute(context(withFields, "extract", Map.of())))
                .assertNext(result -> assertThat(((ExecutorResult.Fail) result).errorKind()).isEqualTo(ProcFlowErrorKind.VALIDATION))
                .verifyComplete();

        StepVerifier.create(new AiExtractionNodeExecutor(answering(Mono.just(Map.of()))).execute(context(withoutFields, "extract", Map.of())))
                .assertNext(result -> assertThat(((ExecutorResult.Fail) result).errorKind()).isEqualTo(ProcFlowErrorKind.VALIDATION))
                .verifyComplete();
        assertThat(seenPrompt.get()).isNull();
    }
}
