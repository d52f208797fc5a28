package com.procflow.core.engine.validation;

import com.procflow.core.engine.expression.ProcFlowExpressionEvaluator;
import com.procflow.core.engine.node.ProcFlowNodeExecutorRegistry;
import com.procflow.core.engine.support.TestDefinitions;
import com.procflow.integration.enumerations.ProcFlowFieldType;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.enumerations.ProcFlowTriggerType;
import com.procflow.integration.exception.ProcFlowValidationException;
import com.procflow.integration.models.workflow.DefinitionValidationResult;
import com.procflow.integration.models.workflow.EdgeDefinition;
import com.procflow.integration.models.workflow.NodeDefinition;
import com.procflow.integration.models.workflow.TriggerConfig;
import com.procflow.integration.models.workflow.WorkflowDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.procflow.core.engine.support.TestDefinitions.INVOICE_PDF;
import static com.procflow.core.engine.support.TestDefinitions.node;
import static org.assertj.core.api.Assertions.*;
import static org.assertj.core.api.InstanceOfAssertFactories.STRING;

@DisplayName("Definition Validator Tests")
class ProcFlowDefinitionValidatorTest {

    private final ProcFlowDefinitionValidator validator = new ProcFlowDefinitionValidator(
            ProcFlowExpressionEvaluator.getInstance(), ProcFlowNodeExecutorRegistry.defaults(null));

    private static WorkflowDefinition graph(List<NodeDefinition> nodes, List<EdgeDefinition> edges) {
        return WorkflowDefinition.builder()
                .id("graph")
                .nodes(new ArrayList<>(nodes))
                .edges(new ArrayList<>(edges))
                .build();
    }

    // ========================================================================
    // STRUCTURE
    // ========================================================================

    @Nested
    @DisplayName("Structure")
    class StructureTests {

        @Test
        @DisplayName("Should accept the shipped sample definitions")
        void shouldAcceptValidDefinitions() {
            assertThat(validator.validate(TestDefinitions.invoiceRouting()).isValid()).isTrue();
            assertThat(validator.validate(TestDefinitions.invoiceExtraction(true)).getErrors()).isEmpty();
            assertThat(validator.validate(TestDefinitions.forkJoin("a", "b")).getWarnings()).isEmpty();
        }

        @Test
        @DisplayName("Should report bean constraint violations")
        void shouldReportConstraints() {
            WorkflowDefinition definition = TestDefinitions.linear(1).toBuilder().id(" ").version(0).build();

            assertThat(validator.validate(definition).getErrors()).contains(
                    "id: definition id must not be blank",
                    "version: definition version must be at least 1");
        }

        @Test
        @DisplayName("Should require exactly one start node")
        void shouldRequireSingleStart() {
            WorkflowDefinition definition = graph(
                    List.of(node("a", ProcFlowNodeKind.START), node("b", ProcFlowNodeKind.START), node("end", ProcFlowNodeKind.END)),
                    List.of(EdgeDefinition.of("a", "end"), EdgeDefinition.of("b", "end")));

            assertThat(validator.validate(definition).getErrors())
                    .contains("definition must have exactly one START node but has 2");
        }

        @Test
        @DisplayName("Should reject duplicate ids, dotted ids and dangling edges")
        void shouldRejectBadIdsAndEdges() {
            WorkflowDefinition definition = graph(
                    List.of(node("start", ProcFlowNodeKind.START), node("a.b", ProcFlowNodeKind.API_CALL),
                            node("end", ProcFlowNodeKind.END), node("end", ProcFlowNodeKind.END)),
                    List.of(EdgeDefinition.of("start", "a.b"), EdgeDefinition.of("a.b", "ghost"),
                            EdgeDefinition.of("a.b", "start")));

            assertThat(validator.validate(definition).getErrors()).contains(
                    "node id 'a.b' must not contain '.'",
                    "duplicate node id 'end'",
                    "edge target 'ghost' does not exist",
                    "edge a.b -> start must not target the START node");
        }

        @Test
        @DisplayName("Should report unreachable nodes")
        void shouldReportUnreachable() {
            WorkflowDefinition definition = graph(
                    List.of(node("start", ProcFlowNodeKind.START), node("end", ProcFlowNodeKind.END),
                            node("orphan", ProcFlowNodeKind.NOTIFICATION)),
                    List.of(EdgeDefinition.of("start", "end"), EdgeDefinition.of("orphan", "end")));

            assertThat(validator.validate(definition).getErrors())
                    .containsExactly("node 'orphan' is not reachable from the START node");
        }

        @Test
        @DisplayName("Should reject cycles")
        void shouldRejectCycles() {
            WorkflowDefinition definition = graph(
                    List.of(node("start", ProcFlowNodeKind.START), node("a", ProcFlowNodeKind.API_CALL),
                            node("b", ProcFlowNodeKind.API_CALL), node("end", ProcFlowNodeKind.END)),
                    List.of(EdgeDefinition.of("start", "a"), EdgeDefinition.of("a", "b"),
                            EdgeDefinition.of("b", "a"), EdgeDefinition.of("b", "end")));

            assertThat(validator.validate(definition).getErrors())
                    .singleElement(as(STRING))
                    .startsWith("definition contains a cycle through node");
        }

        @Test
        @DisplayName("Should list every error when a valid definition is required")
        void shouldThrowOnRequireValid() {
            WorkflowDefinition definition = graph(List.of(node("end", ProcFlowNodeKind.END)), List.of());

            assertThatThrownBy(() -> validator.requireValid(definition))
                    .isInstanceOfSatisfying(ProcFlowValidationException.class, e ->
                            assertThat(e.getErrors()).containsExactly("definition must have exactly one START node but has 0"))
                    .hasMessageStartingWith("Workflow definition graph is invalid");
        }
    }

    // ========================================================================
    // NODE SEMANTICS
    // ========================================================================

    @Nested
    @DisplayName("Node Semantics")
    class NodeSemanticsTests {

        @Test
        @DisplayName("Should reject an unparseable condition and warn about conditions off decisions")
        void shouldCheckConditions() {
            WorkflowDefinition definition = graph(
                    List.of(node("start", ProcFlowNodeKind.START), node("end", ProcFlowNodeKind.END)),
                    List.of(EdgeDefinition.builder().source("start").target("end").condition("amount >").build()));

            DefinitionValidationResult result = validator.validate(definition);

            assertThat(result.getErrors()).singleElement(as(STRING))
                    .startsWith("condition on edge start -> end is invalid");
            assertThat(result.getWarnings())
                    .contains("edge start -> end has a condition but its source is not a decision node");
        }

        @Test
        @DisplayName("Should reject a decision without outgoing edges")
        void shouldRejectDeadEndDecision() {
            WorkflowDefinition definition = graph(
                    List.of(node("start", ProcFlowNodeKind.START), node("route", ProcFlowNodeKind.DECISION)),
                    List.of(EdgeDefinition.of("start", "route")));

            DefinitionValidationResult result = validator.validate(definition);

            assertThat(result.getErrors()).containsExactly("decision node 'route' has no outgoing edges");
            assertThat(result.getWarnings()).contains("definition has no END node");
        }

        @Test
        @DisplayName("Should check the expected arrivals of a join")
        void shouldCheckJoinExpected() {
            WorkflowDefinition tooMany = TestDefinitions.withNode(TestDefinitions.forkJoin("a", "b"), "join",
                    join -> join.config(Map.of("expected", 3)));
            WorkflowDefinition notNumeric = TestDefinitions.withNode(TestDefinitions.forkJoin("a", "b"), "join",
                    join -> join.config(Map.of("expected", "two")));

            assertThat(validator.validate(tooMany).getErrors())
                    .containsExactly("join node 'join' expects 3 arrivals but has 2 predecessors");
            assertThat(validator.validate(notNumeric).getErrors())
                    .containsExactly("join node 'join' has a non-positive or non-numeric 'expected'");
        }

        @Test
        @DisplayName("Should check approval timeouts, quorum and escalation settings")
        void shouldCheckApprovalLifecycle() {
            WorkflowDefinition invalid = TestDefinitions.withNode(TestDefinitions.invoiceRouting(), "manager-approval",
                    approval -> approval.config(Map.of(
                            "assignees", List.of("manager-1"),
                            "timeoutAction", "escalate",
                            "minApprovals", 0,
                            "timeoutHours", -1)));
            WorkflowDefinition escalatesNowhere = TestDefinitions.withNode(TestDefinitions.invoiceRouting(), "manager-approval",
                    approval -> approval.config(Map.of("escalationEnabled", true)));

            assertThat(validator.validate(invalid).getErrors()).containsExactly(
                    "approval node 'manager-approval' has an unknown timeoutAction 'escalate'",
                    "approval node 'manager-approval' has a non-positive or non-numeric 'minApprovals'",
                    "approval node 'manager-approval' has a non-positive or non-numeric 'timeoutHours'");
            DefinitionValidationResult result = validator.validate(escalatesNowhere);
            assertThat(result.getErrors())
                    .containsExactly("approval node 'manager-approval' enables escalation without 'escalationAfterHours'");
            assertThat(result.getWarnings()).contains("approval node 'manager-approval' escalates to nobody");
        }

        @Test
        @DisplayName("Should warn about degenerate forks, joins, empty extractions and inert triggers")
        void shouldCollectWarnings() {
            WorkflowDefinition definition = TestDefinitions.withNode(
                            TestDefinitions.invoiceExtraction(false), "extract", extract -> extract.outputFields(new ArrayList<>()))
                    .toBuilder()
                    .trigger(TriggerConfig.builder().type(ProcFlowTriggerType.SCHEDULE).schedule("0 9 * * *").build())
                    .build();

            DefinitionValidationResult result = validator.validate(definition);

            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).containsExactly(
                    "extraction node 'extract' declares no output fields",
                    "trigger type SCHEDULE is accepted but never fires; start runs through the API");
            assertThat(validator.validate(TestDefinitions.forkJoin("only")).getWarnings()).containsExactlyInAnyOrder(
                    "fork node 'fork' has fewer than 2 targets",
                    "join node 'join' has fewer than 2 predecessors");
        }
    }

    // ========================================================================
    // TRIGGER INPUT
    // ========================================================================

    @Nested
    @DisplayName("Trigger Input")
    class TriggerInputTests {

        @Test
        @DisplayName("Should accept input matching the start node's fields")
        void shouldAcceptMatchingInput() {
            assertThatCode(() -> validator.validateTriggerInput(TestDefinitions.invoiceExtraction(false),
                    Map.of("invoice", INVOICE_PDF))).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should reject missing and mistyped fields")
        void shouldRejectBadInput() {
            WorkflowDefinition definition = TestDefinitions.withNode(TestDefinitions.invoiceRouting(), "start",
                    start -> start.inputFields(new ArrayList<>(List.of(
                            TestDefinitions.field("amount", ProcFlowFieldType.NUMBER, true),
                            TestDefinitions.field("requester", ProcFlowFieldType.EMAIL, true)))));

            assertThatThrownBy(() -> validator.validateTriggerInput(definition, Map.of("amount", "lots")))
                    .isInstanceOfSatisfying(ProcFlowValidationException.class, e ->
                            assertThat(e.getErrors()).hasSize(2))
                    .hasMessageStartingWith("Trigger input for workflow invoice-routing is invalid");
        }

        @Test
        @DisplayName("Should reject keys that would shadow node outputs")
        void shouldRejectKeysInNodeNamespace() {
            Map<String, Object> input = new LinkedHashMap<>();
            input.put("amount", 500);
            input.put("route.branch", "note");
            input.put("auto-approve", true);

            assertThatThrownBy(() -> validator.validateTriggerInput(TestDefinitions.invoiceRouting(), input))
                    .isInstanceOfSatisfying(ProcFlowValidationException.class, e ->
                            assertThat(e.getErrors()).containsExactly(
                                    "Trigger input key 'route.branch' must not contain '.'",
                                    "Trigger input key 'auto-approve' collides with node id 'auto-approve'"));
        }

        @Test
        @DisplayName("Should treat null input as empty")
        void shouldTreatNullAsEmpty() {
            assertThatThrownBy(() -> validator.validateTriggerInput(TestDefinitions.invoiceRouting(), null))
                    .isInstanceOf(ProcFlowValidationException.class);
        }
    }
}
