package com.procflow.core.engine.support;

import com.procflow.integration.enumerations.ProcFlowFieldType;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.models.commons.FileReference;
import com.procflow.integration.models.workflow.EdgeDefinition;
import com.procflow.integration.models.workflow.FieldDefinition;
import com.procflow.integration.models.workflow.NodeDefinition;
import com.procflow.integration.models.workflow.WorkflowDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Workflow definitions shared by the engine tests.
 */
public final class TestDefinitions {

    public static final FileReference INVOICE_PDF = FileReference.builder()
            .id("file-42")
            .name("invoice-0042.pdf")
            .size(48_213)
            .contentType("application/pdf")
            .build();

    private TestDefinitions() {}

    public static NodeDefinition node(String nodeId, ProcFlowNodeKind kind) {
        return node(nodeId, kind, Map.of());
    }

    public static NodeDefinition node(String nodeId, ProcFlowNodeKind kind, Map<String, Object> config) {
        return NodeDefinition.builder()
                .nodeId(nodeId)
                .kind(kind)
                .name(nodeId)
                .config(new LinkedHashMap<>(config))
                .build();
    }

    public static FieldDefinition field(String name, ProcFlowFieldType type, boolean required) {
        return FieldDefinition.builder().name(name).type(type).required(required).build();
    }

    /**
     * start ─→ route ─┬─ amount > 1000 ─→ manager-approval ─┐
     *                 └─ otherwise ──────→ auto-approve ─────┴─→ end
     */
    public static WorkflowDefinition invoiceRouting() {
        NodeDefinition start = node("start", ProcFlowNodeKind.START).toBuilder()
                .inputFields(List.of(field("amount", ProcFlowFieldType.NUMBER, true)))
                .build();
        return WorkflowDefinition.builder()
                .id("invoice-routing")
                .name("Invoice routing")
                .nodes(new ArrayList<>(List.of(
                        start,
                        node("route", ProcFlowNodeKind.DECISION),
                        node("manager-approval", ProcFlowNodeKind.APPROVAL, Map.of(
                                "title", "Approve invoice of {{amount}}",
                                "assignees", List.of("manager-1"))),
                        node("auto-approve", ProcFlowNodeKind.NOTIFICATION, Map.of(
                                "recipients", "finance@example.com",
                                "message", "Invoice of {{amount}} approved automatically")),
                        node("end", ProcFlowNodeKind.END, Map.of("output", Map.of("amount", "amount"))))))
                .edges(new ArrayList<>(List.of(
                        EdgeDefinition.of("start", "route"),
                        EdgeDefinition.when("route", "manager-approval", "amount > 1000"),
                        EdgeDefinition.otherwise("route", "auto-approve"),
                        EdgeDefinition.of("manager-approval", "end"),
                        EdgeDefinition.of("auto-approve", "end"))))
                .build();
    }

    /**
     * start ─→ fork ─→ each branch ─→ join ─→ end. Branch nodes are API calls, so tests can
     * script them through an API_CALL executor override.
     */
    public static WorkflowDefinition forkJoin(String... branches) {
        List<NodeDefinition> nodes = new ArrayList<>(List.of(
                node("start", ProcFlowNodeKind.START),
                node("fork", ProcFlowNodeKind.FORK)));
        List<EdgeDefinition> edges = new ArrayList<>(List.of(EdgeDefinition.of("start", "fork")));
        for (String branch : branches) {
            nodes.add(node(branch, ProcFlowNodeKind.API_CALL, Map.of("url", "https://example.com/" + branch)));
            edges.add(EdgeDefinition.of("fork", branch));
            edges.add(EdgeDefinition.of(branch, "join"));
        }
        nodes.add(node("join", ProcFlowNodeKind.JOIN));
        nodes.add(node("end", ProcFlowNodeKind.END));
        edges.add(EdgeDefinition.of("join", "end"));
        return WorkflowDefinition.builder()
                .id("fork-join")
                .nodes(nodes)
                .edges(edges)
                .build();
    }

    /**
     * start ─→ extract ─→ [review ─→] end
     */
    public static WorkflowDefinition invoiceExtraction(boolean withReview) {
        NodeDefinition start = node("start", ProcFlowNodeKind.START).toBuilder()
                .inputFields(List.of(field("invoice", ProcFlowFieldType.FILE, true)))
                .build();
        NodeDefinition extract = node("extract", ProcFlowNodeKind.AI_EXTRACTION, Map.of(
                "prompt", "Extract the totals of {{invoice.name}}")).toBuilder()
                .outputFields(List.of(
                        FieldDefinition.builder().name("total").type(ProcFlowFieldType.CURRENCY).required(true).max(1000.0).build(),
                        field("vendor", ProcFlowFieldType.TEXT, true),
                        field("dueDate", ProcFlowFieldType.DATE, false)))
                .build();

        List<NodeDefinition> nodes = new ArrayList<>(List.of(start, extract));
        List<EdgeDefinition> edges = new ArrayList<>(List.of(EdgeDefinition.of("start", "extract")));
        if (withReview) {
            nodes.add(node("review", ProcFlowNodeKind.APPROVAL, Map.of(
                    "title", "Review invoice from {{extract.vendor}}",
                    "reviewFrom", "extract",
                    "deadlineHours", 24)));
            edges.add(EdgeDefinition.of("extract", "review"));
            edges.add(EdgeDefinition.of("review", "end"));
        } else {
            edges.add(EdgeDefinition.of("extract", "end"));
        }
        nodes.add(node("end", ProcFlowNodeKind.END));
        return WorkflowDefinition.builder()
                .id(withReview ? "invoice-extraction-review" : "invoice-extraction")
                .nodes(nodes)
                .edges(edges)
                .build();
    }

    /**
     * start ─→ step-1 ─→ ... ─→ step-n ─→ end, every step an API call.
     */
    public static WorkflowDefinition linear(int steps) {
        List<NodeDefinition> nodes = new ArrayList<>(List.of(node("start", ProcFlowNodeKind.START)));
        List<EdgeDefinition> edges = new ArrayList<>();
        String previous = "start";
        for (int i = 1; i <= steps; i++) {
            String nodeId = "step-" + i;
            nodes.add(node(nodeId, ProcFlowNodeKind.API_CALL, Map.of("url", "https://example.com/" + nodeId)));
            edges.add(EdgeDefinition.of(previous, nodeId));
            previous = nodeId;
        }
        nodes.add(node("end", ProcFlowNodeKind.END));
        edges.add(EdgeDefinition.of(previous, "end"));
        return WorkflowDefinition.builder()
                .id("linear-" + steps)
                .nodes(nodes)
                .edges(edges)
                .build();
    }

    /**
     * Copy of {@code definition} with one node changed.
     */
    public static WorkflowDefinition withNode(WorkflowDefinition definition, String nodeId,
                                              UnaryOperator<NodeDefinition.NodeDefinitionBuilder> change) {
        List<NodeDefinition> nodes = new ArrayList<>();
        for (NodeDefinition node : definition.getNodes()) {
            nodes.add(node.getNodeId().equals(nodeId) ? change.apply(node.toBuilder()).build() : node);
        }
        return definition.toBuilder().nodes(nodes).edges(new ArrayList<>(definition.getEdges())).build();
    }
}
