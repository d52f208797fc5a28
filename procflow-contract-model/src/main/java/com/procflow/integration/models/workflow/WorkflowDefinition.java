package com.procflow.integration.models.workflow;

import com.procflow.integration.enumerations.ProcFlowNodeKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable workflow template: an ordered list of typed nodes connected by edges.
 *
 * <p>A definition is validated once before it is stored and is never mutated in place.
 * Edits produce a new {@code version}.</p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Exactly one node of kind {@link ProcFlowNodeKind#START}</li>
 *   <li>Every non-start node is reachable from the start node</li>
 *   <li>Every edge references existing node ids</li>
 *   <li>Node ids are unique</li>
 * </ul>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    @NotBlank(message = "definition id must not be blank")
    private String id;

    @Min(value = 1, message = "definition version must be at least {value}")
    @Builder.Default
    private int version = 1;

    private String name;

    @NotEmpty(message = "definition must declare at least one node")
    @Builder.Default
    private List<@Valid NodeDefinition> nodes = new ArrayList<>();

    @Builder.Default
    private List<@Valid EdgeDefinition> edges = new ArrayList<>();

    @NotNull(message = "trigger must not be null")
    @Valid
    @Builder.Default
    private TriggerConfig trigger = TriggerConfig.manual();

    public Optional<NodeDefinition> node(String nodeId) {
        return nodes.stream()
                .filter(node -> node.getNodeId() != null && node.getNodeId().equals(nodeId))
                .findFirst();
    }

    public List<NodeDefinition> nodesOfKind(ProcFlowNodeKind kind) {
        return nodes.stream()
                .filter(node -> node.getKind() == kind)
                .toList();
    }

    /**
     * Returns the single start node, or empty when the definition does not have exactly one.
     */
    public Optional<NodeDefinition> startNode() {
        List<NodeDefinition> starts = nodesOfKind(ProcFlowNodeKind.START);
        return starts.size() == 1 ? Optional.of(starts.get(0)) : Optional.empty();
    }

    /**
     * Outgoing edges of a node in declaration order.
     */
    public List<EdgeDefinition> outgoingEdges(String nodeId) {
        return edges.stream()
                .filter(edge -> nodeId.equals(edge.getSource()))
                .toList();
    }

    public List<EdgeDefinition> incomingEdges(String nodeId) {
        return edges.stream()
                .filter(edge -> nodeId.equals(edge.getTarget()))
                .toList();
    }

    /**
     * Position of a node in the declared node list, used to keep frontier order stable.
     */
    public int indexOf(String nodeId) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodeId.equals(nodes.get(i).getNodeId())) {
                return i;
            }
        }
        return -1;
    }
}
