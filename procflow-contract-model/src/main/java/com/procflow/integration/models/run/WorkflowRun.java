package com.procflow.integration.models.run;

import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowRunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One execution instance of a workflow definition.
 *
 * <p>The run is owned exclusively by the engine. Stores persist it but never change it on
 * their own. Everything needed to continue the walk lives here, so a run can be re-entered
 * from persisted state on any process.</p>
 *
 * <h2>State Components</h2>
 * <ul>
 *   <li><b>Identity:</b> run id, definition id and version</li>
 *   <li><b>Scope:</b> trigger input and the append-only {@code variables}</li>
 *   <li><b>Progress:</b> frontier, join arrivals, suspended nodes, step count</li>
 *   <li><b>Outcome:</b> status, output, error kind and message, failed node</li>
 * </ul>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRun implements Serializable {

    private static final long serialVersionUID = 1L;

    // ========================================================================
    // IDENTITY
    // ========================================================================

    private String runId;

    private String definitionId;

    private int definitionVersion;

    // ========================================================================
    // SCOPE
    // ========================================================================

    private ProcFlowRunStatus status;

    @Builder.Default
    private Map<String, Object> triggerInput = new LinkedHashMap<>();

    /**
     * Trigger fields under their bare names plus every completed node's outputs
     * under {@code nodeId.field}. Keys are never removed or overwritten.
     */
    @Builder.Default
    private Map<String, Object> variables = new LinkedHashMap<>();

    // ========================================================================
    // PROGRESS
    // ========================================================================

    /**
     * Node ids awaiting execution, in scheduling order, without duplicates.
     */
    @Builder.Default
    private List<String> frontier = new ArrayList<>();

    /**
     * Join node id to the predecessor node ids that have reached it.
     */
    @Builder.Default
    private Map<String, List<String>> joinArrivals = new LinkedHashMap<>();

    /**
     * Approval nodes currently waiting for a reviewer decision.
     */
    @Builder.Default
    private List<String> suspendedNodes = new ArrayList<>();

    /**
     * Total number of step attempts executed for this run.
     */
    private int stepCount;

    // ========================================================================
    // OUTCOME
    // ========================================================================

    @Builder.Default
    private Map<String, Object> output = new LinkedHashMap<>();

    private ProcFlowErrorKind errorKind;

    private String error;

    private String failedNodeId;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant completedAt;

    /**
     * Returns a copy whose collections can be changed without affecting this instance.
     */
    public WorkflowRun copy() {
        Map<String, List<String>> arrivals = new LinkedHashMap<>();
        if (joinArrivals != null) {
            joinArrivals.forEach((join, sources) -> arrivals.put(join, new ArrayList<>(sources)));
        }
        return toBuilder()
                .triggerInput(triggerInput == null ? new LinkedHashMap<>() : new LinkedHashMap<>(triggerInput))
                .variables(variables == null ? new LinkedHashMap<>() : new LinkedHashMap<>(variables))
                .frontier(frontier == null ? new ArrayList<>() : new ArrayList<>(frontier))
                .joinArrivals(arrivals)
                .suspendedNodes(suspendedNodes == null ? new ArrayList<>() : new ArrayList<>(suspendedNodes))
                .output(output == null ? new LinkedHashMap<>() : new LinkedHashMap<>(output))
                .build();
    }
}
