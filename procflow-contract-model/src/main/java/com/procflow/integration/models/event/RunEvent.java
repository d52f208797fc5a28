package com.procflow.integration.models.event;

import com.procflow.integration.enumerations.ProcFlowRunEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lifecycle notification emitted while a run is walked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunEvent {

    private ProcFlowRunEventType type;

    private String runId;

    private String nodeId;

    @Builder.Default
    private Instant timestamp = Instant.now();

    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    public static RunEvent of(ProcFlowRunEventType type, String runId) {
        return RunEvent.builder().type(type).runId(runId).timestamp(Instant.now()).build();
    }

    public static RunEvent of(ProcFlowRunEventType type, String runId, String nodeId, Map<String, Object> data) {
        return RunEvent.builder()
                .type(type)
                .runId(runId)
                .nodeId(nodeId)
                .timestamp(Instant.now())
                .data(data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data))
                .build();
    }
}
