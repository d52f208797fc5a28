package com.procflow.core.engine.rest.dto;

import com.procflow.integration.models.workflow.WorkflowDefinition;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartRunRequest {

    /**
     * Optional caller-chosen id; starting the same id twice returns the existing run.
     */
    private String runId;

    @NotNull(message = "definition is required")
    private WorkflowDefinition definition;

    @Builder.Default
    private Map<String, Object> triggerInput = new LinkedHashMap<>();
}
