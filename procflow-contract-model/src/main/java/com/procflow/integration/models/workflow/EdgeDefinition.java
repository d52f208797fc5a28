package com.procflow.integration.models.workflow;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Directed edge between two nodes. An edge without a condition is unconditional;
 * on a decision node it doubles as the default branch.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EdgeDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    @NotBlank(message = "edge source must not be blank")
    private String source;

    @NotBlank(message = "edge target must not be blank")
    private String target;

    private String condition;

    private boolean defaultEdge;

    private String label;

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }

    public static EdgeDefinition of(String source, String target) {
        return EdgeDefinition.builder().source(source).target(target).build();
    }

    public static EdgeDefinition when(String source, String target, String condition) {
        return EdgeDefinition.builder().source(source).target(target).condition(condition).build();
    }

    public static EdgeDefinition otherwise(String source, String target) {
        return EdgeDefinition.builder().source(source).target(target).defaultEdge(true).build();
    }
}
