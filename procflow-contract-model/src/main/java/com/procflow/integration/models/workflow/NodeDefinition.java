package com.procflow.integration.models.workflow;

import com.procflow.integration.enumerations.ProcFlowNodeKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single typed node of a workflow definition.
 *
 * <p>{@code config} is interpreted by the executor registered for {@link #kind}.
 * {@code maxAttempts} and {@code timeoutMs} override the engine defaults for this node only.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NodeDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    @NotBlank(message = "node id must not be blank")
    private String nodeId;

    @NotNull(message = "node kind must not be null")
    private ProcFlowNodeKind kind;

    private String name;

    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    @Builder.Default
    private List<@Valid FieldDefinition> inputFields = new ArrayList<>();

    @Builder.Default
    private List<@Valid FieldDefinition> outputFields = new ArrayList<>();

    /**
     * Disabled nodes are recorded as skipped and routing continues past them.
     */
    @Builder.Default
    private boolean enabled = true;

    /**
     * When set, a fatal failure is recorded as skipped instead of failing the run.
     */
    private boolean skipOnError;

    @Positive(message = "maxAttempts must be positive")
    private Integer maxAttempts;

    @Positive(message = "timeoutMs must be positive")
    private Long timeoutMs;

    public Object configValue(String key) {
        return config == null ? null : config.get(key);
    }

    public String configString(String key, String defaultValue) {
        Object value = configValue(key);
        return value == null ? defaultValue : value.toString();
    }
}
