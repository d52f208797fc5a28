package com.procflow.integration.models.workflow;

import com.procflow.integration.enumerations.ProcFlowFieldType;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * Declared input or output field of a node, with optional validation rules.
 * Rules on extraction outputs produce anomaly flags rather than failures.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FieldDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    @NotBlank(message = "field name must not be blank")
    private String name;

    private String label;

    @Builder.Default
    private ProcFlowFieldType type = ProcFlowFieldType.TEXT;

    private boolean required;

    private Double min;

    private Double max;

    private String pattern;

    private List<String> allowedValues;
}
