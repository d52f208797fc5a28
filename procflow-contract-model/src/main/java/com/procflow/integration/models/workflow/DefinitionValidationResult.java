package com.procflow.integration.models.workflow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DefinitionValidationResult {

    private boolean valid;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public static DefinitionValidationResult of(List<String> errors, List<String> warnings) {
        return new DefinitionValidationResult(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings));
    }
}
