package com.procflow.core.engine.node;

import com.procflow.core.exception.ProcFlowVariableConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Run Variables Tests")
class RunVariablesTest {

    @Test
    @DisplayName("Should namespace node outputs and seed trigger input under bare names")
    void shouldNamespaceOutputs() {
        Map<String, Object> variables = new LinkedHashMap<>();

        RunVariables.seedTriggerInput("run-1", variables, Map.of("amount", 500));
        RunVariables.mergeNodeOutputs("run-1", variables, "extract", Map.of("vendor", "Acme Corp"));

        assertThat(variables).containsOnly(entry("amount", 500), entry("extract.vendor", "Acme Corp"));
        assertThat(RunVariables.outputsOf(variables, "extract")).containsOnly(entry("vendor", "Acme Corp"));
    }

    @Test
    @DisplayName("Should accept rebinding a key to an equal value")
    void shouldAcceptEqualRebind() {
        Map<String, Object> variables = new LinkedHashMap<>(Map.of("extract.vendor", "Acme Corp"));

        RunVariables.mergeNodeOutputs("run-1", variables, "extract", Map.of("vendor", "Acme Corp"));

        assertThat(variables).hasSize(1);
    }

    @Test
    @DisplayName("Should reject a conflicting write without applying any part of it")
    void shouldRejectConflictAtomically() {
        Map<String, Object> variables = new LinkedHashMap<>(Map.of("extract.vendor", "Acme Corp"));
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("total", 12.5);
        outputs.put("vendor", "Globex");

        assertThatThrownBy(() -> RunVariables.mergeNodeOutputs("run-1", variables, "extract", outputs))
                .isInstanceOfSatisfying(ProcFlowVariableConflictException.class, e ->
                        assertThat(e.getKey()).isEqualTo("extract.vendor"))
                .hasMessageContaining("run-1");
        assertThat(variables).containsOnlyKeys("extract.vendor");
    }

    @Test
    @DisplayName("Should not confuse nodes sharing an id prefix")
    void shouldMatchWholeNodeIds() {
        Map<String, Object> variables = Map.of("step.a", 1, "step-2.b", 2, "stepper", 3);

        assertThat(RunVariables.outputsOf(variables, "step")).containsOnly(entry("a", 1));
    }
}
