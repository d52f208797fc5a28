package com.procflow.core.engine.node.executor.support;

import com.procflow.integration.enumerations.ProcFlowFieldType;
import com.procflow.integration.models.workflow.FieldDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Field Rule Checker Tests")
class FieldRuleCheckerTest {

    private static FieldDefinition.FieldDefinitionBuilder field(String name, ProcFlowFieldType type) {
        return FieldDefinition.builder().name(name).type(type);
    }

    private static List<String> rules(List<Map<String, Object>> findings) {
        return findings.stream().map(finding -> (String) finding.get("rule")).toList();
    }

    @Test
    @DisplayName("Should accept values that satisfy every rule")
    void shouldAcceptValidValues() {
        List<FieldDefinition> fields = List.of(
                field("total", ProcFlowFieldType.CURRENCY).required(true).min(0.0).max(1000.0).build(),
                field("email", ProcFlowFieldType.EMAIL).build(),
                field("status", ProcFlowFieldType.TEXT).allowedValues(List.of("open", "paid")).build());

        assertThat(FieldRuleChecker.check(fields, Map.of("total", 99.5, "email", "ap@example.com", "status", "paid")))
                .isEmpty();
    }

    @Test
    @DisplayName("Should report missing required fields and ignore missing optional ones")
    void shouldReportMissingRequiredFields() {
        List<FieldDefinition> fields = List.of(
                field("vendor", ProcFlowFieldType.TEXT).required(true).build(),
                field("notes", ProcFlowFieldType.TEXT).build(),
                field("lines", ProcFlowFieldType.LIST).required(true).build());
        Map<String, Object> values = new HashMap<>();
        values.put("vendor", "   ");
        values.put("lines", List.of());

        List<Map<String, Object>> findings = FieldRuleChecker.check(fields, values);

        assertThat(rules(findings)).containsExactly(FieldRuleChecker.REQUIRED_MISSING, FieldRuleChecker.REQUIRED_MISSING);
        assertThat(findings.get(0)).containsEntry("field", "vendor");
        assertThat(findings.get(1)).containsEntry("field", "lines");
    }

    @Test
    @DisplayName("Should report type mismatches before range checks")
    void shouldReportTypeMismatch() {
        List<FieldDefinition> fields = List.of(
                field("total", ProcFlowFieldType.NUMBER).max(10.0).build(),
                field("due", ProcFlowFieldType.DATE).build(),
                field("contact", ProcFlowFieldType.EMAIL).build(),
                field("attachment", ProcFlowFieldType.FILE).build());

        List<Map<String, Object>> findings = FieldRuleChecker.check(fields, Map.of(
                "total", "lots",
                "due", "someday",
                "contact", "not-an-address",
                "attachment", "scan.pdf"));

        assertThat(rules(findings)).containsOnly(FieldRuleChecker.TYPE_MISMATCH).hasSize(4);
    }

    @Test
    @DisplayName("Should compare numbers by value, text by length and lists by size")
    void shouldCheckRanges() {
        List<FieldDefinition> fields = List.of(
                field("total", ProcFlowFieldType.CURRENCY).min(1.0).build(),
                field("code", ProcFlowFieldType.TEXT).max(3.0).build(),
                field("lines", ProcFlowFieldType.LIST).min(2.0).build());

        List<Map<String, Object>> findings = FieldRuleChecker.check(fields, Map.of(
                "total", 0.5,
                "code", "ABCD",
                "lines", List.of("one")));

        assertThat(rules(findings)).containsExactly(
                FieldRuleChecker.BELOW_MIN, FieldRuleChecker.ABOVE_MAX, FieldRuleChecker.BELOW_MIN);
    }

    @Test
    @DisplayName("Should check patterns and report invalid patterns")
    void shouldCheckPatterns() {
        List<FieldDefinition> fields = List.of(
                field("invoiceNo", ProcFlowFieldType.TEXT).pattern("INV-\\d{4}").build(),
                field("broken", ProcFlowFieldType.TEXT).pattern("([a-z").build());

        List<Map<String, Object>> findings = FieldRuleChecker.check(fields, Map.of("invoiceNo", "INV-12", "broken", "x"));

        assertThat(rules(findings)).containsExactly(FieldRuleChecker.PATTERN_MISMATCH, FieldRuleChecker.PATTERN_MISMATCH);
        assertThat(FieldRuleChecker.messages(findings).get(1)).contains("invalid pattern");
    }

    @Test
    @DisplayName("Should reject values outside the allowed set")
    void shouldRejectDisallowedValue() {
        List<FieldDefinition> fields = List.of(
                field("currency", ProcFlowFieldType.TEXT).allowedValues(List.of("USD", "EUR")).build());

        List<Map<String, Object>> findings = FieldRuleChecker.check(fields, Map.of("currency", "GBP"));

        assertThat(rules(findings)).containsExactly(FieldRuleChecker.NOT_ALLOWED);
        assertThat(FieldRuleChecker.messages(findings)).containsExactly("Field 'currency' must be one of [USD, EUR]");
    }

    @Test
    @DisplayName("Should treat absent field lists and values as nothing to check")
    void shouldHandleNulls() {
        assertThat(FieldRuleChecker.check(null, Map.of("a", 1))).isEmpty();
        assertThat(FieldRuleChecker.check(List.of(field("a", ProcFlowFieldType.TEXT).required(true).build()), null))
                .extracting(finding -> finding.get("rule"))
                .containsExactly(FieldRuleChecker.REQUIRED_MISSING);
    }
}
