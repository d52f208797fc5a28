package com.procflow.integration.contract.collaborator;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Black-box structured extraction backed by an LLM provider.
 * Errors are signalled through the returned {@link Mono}.
 */
public interface IProcFlowExtractionAdapter {

    /**
     * @param prompt  fully interpolated prompt text
     * @param schema  field name to declared type name
     * @param context variables made available to the model
     * @return structured output keyed by field name
     */
    Mono<Map<String, Object>> extract(String prompt, Map<String, Object> schema, Map<String, Object> context);
}
