package com.procflow.integration.contract.collaborator;

import com.procflow.integration.exception.ProcFlowCollaboratorException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Side-effecting collaborator behind action nodes: file operations, document generation,
 * notifications and outbound API calls.
 *
 * <p>Each attempt receives {@code runId:nodeId:attempt}. Providers that de-duplicate across
 * retries can key on the {@code runId:nodeId} prefix. Signal a failure that must not be
 * retried with {@link ProcFlowCollaboratorException#permanent(String)}.</p>
 */
public interface IProcFlowActionProvider {

    Mono<Map<String, Object>> invoke(Map<String, Object> actionConfig, Map<String, Object> variables, String idempotencyKey);
}
