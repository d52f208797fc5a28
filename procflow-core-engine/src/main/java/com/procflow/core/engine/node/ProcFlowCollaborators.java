package com.procflow.core.engine.node;

import com.procflow.integration.contract.collaborator.IProcFlowActionProvider;
import com.procflow.integration.contract.collaborator.IProcFlowExtractionAdapter;
import com.procflow.integration.contract.collaborator.IProcFlowFileStore;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * External systems the executors delegate to. Any of them may be absent; nodes that need a
 * missing collaborator fail with a validation error when they run.
 */
@Getter
@Builder
@ToString
public class ProcFlowCollaborators {

    private final IProcFlowExtractionAdapter extractionAdapter;

    private final IProcFlowFileStore fileStore;

    @Singular
    private final Map<ProcFlowNodeKind, IProcFlowActionProvider> actionProviders;

    public static ProcFlowCollaborators none() {
        return ProcFlowCollaborators.builder().build();
    }

    public Optional<IProcFlowExtractionAdapter> extractionAdapter() {
        return Optional.ofNullable(extractionAdapter);
    }

    public Optional<IProcFlowFileStore> fileStore() {
        return Optional.ofNullable(fileStore);
    }

    public Optional<IProcFlowActionProvider> actionProvider(ProcFlowNodeKind kind) {
        return Optional.ofNullable(actionProviders.get(kind));
    }

    public Map<ProcFlowNodeKind, IProcFlowActionProvider> getActionProviders() {
        return actionProviders.isEmpty() ? Map.of() : new EnumMap<>(actionProviders);
    }
}
