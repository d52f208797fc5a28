package com.procflow.core.engine.node.executor;

import com.procflow.core.engine.node.ProcFlowCollaborators;
import com.procflow.integration.contract.collaborator.IProcFlowFileStore;
import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Renders a document through the action provider. Returned {@code content} is uploaded to the
 * file store and replaced by a {@code document} file reference, so file bytes never enter the
 * run variables.
 */
@Slf4j
public class DocumentGenerationNodeExecutor extends AbstractActionNodeExecutor {

    public static final String CONFIG_TEMPLATE = "template";
    public static final String CONFIG_FILE_NAME = "fileName";
    public static final String CONFIG_CONTENT_TYPE = "contentType";
    public static final String RESULT_CONTENT = "content";
    public static final String OUTPUT_DOCUMENT = "document";

    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    public DocumentGenerationNodeExecutor(ProcFlowCollaborators collaborators) {
        super(ProcFlowNodeKind.DOCUMENT_GENERATION, collaborators);
    }

    @Override
    protected Optional<String> validateConfig(Map<String, Object> actionConfig) {
        return isBlank(actionConfig.get(CONFIG_TEMPLATE))
                ? Optional.of("'template' is required")
                : Optional.empty();
    }

    @Override
    protected Mono<ExecutorResult> postProcess(ExecutionContext context, Map<String, Object> actionConfig,
                                               Map<String, Object> result) {
        Object content = result.remove(RESULT_CONTENT);
        if (content == null) {
            return Mono.just(ExecutorResult.proceed(result));
        }
        Optional<IProcFlowFileStore> fileStore = collaborators.fileStore();
        if (fileStore.isEmpty()) {
            return Mono.just(ExecutorResult.fail(ProcFlowErrorKind.VALIDATION, false,
                    "Node '" + context.getNodeId() + "' produced content but no file store is configured"));
        }

        byte[] bytes = content instanceof byte[] raw ? raw : content.toString().getBytes(StandardCharsets.UTF_8);
        String name = firstNonBlank(result.get("name"), actionConfig.get(CONFIG_FILE_NAME), context.getNodeId() + ".txt");
        String contentType = firstNonBlank(result.get(CONFIG_CONTENT_TYPE), actionConfig.get(CONFIG_CONTENT_TYPE), DEFAULT_CONTENT_TYPE);

        return fileStore.get().upload(bytes, name, contentType)
                .map(reference -> {
                    log.debug("Document stored: runId={}, nodeId={}, fileId={}, size={}",
                            context.getRunId(), context.getNodeId(), reference.getId(), reference.getSize());
                    result.put(OUTPUT_DOCUMENT, reference);
                    return ExecutorResult.proceed(result);
                });
    }

    private static String firstNonBlank(Object first, Object second, String fallback) {
        if (!isBlank(first)) {
            return first.toString();
        }
        return isBlank(second) ? fallback : second.toString();
    }
}
