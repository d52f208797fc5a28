package com.procflow.core.engine.node.executor;

import com.procflow.core.engine.node.ProcFlowCollaborators;
import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.models.commons.FileReference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * File handling through the action provider. {@code file} and {@code files} are resolved into
 * {@link FileReference}s before the call; {@code operation} is required.
 */
public class FileOperationNodeExecutor extends AbstractActionNodeExecutor {

    public static final String CONFIG_OPERATION = "operation";
    public static final String CONFIG_FILE = "file";
    public static final String CONFIG_FILES = "files";

    public FileOperationNodeExecutor(ProcFlowCollaborators collaborators) {
        super(ProcFlowNodeKind.FILE_OPERATION, collaborators);
    }

    @Override
    protected Optional<String> validateConfig(Map<String, Object> actionConfig) {
        if (isBlank(actionConfig.get(CONFIG_OPERATION))) {
            return Optional.of("'operation' is required");
        }
        Object file = actionConfig.get(CONFIG_FILE);
        if (file != null && FileReference.from(file).isEmpty()) {
            return Optional.of("'file' does not resolve to a file reference");
        }
        Object files = actionConfig.get(CONFIG_FILES);
        if (files != null) {
            if (!(files instanceof Collection<?> items)) {
                return Optional.of("'files' must be a list of file references");
            }
            if (items.stream().anyMatch(item -> FileReference.from(item).isEmpty())) {
                return Optional.of("'files' contains an entry that is not a file reference");
            }
        }
        return Optional.empty();
    }

    @Override
    protected Map<String, Object> prepare(ExecutionContext context, Map<String, Object> actionConfig) {
        Object file = actionConfig.get(CONFIG_FILE);
        if (file != null) {
            actionConfig.put(CONFIG_FILE, FileReference.from(file).orElseThrow());
        }
        if (actionConfig.get(CONFIG_FILES) instanceof Collection<?> items) {
            List<FileReference> references = new ArrayList<>();
            items.forEach(item -> references.add(FileReference.from(item).orElseThrow()));
            actionConfig.put(CONFIG_FILES, references);
        }
        return actionConfig;
    }
}
