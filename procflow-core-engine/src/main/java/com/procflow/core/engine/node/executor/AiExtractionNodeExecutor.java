package com.procflow.core.engine.node.executor;

import com.procflow.core.engine.node.executor.support.FieldRuleChecker;
import com.procflow.core.engine.node.executor.support.FieldValueCoercer;
import com.procflow.integration.contract.collaborator.IProcFlowExtractionAdapter;
import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.enumerations.ProcFlowErrorKind;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import com.procflow.integration.models.commons.FileReference;
import com.procflow.integration.models.workflow.FieldDefinition;
import com.procflow.integration.models.workflow.NodeDefinition;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured extraction through the external LLM adapter.
 *
 * <h2>Config</h2>
 * <ul>
 *   <li>{@code prompt}: template, interpolated against the run variables</li>
 *   <li>{@code schema}: optional field name to type map; defaults to the declared output fields</li>
 *   <li>{@code contextFields}: optional list of variable names handed to the adapter;
 *       defaults to every variable</li>
 * </ul>
 *
 * <h2>Outputs</h2>
 * Every returned field, coerced to its declared type, plus {@code anomalies} (rule findings on
 * the declared output fields) and {@code sourceFiles} (file references found in the context).
 */
@Slf4j
public class AiExtractionNodeExecutor extends AbstractProcFlowNodeExecutor {

    public static final String CONFIG_PROMPT = "prompt";
    public static final String CONFIG_SCHEMA = "schema";
    public static final String CONFIG_CONTEXT_FIELDS = "contextFields";
    public static final String OUTPUT_ANOMALIES = "anomalies";
    public static final String OUTPUT_SOURCE_FILES = "sourceFiles";

    private final IProcFlowExtractionAdapter adapter;

    public AiExtractionNodeExecutor(IProcFlowExtractionAdapter adapter) {
        super(ProcFlowNodeKind.AI_EXTRACTION);
        this.adapter = adapter;
    }

    @Override
    protected Mono<ExecutorResult> doExecute(ExecutionContext context) {
        if (adapter == null) {
            return invalid("No extraction adapter is configured for node '" + context.getNodeId() + "'");
        }
        NodeDefinition node = context.getNode();
        Map<String, Object> schema = schemaOf(node);
        if (schema.isEmpty()) {
            return invalid("Extraction node '" + context.getNodeId() + "' declares no output fields");
        }

        String prompt = context.getEvaluator().interpolate(node.configString(CONFIG_PROMPT, ""), context.getVariables());
        Map<String, Object> extractionContext = contextOf(context);
        List<FileReference> sourceFiles = collectFiles(extractionContext.values());

        log.debug("Calling extraction adapter: runId={}, nodeId={}, attempt={}, fields={}",
                context.getRunId(), context.getNodeId(), context.getAttempt(), schema.keySet());

        return adapter.extract(prompt, schema, extractionContext)
                .map(extracted -> (ExecutorResult) ExecutorResult.proceed(buildOutputs(node, extracted, sourceFiles)))
                .switchIfEmpty(Mono.fromSupplier(() -> ExecutorResult.fail(ProcFlowErrorKind.UPSTREAM, true,
                        "Extraction adapter returned no result")))
                .onErrorResume(error -> {
                    log.warn("Extraction failed: runId={}, nodeId={}, attempt={}, error={}",
                            context.getRunId(), context.getNodeId(), context.getAttempt(), error.getMessage());
                    return Mono.just(upstreamFailure(error));
                });
    }

    static Map<String, Object> schemaOf(NodeDefinition node) {
        Map<String, Object> schema = new LinkedHashMap<>();
        if (node.configValue(CONFIG_SCHEMA) instanceof Map<?, ?> configured) {
            configured.forEach((field, type) -> schema.put(String.valueOf(field), type));
            return schema;
        }
        for (FieldDefinition field : node.getOutputFields()) {
            schema.put(field.getName(), field.getType().name());
        }
        return schema;
    }

    private static Map<String, Object> contextOf(ExecutionContext context) {
        Object fields = context.getNode().configValue(CONFIG_CONTEXT_FIELDS);
        if (!(fields instanceof Collection<?> names) || names.isEmpty()) {
            return new LinkedHashMap<>(context.getVariables());
        }
        Map<String, Object> selected = new LinkedHashMap<>();
        for (Object name : names) {
            String key = String.valueOf(name);
            selected.put(key, context.getVariables().containsKey(key) ? context.getVariables().get(key) : context.evaluate(key));
        }
        return selected;
    }

    private static Map<String, Object> buildOutputs(NodeDefinition node, Map<String, Object> extracted,
                                                    List<FileReference> sourceFiles) {
        Map<String, Object> outputs = new LinkedHashMap<>(extracted);
        for (FieldDefinition field : node.getOutputFields()) {
            if (outputs.containsKey(field.getName())) {
                outputs.put(field.getName(), FieldValueCoercer.coerce(outputs.get(field.getName()), field.getType()));
            }
        }
        outputs.put(OUTPUT_ANOMALIES, FieldRuleChecker.check(node.getOutputFields(), outputs));
        outputs.put(OUTPUT_SOURCE_FILES, sourceFiles);
        return outputs;
    }

    static List<FileReference> collectFiles(Collection<?> values) {
        List<FileReference> files = new ArrayList<>();
        for (Object value : values) {
            if (value instanceof Collection<?> items) {
                items.forEach(item -> FileReference.from(item).filter(file -> !files.contains(file)).ifPresent(files::add));
            } else {
                FileReference.from(value).filter(file -> !files.contains(file)).ifPresent(files::add);
            }
        }
        return files;
    }
}
