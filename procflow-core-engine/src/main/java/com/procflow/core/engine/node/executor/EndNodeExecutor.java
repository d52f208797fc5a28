package com.procflow.core.engine.node.executor;

import com.procflow.integration.contract.executor.ExecutionContext;
import com.procflow.integration.contract.executor.ExecutorResult;
import com.procflow.integration.enumerations.ProcFlowNodeKind;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates the optional {@code output} config into the run output.
 *
 * <p>{@code output} is either a map of key to expression or a single expression. String values
 * containing {@code {{...}}} are interpolated instead of evaluated; non-string values are
 * taken literally. A single expression yielding a map becomes the whole output, any other
 * value is published as {@code result}.</p>
 */
public class EndNodeExecutor extends AbstractProcFlowNodeExecutor {

    public static final String CONFIG_OUTPUT = "output";

    public EndNodeExecutor() {
        super(ProcFlowNodeKind.END);
    }

    @Override
    protected Mono<ExecutorResult> doExecute(ExecutionContext context) {
        Object output = context.getNode().configValue(CONFIG_OUTPUT);
        if (output == null) {
            return Mono.just(ExecutorResult.proceed(Map.of("completed", true)));
        }

        Map<String, Object> outputs = new LinkedHashMap<>();
        if (output instanceof Map<?, ?> mapping) {
            mapping.forEach((key, value) -> outputs.put(String.valueOf(key), resolve(context, value)));
        } else {
            Object value = resolve(context, output);
            if (value instanceof Map<?, ?> map) {
                map.forEach((key, item) -> outputs.put(String.valueOf(key), item));
            } else {
                outputs.put("result", value);
            }
        }
        return Mono.just(ExecutorResult.proceed(outputs));
    }

    private static Object resolve(ExecutionContext context, Object value) {
        if (value instanceof String expression) {
            return expression.contains("{{") ? context.interpolate(expression) : context.evaluate(expression);
        }
        return context.interpolate(value);
    }
}
