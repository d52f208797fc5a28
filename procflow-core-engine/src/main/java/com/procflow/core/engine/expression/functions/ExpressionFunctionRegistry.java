package com.procflow.core.engine.expression.functions;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class ExpressionFunctionRegistry {
    private final Map<String, IExpressionFunction> functionRegistry;

    private ExpressionFunctionRegistry() {
        functionRegistry = new HashMap<>();
        this.register(new DaysBetweenFunction());
        this.register(new AddDaysFunction());
        this.register(new ConcatFunction());
        this.register(new LengthFunction());
        this.register(new LowerFunction());
        this.register(new UpperFunction());
        this.register(new ContainsFunction());
        this.register(new RoundFunction());
        this.register(new MinFunction());
        this.register(new MaxFunction());
        this.register(new CoalesceFunction());
        this.register(new VarFunction());
    }

    private static class SingletonHolder {
        private static final ExpressionFunctionRegistry INSTANCE = new ExpressionFunctionRegistry();
    }

    public static ExpressionFunctionRegistry getInstance() {
        return SingletonHolder.INSTANCE;
    }

    private void register(IExpressionFunction function) {
        this.functionRegistry.put(function.getName(), function);
    }

    public IExpressionFunction getFunction(String functionName) {
        return this.functionRegistry.get(functionName);
    }

    public Map<String, IExpressionFunction> getAllFunctions() {
        return Collections.unmodifiableMap(functionRegistry);
    }

}
