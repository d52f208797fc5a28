package com.procflow.core.engine.expression.functions;

import java.util.List;

public class MaxFunction extends AbstractExtremumFunction {

    @Override
    public String getName() {
        return "max";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "max(extract.total_amount, 0)",
                "max(extract.line_totals)"
        );
    }

    @Override
    protected boolean prefer(int comparison) {
        return comparison > 0;
    }
}
