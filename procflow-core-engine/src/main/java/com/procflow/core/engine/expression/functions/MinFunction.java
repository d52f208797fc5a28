package com.procflow.core.engine.expression.functions;

import java.util.List;

public class MinFunction extends AbstractExtremumFunction {

    @Override
    public String getName() {
        return "min";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "min(extract.total_amount, 10000)",
                "min(extract.line_totals)"
        );
    }

    @Override
    protected boolean prefer(int comparison) {
        return comparison < 0;
    }
}
