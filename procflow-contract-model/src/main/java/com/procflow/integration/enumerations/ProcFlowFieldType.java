package com.procflow.integration.enumerations;

public enum ProcFlowFieldType {
    TEXT,
    NUMBER,
    CURRENCY,
    BOOLEAN,
    DATE,
    LIST,
    EMAIL,
    FILE;

    public boolean isNumeric() {
        return this == NUMBER || this == CURRENCY;
    }
}
