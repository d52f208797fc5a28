package com.procflow.core.engine.misc;

import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * Shared Jackson mapper for persisted run documents and REST payload conversion.
 * Unknown properties are ignored so that documents written by newer versions still load.
 */
public class ProcFlowObjectMapper {

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private ProcFlowObjectMapper() {}

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public <T> T convertValue(Object fromValue, Class<T> toValueType) throws IllegalArgumentException {
        return objectMapper.convertValue(fromValue, toValueType);
    }

    private static final class SingletonHolder {
        private static final ProcFlowObjectMapper INSTANCE = new ProcFlowObjectMapper();
    }

    public static ProcFlowObjectMapper getInstance() {
        return SingletonHolder.INSTANCE;
    }
}
