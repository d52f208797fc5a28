package com.procflow.core.engine.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProcFlowEngineConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("procflow.engine.maxAttempts");
        System.clearProperty("procflow.engine.stepTimeout");
        System.clearProperty("procflow.engine.lockDuration");
        System.clearProperty("procflow.engine.backoffMultiplier");
        System.clearProperty("procflow.engine.maxNodeExecutions");
    }

    @Test
    @DisplayName("should expose the documented defaults")
    void shouldExposeDefaults() {
        ProcFlowEngineConfig config = ProcFlowEngineConfig.defaults();

        assertEquals(3, config.getMaxAttempts());
        assertEquals(Duration.ofSeconds(30), config.getStepTimeout());
        assertEquals(1000, config.getMaxNodeExecutions());
        assertEquals(2.0, config.getBackoffMultiplier());
    }

    @Test
    @DisplayName("should read system properties in milliseconds or ISO-8601")
    void shouldReadSystemProperties() {
        System.setProperty("procflow.engine.maxAttempts", " 5 ");
        System.setProperty("procflow.engine.stepTimeout", "1500");
        System.setProperty("procflow.engine.lockDuration", "PT2M");
        System.setProperty("procflow.engine.backoffMultiplier", "1.5");

        ProcFlowEngineConfig config = ProcFlowEngineConfig.fromSystem();

        assertEquals(5, config.getMaxAttempts());
        assertEquals(Duration.ofMillis(1500), config.getStepTimeout());
        assertEquals(Duration.ofMinutes(2), config.getLockDuration());
        assertEquals(1.5, config.getBackoffMultiplier());
    }

    @Test
    @DisplayName("should fall back to the default on malformed values")
    void shouldFallBackOnMalformedValues() {
        System.setProperty("procflow.engine.maxNodeExecutions", "many");
        System.setProperty("procflow.engine.stepTimeout", "thirty seconds");

        ProcFlowEngineConfig config = ProcFlowEngineConfig.fromSystem();

        assertEquals(1000, config.getMaxNodeExecutions());
        assertEquals(Duration.ofSeconds(30), config.getStepTimeout());
    }

    @ParameterizedTest
    @CsvSource({
            "maxAttempts, MAX_ATTEMPTS",
            "stepTimeout, STEP_TIMEOUT",
            "maxExpressionDepth, MAX_EXPRESSION_DEPTH",
            "recoveryStaleAfter, RECOVERY_STALE_AFTER"
    })
    @DisplayName("should map setting names to environment variable suffixes")
    void shouldMapEnvNames(String name, String expected) {
        assertEquals(expected, ProcFlowEngineConfig.toEnvName(name));
    }
}
