package com.procflow.core.engine.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Engine tuning knobs.
 *
 * <h2>Configuration</h2>
 * {@link #fromSystem()} resolves each value from, in order:
 * <ul>
 *   <li>System property: {@code procflow.engine.<name>} (e.g. {@code procflow.engine.maxAttempts})</li>
 *   <li>Environment variable: {@code PROCFLOW_ENGINE_<NAME>} (e.g. {@code PROCFLOW_ENGINE_MAX_ATTEMPTS})</li>
 *   <li>The default declared below</li>
 * </ul>
 * Durations accept either milliseconds or an ISO-8601 value such as {@code PT30S}.
 */
@Slf4j
@Getter
@ToString
@Builder(toBuilder = true)
public class ProcFlowEngineConfig {

    private static final String PROPERTY_PREFIX = "procflow.engine.";
    private static final String ENV_PREFIX = "PROCFLOW_ENGINE_";

    /**
     * Attempts per node, first attempt included.
     */
    @Builder.Default
    private final int maxAttempts = 3;

    @Builder.Default
    private final Duration initialBackoff = Duration.ofMillis(200);

    @Builder.Default
    private final Duration maxBackoff = Duration.ofSeconds(5);

    @Builder.Default
    private final double backoffMultiplier = 2.0;

    @Builder.Default
    private final Duration stepTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private final Duration lockDuration = Duration.ofMinutes(5);

    @Builder.Default
    private final Duration lockWaitTimeout = Duration.ofSeconds(10);

    /**
     * Upper bound on step attempts per run; protects against runaway graphs.
     */
    @Builder.Default
    private final int maxNodeExecutions = 1000;

    @Builder.Default
    private final int maxExpressionDepth = 64;

    @Builder.Default
    private final int maxExpressionLength = 4096;

    /**
     * How many frontier nodes of one run execute at the same time.
     */
    @Builder.Default
    private final int branchConcurrency = 8;

    @Builder.Default
    private final Duration recoveryInterval = Duration.ofMinutes(1);

    /**
     * A RUNNING run untouched for this long is considered abandoned by its walker.
     */
    @Builder.Default
    private final Duration recoveryStaleAfter = Duration.ofMinutes(5);

    public static ProcFlowEngineConfig defaults() {
        return ProcFlowEngineConfig.builder().build();
    }

    public static ProcFlowEngineConfig fromSystem() {
        ProcFlowEngineConfig defaults = defaults();
        ProcFlowEngineConfig config = ProcFlowEngineConfig.builder()
                .maxAttempts(resolveInt("maxAttempts", defaults.maxAttempts))
                .initialBackoff(resolveDuration("initialBackoff", defaults.initialBackoff))
                .maxBackoff(resolveDuration("maxBackoff", defaults.maxBackoff))
                .backoffMultiplier(resolveDouble("backoffMultiplier", defaults.backoffMultiplier))
                .stepTimeout(resolveDuration("stepTimeout", defaults.stepTimeout))
                .lockDuration(resolveDuration("lockDuration", defaults.lockDuration))
                .lockWaitTimeout(resolveDuration("lockWaitTimeout", defaults.lockWaitTimeout))
                .maxNodeExecutions(resolveInt("maxNodeExecutions", defaults.maxNodeExecutions))
                .maxExpressionDepth(resolveInt("maxExpressionDepth", defaults.maxExpressionDepth))
                .maxExpressionLength(resolveInt("maxExpressionLength", defaults.maxExpressionLength))
                .branchConcurrency(resolveInt("branchConcurrency", defaults.branchConcurrency))
                .recoveryInterval(resolveDuration("recoveryInterval", defaults.recoveryInterval))
                .recoveryStaleAfter(resolveDuration("recoveryStaleAfter", defaults.recoveryStaleAfter))
                .build();
        log.info("Resolved engine configuration: {}", config);
        return config;
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private static String resolve(String name) {
        String property = System.getProperty(PROPERTY_PREFIX + name);
        if (property != null && !property.isBlank()) {
            return property.trim();
        }
        String env = System.getenv(ENV_PREFIX + toEnvName(name));
        if (env != null && !env.isBlank()) {
            return env.trim();
        }
        return null;
    }

    static String toEnvName(String name) {
        return name.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
    }

    private static int resolveInt(String name, int defaultValue) {
        String value = resolve(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for engine setting. name={}, value={}. Using default {}", name, value, defaultValue);
            return defaultValue;
        }
    }

    private static double resolveDouble(String name, double defaultValue) {
        String value = resolve(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid number for engine setting. name={}, value={}. Using default {}", name, value, defaultValue);
            return defaultValue;
        }
    }

    private static Duration resolveDuration(String name, Duration defaultValue) {
        String value = resolve(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("Invalid duration for engine setting. name={}, value={}. Using default {}", name, value, defaultValue);
            return defaultValue;
        }
    }
}
