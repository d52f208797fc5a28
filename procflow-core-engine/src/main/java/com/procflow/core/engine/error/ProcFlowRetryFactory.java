package com.procflow.core.engine.error;

import com.procflow.core.engine.config.ProcFlowEngineConfig;
import org.jetbrains.annotations.NotNull;
import reactor.util.retry.Retry;

import java.util.function.Predicate;

public final class ProcFlowRetryFactory {

    private ProcFlowRetryFactory() {}

    /**
     * @param maxAttempts total attempts including the first one
     */
    public static @NotNull Retry buildRetry(int maxAttempts, ProcFlowEngineConfig config, Predicate<Throwable> retryPredicate) {
        if (maxAttempts <= 1) {
            return Retry.max(0).onRetryExhaustedThrow((spec, signal) -> signal.failure());
        }

        return Retry
                .backoff(maxAttempts - 1L, config.getInitialBackoff())
                .maxBackoff(config.getMaxBackoff().compareTo(config.getInitialBackoff()) < 0
                        ? config.getInitialBackoff()
                        : config.getMaxBackoff())
                .multiplier(config.getBackoffMultiplier())
                .jitter(0.2)
                .filter(retryPredicate)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
