package com.procflow.core.engine.support;

import com.procflow.core.engine.ProcFlowFacade;
import com.procflow.core.engine.config.ProcFlowEngineConfig;
import com.procflow.core.engine.lock.impl.InMemoryRunLockService;
import com.procflow.core.engine.node.ProcFlowRunCancellationRegistry;
import com.procflow.core.engine.state.impl.InMemoryExecutionStore;

import java.time.Duration;

/**
 * Engines with isolated state and millisecond backoff, so tests neither share runs nor wait.
 */
public final class TestEngines {

    private TestEngines() {}

    public static ProcFlowEngineConfig fastConfig() {
        return ProcFlowEngineConfig.builder()
                .initialBackoff(Duration.ofMillis(1))
                .maxBackoff(Duration.ofMillis(5))
                .stepTimeout(Duration.ofSeconds(5))
                .lockWaitTimeout(Duration.ofSeconds(5))
                .build();
    }

    /**
     * Builder with a fresh store, lock service and cancellation registry; callers add
     * collaborators, executors and listeners as needed.
     */
    public static ProcFlowFacade.ProcFlowFacadeBuilder isolated() {
        return ProcFlowFacade.builder()
                .config(fastConfig())
                .executionStore(InMemoryExecutionStore.create())
                .lockService(new InMemoryRunLockService(Duration.ofSeconds(60), Duration.ofMillis(5)))
                .cancellations(ProcFlowRunCancellationRegistry.create());
    }
}
