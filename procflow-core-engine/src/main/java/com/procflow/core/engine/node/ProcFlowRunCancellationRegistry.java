package com.procflow.core.engine.node;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cooperative cancellation requests. The walker polls it between rounds and before each
 * retry, so calls already in flight always finish.
 */
@Slf4j
public class ProcFlowRunCancellationRegistry {

    private final Set<String> requested = ConcurrentHashMap.newKeySet();

    private ProcFlowRunCancellationRegistry() {}

    private static final class SingletonHelper {
        private static final ProcFlowRunCancellationRegistry INSTANCE = new ProcFlowRunCancellationRegistry();
    }

    public static ProcFlowRunCancellationRegistry getInstance() {
        return SingletonHelper.INSTANCE;
    }

    public static ProcFlowRunCancellationRegistry create() {
        return new ProcFlowRunCancellationRegistry();
    }

    public void request(String runId) {
        if (requested.add(runId)) {
            log.info("Cancellation requested: runId={}", runId);
        }
    }

    public boolean isRequested(String runId) {
        return requested.contains(runId);
    }

    public void clear(String runId) {
        requested.remove(runId);
    }

    public int size() {
        return requested.size();
    }
}
