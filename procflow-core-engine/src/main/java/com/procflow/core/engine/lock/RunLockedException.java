package com.procflow.core.engine.lock;

import com.procflow.core.exception.ProcFlowEngineException;
import com.procflow.core.exception.codes.ProcFlowEngineErrorCodes;
import lombok.Getter;

/**
 * Raised when an operation cannot proceed because another walker holds the run lock.
 */
@Getter
public class RunLockedException extends ProcFlowEngineException {

    private static final long serialVersionUID = 1L;

    private final String runId;
    private final String currentOwner;

    public RunLockedException(String runId, String currentOwner) {
        super(ProcFlowEngineErrorCodes.RUN_LOCKED, runId);
        this.runId = runId;
        this.currentOwner = currentOwner;
    }

    public static RunLockedException lockedBy(RunLock lock) {
        return new RunLockedException(lock.getRunId(), lock.getOwnerId());
    }

    public static RunLockedException timeout(String runId) {
        return new RunLockedException(runId, null);
    }
}
