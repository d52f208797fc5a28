package com.procflow.core.engine.lock;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Run-scoped lease lock. Serializes walks, resumes and cancels of one run while leaving
 * different runs fully independent.
 *
 * <h2>Lock Lifecycle</h2>
 * <pre>
 * tryAcquire() ─→ ACQUIRED
 *                    │
 *         ┌─────────┼──────────┐
 *         │         │          │
 *     extend()   release()  EXPIRED
 *         │         │          │
 *         └─────────┴──────────┘
 *                    │
 *                RELEASED
 * </pre>
 *
 * <p>A suspended run holds no lock: the walk that suspended it has already released it.</p>
 *
 * @see RunLock
 * @see RunLockedException
 */
public interface IProcFlowRunLockService {

    /**
     * @return true if acquired, false if another owner holds a valid lease
     */
    Mono<Boolean> tryAcquire(String runId, String ownerId, Duration duration);

    /**
     * Polls for the lock until acquired or {@code waitTimeout} elapses.
     */
    Mono<Boolean> acquireWithWait(String runId, String ownerId, Duration duration, Duration waitTimeout);

    /**
     * @return true if released, false if not held by this owner
     */
    Mono<Boolean> release(String runId, String ownerId);

    /**
     * @return true if extended, false if not held by this owner or already expired
     */
    Mono<Boolean> extend(String runId, String ownerId, Duration extensionDuration);

    Mono<Boolean> isLocked(String runId);

    Mono<Optional<RunLock>> getLockInfo(String runId);

    Mono<Long> getActiveLockCount();

    Mono<Long> cleanupExpiredLocks();

    /**
     * Runs {@code action} while holding the lock, failing fast with {@link RunLockedException}
     * if the run is already locked. The lock is released before the action's outcome is
     * propagated, however it terminates.
     */
    default <T> Mono<T> executeWithLock(String runId, String ownerId, Duration duration, Supplier<Mono<T>> action) {
        return tryAcquire(runId, ownerId, duration)
                .flatMap(acquired -> {
                    if (!acquired) {
                        return Mono.error(new RunLockedException(runId, null));
                    }
                    return Mono.usingWhen(Mono.just(ownerId), owner -> Mono.defer(action), owner -> release(runId, owner));
                });
    }

    /**
     * Like {@link #executeWithLock} but waits up to {@code waitTimeout} for the current holder.
     */
    default <T> Mono<T> executeWithLockWaiting(String runId, String ownerId, Duration duration,
                                               Duration waitTimeout, Supplier<Mono<T>> action) {
        return acquireWithWait(runId, ownerId, duration, waitTimeout)
                .flatMap(acquired -> {
                    if (!acquired) {
                        return Mono.error(RunLockedException.timeout(runId));
                    }
                    return Mono.usingWhen(Mono.just(ownerId), owner -> Mono.defer(action), owner -> release(runId, owner));
                });
    }
}
