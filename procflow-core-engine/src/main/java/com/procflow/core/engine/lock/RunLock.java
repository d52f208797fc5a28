package com.procflow.core.engine.lock;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Lease held by one walker on one run.
 */
@Data
@Builder(toBuilder = true)
public class RunLock {

    public enum LockStatus {
        ACTIVE,
        RELEASED
    }

    private final String runId;

    /**
     * Unique per walk, resume or cancel invocation, so two operations on one run never share a lease.
     */
    private final String ownerId;

    private final Instant acquiredAt;

    private final Instant expiresAt;

    @Builder.Default
    private final LockStatus status = LockStatus.ACTIVE;

    /**
     * The operation that acquired the lock (walk, resume, cancel), for diagnostics.
     */
    private final String operation;

    @Builder.Default
    private final int extensionCount = 0;

    private final Instant lastExtendedAt;

    private final String holderThreadId;

    public boolean isValid() {
        return status == LockStatus.ACTIVE && !isExpired();
    }

    public boolean isExpired() {
        return expiresAt != null && Instant.now().isAfter(expiresAt);
    }

    public Duration getRemainingTime() {
        if (expiresAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(Instant.now(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public RunLock extend(Duration extensionDuration) {
        Instant now = Instant.now();
        return toBuilder()
                .expiresAt(now.plus(extensionDuration))
                .status(LockStatus.ACTIVE)
                .extensionCount(extensionCount + 1)
                .lastExtendedAt(now)
                .build();
    }

    public RunLock release() {
        return toBuilder()
                .status(LockStatus.RELEASED)
                .build();
    }

    public static RunLock create(String runId, String ownerId, Duration duration, String operation) {
        Instant now = Instant.now();
        return RunLock.builder()
                .runId(runId)
                .ownerId(ownerId)
                .acquiredAt(now)
                .expiresAt(now.plus(duration))
                .status(LockStatus.ACTIVE)
                .operation(operation)
                .holderThreadId(Thread.currentThread().getName())
                .build();
    }
}
