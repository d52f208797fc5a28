package com.procflow.core.engine.lock.impl;

import com.procflow.core.engine.lock.IProcFlowRunLockService;
import com.procflow.core.engine.lock.RunLock;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory run lock for single-process deployments.
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Atomic acquisition through {@link ConcurrentHashMap#compute}</li>
 *   <li>Expiring leases that another owner may take over</li>
 *   <li>Periodic cleanup of expired leases on a daemon thread</li>
 * </ul>
 */
@Slf4j
public class InMemoryRunLockService implements IProcFlowRunLockService {

    private final Map<String, RunLock> locks = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleanupExecutor;
    private final AtomicLong acquiredCount = new AtomicLong(0);
    private final AtomicLong releasedCount = new AtomicLong(0);
    private final AtomicLong expiredCount = new AtomicLong(0);

    private final Duration retryInterval;

    private InMemoryRunLockService() {
        this(Duration.ofSeconds(30), Duration.ofMillis(25));
    }

    public InMemoryRunLockService(Duration cleanupInterval, Duration retryInterval) {
        this.retryInterval = retryInterval;

        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "procflow-run-lock-cleanup");
            t.setDaemon(true);
            return t;
        });

        this.cleanupExecutor.scheduleAtFixedRate(
                this::cleanupExpiredLocksSync,
                cleanupInterval.toMillis(),
                cleanupInterval.toMillis(),
                TimeUnit.MILLISECONDS);

        log.info("InMemoryRunLockService initialized. cleanupInterval={}", cleanupInterval);
    }

    private static final class SingletonHelper {
        private static final InMemoryRunLockService INSTANCE = new InMemoryRunLockService();
    }

    public static InMemoryRunLockService getInstance() {
        return SingletonHelper.INSTANCE;
    }

    @Override
    public Mono<Boolean> tryAcquire(String runId, String ownerId, Duration duration) {
        return Mono.fromCallable(() -> tryAcquireSync(runId, ownerId, duration, "walk"));
    }

    public boolean tryAcquireSync(String runId, String ownerId, Duration duration, String operation) {
        if (runId == null || ownerId == null) {
            throw new IllegalArgumentException("runId and ownerId cannot be null");
        }

        return locks.compute(runId, (key, existingLock) -> {
            if (existingLock == null) {
                log.debug("Acquiring run lock. runId={}, owner={}, duration={}", runId, ownerId, duration);
                acquiredCount.incrementAndGet();
                return RunLock.create(runId, ownerId, duration, operation);
            }

            if (existingLock.getOwnerId().equals(ownerId)) {
                return existingLock.extend(duration);
            }

            if (existingLock.isExpired()) {
                log.warn("Taking over expired run lock. runId={}, previousOwner={}, newOwner={}",
                        runId, existingLock.getOwnerId(), ownerId);
                expiredCount.incrementAndGet();
                acquiredCount.incrementAndGet();
                return RunLock.create(runId, ownerId, duration, operation);
            }

            log.debug("Run lock held by another owner. runId={}, holder={}", runId, existingLock.getOwnerId());
            return existingLock;
        }).getOwnerId().equals(ownerId);
    }

    @Override
    public Mono<Boolean> acquireWithWait(String runId, String ownerId, Duration duration, Duration waitTimeout) {
        return Mono.defer(() -> {
            long deadline = System.currentTimeMillis() + waitTimeout.toMillis();

            while (true) {
                if (tryAcquireSync(runId, ownerId, duration, "wait")) {
                    return Mono.just(true);
                }
                if (System.currentTimeMillis() >= deadline) {
                    return Mono.just(false);
                }
                try {
                    Thread.sleep(retryInterval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Mono.just(false);
                }
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> release(String runId, String ownerId) {
        return Mono.fromCallable(() -> releaseSync(runId, ownerId));
    }

    public boolean releaseSync(String runId, String ownerId) {
        if (runId == null || ownerId == null) {
            return false;
        }

        boolean[] released = {false};

        locks.computeIfPresent(runId, (key, existingLock) -> {
            if (existingLock.getOwnerId().equals(ownerId)) {
                log.debug("Releasing run lock. runId={}, owner={}", runId, ownerId);
                released[0] = true;
                releasedCount.incrementAndGet();
                return null;
            }
            log.warn("Cannot release run lock, not owner. runId={}, holder={}, requester={}",
                    runId, existingLock.getOwnerId(), ownerId);
            return existingLock;
        });

        return released[0];
    }

    @Override
    public Mono<Boolean> extend(String runId, String ownerId, Duration extensionDuration) {
        return Mono.fromCallable(() -> {
            boolean[] extended = {false};

            locks.computeIfPresent(runId, (key, existingLock) -> {
                if (existingLock.getOwnerId().equals(ownerId) && !existingLock.isExpired()) {
                    extended[0] = true;
                    return existingLock.extend(extensionDuration);
                }
                return existingLock;
            });

            if (!extended[0]) {
                log.warn("Could not extend run lock. runId={}, owner={}", runId, ownerId);
            }
            return extended[0];
        });
    }

    @Override
    public Mono<Boolean> isLocked(String runId) {
        return Mono.fromCallable(() -> {
            RunLock lock = locks.get(runId);
            return lock != null && lock.isValid();
        });
    }

    @Override
    public Mono<Optional<RunLock>> getLockInfo(String runId) {
        return Mono.fromCallable(() -> {
            RunLock lock = locks.get(runId);
            if (lock != null && !lock.isExpired()) {
                return Optional.of(lock);
            }
            return Optional.empty();
        });
    }

    @Override
    public Mono<Long> getActiveLockCount() {
        return Mono.fromCallable(() -> locks.values().stream()
                .filter(lock -> !lock.isExpired())
                .count());
    }

    @Override
    public Mono<Long> cleanupExpiredLocks() {
        return Mono.fromCallable(this::cleanupExpiredLocksSync);
    }

    private long cleanupExpiredLocksSync() {
        long count = 0;
        for (Map.Entry<String, RunLock> entry : locks.entrySet()) {
            if (entry.getValue().isExpired() && locks.remove(entry.getKey(), entry.getValue())) {
                count++;
                expiredCount.incrementAndGet();
                log.debug("Cleaned up expired run lock. runId={}, owner={}",
                        entry.getKey(), entry.getValue().getOwnerId());
            }
        }
        if (count > 0) {
            log.info("Cleaned up {} expired run locks", count);
        }
        return count;
    }

    public LockStatistics getStatistics() {
        return new LockStatistics(
                locks.size(),
                locks.values().stream().filter(lock -> !lock.isExpired()).count(),
                acquiredCount.get(),
                releasedCount.get(),
                expiredCount.get()
        );
    }

    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("InMemoryRunLockService shut down");
    }

    public record LockStatistics(
            long totalLocks,
            long activeLocks,
            long acquiredCount,
            long releasedCount,
            long expiredCount
    ) {}
}
