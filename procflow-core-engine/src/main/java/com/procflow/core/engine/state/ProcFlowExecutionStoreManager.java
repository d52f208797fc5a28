package com.procflow.core.engine.state;

import com.procflow.core.engine.state.impl.FileBasedExecutionStore;
import com.procflow.core.engine.state.impl.InMemoryExecutionStore;
import com.procflow.integration.contract.store.IProcFlowExecutionStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Picks and owns the active execution store.
 *
 * <h2>Supported Storage Types</h2>
 * <ul>
 *   <li>MEMORY: in-memory storage (default, no persistence)</li>
 *   <li>FILE: one JSON document per run under the store path</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>System property {@code procflow.execution.store.type} or environment variable
 *       {@code PROCFLOW_EXECUTION_STORE_TYPE}</li>
 *   <li>System property {@code procflow.execution.store.path} or environment variable
 *       {@code PROCFLOW_EXECUTION_STORE_PATH}</li>
 * </ul>
 */
@Slf4j
public class ProcFlowExecutionStoreManager {

    private static final String STORE_TYPE_PROPERTY = "procflow.execution.store.type";
    private static final String STORE_TYPE_ENV = "PROCFLOW_EXECUTION_STORE_TYPE";
    private static final String STORE_PATH_PROPERTY = "procflow.execution.store.path";
    private static final String STORE_PATH_ENV = "PROCFLOW_EXECUTION_STORE_PATH";

    public enum StoreType {
        MEMORY,
        FILE
    }

    private volatile IProcFlowExecutionStore activeStore;
    private volatile StoreType activeStoreType;
    private volatile boolean initialized = false;

    private ProcFlowExecutionStoreManager() {}

    private static final class SingletonHelper {
        private static final ProcFlowExecutionStoreManager INSTANCE = new ProcFlowExecutionStoreManager();
    }

    public static ProcFlowExecutionStoreManager getInstance() {
        return SingletonHelper.INSTANCE;
    }

    public Mono<Void> initialize() {
        return Mono.defer(() -> {
            if (initialized) {
                return Mono.empty();
            }
            StoreType type = determineStoreType();
            log.info("Initializing execution store. type={}", type);
            IProcFlowExecutionStore store = createStore(type);
            return store.initialize()
                    .doOnSuccess(v -> {
                        this.activeStore = store;
                        this.activeStoreType = type;
                        this.initialized = true;
                        log.info("Execution store initialized. type={}", type);
                    })
                    .doOnError(e -> log.error("Failed to initialize execution store. type={}", type, e));
        });
    }

    public Mono<Void> shutdown() {
        return Mono.defer(() -> {
            if (!initialized || activeStore == null) {
                return Mono.empty();
            }
            log.info("Shutting down execution store. type={}", activeStoreType);
            return activeStore.shutdown()
                    .doFinally(signal -> {
                        initialized = false;
                        activeStore = null;
                        activeStoreType = null;
                    });
        });
    }

    /**
     * Returns the active store, initializing it from configuration on first use.
     */
    public IProcFlowExecutionStore getStore() {
        if (!initialized || activeStore == null) {
            initialize().block();
        }
        return activeStore;
    }

    public StoreType getActiveStoreType() {
        return activeStoreType;
    }

    public Mono<Boolean> healthCheck() {
        if (!initialized || activeStore == null) {
            return Mono.just(false);
        }
        return activeStore.healthCheck();
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    StoreType determineStoreType() {
        String value = firstNonBlank(System.getProperty(STORE_TYPE_PROPERTY), System.getenv(STORE_TYPE_ENV));
        if (value != null) {
            try {
                return StoreType.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid execution store type: {}. Using MEMORY.", value);
            }
        }
        return StoreType.MEMORY;
    }

    private Path determineStorePath() {
        String value = firstNonBlank(System.getProperty(STORE_PATH_PROPERTY), System.getenv(STORE_PATH_ENV));
        if (value != null) {
            return Paths.get(value.trim());
        }
        return Paths.get(System.getProperty("user.home"), ".procflow", "execution-store");
    }

    private IProcFlowExecutionStore createStore(StoreType type) {
        switch (type) {
            case FILE:
                Path storePath = determineStorePath();
                log.info("Creating file-based execution store. path={}", storePath);
                return new FileBasedExecutionStore(storePath);
            case MEMORY:
            default:
                log.info("Creating in-memory execution store");
                return InMemoryExecutionStore.getInstance();
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }
}
