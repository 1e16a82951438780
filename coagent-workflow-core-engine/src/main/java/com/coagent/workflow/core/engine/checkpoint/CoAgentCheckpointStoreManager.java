package com.coagent.workflow.core.engine.checkpoint;

import com.coagent.workflow.core.engine.checkpoint.impl.FileBasedCheckpointStore;
import com.coagent.workflow.core.engine.checkpoint.impl.InMemoryCheckpointStore;
import com.coagent.workflow.core.engine.config.CoAgentEngineSettings;
import com.coagent.workflow.core.engine.config.CoAgentEngineSettings.StoreType;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Creates the checkpoint store selected by the engine settings and owns its lifecycle.
 *
 * <h2>Supported Storage Types</h2>
 * <ul>
 *   <li>MEMORY: in-memory storage, no persistence</li>
 *   <li>FILE: one JSON file per thread</li>
 *   <li>DATABASE: store contributed by an {@link ICoAgentCheckpointStoreProvider} plugin,
 *       e.g. the MongoDB checkpoint plugin</li>
 * </ul>
 */
@Slf4j
public class CoAgentCheckpointStoreManager {

    private final CoAgentEngineSettings settings;
    private volatile ICoAgentCheckpointStore activeStore;
    private volatile StoreType activeStoreType;
    private volatile boolean initialized = false;

    public CoAgentCheckpointStoreManager(CoAgentEngineSettings settings) {
        this.settings = settings;
    }

    public Mono<Void> initialize() {
        return Mono.defer(() -> {
            if (initialized) {
                return Mono.empty();
            }
            StoreType type = settings.getStoreType();
            log.info("Initializing checkpoint store with type: {}", type);
            return Mono.fromCallable(() -> createStore(type))
                    .flatMap(store -> {
                        this.activeStore = store;
                        this.activeStoreType = type;
                        return store.initialize();
                    })
                    .doOnSuccess(v -> {
                        initialized = true;
                        log.info("Checkpoint store initialized successfully");
                    })
                    .doOnError(e -> log.error("Failed to initialize checkpoint store", e));
        });
    }

    public Mono<Void> shutdown() {
        return Mono.defer(() -> {
            if (!initialized || activeStore == null) {
                return Mono.empty();
            }
            log.info("Shutting down checkpoint store");
            return activeStore.shutdown()
                    .doFinally(signal -> {
                        initialized = false;
                        activeStore = null;
                        activeStoreType = null;
                    });
        });
    }

    public ICoAgentCheckpointStore getStore() {
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

    private ICoAgentCheckpointStore createStore(StoreType type) {
        switch (type) {
            case MEMORY:
                log.info("Creating in-memory checkpoint store");
                return new InMemoryCheckpointStore();

            case FILE:
                log.info("Creating file-based checkpoint store at: {}", settings.getStorePath());
                return new FileBasedCheckpointStore(settings.getStorePath());

            case DATABASE:
                Iterator<ICoAgentCheckpointStoreProvider> providers =
                        ServiceLoader.load(ICoAgentCheckpointStoreProvider.class).iterator();
                if (providers.hasNext()) {
                    ICoAgentCheckpointStoreProvider provider = providers.next();
                    log.info("Creating checkpoint store from provider: {}", provider.getName());
                    return provider.createStore(settings);
                }
                log.warn("No checkpoint store provider on the classpath. Falling back to file-based.");
                return new FileBasedCheckpointStore(settings.getStorePath());

            default:
                throw new IllegalArgumentException("Unknown store type: " + type);
        }
    }
}
