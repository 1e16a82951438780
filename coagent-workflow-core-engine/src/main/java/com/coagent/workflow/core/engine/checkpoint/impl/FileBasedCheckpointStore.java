package com.coagent.workflow.core.engine.checkpoint.impl;

import com.coagent.workflow.core.engine.checkpoint.CoAgentCheckpointVersions;
import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStore;
import com.coagent.workflow.core.engine.misc.CoAgentObjectMapper;
import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.core.exception.checkpoint.CoAgentCheckpointPersistenceException;
import com.coagent.workflow.integration.models.execution.CoAgentCheckpoint;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * File-based checkpoint store, one JSON document per thread.
 *
 * <p>Writes go to a temporary file that is atomically moved over the previous checkpoint, so a
 * crash never leaves a half-written checkpoint behind. All checkpoints are loaded into a cache on
 * initialization; reads are served from the cache, writes go through to disk before the cache is
 * updated.</p>
 *
 * <h2>Storage Layout</h2>
 * <pre>
 * {storageDirectory}/
 *   ├── {threadId}.json
 *   └── {threadId}.json.tmp   (only while a write is in progress)
 * </pre>
 */
@Slf4j
public class FileBasedCheckpointStore implements ICoAgentCheckpointStore {

    private static final String FILE_EXTENSION = ".json";
    private static final String TEMP_EXTENSION = ".tmp";

    private final Path storageDirectory;
    private final CoAgentObjectMapper objectMapper = CoAgentObjectMapper.getInstance();
    private final Map<String, CoAgentCheckpoint> cache = new ConcurrentHashMap<>();
    private final Map<String, Object> threadMonitors = new ConcurrentHashMap<>();
    private volatile boolean initialized = false;

    public FileBasedCheckpointStore(Path storageDirectory) {
        this.storageDirectory = storageDirectory;
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.<Void>fromRunnable(this::initializeSync)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof CoAgentWorkflowException),
                        e -> new CoAgentCheckpointPersistenceException("initializing store for", "*", e));
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("Shutting down file-based checkpoint store at: {}", storageDirectory);
            cache.clear();
            initialized = false;
        });
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.fromCallable(() -> initialized && Files.isDirectory(storageDirectory) && Files.isWritable(storageDirectory));
    }

    @Override
    public Mono<CoAgentCheckpoint> get(String threadId) {
        return Mono.fromCallable(() -> {
                    ensureInitialized();
                    return copy(cache.get(threadId));
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof CoAgentWorkflowException),
                        e -> new CoAgentCheckpointPersistenceException("reading", threadId, e));
    }

    @Override
    public Mono<CoAgentCheckpoint> put(CoAgentCheckpoint checkpoint) {
        String threadId = checkpoint.getThreadId();
        return Mono.fromCallable(() -> {
                    ensureInitialized();
                    synchronized (monitorFor(threadId)) {
                        CoAgentCheckpoint stored = cache.get(threadId);
                        CoAgentCheckpoint toStore = copy(checkpoint.withTimestamp(Instant.now()));
                        CoAgentCheckpointVersions.checkSuccessor(stored, toStore);
                        writeFile(toStore);
                        cache.put(threadId, toStore);
                        log.debug("Persisted checkpoint: threadId={}, version={}, node={}, status={}",
                                threadId, toStore.getVersion(), toStore.getNodeName(), toStore.getStatus());
                        return copy(toStore);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof CoAgentWorkflowException),
                        e -> new CoAgentCheckpointPersistenceException("writing", threadId, e));
    }

    @Override
    public Mono<Boolean> delete(String threadId) {
        return Mono.fromCallable(() -> {
                    ensureInitialized();
                    synchronized (monitorFor(threadId)) {
                        boolean existed = cache.remove(threadId) != null;
                        Files.deleteIfExists(fileFor(threadId));
                        return existed;
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof CoAgentWorkflowException),
                        e -> new CoAgentCheckpointPersistenceException("deleting", threadId, e));
    }

    @Override
    public Flux<CoAgentCheckpoint> findAll() {
        return Flux.defer(() -> {
            ensureInitialized();
            return Flux.fromIterable(cache.values()).map(this::copy);
        });
    }

    @Override
    public Mono<Long> count() {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            return (long) cache.size();
        });
    }

    public Path getStorageDirectory() {
        return storageDirectory;
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private synchronized void initializeSync() {
        if (initialized) {
            return;
        }
        try {
            Files.createDirectories(storageDirectory);
            try (Stream<Path> files = Files.list(storageDirectory)) {
                files.filter(path -> path.getFileName().toString().endsWith(FILE_EXTENSION))
                        .forEach(this::loadFile);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        initialized = true;
        log.info("File-based checkpoint store initialized at {} with {} checkpoints", storageDirectory, cache.size());
    }

    private void ensureInitialized() {
        if (!initialized) {
            initializeSync();
        }
    }

    private void loadFile(Path file) {
        try {
            CoAgentCheckpoint checkpoint = objectMapper.fromJson(Files.readAllBytes(file), CoAgentCheckpoint.class);
            cache.put(checkpoint.getThreadId(), checkpoint);
        } catch (IOException | RuntimeException e) {
            // unreadable files are skipped
            log.error("Skipping unreadable checkpoint file: {}", file, e);
        }
    }

    private void writeFile(CoAgentCheckpoint checkpoint) throws IOException {
        Path target = fileFor(checkpoint.getThreadId());
        Path temp = target.resolveSibling(target.getFileName() + TEMP_EXTENSION);
        Files.write(temp, objectMapper.toJsonBytes(checkpoint));
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Path fileFor(String threadId) {
        return storageDirectory.resolve(URLEncoder.encode(threadId, StandardCharsets.UTF_8) + FILE_EXTENSION);
    }

    private Object monitorFor(String threadId) {
        return threadMonitors.computeIfAbsent(threadId, id -> new Object());
    }

    private CoAgentCheckpoint copy(CoAgentCheckpoint checkpoint) {
        return objectMapper.deepCopy(checkpoint, CoAgentCheckpoint.class);
    }
}
