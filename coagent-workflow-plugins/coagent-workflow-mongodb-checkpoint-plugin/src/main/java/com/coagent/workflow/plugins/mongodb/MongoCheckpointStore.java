package com.coagent.workflow.plugins.mongodb;

import com.coagent.workflow.core.engine.checkpoint.CoAgentCheckpointVersions;
import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStore;
import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.core.exception.checkpoint.CoAgentCheckpointConflictException;
import com.coagent.workflow.core.exception.checkpoint.CoAgentCheckpointPersistenceException;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.models.execution.CoAgentCheckpoint;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import com.mongodb.reactivestreams.client.MongoCollection;
import com.mongodb.reactivestreams.client.MongoDatabase;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Checkpoint store backed by a MongoDB collection, one document per thread keyed by thread id.
 *
 * <p>The version check is done by the database: the first checkpoint of a thread is inserted and
 * relies on the {@code _id} uniqueness, every later one replaces the document only if it still
 * carries the predecessor version. A write that matches nothing is reported as a conflict against
 * whatever is stored at that moment.</p>
 */
@Slf4j
public class MongoCheckpointStore implements ICoAgentCheckpointStore {

    public static final String DEFAULT_COLLECTION = "coagent_checkpoints";

    private final MongoClient client;
    private final MongoDatabase database;
    private final MongoCollection<Document> collection;

    public MongoCheckpointStore(MongoClient client, String databaseName) {
        this(client, databaseName, DEFAULT_COLLECTION);
    }

    public MongoCheckpointStore(MongoClient client, String databaseName, String collectionName) {
        this.client = client;
        this.database = client.getDatabase(databaseName);
        this.collection = database.getCollection(collectionName);
    }

    /**
     * Creates a store with its own client. The client is closed by {@link #shutdown()}.
     */
    public static MongoCheckpointStore create(String connectionString, String databaseName) {
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(connectionString))
                .retryWrites(true)
                .retryReads(true)
                .build();
        MongoClient client = MongoClients.create(settings);
        log.info("Created MongoDB client for checkpoint store: {}, database: {}",
                MongoCheckpointDocuments.maskConnectionString(connectionString), databaseName);
        return new MongoCheckpointStore(client, databaseName);
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.from(collection.createIndex(Indexes.ascending(MongoCheckpointDocuments.STATUS)))
                .then(Mono.from(collection.createIndex(Indexes.ascending(MongoCheckpointDocuments.TIMESTAMP))))
                .doOnSuccess(index -> log.info("MongoDB checkpoint store initialized: collection={}",
                        collection.getNamespace().getFullName()))
                .then()
                .onErrorMap(e -> !(e instanceof CoAgentWorkflowException),
                        e -> new CoAgentCheckpointPersistenceException("initializing store for", "*", e));
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("Shutting down MongoDB checkpoint store");
            client.close();
        });
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.from(database.runCommand(new Document("ping", 1)))
                .map(reply -> true)
                .onErrorResume(e -> {
                    log.warn("MongoDB checkpoint store health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    @Override
    public Mono<CoAgentCheckpoint> get(String threadId) {
        return findDocument(threadId)
                .map(MongoCheckpointDocuments::fromDocument)
                .onErrorMap(e -> !(e instanceof CoAgentWorkflowException),
                        e -> new CoAgentCheckpointPersistenceException("reading", threadId, e));
    }

    @Override
    public Mono<CoAgentCheckpoint> put(CoAgentCheckpoint checkpoint) {
        String threadId = checkpoint.getThreadId();
        return Mono.defer(() -> {
                    CoAgentCheckpoint toStore = checkpoint.withTimestamp(Instant.now());
                    Document document = MongoCheckpointDocuments.toDocument(toStore);
                    Mono<Boolean> written = toStore.getVersion() == 1
                            ? insertFirst(document)
                            : replacePredecessor(threadId, toStore.getVersion(), document);
                    return written.flatMap(applied -> applied
                            ? Mono.just(MongoCheckpointDocuments.fromDocument(document))
                            : conflict(toStore));
                })
                .doOnNext(stored -> log.debug("Persisted checkpoint: threadId={}, version={}, node={}, status={}",
                        threadId, stored.getVersion(), stored.getNodeName(), stored.getStatus()))
                .onErrorMap(e -> !(e instanceof CoAgentWorkflowException),
                        e -> new CoAgentCheckpointPersistenceException("writing", threadId, e));
    }

    @Override
    public Mono<Boolean> delete(String threadId) {
        return Mono.from(collection.deleteOne(Filters.eq(MongoCheckpointDocuments.ID, threadId)))
                .map(result -> result.getDeletedCount() > 0)
                .onErrorMap(e -> !(e instanceof CoAgentWorkflowException),
                        e -> new CoAgentCheckpointPersistenceException("deleting", threadId, e));
    }

    @Override
    public Flux<CoAgentCheckpoint> findAll() {
        return Flux.from(collection.find())
                .map(MongoCheckpointDocuments::fromDocument)
                .onErrorMap(e -> !(e instanceof CoAgentWorkflowException),
                        e -> new CoAgentCheckpointPersistenceException("listing", "*", e));
    }

    @Override
    public Flux<CoAgentCheckpoint> findByStatus(CoAgentExecutionStatus status) {
        return Flux.from(collection.find(Filters.eq(MongoCheckpointDocuments.STATUS, status.name())))
                .map(MongoCheckpointDocuments::fromDocument)
                .onErrorMap(e -> !(e instanceof CoAgentWorkflowException),
                        e -> new CoAgentCheckpointPersistenceException("listing", "*", e));
    }

    @Override
    public Mono<Long> count() {
        return Mono.from(collection.countDocuments())
                .onErrorMap(e -> new CoAgentCheckpointPersistenceException("counting", "*", e));
    }

    @Override
    public Mono<Long> purgeOlderThan(Duration retention) {
        Date cutoff = Date.from(Instant.now().minus(retention));
        return Mono.from(collection.deleteMany(Filters.lt(MongoCheckpointDocuments.TIMESTAMP, cutoff)))
                .map(DeleteResult::getDeletedCount)
                .doOnNext(removed -> log.info("Purged {} checkpoints older than {}", removed, cutoff))
                .onErrorMap(e -> new CoAgentCheckpointPersistenceException("purging", "*", e));
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private Mono<Document> findDocument(String threadId) {
        return Mono.from(collection.find(Filters.eq(MongoCheckpointDocuments.ID, threadId)).first());
    }

    private Mono<Boolean> insertFirst(Document document) {
        return Mono.from(collection.insertOne(document))
                .thenReturn(true)
                .onErrorResume(MongoCheckpointDocuments::isDuplicateKey, e -> Mono.just(false));
    }

    private Mono<Boolean> replacePredecessor(String threadId, long version, Document document) {
        return Mono.from(collection.replaceOne(
                        Filters.and(
                                Filters.eq(MongoCheckpointDocuments.ID, threadId),
                                Filters.eq(MongoCheckpointDocuments.VERSION, version - 1)),
                        document))
                .map(result -> result.getMatchedCount() > 0);
    }

    private Mono<CoAgentCheckpoint> conflict(CoAgentCheckpoint rejected) {
        String threadId = rejected.getThreadId();
        return findDocument(threadId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(stored -> {
                    long storedVersion = stored.map(MongoCheckpointDocuments::versionOf).orElse(0L);
                    CoAgentCheckpointVersions.checkSuccessor(
                            stored.map(MongoCheckpointDocuments::fromDocument).orElse(null), rejected);
                    // another writer replaced the document between the failed write and this read
                    return Mono.error(new CoAgentCheckpointConflictException(threadId,
                            "stored version " + storedVersion + " changed while writing " + rejected.getVersion()));
                });
    }
}
