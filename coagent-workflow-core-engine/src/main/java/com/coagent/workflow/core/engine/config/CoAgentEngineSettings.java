package com.coagent.workflow.core.engine.config;

import com.coagent.workflow.integration.constant.CoAgentConstants;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Engine configuration.
 *
 * <p>Every setting is resolved from a system property first, then from the environment variable
 * derived from it ({@code coagent.workflow.recursion.limit} becomes
 * {@code COAGENT_WORKFLOW_RECURSION_LIMIT}), then from the default.</p>
 *
 * <h2>Settings</h2>
 * <ul>
 *   <li>coagent.workflow.checkpoint.store.type: MEMORY, FILE or DATABASE (default FILE)</li>
 *   <li>coagent.workflow.checkpoint.store.path: directory of the file store (default ~/.coagent/checkpoints)</li>
 *   <li>coagent.workflow.checkpoint.retention.hours: age after which {@code purgeExpiredCheckpoints} removes a checkpoint (default 24)</li>
 *   <li>coagent.workflow.recursion.limit: node visits allowed per call (default 25)</li>
 *   <li>coagent.workflow.stream.buffer.size: events kept per thread for replay (default 256)</li>
 *   <li>coagent.workflow.stream.terminal.retention.seconds: how long the events of a finished thread stay replayable (default 300)</li>
 *   <li>coagent.workflow.lock.duration.seconds: lease of a thread lock (default 30)</li>
 *   <li>coagent.workflow.notification.webhook.url: webhook for notifications, console when unset</li>
 *   <li>coagent.workflow.server.port: HTTP port (default 8080)</li>
 *   <li>coagent.workflow.mongodb.uri / coagent.workflow.mongodb.database: DATABASE store connection</li>
 * </ul>
 */
@Slf4j
@Getter
@Builder(toBuilder = true)
@ToString
public class CoAgentEngineSettings {

    public static final String STORE_TYPE_PROPERTY = "coagent.workflow.checkpoint.store.type";
    public static final String STORE_PATH_PROPERTY = "coagent.workflow.checkpoint.store.path";
    public static final String RETENTION_HOURS_PROPERTY = "coagent.workflow.checkpoint.retention.hours";
    public static final String RECURSION_LIMIT_PROPERTY = "coagent.workflow.recursion.limit";
    public static final String STREAM_BUFFER_SIZE_PROPERTY = "coagent.workflow.stream.buffer.size";
    public static final String STREAM_RETENTION_PROPERTY = "coagent.workflow.stream.terminal.retention.seconds";
    public static final String LOCK_DURATION_PROPERTY = "coagent.workflow.lock.duration.seconds";
    public static final String WEBHOOK_URL_PROPERTY = "coagent.workflow.notification.webhook.url";
    public static final String SERVER_PORT_PROPERTY = "coagent.workflow.server.port";
    public static final String MONGODB_URI_PROPERTY = "coagent.workflow.mongodb.uri";
    public static final String MONGODB_DATABASE_PROPERTY = "coagent.workflow.mongodb.database";

    public enum StoreType {
        /** In-memory storage, lost on restart */
        MEMORY,
        /** One JSON file per thread */
        FILE,
        /** Store contributed by a checkpoint store plugin */
        DATABASE
    }

    @Builder.Default
    private final StoreType storeType = StoreType.FILE;
    private final Path storePath;
    @Builder.Default
    private final Duration checkpointRetention = Duration.ofHours(24);
    @Builder.Default
    private final int recursionLimit = CoAgentConstants.DEFAULT_RECURSION_LIMIT;
    @Builder.Default
    private final int streamBufferSize = CoAgentConstants.DEFAULT_STREAM_BUFFER_SIZE;
    @Builder.Default
    private final Duration streamTerminalRetention = Duration.ofMinutes(5);
    @Builder.Default
    private final Duration lockDuration = Duration.ofSeconds(30);
    private final String webhookUrl;
    @Builder.Default
    private final int serverPort = 8080;
    @Builder.Default
    private final String mongoUri = "mongodb://localhost:27017";
    @Builder.Default
    private final String mongoDatabase = "coagent";

    public Optional<String> getWebhookUrl() {
        return Optional.ofNullable(webhookUrl).filter(url -> !url.isBlank());
    }

    public Path getStorePath() {
        return storePath != null ? storePath : Paths.get(System.getProperty("user.home"), ".coagent", "checkpoints");
    }

    /**
     * Resolves every setting from system properties and environment.
     */
    public static CoAgentEngineSettings fromEnvironment() {
        CoAgentEngineSettingsBuilder builder = CoAgentEngineSettings.builder();
        resolve(STORE_TYPE_PROPERTY).ifPresent(value -> {
            try {
                builder.storeType(StoreType.valueOf(value.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid checkpoint store type: {}. Using default.", value);
            }
        });
        resolve(STORE_PATH_PROPERTY).ifPresent(value -> builder.storePath(Paths.get(value)));
        resolveInt(RETENTION_HOURS_PROPERTY).ifPresent(hours -> builder.checkpointRetention(Duration.ofHours(hours)));
        resolveInt(RECURSION_LIMIT_PROPERTY).ifPresent(builder::recursionLimit);
        resolveInt(STREAM_BUFFER_SIZE_PROPERTY).ifPresent(builder::streamBufferSize);
        resolveInt(STREAM_RETENTION_PROPERTY).ifPresent(seconds -> builder.streamTerminalRetention(Duration.ofSeconds(Math.max(0, seconds))));
        resolveInt(LOCK_DURATION_PROPERTY).ifPresent(seconds -> builder.lockDuration(Duration.ofSeconds(seconds)));
        resolve(WEBHOOK_URL_PROPERTY).ifPresent(builder::webhookUrl);
        resolveInt(SERVER_PORT_PROPERTY).ifPresent(builder::serverPort);
        resolve(MONGODB_URI_PROPERTY).ifPresent(builder::mongoUri);
        resolve(MONGODB_DATABASE_PROPERTY).ifPresent(builder::mongoDatabase);
        CoAgentEngineSettings settings = builder.build();
        log.info("Resolved engine settings: {}", settings);
        return settings;
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    static Optional<String> resolve(String property) {
        String value = System.getProperty(property);
        if (value != null && !value.isBlank()) {
            return Optional.of(value.trim());
        }
        value = System.getenv(toEnvironmentName(property));
        if (value != null && !value.isBlank()) {
            return Optional.of(value.trim());
        }
        return Optional.empty();
    }

    static String toEnvironmentName(String property) {
        return property.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private static Optional<Integer> resolveInt(String property) {
        return resolve(property).flatMap(value -> {
            try {
                return Optional.of(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}. Using default.", property, value);
                return Optional.empty();
            }
        });
    }
}
