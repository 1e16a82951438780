package com.coagent.workflow.core.engine;

import com.coagent.workflow.core.engine.checkpoint.CoAgentCheckpointStoreManager;
import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStore;
import com.coagent.workflow.core.engine.config.CoAgentEngineSettings;
import com.coagent.workflow.core.engine.document.impl.InMemoryDocumentClient;
import com.coagent.workflow.core.engine.execution.ICoAgentExecutionEngine;
import com.coagent.workflow.core.engine.execution.impl.CoAgentExecutionEngine;
import com.coagent.workflow.core.engine.lock.ICoAgentThreadLockService;
import com.coagent.workflow.core.engine.lock.impl.InMemoryThreadLockService;
import com.coagent.workflow.core.engine.misc.CoAgentObjectMapper;
import com.coagent.workflow.core.engine.notification.impl.ConsoleNotificationSink;
import com.coagent.workflow.core.engine.notification.impl.WebhookNotificationSink;
import com.coagent.workflow.core.engine.registry.ICoAgentWorkflowRegistry;
import com.coagent.workflow.core.engine.registry.impl.CoAgentWorkflowRegistry;
import com.coagent.workflow.core.engine.stream.ICoAgentProgressStream;
import com.coagent.workflow.core.engine.stream.impl.CoAgentProgressStreamAdapter;
import com.coagent.workflow.integration.contract.ICoAgentDocumentClient;
import com.coagent.workflow.integration.contract.ICoAgentNotificationSink;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Wires the engine and its collaborators from {@link CoAgentEngineSettings}.
 *
 * <p>{@link #getInstance()} builds from the environment on first use; {@link #create} builds an
 * independent instance, e.g. for an embedded server or a test.</p>
 */
@Slf4j
@Getter
public class CoAgentFacade implements ICoAgentFacade {

    private final CoAgentEngineSettings settings;
    private final CoAgentObjectMapper objectMapper;
    private final CoAgentCheckpointStoreManager checkpointStoreManager;
    private final ICoAgentWorkflowRegistry workflowRegistry;
    private final ICoAgentThreadLockService threadLockService;
    private final ICoAgentProgressStream progressStream;
    private final ICoAgentNotificationSink notificationSink;
    private final ICoAgentDocumentClient documentClient;
    private final CoAgentExecutionEngine executionEngine;

    private CoAgentFacade(CoAgentEngineSettings settings, ICoAgentWorkflowRegistry registry) {
        this.settings = settings;
        this.objectMapper = CoAgentObjectMapper.getInstance();
        this.checkpointStoreManager = new CoAgentCheckpointStoreManager(settings);
        this.workflowRegistry = registry;
        this.threadLockService = new InMemoryThreadLockService();
        this.progressStream = new CoAgentProgressStreamAdapter(settings.getStreamBufferSize(), settings.getStreamTerminalRetention());
        this.notificationSink = settings.getWebhookUrl()
                .<ICoAgentNotificationSink>map(WebhookNotificationSink::new)
                .orElseGet(ConsoleNotificationSink::new);
        this.documentClient = new InMemoryDocumentClient();
        this.executionEngine = CoAgentExecutionEngine.builder()
                .registry(workflowRegistry)
                .checkpointStore(checkpointStoreManager.getStore())
                .lockService(threadLockService)
                .progressStream(progressStream)
                .notificationSink(notificationSink)
                .documentClient(documentClient)
                .lockDuration(settings.getLockDuration())
                .build();

        log.info("CoAgent engine ready: store={}, workflows={}, notifications={}",
                checkpointStoreManager.getActiveStoreType(),
                workflowRegistry.list(null).size(),
                notificationSink.getClass().getSimpleName());
        executionEngine.rescheduleApprovalTimeouts().block();
    }

    private static final class SingletonHelper {
        private static final ICoAgentFacade INSTANCE =
                new CoAgentFacade(CoAgentEngineSettings.fromEnvironment(), CoAgentWorkflowRegistry.discover());
    }

    public static ICoAgentFacade getInstance() {
        return SingletonHelper.INSTANCE;
    }

    public static ICoAgentFacade create(CoAgentEngineSettings settings) {
        return new CoAgentFacade(settings, CoAgentWorkflowRegistry.discover());
    }

    public static ICoAgentFacade create(CoAgentEngineSettings settings, ICoAgentWorkflowRegistry registry) {
        return new CoAgentFacade(settings, registry);
    }

    @Override
    public ICoAgentExecutionEngine getExecutionEngine() {
        return executionEngine;
    }

    @Override
    public ICoAgentCheckpointStore getCheckpointStore() {
        return checkpointStoreManager.getStore();
    }

    @Override
    public Mono<Long> purgeExpiredCheckpoints() {
        Duration retention = settings.getCheckpointRetention();
        return getCheckpointStore().purgeOlderThan(retention)
                .doOnNext(purged -> {
                    int channels = progressStream.purgeReleased();
                    log.info("Purged {} checkpoints older than {} and {} finished event channels", purged, retention, channels);
                });
    }

    @Override
    public void shutdown() {
        log.info("Shutting down CoAgent engine");
        executionEngine.shutdown();
        checkpointStoreManager.shutdown().block();
    }
}
