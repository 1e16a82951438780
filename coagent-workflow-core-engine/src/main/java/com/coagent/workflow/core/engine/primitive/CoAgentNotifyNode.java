package com.coagent.workflow.core.engine.primitive;

import com.coagent.workflow.core.exception.notification.CoAgentNotificationDeliveryException;
import com.coagent.workflow.integration.constant.CoAgentConstants;
import com.coagent.workflow.integration.enumerations.CoAgentProgressEventType;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.node.ICoAgentNodeContext;
import com.coagent.workflow.integration.models.node.ICoAgentRoutingNode;
import com.coagent.workflow.integration.models.notification.CoAgentNotification;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Publishes a {@code notify} event and, when a recipient is set, sends the notification through
 * the sink. Never suspends.
 */
@Slf4j
@Getter
public class CoAgentNotifyNode implements ICoAgentRoutingNode {

    private final Function<CoAgentExecutionState, CoAgentNotification> notification;
    private final String nextNode;
    private final String recipient;

    public CoAgentNotifyNode(Function<CoAgentExecutionState, CoAgentNotification> notification, String nextNode) {
        this(notification, nextNode, null);
    }

    public CoAgentNotifyNode(Function<CoAgentExecutionState, CoAgentNotification> notification, String nextNode, String recipient) {
        this.notification = notification;
        this.nextNode = nextNode;
        this.recipient = recipient;
    }

    @Override
    public Set<String> getSuccessors() {
        return Set.of(nextNode);
    }

    @Override
    public Mono<CoAgentNodeOutcome> execute(CoAgentExecutionState state, ICoAgentNodeContext context) {
        return Mono.defer(() -> {
            Map<String, Object> payload = notification.apply(state).toPayload();
            context.emit(CoAgentProgressEventType.NOTIFY, payload);
            if (recipient == null) {
                return Mono.just(record(payload, null));
            }
            return context.getNotificationSink()
                    .notify(recipient, payload)
                    .onErrorMap(error -> !(error instanceof CoAgentNotificationDeliveryException),
                            error -> new CoAgentNotificationDeliveryException(recipient, error))
                    .doOnNext(id -> log.debug("Notification {} sent to [{}] for thread [{}]", id, recipient, context.getThreadId()))
                    .map(id -> record(payload, id));
        });
    }

    private CoAgentNodeOutcome record(Map<String, Object> payload, String notificationId) {
        Map<String, Object> entry = new LinkedHashMap<>(payload);
        if (notificationId != null) {
            entry.put("recipient", recipient);
            entry.put("notification_id", notificationId);
        }
        return CoAgentNodeOutcome.next(nextNode, CoAgentStatePatch.builder().append(CoAgentConstants.NOTIFICATIONS, entry).build());
    }
}
