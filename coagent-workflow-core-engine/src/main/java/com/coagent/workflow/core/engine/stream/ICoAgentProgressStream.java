package com.coagent.workflow.core.engine.stream;

import com.coagent.workflow.integration.enumerations.CoAgentProgressEventType;
import com.coagent.workflow.integration.models.events.CoAgentProgressEvent;
import com.coagent.workflow.integration.models.events.ICoAgentEventSink;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

/**
 * Ordered per-thread feed of progress events.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>Sequence numbers are strictly increasing per thread, starting at 1</li>
 *   <li>Every sink sees events in publication order, exactly once</li>
 *   <li>A sink attached with a replay point receives the buffered events after that point
 *       before any live event, with no gap and no duplicate</li>
 *   <li>The replay buffer is bounded; on overflow the most recent events and every terminal
 *       event are retained</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Disposable subscription = progressStream.attach(threadId, 0, event -> frames.add(event));
 * ...
 * subscription.dispose();
 * }</pre>
 */
public interface ICoAgentProgressStream {

    /**
     * Assigns the next sequence number and delivers the event to attached sinks.
     */
    CoAgentProgressEvent publish(String threadId, CoAgentProgressEventType type, Map<String, Object> payload);

    /**
     * Attaches a sink that receives live events only.
     */
    Disposable attach(String threadId, ICoAgentEventSink sink);

    /**
     * Attaches a sink that first receives the buffered events with a sequence greater than
     * {@code sinceSequence}, then live events.
     */
    Disposable attach(String threadId, long sinceSequence, ICoAgentEventSink sink);

    /**
     * Replay plus live events as a {@link Flux}, completing after the first terminal event.
     */
    Flux<CoAgentProgressEvent> events(String threadId, long sinceSequence);

    List<CoAgentProgressEvent> history(String threadId);

    long lastSequence(String threadId);

    /**
     * Makes the next sequence of the thread greater than {@code sequence}. Used when a thread is
     * rehydrated from a checkpoint written by an earlier process.
     */
    void advanceSequence(String threadId, long sequence);

    /**
     * Marks the thread as finished. Its channel is dropped once no sink is attached and the
     * terminal retention has elapsed; until then the events can still be replayed.
     */
    void release(String threadId);

    /**
     * Drops the channel of a thread at once, buffered events included. Attached sinks receive
     * nothing further.
     */
    void evict(String threadId);

    /**
     * Drops the channels of finished threads whose retention elapsed and that have no sink attached.
     *
     * @return number of channels dropped
     */
    int purgeReleased();
}
