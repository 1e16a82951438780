package com.coagent.workflow.core.engine.stream.impl;

import com.coagent.workflow.core.engine.stream.ICoAgentProgressStream;
import com.coagent.workflow.integration.enumerations.CoAgentProgressEventType;
import com.coagent.workflow.integration.models.events.CoAgentProgressEvent;
import com.coagent.workflow.integration.models.events.ICoAgentEventSink;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process implementation of the progress feed.
 *
 * <p>Each thread has a channel; publication, replay and attachment for a thread happen under
 * the channel's monitor, which is what makes sequence assignment, buffering and delivery one
 * atomic step.</p>
 *
 * <p>A released channel (its thread finished) stays readable for {@code terminalRetention} and is
 * dropped by the next sweep once no sink is attached. Sweeps run on every release and whenever a
 * sink of a released channel detaches.</p>
 */
@Slf4j
public class CoAgentProgressStreamAdapter implements ICoAgentProgressStream {

    public static final Duration DEFAULT_TERMINAL_RETENTION = Duration.ofMinutes(5);

    private final int bufferSize;
    private final Duration terminalRetention;
    private final Clock clock;
    private final Map<String, ThreadChannel> channels = new ConcurrentHashMap<>();

    public CoAgentProgressStreamAdapter(int bufferSize) {
        this(bufferSize, DEFAULT_TERMINAL_RETENTION);
    }

    public CoAgentProgressStreamAdapter(int bufferSize, Duration terminalRetention) {
        this(bufferSize, terminalRetention, Clock.systemUTC());
    }

    public CoAgentProgressStreamAdapter(int bufferSize, Duration terminalRetention, Clock clock) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
        if (terminalRetention == null || terminalRetention.isNegative()) {
            throw new IllegalArgumentException("terminalRetention must not be negative");
        }
        this.bufferSize = bufferSize;
        this.terminalRetention = terminalRetention;
        this.clock = clock;
    }

    @Override
    public CoAgentProgressEvent publish(String threadId, CoAgentProgressEventType type, Map<String, Object> payload) {
        ThreadChannel channel = channelFor(threadId);
        synchronized (channel) {
            CoAgentProgressEvent event = CoAgentProgressEvent.builder()
                    .type(type)
                    .threadId(threadId)
                    .sequence(++channel.lastSequence)
                    .payload(payload == null ? Map.of() : payload)
                    .timestamp(Instant.now())
                    .build();
            channel.buffer(event, bufferSize);
            for (ICoAgentEventSink sink : channel.sinks) {
                deliver(channel, sink, event);
            }
            log.debug("Published event: threadId={}, seq={}, type={}", threadId, event.getSequence(), type);
            return event;
        }
    }

    @Override
    public Disposable attach(String threadId, ICoAgentEventSink sink) {
        ThreadChannel channel = channelFor(threadId);
        synchronized (channel) {
            return attachLocked(channel, channel.lastSequence, sink);
        }
    }

    @Override
    public Disposable attach(String threadId, long sinceSequence, ICoAgentEventSink sink) {
        ThreadChannel channel = channelFor(threadId);
        synchronized (channel) {
            return attachLocked(channel, sinceSequence, sink);
        }
    }

    @Override
    public Flux<CoAgentProgressEvent> events(String threadId, long sinceSequence) {
        return Flux.create(emitter -> {
            Disposable subscription = attach(threadId, sinceSequence, new FluxSinkAdapter(emitter));
            emitter.onDispose(subscription);
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    @Override
    public List<CoAgentProgressEvent> history(String threadId) {
        ThreadChannel channel = channels.get(threadId);
        if (channel == null) {
            return List.of();
        }
        synchronized (channel) {
            return Collections.unmodifiableList(channel.snapshot());
        }
    }

    @Override
    public long lastSequence(String threadId) {
        ThreadChannel channel = channels.get(threadId);
        if (channel == null) {
            return 0L;
        }
        synchronized (channel) {
            return channel.lastSequence;
        }
    }

    @Override
    public void advanceSequence(String threadId, long sequence) {
        ThreadChannel channel = channelFor(threadId);
        synchronized (channel) {
            if (sequence > channel.lastSequence) {
                log.debug("Advancing event sequence: threadId={}, from={}, to={}", threadId, channel.lastSequence, sequence);
                channel.lastSequence = sequence;
            }
        }
    }

    @Override
    public void release(String threadId) {
        ThreadChannel channel = channels.get(threadId);
        if (channel != null) {
            synchronized (channel) {
                channel.releasedAt = clock.instant();
            }
        }
        purgeReleased();
    }

    @Override
    public void evict(String threadId) {
        ThreadChannel channel = channels.remove(threadId);
        if (channel != null) {
            synchronized (channel) {
                channel.recent.clear();
                channel.retainedTerminal.clear();
                channel.sinks.clear();
            }
            log.debug("Evicted event channel: threadId={}", threadId);
        }
    }

    @Override
    public int purgeReleased() {
        Instant now = clock.instant();
        int dropped = 0;
        for (Map.Entry<String, ThreadChannel> entry : channels.entrySet()) {
            if (dropIfExpired(entry.getKey(), entry.getValue(), now)) {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} released event channels", dropped);
        }
        return dropped;
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private Disposable attachLocked(ThreadChannel channel, long sinceSequence, ICoAgentEventSink sink) {
        for (CoAgentProgressEvent event : channel.snapshot()) {
            if (event.getSequence() > sinceSequence) {
                deliver(channel, sink, event);
            }
        }
        channel.sinks.add(sink);
        return () -> {
            channel.sinks.remove(sink);
            dropIfExpired(channel.threadId, channel, clock.instant());
        };
    }

    private boolean dropIfExpired(String threadId, ThreadChannel channel, Instant now) {
        synchronized (channel) {
            if (channel.releasedAt == null
                    || !channel.sinks.isEmpty()
                    || now.isBefore(channel.releasedAt.plus(terminalRetention))) {
                return false;
            }
            return channels.remove(threadId, channel);
        }
    }

    private void deliver(ThreadChannel channel, ICoAgentEventSink sink, CoAgentProgressEvent event) {
        try {
            sink.push(event);
        } catch (RuntimeException e) {
            // a failing observer is detached, the execution it observes keeps going
            log.warn("Detaching event sink after failure: threadId={}, seq={}", event.getThreadId(), event.getSequence(), e);
            channel.sinks.remove(sink);
        }
    }

    private ThreadChannel channelFor(String threadId) {
        return channels.computeIfAbsent(threadId, ThreadChannel::new);
    }

    private static final class ThreadChannel {
        private final String threadId;
        private long lastSequence;
        private Instant releasedAt;
        private final Deque<CoAgentProgressEvent> recent = new ArrayDeque<>();
        private final List<CoAgentProgressEvent> retainedTerminal = new ArrayList<>();
        private final List<ICoAgentEventSink> sinks = new CopyOnWriteArrayList<>();

        private ThreadChannel(String threadId) {
            this.threadId = threadId;
        }

        private void buffer(CoAgentProgressEvent event, int bufferSize) {
            recent.addLast(event);
            while (recent.size() > bufferSize) {
                CoAgentProgressEvent dropped = recent.removeFirst();
                if (dropped.isTerminal()) {
                    retainedTerminal.add(dropped);
                }
            }
        }

        private List<CoAgentProgressEvent> snapshot() {
            List<CoAgentProgressEvent> events = new ArrayList<>(retainedTerminal.size() + recent.size());
            events.addAll(retainedTerminal);
            events.addAll(recent);
            events.sort(Comparator.comparingLong(CoAgentProgressEvent::getSequence));
            return events;
        }
    }

    private static final class FluxSinkAdapter implements ICoAgentEventSink {
        private final FluxSink<CoAgentProgressEvent> emitter;

        private FluxSinkAdapter(FluxSink<CoAgentProgressEvent> emitter) {
            this.emitter = emitter;
        }

        @Override
        public void push(CoAgentProgressEvent event) {
            emitter.next(event);
            if (event.isTerminal()) {
                emitter.complete();
            }
        }
    }
}
