package com.coagent.workflow.core.engine.stream.impl;

import com.coagent.workflow.integration.enumerations.CoAgentProgressEventType;
import com.coagent.workflow.integration.models.events.CoAgentProgressEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoAgentProgressStreamAdapterTest {

    private CoAgentProgressStreamAdapter stream;

    @BeforeEach
    void setUp() {
        stream = new CoAgentProgressStreamAdapter(4);
    }

    private void publishNodes(String threadId, int count) {
        for (int i = 0; i < count; i++) {
            stream.publish(threadId, CoAgentProgressEventType.NODE_ENTER, Map.of("node", "node_" + i));
        }
    }

    private static List<Long> sequences(List<CoAgentProgressEvent> events) {
        return events.stream().map(CoAgentProgressEvent::getSequence).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Sequencing")
    class Sequencing {

        @Test
        @DisplayName("numbers events per thread from one")
        void perThreadSequences() {
            stream.publish("a", CoAgentProgressEventType.START, Map.of());
            stream.publish("b", CoAgentProgressEventType.START, Map.of());
            CoAgentProgressEvent second = stream.publish("a", CoAgentProgressEventType.NODE_ENTER, null);

            assertThat(second.getSequence()).isEqualTo(2L);
            assertThat(second.getPayload()).isEmpty();
            assertThat(stream.lastSequence("b")).isEqualTo(1L);
            assertThat(stream.lastSequence("unknown")).isZero();
        }

        @Test
        @DisplayName("continues after a sequence restored from a checkpoint")
        void advanceSequence() {
            stream.advanceSequence("a", 41);
            stream.advanceSequence("a", 12);

            assertThat(stream.publish("a", CoAgentProgressEventType.RESUMED, Map.of()).getSequence()).isEqualTo(42L);
        }

        @Test
        @DisplayName("refuses a buffer without capacity")
        void invalidBuffer() {
            assertThatThrownBy(() -> new CoAgentProgressStreamAdapter(0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new CoAgentProgressStreamAdapter(4, Duration.ofSeconds(-1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Buffering")
    class Buffering {

        @Test
        @DisplayName("drops the oldest events beyond the buffer size")
        void dropsOldest() {
            publishNodes("a", 6);

            assertThat(sequences(stream.history("a"))).containsExactly(3L, 4L, 5L, 6L);
        }

        @Test
        @DisplayName("never drops a terminal event")
        void keepsTerminalEvents() {
            stream.publish("a", CoAgentProgressEventType.START, Map.of());
            stream.publish("a", CoAgentProgressEventType.COMPLETE, Map.of("status", "completed"));
            publishNodes("a", 5);

            List<CoAgentProgressEvent> history = stream.history("a");
            assertThat(sequences(history)).containsExactly(2L, 4L, 5L, 6L, 7L);
            assertThat(history.get(0).getType()).isEqualTo(CoAgentProgressEventType.COMPLETE);
        }

        @Test
        @DisplayName("evict drops the channel with its events and sequence")
        void evict() {
            publishNodes("a", 3);

            stream.evict("a");

            assertThat(stream.history("a")).isEmpty();
            assertThat(stream.lastSequence("a")).isZero();
            assertThat(stream.publish("a", CoAgentProgressEventType.NODE_EXIT, Map.of()).getSequence()).isEqualTo(1L);
        }
    }

    @Nested
    @DisplayName("Subscribers")
    class Subscribers {

        @Test
        @DisplayName("replays events after the given sequence, then delivers live ones")
        void replayThenLive() {
            publishNodes("a", 3);
            List<Long> received = new ArrayList<>();

            Disposable subscription = stream.attach("a", 1, event -> received.add(event.getSequence()));
            publishNodes("a", 1);
            subscription.dispose();
            publishNodes("a", 1);

            assertThat(received).containsExactly(2L, 3L, 4L);
        }

        @Test
        @DisplayName("attaching without a sequence only delivers new events")
        void liveOnly() {
            publishNodes("a", 2);
            List<Long> received = new ArrayList<>();

            stream.attach("a", event -> received.add(event.getSequence()));
            publishNodes("a", 1);

            assertThat(received).containsExactly(3L);
        }

        @Test
        @DisplayName("a failing subscriber is detached without affecting the publisher")
        void failingSubscriber() {
            List<Long> healthy = new ArrayList<>();
            stream.attach("a", event -> {
                throw new IllegalStateException("client went away");
            });
            stream.attach("a", event -> healthy.add(event.getSequence()));

            publishNodes("a", 2);

            assertThat(healthy).containsExactly(1L, 2L);
        }

        @Test
        @DisplayName("the event flux completes with the terminal event")
        void fluxCompletesOnTerminal() {
            publishNodes("a", 2);

            StepVerifier.create(stream.events("a", 0).map(CoAgentProgressEvent::getType))
                    .expectNext(CoAgentProgressEventType.NODE_ENTER, CoAgentProgressEventType.NODE_ENTER)
                    .then(() -> stream.publish("a", CoAgentProgressEventType.ERROR, Map.of("error", "boom")))
                    .expectNext(CoAgentProgressEventType.ERROR)
                    .verifyComplete();
        }

        @Test
        @DisplayName("a late subscriber of a finished thread gets the terminal event and completes")
        void lateSubscriber() {
            stream.publish("a", CoAgentProgressEventType.START, Map.of());
            stream.publish("a", CoAgentProgressEventType.CANCELLED, Map.of());
            publishNodes("a", 4);

            StepVerifier.create(stream.events("a", 0).take(1))
                    .assertNext(event -> assertThat(event.getType()).isEqualTo(CoAgentProgressEventType.CANCELLED))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Retention")
    class Retention {

        private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

        @Test
        @DisplayName("a released channel stays readable until its retention elapsed")
        void keptDuringRetention() {
            CoAgentProgressStreamAdapter retaining = new CoAgentProgressStreamAdapter(4, Duration.ofMinutes(5), clock);
            retaining.publish("a", CoAgentProgressEventType.COMPLETE, Map.of());

            retaining.release("a");
            clock.advance(Duration.ofMinutes(4));

            assertThat(retaining.purgeReleased()).isZero();
            assertThat(retaining.history("a")).hasSize(1);

            clock.advance(Duration.ofMinutes(1));

            assertThat(retaining.purgeReleased()).isEqualTo(1);
            assertThat(retaining.history("a")).isEmpty();
        }

        @Test
        @DisplayName("a channel released without retention is dropped at once")
        void droppedWithoutRetention() {
            CoAgentProgressStreamAdapter forgetting = new CoAgentProgressStreamAdapter(4, Duration.ZERO, clock);
            forgetting.publish("a", CoAgentProgressEventType.COMPLETE, Map.of());
            forgetting.publish("b", CoAgentProgressEventType.START, Map.of());

            forgetting.release("a");

            assertThat(forgetting.history("a")).isEmpty();
            assertThat(forgetting.history("b")).hasSize(1);
        }

        @Test
        @DisplayName("a channel with an attached sink is dropped when the sink detaches")
        void keptWhileObserved() {
            CoAgentProgressStreamAdapter forgetting = new CoAgentProgressStreamAdapter(4, Duration.ZERO, clock);
            List<Long> received = new ArrayList<>();
            Disposable subscription = forgetting.attach("a", event -> received.add(event.getSequence()));
            forgetting.publish("a", CoAgentProgressEventType.COMPLETE, Map.of());

            forgetting.release("a");

            assertThat(forgetting.history("a")).hasSize(1);

            subscription.dispose();

            assertThat(forgetting.history("a")).isEmpty();
            assertThat(received).containsExactly(1L);
        }

        @Test
        @DisplayName("a channel that was never released is kept")
        void unreleasedKept() {
            CoAgentProgressStreamAdapter forgetting = new CoAgentProgressStreamAdapter(4, Duration.ZERO, clock);
            forgetting.publish("a", CoAgentProgressEventType.START, Map.of());

            assertThat(forgetting.purgeReleased()).isZero();
            assertThat(forgetting.history("a")).hasSize(1);
        }
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
