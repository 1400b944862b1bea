package com.ryuqq.saga.adapter.inmemory.channel;

import com.ryuqq.saga.core.contract.SagaFailedEvent;
import com.ryuqq.saga.core.contract.SagaMessage;
import com.ryuqq.saga.core.model.SagaId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryCommandChannel 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryCommandChannelTest {

    private static final SagaId SAGA_ID = SagaId.of("saga-1");

    private InMemoryCommandChannel channel;

    @BeforeEach
    void setUp() {
        channel = new InMemoryCommandChannel();
    }

    @Test
    void publish_DeliversToSubscribersOfDestinationOnly() {
        // given
        List<SagaMessage> received = new ArrayList<>();
        List<SagaMessage> other = new ArrayList<>();
        channel.subscribe("events.a", (message, headers) -> received.add(message));
        channel.subscribe("events.b", (message, headers) -> other.add(message));
        SagaFailedEvent event = new SagaFailedEvent(SAGA_ID, "boom");

        // when
        String messageId = channel.publish("events.a", event, Map.of("saga-id", "saga-1"));

        // then
        assertThat(messageId).isNotBlank();
        assertThat(received).containsExactly(event);
        assertThat(other).isEmpty();
    }

    @Test
    void publish_PassesHeadersToHandler() {
        // given
        List<Map<String, String>> seen = new ArrayList<>();
        channel.subscribe("events.a", (message, headers) -> seen.add(headers));

        // when
        channel.publish("events.a", new SagaFailedEvent(SAGA_ID, "boom"), Map.of("step-index", "2"));
        channel.publish("events.a", new SagaFailedEvent(SAGA_ID, "boom"));

        // then
        assertThat(seen).hasSize(2);
        assertThat(seen.get(0)).containsEntry("step-index", "2");
        assertThat(seen.get(1)).isEmpty();
    }

    @Test
    void published_RecordsMessagesInOrder() {
        // when
        channel.publish("events.a", new SagaFailedEvent(SAGA_ID, "first"));
        channel.publish("events.b", new SagaFailedEvent(SAGA_ID, "second"));
        channel.publish("events.a", new SagaFailedEvent(SAGA_ID, "third"));

        // then
        assertThat(channel.published()).hasSize(3);
        assertThat(channel.published("events.a"))
            .extracting(p -> ((SagaFailedEvent) p.message()).reason())
            .containsExactly("first", "third");
    }

    @Test
    void unsubscribe_StopsDelivery_UnknownIdIgnored() {
        // given
        List<SagaMessage> received = new ArrayList<>();
        String subscriptionId = channel.subscribe("events.a", (message, headers) -> received.add(message));

        // when
        channel.unsubscribe(subscriptionId);
        channel.unsubscribe("unknown");
        channel.publish("events.a", new SagaFailedEvent(SAGA_ID, "boom"));

        // then
        assertThat(received).isEmpty();
        assertThat(channel.subscriptionCount()).isZero();
    }

    @Test
    void unsubscribeDuringDelivery_DoesNotBreakCurrentDelivery() {
        // given
        List<String> calls = new ArrayList<>();
        String[] firstId = new String[1];
        firstId[0] = channel.subscribe("events.a", (message, headers) -> {
            calls.add("first");
            channel.unsubscribe(firstId[0]);
        });
        channel.subscribe("events.a", (message, headers) -> calls.add("second"));

        // when
        channel.publish("events.a", new SagaFailedEvent(SAGA_ID, "one"));
        channel.publish("events.a", new SagaFailedEvent(SAGA_ID, "two"));

        // then
        assertThat(calls).containsExactly("first", "second", "second");
    }

    @Test
    void invalidArguments_AreRejected() {
        assertThatThrownBy(() -> channel.publish(" ", new SagaFailedEvent(SAGA_ID, "x")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> channel.publish("a", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> channel.subscribe("a", null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
