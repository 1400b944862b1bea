package com.ryuqq.saga.adapter.inmemory.channel;

import com.ryuqq.saga.core.contract.SagaMessage;
import com.ryuqq.saga.core.spi.CommandChannel;
import com.ryuqq.saga.core.spi.MessageHandler;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link CommandChannel} SPI for testing and reference purposes.
 *
 * <p>Delivery is synchronous: {@code publish} records the message and then invokes every
 * handler subscribed to the destination on the calling thread, in subscription order.
 * Handlers subscribed or unsubscribed during delivery do not affect the current delivery.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Published message log for assertions ({@link #published()}, {@link #published(String)})</li>
 *   <li>Thread-safe operations using concurrent data structures</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryCommandChannel channel = new InMemoryCommandChannel();
 * channel.subscribe("payments.charge", (message, headers) -&gt; { ... });
 * channel.publish("payments.charge", command, headers);
 *
 * assertThat(channel.published("payments.charge")).hasSize(1);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryCommandChannel implements CommandChannel {

    private final CopyOnWriteArrayList<PublishedMessage> published = new CopyOnWriteArrayList<>();

    private final CopyOnWriteArrayList<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    @Override
    public String publish(String destination, SagaMessage message, Map<String, String> headers) {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be null or blank");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        Map<String, String> safeHeaders = headers == null ? Map.of() : Map.copyOf(headers);
        String messageId = UUID.randomUUID().toString();
        published.add(new PublishedMessage(messageId, destination, message, safeHeaders));

        // CopyOnWriteArrayList 순회는 스냅샷이므로 전달 중 구독 변경의 영향을 받지 않음
        for (Subscription subscription : subscriptions) {
            if (subscription.destination().equals(destination)) {
                subscription.handler().onMessage(message, safeHeaders);
            }
        }
        return messageId;
    }

    @Override
    public String subscribe(String destination, MessageHandler handler) {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        String subscriptionId = UUID.randomUUID().toString();
        subscriptions.add(new Subscription(subscriptionId, destination, handler));
        return subscriptionId;
    }

    @Override
    public void unsubscribe(String subscriptionId) {
        if (subscriptionId != null) {
            subscriptions.removeIf(s -> s.id().equals(subscriptionId));
        }
    }

    /**
     * All published messages in publish order.
     *
     * @return snapshot of published messages
     */
    public List<PublishedMessage> published() {
        return List.copyOf(published);
    }

    /**
     * Messages published to one destination, in publish order.
     *
     * @param destination destination name
     * @return snapshot of matching messages
     */
    public List<PublishedMessage> published(String destination) {
        return published.stream()
            .filter(m -> m.destination().equals(destination))
            .collect(Collectors.toList());
    }

    /**
     * Number of active subscriptions.
     *
     * @return subscription count
     */
    public int subscriptionCount() {
        return subscriptions.size();
    }

    /**
     * Clears the published log and every subscription (for testing).
     */
    public void clear() {
        published.clear();
        subscriptions.clear();
    }

    /**
     * A message recorded by {@link #publish(String, SagaMessage, Map)}.
     *
     * @param messageId assigned message id
     * @param destination destination name
     * @param message message body
     * @param headers headers
     */
    public record PublishedMessage(
        String messageId,
        String destination,
        SagaMessage message,
        Map<String, String> headers
    ) {
    }

    private record Subscription(String id, String destination, MessageHandler handler) {
    }
}
